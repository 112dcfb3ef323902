package com.trino.client.api.impl;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableMap;
import com.trino.client.api.impl.session.SessionSnapshot;
import com.trino.client.common.TrinoClientConstants;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import org.apache.http.client.methods.HttpPost;
import org.apache.http.entity.ContentType;
import org.apache.http.entity.StringEntity;

/** One statement submission: SQL text, the session it runs in, and any extra headers. */
public final class StatementRequest {

  private final String sql;
  private final SessionSnapshot session;
  private final Map<String, String> additionalHeaders;

  public StatementRequest(String sql, SessionSnapshot session) {
    this(sql, session, ImmutableMap.of());
  }

  public StatementRequest(
      String sql, SessionSnapshot session, Map<String, String> additionalHeaders) {
    this.sql = checkNotNull(sql, "sql is null");
    this.session = checkNotNull(session, "session is null");
    this.additionalHeaders = ImmutableMap.copyOf(additionalHeaders);
  }

  public String getSql() {
    return sql;
  }

  public SessionSnapshot getSession() {
    return session;
  }

  public Map<String, String> getAdditionalHeaders() {
    return additionalHeaders;
  }

  /** {@code POST /v1/statement} with the SQL as a UTF-8 body. */
  HttpPost toHttpPost(URI coordinatorUri) {
    HttpPost post = new HttpPost(coordinatorUri.resolve(TrinoClientConstants.URL_STATEMENT_PATH));
    session.toHeaders().forEach(post::setHeader);
    additionalHeaders.forEach(post::setHeader);
    post.setEntity(
        new StringEntity(sql, ContentType.create("text/plain", StandardCharsets.UTF_8)));
    return post;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this).add("sql", sql).add("session", session).toString();
  }
}
