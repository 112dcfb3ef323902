package com.trino.client.common;

import com.google.common.collect.ImmutableSet;
import java.util.Set;

/** Protocol constants shared by the transport, session and execution layers. */
public final class TrinoClientConstants {

  private TrinoClientConstants() {}

  public static final int DEFAULT_PORT = 8080;
  public static final int DEFAULT_TLS_PORT = 443;
  public static final String DEFAULT_SOURCE = "trino-java-client";
  public static final int DEFAULT_MAX_ATTEMPTS = 3;
  public static final int DEFAULT_MAX_RETRY_ELAPSED_SECONDS = 300;
  public static final int DEFAULT_REQUEST_TIMEOUT_SECONDS = 30;
  public static final String CLIENT_VERSION = "0.1.0";
  public static final String USER_AGENT = DEFAULT_SOURCE + "/" + CLIENT_VERSION;

  public static final String HTTP = "http";
  public static final String HTTPS = "https";
  public static final String URL_SCHEME = "trino";
  public static final String URL_STATEMENT_PATH = "/v1/statement";

  public static final String HEADER_CATALOG = "X-Trino-Catalog";
  public static final String HEADER_SCHEMA = "X-Trino-Schema";
  public static final String HEADER_SOURCE = "X-Trino-Source";
  public static final String HEADER_USER = "X-Trino-User";
  public static final String HEADER_TIME_ZONE = "X-Trino-Time-Zone";
  public static final String HEADER_LANGUAGE = "X-Trino-Language";
  public static final String HEADER_CLIENT_INFO = "X-Trino-Client-Info";
  public static final String HEADER_CLIENT_TAGS = "X-Trino-Client-Tags";
  public static final String HEADER_EXTRA_CREDENTIAL = "X-Trino-Extra-Credential";
  public static final String HEADER_QUERY_DATA_ENCODING = "X-Trino-Query-Data-Encoding";

  public static final String HEADER_SESSION = "X-Trino-Session";
  public static final String HEADER_SET_SESSION = "X-Trino-Set-Session";
  public static final String HEADER_CLEAR_SESSION = "X-Trino-Clear-Session";

  public static final String HEADER_ROLE = "X-Trino-Role";
  public static final String HEADER_SET_ROLE = "X-Trino-Set-Role";

  public static final String HEADER_TRANSACTION = "X-Trino-Transaction-Id";
  public static final String HEADER_STARTED_TRANSACTION = "X-Trino-Started-Transaction-Id";
  public static final String HEADER_CLEAR_TRANSACTION = "X-Trino-Clear-Transaction-Id";

  public static final String HEADER_PREPARED_STATEMENT = "X-Trino-Prepared-Statement";
  public static final String HEADER_ADDED_PREPARE = "X-Trino-Added-Prepare";
  public static final String HEADER_DEALLOCATED_PREPARE = "X-Trino-Deallocated-Prepare";

  public static final String HEADER_SET_CATALOG = "X-Trino-Set-Catalog";
  public static final String HEADER_SET_SCHEMA = "X-Trino-Set-Schema";

  public static final String HEADER_RETRY_AFTER = "Retry-After";
  public static final String HEADER_WWW_AUTHENTICATE = "WWW-Authenticate";
  public static final String HEADER_AUTHORIZATION = "Authorization";

  /** Transaction id sent while in autocommit mode. */
  public static final String NO_TRANSACTION = "NONE";

  /** Headers owned by the protocol; user supplied headers may not replace them. */
  public static final Set<String> RESERVED_HEADERS =
      ImmutableSet.of(
          HEADER_CATALOG,
          HEADER_SCHEMA,
          HEADER_SOURCE,
          HEADER_USER,
          HEADER_TIME_ZONE,
          HEADER_LANGUAGE,
          HEADER_CLIENT_INFO,
          HEADER_CLIENT_TAGS,
          HEADER_EXTRA_CREDENTIAL,
          HEADER_QUERY_DATA_ENCODING,
          HEADER_SESSION,
          HEADER_ROLE,
          HEADER_TRANSACTION,
          HEADER_PREPARED_STATEMENT);
}
