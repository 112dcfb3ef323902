package com.trino.client.dbclient;

import com.trino.client.exception.TrinoSQLException;
import java.io.Closeable;
import org.apache.http.client.methods.HttpUriRequest;

/** Http client interface for executing requests against a Trino coordinator or segment store. */
public interface ITrinoHttpClient extends Closeable {

  /**
   * Executes the request, attaching credentials and retrying transient failures.
   *
   * @param request underlying http request
   * @return the fully read response of the last attempt
   * @throws TrinoSQLException when retries are exhausted or the failure is not retryable
   */
  TrinoHttpResponse execute(HttpUriRequest request) throws TrinoSQLException;

  /**
   * Executes the request once, with credentials but without retries. Used for best-effort calls
   * such as cancellation and segment acknowledgement.
   */
  TrinoHttpResponse executeOnce(HttpUriRequest request) throws TrinoSQLException;
}
