package com.trino.client.exception;

/** Client-side error codes, used as the SQL state when the server supplies none. */
public enum TrinoDriverErrorCode {
  CONNECTION_ERROR,
  RETRIES_EXHAUSTED,
  PROTOCOL_ERROR,
  UNSUPPORTED_ENCODING,
  QUERY_FAILED,
  DATA_CONVERSION_ERROR,
  AUTHENTICATION_ERROR,
  HTTP_ERROR,
  INVALID_CONFIGURATION,
  INVALID_STATE,
  INVALID_ARGUMENT,
  SEGMENT_DOWNLOAD_ERROR,
  THREAD_INTERRUPTED_ERROR,
  TRANSACTION_ERROR,
}
