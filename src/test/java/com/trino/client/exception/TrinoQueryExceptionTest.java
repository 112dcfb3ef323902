package com.trino.client.exception;

import static org.junit.jupiter.api.Assertions.*;

import com.trino.client.model.core.FailureInfo;
import com.trino.client.model.core.QueryError;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

public class TrinoQueryExceptionTest {

  @ParameterizedTest
  @CsvSource({
    "USER_ERROR, TrinoUserErrorException",
    "EXTERNAL, TrinoExternalErrorException",
    "INTERNAL_ERROR, TrinoInternalErrorException",
    "INSUFFICIENT_RESOURCES, TrinoInternalErrorException",
    "SOMETHING_NEW, TrinoQueryException"
  })
  void testSubclassFollowsErrorType(String errorType, String expectedClass) {
    QueryError error = new QueryError().setErrorType(errorType).setMessage("boom");
    assertEquals(expectedClass, TrinoQueryException.of(error, "q1").getClass().getSimpleName());
  }

  @Test
  void testServerFieldsAreKept() {
    QueryError error =
        new QueryError()
            .setMessage("line 1:15: Table 'hive.default.missing' does not exist")
            .setErrorCode(46)
            .setErrorName("TABLE_NOT_FOUND")
            .setErrorType("USER_ERROR")
            .setFailureInfo(new FailureInfo().setType("io.trino.spi.TrinoException"));
    TrinoQueryException e = TrinoQueryException.of(error, "20240102_000000_00001_abcde");
    assertEquals(46, e.getErrorCode());
    assertEquals(Integer.valueOf(46), e.getError().getErrorCode());
    assertEquals("TABLE_NOT_FOUND", e.getErrorName());
    assertEquals("io.trino.spi.TrinoException", e.getErrorException());
    assertEquals("20240102_000000_00001_abcde", e.getQueryId());
    assertEquals(TrinoDriverErrorCode.QUERY_FAILED, e.getInternalError());
    assertTrue(e.toString().startsWith("TrinoUserErrorException(type=USER_ERROR"));
  }

  @Test
  void testMissingMessageGetsDefault() {
    TrinoQueryException e = TrinoQueryException.of(new QueryError(), null);
    assertEquals(TrinoQueryException.DEFAULT_MESSAGE, e.getMessage());
    assertNull(e.getErrorException());
    assertEquals(0, e.getErrorCode());
  }

  @Test
  void testHttpExceptionCarriesStatus() {
    TrinoHttpException e = new TrinoHttpException("Not Found", 404);
    assertEquals(404, e.getStatusCode());
    assertEquals(404, e.getErrorCode());
    assertEquals(TrinoDriverErrorCode.HTTP_ERROR, e.getInternalError());
    assertEquals("HTTP_ERROR", e.getSQLState());
  }
}
