package io.b2mash.cetustek.exception;

/**
 * Base SDK error. Thrown as-is for transport failures (connection errors, HTTP error statuses) and
 * for responses the client cannot interpret; subclasses cover local validation and vendor-reported
 * failures.
 */
public class CetustekException extends RuntimeException {

  public CetustekException(String message) {
    super(message);
  }

  public CetustekException(String message, Throwable cause) {
    super(message, cause);
  }
}
