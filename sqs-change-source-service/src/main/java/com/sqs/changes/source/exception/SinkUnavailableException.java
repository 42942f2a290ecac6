package com.sqs.changes.source.exception;

/** Thrown when the change history store cannot be read or written. */
public class SinkUnavailableException extends RuntimeException {

  public SinkUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }
}
