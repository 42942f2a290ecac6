package com.sqs.changes.source.exception;

/**
 * Raised between pipeline stages once the owning change source has been stopped. Signals that
 * the remaining side effects of the cycle must be skipped.
 */
public class PollCancelledException extends RuntimeException {

  public PollCancelledException(String stage) {
    super("Poll cancelled before " + stage);
  }
}
