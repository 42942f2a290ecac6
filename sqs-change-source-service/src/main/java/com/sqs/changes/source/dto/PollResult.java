package com.sqs.changes.source.dto;

/**
 * Result of a single receive call against the queue.
 *
 * <p>Exactly one of three shapes: nothing available, one message, or a recoverable provider
 * failure. A poll result is never persisted.
 */
public sealed interface PollResult
    permits PollResult.Empty, PollResult.Received, PollResult.TransientFailure {

  /** Shared empty result. */
  PollResult EMPTY = new Empty();

  static PollResult empty() {
    return EMPTY;
  }

  static PollResult received(RawMessage message) {
    return new Received(message);
  }

  static PollResult transientFailure(String reason, Throwable cause) {
    return new TransientFailure(reason, cause);
  }

  /** No message was available within the long-poll wait. */
  record Empty() implements PollResult {}

  /** One message was taken from the queue. */
  record Received(RawMessage message) implements PollResult {
    public Received {
      if (message == null) {
        throw new IllegalArgumentException("Received message cannot be null");
      }
    }
  }

  /** The provider reported a recoverable error; scheduling treats it like {@link Empty}. */
  record TransientFailure(String reason, Throwable cause) implements PollResult {}
}
