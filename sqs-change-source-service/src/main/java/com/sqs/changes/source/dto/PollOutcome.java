package com.sqs.changes.source.dto;

/** What a single poll cycle ended up doing. */
public enum PollOutcome {
  /** Queue returned no message. */
  EMPTY,
  /** Receive failed with a recoverable provider error. */
  TRANSIENT_FAILURE,
  /** A new change was recorded and the message deleted. */
  EMITTED,
  /** The revision was already recorded; the message was deleted without a new change. */
  DUPLICATE,
  /** The pipeline failed; the message was left on the queue for redelivery. */
  FAILED,
  /** A malformed message exceeded its receive budget and was moved to the dead-letter queue. */
  DEAD_LETTERED,
  /** The source was stopped while the poll was in flight; the result was dropped. */
  DISCARDED;

  /** Whether the cycle ended with the message being removed from the queue. */
  public boolean deletesMessage() {
    return this == EMITTED || this == DUPLICATE || this == DEAD_LETTERED;
  }
}
