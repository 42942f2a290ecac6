package com.sqs.changes.source.processor;

import java.util.concurrent.atomic.AtomicBoolean;

import com.sqs.changes.source.exception.PollCancelledException;

/**
 * Cancellation flag shared by every stage of the poll pipeline.
 *
 * <p>One token is created per start of a change source and tripped when it stops. Stages check it
 * before each side effect (emit, delete, dead-letter) so a poll that completes after a stop leaves
 * no trace.
 */
public final class CancellationToken {

  private final AtomicBoolean cancelled = new AtomicBoolean(false);

  /** A token that is already cancelled; used before the first start. */
  public static CancellationToken cancelled() {
    CancellationToken token = new CancellationToken();
    token.cancel();
    return token;
  }

  public void cancel() {
    cancelled.set(true);
  }

  public boolean isCancelled() {
    return cancelled.get();
  }

  /**
   * Fails with {@link PollCancelledException} if the token has been cancelled.
   *
   * @param stage name of the step about to run, used in the exception message
   */
  public void throwIfCancelled(String stage) {
    if (cancelled.get()) {
      throw new PollCancelledException(stage);
    }
  }
}
