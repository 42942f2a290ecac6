package com.sqs.changes.source.listener;

import java.util.concurrent.CompletableFuture;

import com.sqs.changes.source.dto.PollResult;
import com.sqs.changes.source.dto.RawMessage;

/**
 * Narrow receive/delete contract to the message queue.
 *
 * <p>Every call returns immediately with a future; the network round trip never runs on the
 * caller's thread. A single instance serves one queue and is never called concurrently by the
 * poller.
 */
public interface QueueClient {

  /** Identifier of the queue this client reads from. */
  String queueUrl();

  /**
   * Performs one long-poll receive for at most one message.
   *
   * <p>Recoverable provider errors complete the future normally with a {@link
   * PollResult.TransientFailure}; only unexpected errors complete it exceptionally.
   */
  CompletableFuture<PollResult> receive();

  /**
   * Deletes a delivered message. Best effort: failures are logged and reported as {@code false},
   * never as an exceptional completion.
   */
  CompletableFuture<Boolean> delete(String receiptToken);

  /**
   * Copies a message to another queue. Completes exceptionally if the send fails, in which case
   * the message must stay on its source queue.
   */
  CompletableFuture<Void> forward(String targetQueueUrl, RawMessage message);
}
