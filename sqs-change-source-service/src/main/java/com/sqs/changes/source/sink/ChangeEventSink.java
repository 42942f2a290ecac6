package com.sqs.changes.source.sink;

import com.sqs.changes.source.dto.ChangeEvent;
import com.sqs.changes.source.exception.SinkUnavailableException;

/**
 * Narrow contract to the change history store.
 *
 * <p>Implementations own their concurrency discipline; the poller calls them from its worker pool,
 * one call at a time per queue.
 */
public interface ChangeEventSink {

  /**
   * Checks whether a change with exactly this revision has already been recorded.
   *
   * @throws SinkUnavailableException if the store cannot be reached
   */
  boolean exists(String revision);

  /**
   * Records a change.
   *
   * @return {@code true} if the change was stored, {@code false} if a change with the same
   *     revision was already present
   * @throws SinkUnavailableException if the store cannot be reached
   */
  boolean record(ChangeEvent event);
}
