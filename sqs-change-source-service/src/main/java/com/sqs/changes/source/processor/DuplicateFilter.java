package com.sqs.changes.source.processor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.sqs.changes.source.sink.ChangeEventSink;

/**
 * Point lookup of a revision in the recorded change history.
 *
 * <p>The check and the later record are separate calls. Two processes that both see "absent" can
 * both try to record; the sink's {@code record} contract reports the loser as already present.
 */
@Service
public class DuplicateFilter {

  private static final Logger logger = LoggerFactory.getLogger(DuplicateFilter.class);

  private final ChangeEventSink changeEventSink;

  public DuplicateFilter(ChangeEventSink changeEventSink) {
    if (changeEventSink == null) {
      throw new IllegalArgumentException("ChangeEventSink cannot be null");
    }
    this.changeEventSink = changeEventSink;
  }

  /**
   * Whether a change with this exact revision has already been recorded.
   *
   * @throws com.sqs.changes.source.exception.SinkUnavailableException if the history cannot be read
   */
  public boolean isDuplicate(String revision) {
    boolean duplicate = changeEventSink.exists(revision);
    if (duplicate) {
      logger.info("Revision {} already recorded, suppressing duplicate change", revision);
    }
    return duplicate;
  }
}
