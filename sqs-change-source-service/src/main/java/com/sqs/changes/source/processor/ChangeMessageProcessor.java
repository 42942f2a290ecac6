package com.sqs.changes.source.processor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import com.sqs.changes.source.dto.ChangeEvent;
import com.sqs.changes.source.dto.RawMessage;
import com.sqs.changes.source.sink.ChangeEventSink;

/**
 * Runs one message through transform, duplicate check and record.
 *
 * <p>Failures are not caught here: a {@link com.sqs.changes.source.exception.MalformedPayloadException}
 * or {@link com.sqs.changes.source.exception.SinkUnavailableException} reaches the poller, which
 * leaves the message on the queue. The cancellation token is checked before the lookup and before
 * the record.
 */
@Service
public class ChangeMessageProcessor {

  private static final Logger logger = LoggerFactory.getLogger(ChangeMessageProcessor.class);

  private final MessageTransformer messageTransformer;
  private final DuplicateFilter duplicateFilter;
  private final ChangeEventSink changeEventSink;

  @Autowired
  public ChangeMessageProcessor(
      MessageTransformerFactory messageTransformerFactory,
      DuplicateFilter duplicateFilter,
      ChangeEventSink changeEventSink) {
    this(
        requireFactory(messageTransformerFactory).getTransformer(),
        duplicateFilter,
        changeEventSink);
  }

  public ChangeMessageProcessor(
      MessageTransformer messageTransformer,
      DuplicateFilter duplicateFilter,
      ChangeEventSink changeEventSink) {
    if (messageTransformer == null) {
      throw new IllegalArgumentException("MessageTransformer cannot be null");
    }
    if (duplicateFilter == null) {
      throw new IllegalArgumentException("DuplicateFilter cannot be null");
    }
    if (changeEventSink == null) {
      throw new IllegalArgumentException("ChangeEventSink cannot be null");
    }

    this.messageTransformer = messageTransformer;
    this.duplicateFilter = duplicateFilter;
    this.changeEventSink = changeEventSink;

    logger.info(
        "Change message processor initialized with {} transformer",
        messageTransformer.getSupportedFormat());
  }

  /**
   * Processes a message.
   *
   * @return {@code true} if a new change was recorded, {@code false} if the revision was already
   *     present
   */
  public boolean process(RawMessage message, CancellationToken token) {
    ChangeEvent event = messageTransformer.transform(message);

    token.throwIfCancelled("duplicate check");
    if (duplicateFilter.isDuplicate(event.revision())) {
      return false;
    }

    token.throwIfCancelled("record");
    boolean recorded = changeEventSink.record(event);
    if (recorded) {
      logger.info(
          "Recorded change - revision: {}, repository: {}, timestamp: {}",
          event.revision(),
          event.repository(),
          event.timestamp());
    }
    return recorded;
  }

  private static MessageTransformerFactory requireFactory(MessageTransformerFactory factory) {
    if (factory == null) {
      throw new IllegalArgumentException("MessageTransformerFactory cannot be null");
    }
    return factory;
  }
}
