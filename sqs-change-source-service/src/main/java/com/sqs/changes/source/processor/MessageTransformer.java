package com.sqs.changes.source.processor;

import com.sqs.changes.source.config.properties.BodyFormat;
import com.sqs.changes.source.dto.ChangeEvent;
import com.sqs.changes.source.dto.RawMessage;
import com.sqs.changes.source.exception.MalformedPayloadException;

/**
 * Strategy for turning a queue message into a change event.
 *
 * <p>One implementation exists per {@link BodyFormat}; the active one is chosen from configuration
 * by {@link MessageTransformerFactory}.
 */
public interface MessageTransformer {

  /** Property name under which the message body is exposed on every change. */
  String BODY_PROPERTY = "sqs_body";

  /** Tag used for the change source, author and comment. */
  String SOURCE_TAG = "sqs";

  /** The body format this transformer handles. */
  BodyFormat getSupportedFormat();

  /**
   * Builds the change event for a message.
   *
   * @throws MalformedPayloadException if the body does not match the supported format
   */
  ChangeEvent transform(RawMessage message);
}
