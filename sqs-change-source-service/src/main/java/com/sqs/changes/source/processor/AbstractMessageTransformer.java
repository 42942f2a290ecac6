package com.sqs.changes.source.processor;

import java.util.Map;

import com.sqs.changes.source.config.properties.SqsConfigurationProperties;
import com.sqs.changes.source.dto.ChangeEvent;
import com.sqs.changes.source.dto.RawMessage;

/**
 * Derives every change field that does not depend on the body format.
 *
 * <p>revision = message id, timestamp = sent time in seconds, repository = queue URL,
 * codebase/project = configured values, branch = empty, author/comment = {@value #SOURCE_TAG}.
 * Subclasses only supply the properties.
 */
public abstract class AbstractMessageTransformer implements MessageTransformer {

  private final String repository;
  private final String codebase;
  private final String project;

  protected AbstractMessageTransformer(SqsConfigurationProperties sqsConfig) {
    if (sqsConfig == null) {
      throw new IllegalArgumentException("SqsConfigurationProperties cannot be null");
    }
    this.repository = sqsConfig.queueUrl();
    this.codebase = sqsConfig.codebase();
    this.project = sqsConfig.project();
  }

  @Override
  public final ChangeEvent transform(RawMessage message) {
    return new ChangeEvent(
        SOURCE_TAG,
        codebase,
        repository,
        project,
        "",
        SOURCE_TAG,
        SOURCE_TAG,
        message.sentAtMillis() / 1000.0,
        message.id(),
        properties(message));
  }

  /** Properties attached to the change built from {@code message}. */
  protected abstract Map<String, String> properties(RawMessage message);
}
