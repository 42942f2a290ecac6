package com.sqs.changes.source.processor.impl;

import java.util.HashMap;
import java.util.Map;

import com.sqs.changes.source.config.properties.BodyFormat;
import com.sqs.changes.source.config.properties.SqsConfigurationProperties;
import com.sqs.changes.source.dto.RawMessage;
import com.sqs.changes.source.processor.AbstractMessageTransformer;

/** Keeps the body verbatim as the single {@code sqs_body} property. */
public class RawBodyMessageTransformer extends AbstractMessageTransformer {

  public RawBodyMessageTransformer(SqsConfigurationProperties sqsConfig) {
    super(sqsConfig);
  }

  @Override
  public BodyFormat getSupportedFormat() {
    return BodyFormat.RAW;
  }

  @Override
  protected Map<String, String> properties(RawMessage message) {
    // HashMap tolerates a null body; ChangeEvent copies it anyway
    Map<String, String> properties = new HashMap<>();
    properties.put(BODY_PROPERTY, message.body() == null ? "" : message.body());
    return properties;
  }
}
