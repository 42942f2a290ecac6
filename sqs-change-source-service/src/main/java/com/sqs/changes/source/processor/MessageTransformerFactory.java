package com.sqs.changes.source.processor;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sqs.changes.source.config.properties.BodyFormat;
import com.sqs.changes.source.config.properties.SqsConfigurationProperties;
import com.sqs.changes.source.processor.impl.JsonBodyMessageTransformer;
import com.sqs.changes.source.processor.impl.RawBodyMessageTransformer;

/**
 * Holds one transformer per body format and hands out the one selected by {@code sqs.body-format}.
 */
@Service
public class MessageTransformerFactory {

  private static final Logger logger = LoggerFactory.getLogger(MessageTransformerFactory.class);

  private final List<MessageTransformer> transformers;
  private final BodyFormat configuredFormat;

  public MessageTransformerFactory(SqsConfigurationProperties sqsConfig, ObjectMapper objectMapper) {
    if (sqsConfig == null) {
      throw new IllegalArgumentException("SqsConfigurationProperties cannot be null");
    }
    if (objectMapper == null) {
      throw new IllegalArgumentException("ObjectMapper cannot be null");
    }

    this.transformers =
        List.of(
            new RawBodyMessageTransformer(sqsConfig),
            new JsonBodyMessageTransformer(sqsConfig, objectMapper));
    this.configuredFormat = sqsConfig.bodyFormat();
    logger.info("MessageTransformerFactory initialized, body format: {}", configuredFormat);
  }

  /** Transformer for the configured body format. */
  public MessageTransformer getTransformer() {
    return getTransformer(configuredFormat);
  }

  /** Transformer for an explicit body format. */
  public MessageTransformer getTransformer(BodyFormat format) {
    return transformers.stream()
        .filter(transformer -> transformer.getSupportedFormat() == format)
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException("Unsupported body format: " + format));
  }

  public List<BodyFormat> getSupportedFormats() {
    return transformers.stream().map(MessageTransformer::getSupportedFormat).toList();
  }
}
