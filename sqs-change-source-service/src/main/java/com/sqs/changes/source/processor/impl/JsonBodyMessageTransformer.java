package com.sqs.changes.source.processor.impl;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.sqs.changes.source.config.properties.BodyFormat;
import com.sqs.changes.source.config.properties.SqsConfigurationProperties;
import com.sqs.changes.source.dto.RawMessage;
import com.sqs.changes.source.exception.MalformedPayloadException;
import com.sqs.changes.source.processor.AbstractMessageTransformer;

/**
 * Parses the body as a JSON object and exposes its top-level fields as properties.
 *
 * <p>{@code sqs_body} holds the compact re-serialization of the object. Top-level fields are
 * merged in afterwards, so a field named {@code sqs_body} wins over the re-serialized body.
 * Text values are used as-is; every other value is rendered as JSON.
 */
public class JsonBodyMessageTransformer extends AbstractMessageTransformer {

  private static final Logger logger = LoggerFactory.getLogger(JsonBodyMessageTransformer.class);

  private final ObjectReader objectReader;

  public JsonBodyMessageTransformer(SqsConfigurationProperties sqsConfig, ObjectMapper objectMapper) {
    super(sqsConfig);
    if (objectMapper == null) {
      throw new IllegalArgumentException("ObjectMapper cannot be null");
    }
    // content after the top-level value makes the body malformed
    this.objectReader = objectMapper.reader().with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
  }

  @Override
  public BodyFormat getSupportedFormat() {
    return BodyFormat.JSON;
  }

  @Override
  protected Map<String, String> properties(RawMessage message) {
    JsonNode root = parseObject(message);

    Map<String, String> properties = new LinkedHashMap<>();
    properties.put(BODY_PROPERTY, root.toString());

    Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
    while (fields.hasNext()) {
      Map.Entry<String, JsonNode> field = fields.next();
      properties.put(field.getKey(), asPropertyValue(field.getValue()));
    }
    return properties;
  }

  private JsonNode parseObject(RawMessage message) {
    String body = message.body();
    if (body == null || body.isBlank()) {
      throw new MalformedPayloadException(message.id(), "body is empty");
    }

    JsonNode root;
    try {
      root = objectReader.readTree(body);
    } catch (JsonProcessingException e) {
      logger.debug("Body of message {} is not valid JSON", message.id(), e);
      throw new MalformedPayloadException(message.id(), "body is not valid JSON", e);
    }

    if (root == null || !root.isObject()) {
      throw new MalformedPayloadException(
          message.id(), "expected a JSON object but got " + (root == null ? "nothing" : root.getNodeType()));
    }
    return root;
  }

  private static String asPropertyValue(JsonNode value) {
    return value.isTextual() ? value.asText() : value.toString();
  }
}
