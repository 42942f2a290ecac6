package com.sqs.changes.source.config.properties;

/** How message bodies are turned into change properties. */
public enum BodyFormat {
  /** Body is kept verbatim under {@code sqs_body}. */
  RAW,
  /** Body is parsed as a JSON object whose top-level fields become properties. */
  JSON
}
