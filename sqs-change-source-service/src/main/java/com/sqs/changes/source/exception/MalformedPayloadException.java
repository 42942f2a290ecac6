package com.sqs.changes.source.exception;

/** Thrown when a message body cannot be read as the configured structured format. */
public class MalformedPayloadException extends RuntimeException {

  private final String messageId;

  public MalformedPayloadException(String messageId, String reason) {
    super("Malformed payload in message " + messageId + ": " + reason);
    this.messageId = messageId;
  }

  public MalformedPayloadException(String messageId, String reason, Throwable cause) {
    super("Malformed payload in message " + messageId + ": " + reason, cause);
    this.messageId = messageId;
  }

  public String getMessageId() {
    return messageId;
  }
}
