package com.sqs.changes.source.dto;

/**
 * A single message as delivered by the queue.
 *
 * <p>The {@code id} is stable for a message across redeliveries, while the {@code receiptToken}
 * belongs to one delivery attempt and is the only handle accepted for deletion.
 *
 * @param id provider-assigned message id
 * @param receiptToken delivery-specific handle used to delete the message
 * @param body message body as received
 * @param sentAtMillis enqueue time in epoch milliseconds
 * @param receiveCount approximate number of times the message has been received, at least 1
 */
public record RawMessage(
    String id, String receiptToken, String body, long sentAtMillis, int receiveCount) {

  public RawMessage {
    if (id == null || id.isBlank()) {
      throw new IllegalArgumentException("Message id cannot be null or blank");
    }
    if (receiptToken == null || receiptToken.isBlank()) {
      throw new IllegalArgumentException("Receipt token cannot be null or blank");
    }
    if (receiveCount < 1) {
      receiveCount = 1;
    }
  }

  /** Creates a message seen for the first time. */
  public static RawMessage of(String id, String receiptToken, String body, long sentAtMillis) {
    return new RawMessage(id, receiptToken, body, sentAtMillis, 1);
  }
}
