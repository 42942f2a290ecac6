package com.sqs.changes.source.listener;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.sqs.changes.source.config.properties.SqsConfigurationProperties;
import com.sqs.changes.source.dto.PollResult;
import com.sqs.changes.source.dto.RawMessage;

import software.amazon.awssdk.awscore.exception.AwsServiceException;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.services.sqs.SqsAsyncClient;
import software.amazon.awssdk.services.sqs.model.DeleteMessageRequest;
import software.amazon.awssdk.services.sqs.model.Message;
import software.amazon.awssdk.services.sqs.model.MessageAttributeValue;
import software.amazon.awssdk.services.sqs.model.MessageSystemAttributeName;
import software.amazon.awssdk.services.sqs.model.ReceiptHandleIsInvalidException;
import software.amazon.awssdk.services.sqs.model.ReceiveMessageRequest;
import software.amazon.awssdk.services.sqs.model.ReceiveMessageResponse;
import software.amazon.awssdk.services.sqs.model.SendMessageRequest;

/**
 * {@link QueueClient} backed by the AWS SDK v2 async SQS client.
 *
 * <p><strong>Receive:</strong> one message, 20-second long poll, requesting the {@code
 * SentTimestamp} and {@code ApproximateReceiveCount} system attributes. A response without
 * messages is {@link PollResult#empty()}; any further messages are ignored.
 *
 * <p><strong>Error classification:</strong> {@link SdkClientException} (network problems,
 * credential loading failures) and {@link AwsServiceException} (errors returned by SQS) are
 * recoverable and logged once at error level. Anything else completes the future exceptionally.
 */
@Component
public class SqsQueueClient implements QueueClient {

  private static final Logger logger = LoggerFactory.getLogger(SqsQueueClient.class);

  static final String SOURCE_MESSAGE_ID_ATTRIBUTE = "SourceMessageId";
  static final String SOURCE_QUEUE_URL_ATTRIBUTE = "SourceQueueUrl";

  private final SqsAsyncClient sqsAsyncClient;
  private final String queueUrl;
  private final ReceiveMessageRequest receiveMessageRequest;

  public SqsQueueClient(SqsAsyncClient sqsAsyncClient, SqsConfigurationProperties sqsConfig) {
    if (sqsAsyncClient == null) {
      throw new IllegalArgumentException("SqsAsyncClient cannot be null");
    }
    if (sqsConfig == null) {
      throw new IllegalArgumentException("SqsConfigurationProperties cannot be null");
    }

    this.sqsAsyncClient = sqsAsyncClient;
    this.queueUrl = sqsConfig.queueUrl();

    // Immutable, reused for every poll
    this.receiveMessageRequest =
        ReceiveMessageRequest.builder()
            .queueUrl(queueUrl)
            .maxNumberOfMessages(SqsConfigurationProperties.MAX_MESSAGES_PER_RECEIVE)
            .waitTimeSeconds(SqsConfigurationProperties.LONG_POLL_WAIT_SECONDS)
            .messageSystemAttributeNames(
                MessageSystemAttributeName.SENT_TIMESTAMP,
                MessageSystemAttributeName.APPROXIMATE_RECEIVE_COUNT)
            .build();
  }

  @Override
  public String queueUrl() {
    return queueUrl;
  }

  @Override
  public CompletableFuture<PollResult> receive() {
    logger.debug("Polling SQS queue {}", queueUrl);

    CompletableFuture<ReceiveMessageResponse> response;
    try {
      response = sqsAsyncClient.receiveMessage(receiveMessageRequest);
    } catch (RuntimeException e) {
      // Some client-side failures (e.g. credential resolution) surface before a future exists
      response = CompletableFuture.failedFuture(e);
    }

    return response.handle(
        (receiveResponse, throwable) -> {
          if (throwable != null) {
            return classifyFailure(throwable);
          }
          return toPollResult(receiveResponse);
        });
  }

  @Override
  public CompletableFuture<Boolean> delete(String receiptToken) {
    DeleteMessageRequest request =
        DeleteMessageRequest.builder().queueUrl(queueUrl).receiptHandle(receiptToken).build();

    CompletableFuture<Boolean> deletion;
    try {
      deletion = sqsAsyncClient.deleteMessage(request).thenApply(response -> true);
    } catch (RuntimeException e) {
      deletion = CompletableFuture.failedFuture(e);
    }

    return deletion.exceptionally(
        throwable -> {
          Throwable cause = unwrap(throwable);
          if (cause instanceof ReceiptHandleIsInvalidException) {
            logger.info("Message already deleted or receipt handle expired on queue {}", queueUrl);
            return true;
          }
          logger.warn(
              "Failed to delete message from queue {}, it will be redelivered: {}",
              queueUrl,
              cause.getMessage());
          return false;
        });
  }

  @Override
  public CompletableFuture<Void> forward(String targetQueueUrl, RawMessage message) {
    SendMessageRequest request =
        SendMessageRequest.builder()
            .queueUrl(targetQueueUrl)
            .messageBody(message.body() == null ? "" : message.body())
            .messageAttributes(
                Map.of(
                    SOURCE_MESSAGE_ID_ATTRIBUTE, stringAttribute(message.id()),
                    SOURCE_QUEUE_URL_ATTRIBUTE, stringAttribute(queueUrl)))
            .build();

    try {
      return sqsAsyncClient
          .sendMessage(request)
          .thenAccept(
              response ->
                  logger.info(
                      "Forwarded message {} to {} as {}",
                      message.id(),
                      targetQueueUrl,
                      response.messageId()));
    } catch (RuntimeException e) {
      return CompletableFuture.failedFuture(e);
    }
  }

  private PollResult toPollResult(ReceiveMessageResponse response) {
    // "No messages available" normally comes back without a messages list at all
    if (response == null || !response.hasMessages() || response.messages().isEmpty()) {
      logger.debug("No messages received from SQS queue {}", queueUrl);
      return PollResult.empty();
    }

    Message message = response.messages().get(0);
    Map<MessageSystemAttributeName, String> attributes = message.attributes();

    RawMessage rawMessage =
        new RawMessage(
            message.messageId(),
            message.receiptHandle(),
            message.body(),
            parseSentTimestamp(message.messageId(), attributes),
            parseReceiveCount(attributes));

    logger.info("Received message {} from SQS queue {}", rawMessage.id(), queueUrl);
    return PollResult.received(rawMessage);
  }

  private PollResult classifyFailure(Throwable throwable) {
    Throwable cause = unwrap(throwable);
    if (cause instanceof SdkClientException || cause instanceof AwsServiceException) {
      logger.error("Failed to receive messages from SQS queue {}", queueUrl, cause);
      return PollResult.transientFailure(cause.getMessage(), cause);
    }
    if (cause instanceof RuntimeException runtimeException) {
      throw runtimeException;
    }
    throw new CompletionException(cause);
  }

  private static long parseSentTimestamp(
      String messageId, Map<MessageSystemAttributeName, String> attributes) {
    String sentTimestamp = attributes.get(MessageSystemAttributeName.SENT_TIMESTAMP);
    if (sentTimestamp != null) {
      try {
        return Long.parseLong(sentTimestamp);
      } catch (NumberFormatException e) {
        logger.warn("Invalid SentTimestamp '{}' on message {}", sentTimestamp, messageId);
      }
    }
    logger.warn("Message {} has no usable SentTimestamp, using receive time", messageId);
    return System.currentTimeMillis();
  }

  private static int parseReceiveCount(Map<MessageSystemAttributeName, String> attributes) {
    String receiveCount = attributes.get(MessageSystemAttributeName.APPROXIMATE_RECEIVE_COUNT);
    if (receiveCount == null) {
      return 1;
    }
    try {
      return Integer.parseInt(receiveCount);
    } catch (NumberFormatException e) {
      return 1;
    }
  }

  private static MessageAttributeValue stringAttribute(String value) {
    return MessageAttributeValue.builder().dataType("String").stringValue(value).build();
  }

  private static Throwable unwrap(Throwable throwable) {
    Throwable current = throwable;
    while (current instanceof CompletionException && current.getCause() != null) {
      current = current.getCause();
    }
    return current;
  }
}
