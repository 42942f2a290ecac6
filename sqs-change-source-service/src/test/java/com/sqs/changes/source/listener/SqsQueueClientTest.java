package com.sqs.changes.source.listener;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import com.sqs.changes.source.config.properties.SqsConfigurationProperties;
import com.sqs.changes.source.dto.PollResult;
import com.sqs.changes.source.dto.RawMessage;

import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.services.sqs.SqsAsyncClient;
import software.amazon.awssdk.services.sqs.model.DeleteMessageRequest;
import software.amazon.awssdk.services.sqs.model.DeleteMessageResponse;
import software.amazon.awssdk.services.sqs.model.Message;
import software.amazon.awssdk.services.sqs.model.MessageSystemAttributeName;
import software.amazon.awssdk.services.sqs.model.QueueDoesNotExistException;
import software.amazon.awssdk.services.sqs.model.ReceiptHandleIsInvalidException;
import software.amazon.awssdk.services.sqs.model.ReceiveMessageRequest;
import software.amazon.awssdk.services.sqs.model.ReceiveMessageResponse;
import software.amazon.awssdk.services.sqs.model.SendMessageRequest;
import software.amazon.awssdk.services.sqs.model.SendMessageResponse;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class SqsQueueClientTest {

  private static final String QUEUE_URL = "http://localhost:4566/000000000000/changes";

  @Mock private SqsAsyncClient sqsAsyncClient;

  private SqsQueueClient queueClient;

  @BeforeEach
  void setUp() {
    queueClient = new SqsQueueClient(sqsAsyncClient, SqsConfigurationProperties.forQueue(QUEUE_URL));
  }

  private static Message sqsMessage(String id, String receiptHandle, String body, String sentTimestamp) {
    return Message.builder()
        .messageId(id)
        .receiptHandle(receiptHandle)
        .body(body)
        .attributes(Map.of(MessageSystemAttributeName.SENT_TIMESTAMP, sentTimestamp))
        .build();
  }

  @Nested
  class ReceiveTests {

    @Test
    @DisplayName("Should request one message with a 20 second long poll and the sent timestamp")
    void shouldRequestOneMessageWithLongPoll() {
      when(sqsAsyncClient.receiveMessage(any(ReceiveMessageRequest.class)))
          .thenReturn(CompletableFuture.completedFuture(ReceiveMessageResponse.builder().build()));

      queueClient.receive().join();

      ArgumentCaptor<ReceiveMessageRequest> captor = ArgumentCaptor.forClass(ReceiveMessageRequest.class);
      verify(sqsAsyncClient).receiveMessage(captor.capture());
      ReceiveMessageRequest request = captor.getValue();
      assertThat(request.queueUrl()).isEqualTo(QUEUE_URL);
      assertThat(request.maxNumberOfMessages()).isEqualTo(1);
      assertThat(request.waitTimeSeconds()).isEqualTo(20);
      assertThat(request.messageSystemAttributeNames())
          .contains(MessageSystemAttributeName.SENT_TIMESTAMP);
    }

    @Test
    @DisplayName("Should return empty when the response has no messages field")
    void shouldReturnEmptyWhenNoMessagesField() {
      when(sqsAsyncClient.receiveMessage(any(ReceiveMessageRequest.class)))
          .thenReturn(CompletableFuture.completedFuture(ReceiveMessageResponse.builder().build()));

      PollResult result = queueClient.receive().join();

      assertThat(result).isInstanceOf(PollResult.Empty.class);
    }

    @Test
    void shouldReturnEmptyWhenMessageListIsEmpty() {
      when(sqsAsyncClient.receiveMessage(any(ReceiveMessageRequest.class)))
          .thenReturn(
              CompletableFuture.completedFuture(
                  ReceiveMessageResponse.builder().messages(java.util.List.of()).build()));

      assertThat(queueClient.receive().join()).isInstanceOf(PollResult.Empty.class);
    }

    @Test
    @DisplayName("Should map the first message and ignore the rest")
    void shouldMapFirstMessage() {
      Message first = sqsMessage("aaaa", "receipt-a", "{\"foo\": \"bar\"}", "1573477920399");
      Message second = sqsMessage("bbbb", "receipt-b", "other", "1573477920500");
      when(sqsAsyncClient.receiveMessage(any(ReceiveMessageRequest.class)))
          .thenReturn(
              CompletableFuture.completedFuture(
                  ReceiveMessageResponse.builder().messages(first, second).build()));

      PollResult result = queueClient.receive().join();

      assertThat(result).isInstanceOf(PollResult.Received.class);
      RawMessage message = ((PollResult.Received) result).message();
      assertThat(message.id()).isEqualTo("aaaa");
      assertThat(message.receiptToken()).isEqualTo("receipt-a");
      assertThat(message.body()).isEqualTo("{\"foo\": \"bar\"}");
      assertThat(message.sentAtMillis()).isEqualTo(1573477920399L);
      assertThat(message.receiveCount()).isEqualTo(1);
    }

    @Test
    void shouldReadApproximateReceiveCount() {
      Message message =
          Message.builder()
              .messageId("aaaa")
              .receiptHandle("receipt-a")
              .body("x")
              .attributes(
                  Map.of(
                      MessageSystemAttributeName.SENT_TIMESTAMP, "1000",
                      MessageSystemAttributeName.APPROXIMATE_RECEIVE_COUNT, "4"))
              .build();
      when(sqsAsyncClient.receiveMessage(any(ReceiveMessageRequest.class)))
          .thenReturn(
              CompletableFuture.completedFuture(ReceiveMessageResponse.builder().messages(message).build()));

      RawMessage received = ((PollResult.Received) queueClient.receive().join()).message();

      assertThat(received.receiveCount()).isEqualTo(4);
      assertThat(received.sentAtMillis()).isEqualTo(1000L);
    }

    @Test
    @DisplayName("Should classify client errors as transient failures")
    void shouldClassifyClientErrorsAsTransient() {
      SdkClientException credentialsFailure =
          SdkClientException.create("Unable to load credentials from any of the providers");
      when(sqsAsyncClient.receiveMessage(any(ReceiveMessageRequest.class)))
          .thenReturn(CompletableFuture.failedFuture(new CompletionException(credentialsFailure)));

      PollResult result = queueClient.receive().join();

      assertThat(result).isInstanceOf(PollResult.TransientFailure.class);
      assertThat(((PollResult.TransientFailure) result).cause()).isSameAs(credentialsFailure);
    }

    @Test
    void shouldClassifyServiceErrorsAsTransient() {
      when(sqsAsyncClient.receiveMessage(any(ReceiveMessageRequest.class)))
          .thenReturn(
              CompletableFuture.failedFuture(
                  QueueDoesNotExistException.builder().message("no such queue").build()));

      assertThat(queueClient.receive().join()).isInstanceOf(PollResult.TransientFailure.class);
    }

    @Test
    void shouldClassifySynchronousClientErrorsAsTransient() {
      when(sqsAsyncClient.receiveMessage(any(ReceiveMessageRequest.class)))
          .thenThrow(SdkClientException.create("no region"));

      assertThat(queueClient.receive().join()).isInstanceOf(PollResult.TransientFailure.class);
    }

    @Test
    @DisplayName("Should fail the future for unexpected errors")
    void shouldFailFutureForUnexpectedErrors() {
      when(sqsAsyncClient.receiveMessage(any(ReceiveMessageRequest.class)))
          .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("bug")));

      assertThatThrownBy(() -> queueClient.receive().join())
          .isInstanceOf(CompletionException.class)
          .hasRootCauseInstanceOf(IllegalStateException.class);
    }
  }

  @Nested
  class DeleteTests {

    @Test
    void shouldDeleteByReceiptHandle() {
      when(sqsAsyncClient.deleteMessage(any(DeleteMessageRequest.class)))
          .thenReturn(CompletableFuture.completedFuture(DeleteMessageResponse.builder().build()));

      Boolean deleted = queueClient.delete("receipt-a").join();

      assertThat(deleted).isTrue();
      ArgumentCaptor<DeleteMessageRequest> captor = ArgumentCaptor.forClass(DeleteMessageRequest.class);
      verify(sqsAsyncClient).deleteMessage(captor.capture());
      assertThat(captor.getValue().receiptHandle()).isEqualTo("receipt-a");
      assertThat(captor.getValue().queueUrl()).isEqualTo(QUEUE_URL);
    }

    @Test
    @DisplayName("Should treat an expired receipt handle as already deleted")
    void shouldTreatInvalidReceiptHandleAsDeleted() {
      when(sqsAsyncClient.deleteMessage(any(DeleteMessageRequest.class)))
          .thenReturn(
              CompletableFuture.failedFuture(
                  ReceiptHandleIsInvalidException.builder().message("expired").build()));

      assertThat(queueClient.delete("receipt-a").join()).isTrue();
    }

    @Test
    @DisplayName("Should swallow delete failures and report false")
    void shouldSwallowDeleteFailures() {
      when(sqsAsyncClient.deleteMessage(any(DeleteMessageRequest.class)))
          .thenReturn(CompletableFuture.failedFuture(SdkClientException.create("timeout")));

      assertThat(queueClient.delete("receipt-a").join()).isFalse();
    }
  }

  @Nested
  class ForwardTests {

    @Test
    void shouldSendBodyWithSourceAttributes() {
      when(sqsAsyncClient.sendMessage(any(SendMessageRequest.class)))
          .thenReturn(
              CompletableFuture.completedFuture(SendMessageResponse.builder().messageId("dlq-1").build()));

      queueClient.forward("http://localhost:4566/000000000000/dlq", RawMessage.of("aaaa", "r", "{bad", 0L)).join();

      ArgumentCaptor<SendMessageRequest> captor = ArgumentCaptor.forClass(SendMessageRequest.class);
      verify(sqsAsyncClient).sendMessage(captor.capture());
      SendMessageRequest request = captor.getValue();
      assertThat(request.queueUrl()).isEqualTo("http://localhost:4566/000000000000/dlq");
      assertThat(request.messageBody()).isEqualTo("{bad");
      assertThat(request.messageAttributes().get(SqsQueueClient.SOURCE_MESSAGE_ID_ATTRIBUTE).stringValue())
          .isEqualTo("aaaa");
      assertThat(request.messageAttributes().get(SqsQueueClient.SOURCE_QUEUE_URL_ATTRIBUTE).stringValue())
          .isEqualTo(QUEUE_URL);
    }

    @Test
    void shouldFailWhenSendFails() {
      when(sqsAsyncClient.sendMessage(any(SendMessageRequest.class)))
          .thenReturn(CompletableFuture.failedFuture(SdkClientException.create("down")));

      CompletableFuture<Void> forwarded =
          queueClient.forward("http://localhost:4566/000000000000/dlq", RawMessage.of("aaaa", "r", "x", 0L));

      assertThat(forwarded).isCompletedExceptionally();
    }
  }
}
