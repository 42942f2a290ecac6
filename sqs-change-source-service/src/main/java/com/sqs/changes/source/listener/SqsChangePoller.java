package com.sqs.changes.source.listener;

import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import com.sqs.changes.source.config.properties.SqsConfigurationProperties;
import com.sqs.changes.source.dto.PollOutcome;
import com.sqs.changes.source.dto.PollResult;
import com.sqs.changes.source.dto.RawMessage;
import com.sqs.changes.source.exception.MalformedPayloadException;
import com.sqs.changes.source.exception.PollCancelledException;
import com.sqs.changes.source.processor.CancellationToken;
import com.sqs.changes.source.processor.ChangeMessageProcessor;
import com.sqs.changes.source.service.PollingMonitoringService;

import io.micrometer.core.instrument.Timer;

/**
 * Drives one poll cycle per timer tick for a single queue.
 *
 * <p>The poller is either <em>idle</em> or <em>polling</em>. A tick that arrives while a poll is
 * still in flight is remembered and runs as soon as that poll completes, so ticks never overlap
 * and are never lost.
 *
 * <p><strong>Cycle:</strong>
 *
 * <ol>
 *   <li>Long-poll receive through the {@link QueueClient}
 *   <li>Empty or transient failure: nothing else happens this cycle
 *   <li>Message: transform, duplicate check and record on the worker pool
 *   <li>Delete the message only once the change is recorded or known to be a duplicate
 * </ol>
 *
 * <p>A failing pipeline leaves the message on the queue so SQS redelivers it. Malformed payloads
 * that have been received {@code sqs.max-receive-count} times are forwarded to the dead-letter
 * queue and then deleted, when one is configured.
 *
 * <p>Every side effect is preceded by a check of the {@link CancellationToken} passed to {@link
 * #tick(CancellationToken)}; a poll that completes after its source was stopped is discarded.
 */
@Component
public class SqsChangePoller {

  private static final Logger logger = LoggerFactory.getLogger(SqsChangePoller.class);
  private static final String CORRELATION_ID_KEY = "correlationId";
  private static final String MESSAGE_ID_KEY = "messageId";

  private final QueueClient queueClient;
  private final ChangeMessageProcessor changeMessageProcessor;
  private final PollingMonitoringService monitoringService;
  private final SqsConfigurationProperties sqsConfig;
  private final Executor workerExecutor;

  private final AtomicBoolean inFlight = new AtomicBoolean(false);
  private final AtomicReference<CancellationToken> deferredTick = new AtomicReference<>();

  public SqsChangePoller(
      QueueClient queueClient,
      ChangeMessageProcessor changeMessageProcessor,
      PollingMonitoringService monitoringService,
      SqsConfigurationProperties sqsConfig,
      @Qualifier("changeWorkerExecutor") Executor workerExecutor) {
    if (queueClient == null) {
      throw new IllegalArgumentException("QueueClient cannot be null");
    }
    if (changeMessageProcessor == null) {
      throw new IllegalArgumentException("ChangeMessageProcessor cannot be null");
    }
    if (monitoringService == null) {
      throw new IllegalArgumentException("PollingMonitoringService cannot be null");
    }
    if (sqsConfig == null) {
      throw new IllegalArgumentException("SqsConfigurationProperties cannot be null");
    }
    if (workerExecutor == null) {
      throw new IllegalArgumentException("Worker executor cannot be null");
    }

    this.queueClient = queueClient;
    this.changeMessageProcessor = changeMessageProcessor;
    this.monitoringService = monitoringService;
    this.sqsConfig = sqsConfig;
    this.workerExecutor = workerExecutor;
  }

  /**
   * Timer entry point. Starts a poll unless one is already in flight, in which case the tick is
   * deferred until the running poll completes. Never blocks.
   */
  public void tick(CancellationToken token) {
    if (token.isCancelled()) {
      return;
    }
    if (!inFlight.compareAndSet(false, true)) {
      deferredTick.set(token);
      logger.debug("Poll still in flight on {}, deferring tick", queueClient.queueUrl());
      return;
    }

    CompletableFuture<PollOutcome> cycle;
    try {
      cycle = poll(token);
    } catch (RuntimeException e) {
      cycle = CompletableFuture.failedFuture(e);
    }

    cycle.whenComplete(
        (outcome, throwable) -> {
          inFlight.set(false);
          CancellationToken next = deferredTick.getAndSet(null);
          if (next != null && !next.isCancelled()) {
            tick(next);
          }
        });
  }

  /** Whether a poll is currently in flight. */
  public boolean isPolling() {
    return inFlight.get();
  }

  /**
   * Runs one complete poll cycle. The returned future never completes exceptionally; every
   * failure is logged and reported through the outcome.
   */
  public CompletableFuture<PollOutcome> poll(CancellationToken token) {
    String correlationId = UUID.randomUUID().toString();
    Timer.Sample sample = monitoringService.startPoll();

    MDC.put(CORRELATION_ID_KEY, correlationId);
    CompletableFuture<PollResult> received;
    try {
      received = queueClient.receive();
    } catch (RuntimeException e) {
      received = CompletableFuture.failedFuture(e);
    } finally {
      MDC.remove(CORRELATION_ID_KEY);
    }

    return received
        .thenComposeAsync(result -> handle(result, token, correlationId), workerExecutor)
        .exceptionally(
            throwable -> {
              MDC.put(CORRELATION_ID_KEY, correlationId);
              try {
                logger.error(
                    "Unexpected error while polling SQS queue {}",
                    queueClient.queueUrl(),
                    unwrap(throwable));
                return PollOutcome.TRANSIENT_FAILURE;
              } finally {
                MDC.remove(CORRELATION_ID_KEY);
              }
            })
        .thenApply(
            outcome -> {
              monitoringService.recordOutcome(outcome, sample);
              return outcome;
            });
  }

  private CompletableFuture<PollOutcome> handle(
      PollResult result, CancellationToken token, String correlationId) {
    MDC.put(CORRELATION_ID_KEY, correlationId);
    try {
      if (token.isCancelled()) {
        logger.info("Change source stopped while polling, discarding poll result");
        return CompletableFuture.completedFuture(PollOutcome.DISCARDED);
      }
      if (result instanceof PollResult.Received received) {
        return processMessage(received.message(), token);
      }
      if (result instanceof PollResult.TransientFailure) {
        // already logged by the queue client
        return CompletableFuture.completedFuture(PollOutcome.TRANSIENT_FAILURE);
      }
      return CompletableFuture.completedFuture(PollOutcome.EMPTY);
    } finally {
      MDC.remove(CORRELATION_ID_KEY);
    }
  }

  private CompletableFuture<PollOutcome> processMessage(RawMessage message, CancellationToken token) {
    MDC.put(MESSAGE_ID_KEY, message.id());
    try {
      boolean recorded = changeMessageProcessor.process(message, token);
      PollOutcome outcome = recorded ? PollOutcome.EMITTED : PollOutcome.DUPLICATE;

      token.throwIfCancelled("delete");
      return deleteMessage(message).thenApply(deleted -> outcome);

    } catch (PollCancelledException e) {
      logger.info("Change source stopped during processing of message {}: {}", message.id(), e.getMessage());
      return CompletableFuture.completedFuture(PollOutcome.DISCARDED);
    } catch (MalformedPayloadException e) {
      return handleMalformedPayload(message, e, token);
    } catch (Exception e) {
      logger.error("Failed to process message {}, leaving it on the queue for redelivery", message.id(), e);
      return CompletableFuture.completedFuture(PollOutcome.FAILED);
    } finally {
      MDC.remove(MESSAGE_ID_KEY);
    }
  }

  private CompletableFuture<PollOutcome> handleMalformedPayload(
      RawMessage message, MalformedPayloadException error, CancellationToken token) {
    if (!sqsConfig.isDeadLetteringEnabled()
        || message.receiveCount() < sqsConfig.maxReceiveCount()) {
      logger.error(
          "Malformed payload in message {} (receive count {}), leaving it on the queue for redelivery",
          message.id(),
          message.receiveCount(),
          error);
      return CompletableFuture.completedFuture(PollOutcome.FAILED);
    }

    logger.error(
        "Malformed payload in message {} received {} times, moving it to dead-letter queue {}",
        message.id(),
        message.receiveCount(),
        sqsConfig.deadLetterQueueUrl(),
        error);

    if (token.isCancelled()) {
      logger.info("Change source stopped, not dead-lettering message {}", message.id());
      return CompletableFuture.completedFuture(PollOutcome.DISCARDED);
    }
    return queueClient
        .forward(sqsConfig.deadLetterQueueUrl(), message)
        .thenCompose(
            forwarded -> {
              token.throwIfCancelled("delete");
              return deleteMessage(message);
            })
        .thenApply(deleted -> PollOutcome.DEAD_LETTERED)
        .exceptionally(
            throwable -> {
              Throwable cause = unwrap(throwable);
              if (cause instanceof PollCancelledException) {
                return PollOutcome.DISCARDED;
              }
              logger.error(
                  "Failed to dead-letter message {}, leaving it on the queue", message.id(), cause);
              return PollOutcome.FAILED;
            });
  }

  private CompletableFuture<Boolean> deleteMessage(RawMessage message) {
    return queueClient
        .delete(message.receiptToken())
        .thenApply(
            deleted -> {
              monitoringService.recordDelete(deleted);
              if (deleted) {
                logger.debug("Deleted message {} from queue", message.id());
              }
              return deleted;
            });
  }

  private static Throwable unwrap(Throwable throwable) {
    Throwable current = throwable;
    while (current instanceof CompletionException && current.getCause() != null) {
      current = current.getCause();
    }
    return current;
  }
}
