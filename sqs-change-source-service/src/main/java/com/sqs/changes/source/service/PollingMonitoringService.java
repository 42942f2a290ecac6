package com.sqs.changes.source.service;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.sqs.changes.source.dto.PollOutcome;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

/**
 * Tracks polling activity for logging, metrics and the health indicator.
 *
 * <p><strong>Tracked values:</strong>
 *
 * <ul>
 *   <li>Poll cycles per {@link PollOutcome}, also published as {@code sqs.change.poll.outcome}
 *   <li>Successful and failed deletes
 *   <li>Time of the last completed poll and of the last received message
 *   <li>Consecutive transient receive failures, reset by any successful receive
 * </ul>
 */
@Service
public class PollingMonitoringService {

  private static final Logger logger = LoggerFactory.getLogger(PollingMonitoringService.class);

  private final Map<PollOutcome, AtomicLong> outcomeCounts = new EnumMap<>(PollOutcome.class);
  private final Map<PollOutcome, Counter> outcomeCounters = new EnumMap<>(PollOutcome.class);
  private final AtomicLong messagesDeleted = new AtomicLong(0);
  private final AtomicLong deleteFailures = new AtomicLong(0);
  private final AtomicLong consecutiveReceiveFailures = new AtomicLong(0);
  private final AtomicReference<Instant> lastPollCompleted = new AtomicReference<>(null);
  private final AtomicReference<Instant> lastMessageReceived = new AtomicReference<>(null);

  private final Timer pollTimer;

  public PollingMonitoringService(MeterRegistry meterRegistry) {
    if (meterRegistry == null) {
      throw new IllegalArgumentException("MeterRegistry cannot be null");
    }

    for (PollOutcome outcome : PollOutcome.values()) {
      outcomeCounts.put(outcome, new AtomicLong(0));
      outcomeCounters.put(
          outcome,
          Counter.builder("sqs.change.poll.outcome")
              .description("Poll cycles by outcome")
              .tag("outcome", outcome.name().toLowerCase())
              .register(meterRegistry));
    }

    this.pollTimer =
        Timer.builder("sqs.change.poll.duration")
            .description("Time taken by one poll cycle including processing")
            .register(meterRegistry);
  }

  /** Starts timing a poll cycle. */
  public Timer.Sample startPoll() {
    return Timer.start();
  }

  /** Records the end of a poll cycle. */
  public void recordOutcome(PollOutcome outcome, Timer.Sample sample) {
    if (sample != null) {
      sample.stop(pollTimer);
    }
    outcomeCounts.get(outcome).incrementAndGet();
    outcomeCounters.get(outcome).increment();
    lastPollCompleted.set(Instant.now());

    if (outcome == PollOutcome.TRANSIENT_FAILURE) {
      consecutiveReceiveFailures.incrementAndGet();
    } else {
      consecutiveReceiveFailures.set(0);
    }
    if (outcome != PollOutcome.EMPTY && outcome != PollOutcome.TRANSIENT_FAILURE) {
      lastMessageReceived.set(Instant.now());
    }

    logger.debug("Poll outcome recorded - outcome: {}, total: {}", outcome, getCount(outcome));
  }

  public void recordDelete(boolean deleted) {
    if (deleted) {
      messagesDeleted.incrementAndGet();
    } else {
      deleteFailures.incrementAndGet();
    }
  }

  public long getCount(PollOutcome outcome) {
    return outcomeCounts.get(outcome).get();
  }

  public long getConsecutiveReceiveFailures() {
    return consecutiveReceiveFailures.get();
  }

  /**
   * Milliseconds since the last completed poll, or {@link Long#MAX_VALUE} if none completed yet.
   */
  public long getTimeSinceLastPoll() {
    Instant last = lastPollCompleted.get();
    return last != null ? Duration.between(last, Instant.now()).toMillis() : Long.MAX_VALUE;
  }

  public PollingMetrics getMetrics() {
    long totalPolls = 0;
    for (AtomicLong count : outcomeCounts.values()) {
      totalPolls += count.get();
    }
    return new PollingMetrics(
        totalPolls,
        getCount(PollOutcome.EMPTY),
        getCount(PollOutcome.TRANSIENT_FAILURE),
        getCount(PollOutcome.EMITTED),
        getCount(PollOutcome.DUPLICATE),
        getCount(PollOutcome.FAILED),
        getCount(PollOutcome.DEAD_LETTERED),
        getCount(PollOutcome.DISCARDED),
        messagesDeleted.get(),
        deleteFailures.get(),
        consecutiveReceiveFailures.get(),
        lastPollCompleted.get(),
        lastMessageReceived.get());
  }

  /** Snapshot of the polling counters. */
  public record PollingMetrics(
      long totalPolls,
      long emptyPolls,
      long transientFailures,
      long changesEmitted,
      long duplicatesSuppressed,
      long processingFailures,
      long deadLettered,
      long discarded,
      long messagesDeleted,
      long deleteFailures,
      long consecutiveReceiveFailures,
      Instant lastPollCompleted,
      Instant lastMessageReceived) {

    public String summary() {
      return String.format(
          "Polls: %d, Empty: %d, Transient failures: %d, Emitted: %d, Duplicates: %d, Failed: %d,"
              + " Dead-lettered: %d, Deleted: %d",
          totalPolls,
          emptyPolls,
          transientFailures,
          changesEmitted,
          duplicatesSuppressed,
          processingFailures,
          deadLettered,
          messagesDeleted);
    }
  }
}
