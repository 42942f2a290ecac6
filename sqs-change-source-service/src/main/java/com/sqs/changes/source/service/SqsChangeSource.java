package com.sqs.changes.source.service;

import java.util.Objects;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import com.sqs.changes.source.config.properties.SqsConfigurationProperties;
import com.sqs.changes.source.listener.SqsChangePoller;
import com.sqs.changes.source.processor.CancellationToken;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;

/**
 * Change source that polls one SQS queue every {@code sqs.poll-interval-seconds}.
 *
 * <p>Owns the poll timer and the cancellation token of the current run. Stopping cancels the timer
 * and the token but does not interrupt a long poll already in flight; its result is discarded.
 *
 * <p>Two sources are equal when they watch the same queue with the same poll interval.
 */
@Service
public class SqsChangeSource implements ChangeSource {

  private static final Logger logger = LoggerFactory.getLogger(SqsChangeSource.class);

  public static final String NAME = "SQSSource";

  private final SqsChangePoller poller;
  private final ScheduledExecutorService scheduler;
  private final String queueUrl;
  private final int pollIntervalSeconds;
  private final boolean autoStart;

  private final Object lifecycleLock = new Object();
  private CancellationToken token = CancellationToken.cancelled();
  private ScheduledFuture<?> timer;

  public SqsChangeSource(
      SqsChangePoller poller,
      @Qualifier("changePollScheduler") ScheduledExecutorService scheduler,
      SqsConfigurationProperties sqsConfig) {
    if (poller == null) {
      throw new IllegalArgumentException("SqsChangePoller cannot be null");
    }
    if (scheduler == null) {
      throw new IllegalArgumentException("Scheduler cannot be null");
    }
    if (sqsConfig == null) {
      throw new IllegalArgumentException("SqsConfigurationProperties cannot be null");
    }

    this.poller = poller;
    this.scheduler = scheduler;
    this.queueUrl = sqsConfig.queueUrl();
    this.pollIntervalSeconds = sqsConfig.pollIntervalSeconds();
    this.autoStart = sqsConfig.autoStart();
  }

  @PostConstruct
  void startIfEnabled() {
    if (autoStart) {
      start();
    } else {
      logger.info("Auto-start disabled, {} not started", describe());
    }
  }

  @Override
  public String getName() {
    return NAME;
  }

  @Override
  public void start() {
    synchronized (lifecycleLock) {
      if (isRunning()) {
        return;
      }
      CancellationToken runToken = new CancellationToken();
      token = runToken;
      timer =
          scheduler.scheduleAtFixedRate(
              () -> tickSafely(runToken), 0, pollIntervalSeconds, TimeUnit.SECONDS);
      logger.info(
          "Started SQS change source: queueUrl={}, pollIntervalSeconds={}, waitTimeSeconds={}",
          queueUrl,
          pollIntervalSeconds,
          SqsConfigurationProperties.LONG_POLL_WAIT_SECONDS);
    }
  }

  @Override
  @PreDestroy
  public void stop() {
    synchronized (lifecycleLock) {
      if (!isRunning()) {
        return;
      }
      token.cancel();
      timer.cancel(false);
      timer = null;
      logger.info("Stopped SQS change source for {}", queueUrl);
    }
  }

  @Override
  public boolean isRunning() {
    synchronized (lifecycleLock) {
      return timer != null && !token.isCancelled();
    }
  }

  @Override
  public String describe() {
    return NAME + " watching " + queueUrl + (isRunning() ? "" : " [STOPPED]");
  }

  public String getQueueUrl() {
    return queueUrl;
  }

  public int getPollIntervalSeconds() {
    return pollIntervalSeconds;
  }

  // An exception escaping a scheduleAtFixedRate task would cancel all later ticks
  private void tickSafely(CancellationToken runToken) {
    try {
      poller.tick(runToken);
    } catch (Exception e) {
      logger.error("Error scheduling poll for {}", queueUrl, e);
    }
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof SqsChangeSource other)) {
      return false;
    }
    return pollIntervalSeconds == other.pollIntervalSeconds && queueUrl.equals(other.queueUrl);
  }

  @Override
  public int hashCode() {
    return Objects.hash(queueUrl, pollIntervalSeconds);
  }

  @Override
  public String toString() {
    return describe();
  }
}
