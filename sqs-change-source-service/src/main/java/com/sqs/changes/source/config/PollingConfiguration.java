package com.sqs.changes.source.config;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import com.sqs.changes.source.config.properties.SqsConfigurationProperties;

/**
 * Threads used by the change source.
 *
 * <p>A single-threaded scheduler fires poll ticks and never runs blocking work. Processing, which
 * includes blocking change-store calls, runs on a fixed-size worker pool.
 */
@Configuration
public class PollingConfiguration {

  @Bean(destroyMethod = "shutdown")
  public ScheduledExecutorService changePollScheduler() {
    return Executors.newSingleThreadScheduledExecutor(
        new CustomizableThreadFactory("sqs-change-timer-"));
  }

  @Bean(destroyMethod = "shutdown")
  public ExecutorService changeWorkerExecutor(SqsConfigurationProperties sqsConfig) {
    return Executors.newFixedThreadPool(
        sqsConfig.workerThreads(), new CustomizableThreadFactory("sqs-change-worker-"));
  }
}
