package com.sqs.changes.source.config;

import java.net.URI;
import java.time.Duration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.sqs.changes.source.config.properties.SqsConfigurationProperties;

import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.awscore.client.builder.AwsClientBuilder;
import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;
import software.amazon.awssdk.core.retry.RetryPolicy;
import software.amazon.awssdk.core.retry.backoff.BackoffStrategy;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.sqs.SqsAsyncClient;
import software.amazon.awssdk.services.sqs.SqsClient;

/**
 * SQS clients for the change source.
 *
 * <p>Both clients share region, credentials and endpoint. {@code aws.endpoint-url} points them at
 * LocalStack; static credentials apply only when both keys are set.
 */
@Configuration
public class AwsConfiguration {

  private static final Logger logger = LoggerFactory.getLogger(AwsConfiguration.class);

  /** Region used when {@code aws.region} is not set. */
  public static final String DEFAULT_REGION = "eu-central-1";

  /** Headroom on top of the long-poll wait before a receive attempt counts as timed out. */
  static final Duration RECEIVE_ATTEMPT_HEADROOM = Duration.ofSeconds(10);

  static final int SDK_RETRIES = 2;

  @Value("${aws.region:" + DEFAULT_REGION + "}")
  private String region;

  @Value("${aws.endpoint-url:}")
  private String endpointUrl;

  @Value("${aws.credentials.access-key:}")
  private String accessKey;

  @Value("${aws.credentials.secret-key:}")
  private String secretKey;

  /**
   * Timeouts sized around one long-poll receive. Retries stay low: a failed receive is simply
   * retried on the next tick, and an undeleted message is redelivered.
   */
  @Bean
  public ClientOverrideConfiguration changeSourceClientOverrides() {
    Duration attemptTimeout =
        Duration.ofSeconds(SqsConfigurationProperties.LONG_POLL_WAIT_SECONDS)
            .plus(RECEIVE_ATTEMPT_HEADROOM);

    return ClientOverrideConfiguration.builder()
        .apiCallAttemptTimeout(attemptTimeout)
        .apiCallTimeout(attemptTimeout.multipliedBy(SDK_RETRIES + 1L))
        .retryPolicy(
            RetryPolicy.builder()
                .numRetries(SDK_RETRIES)
                .backoffStrategy(BackoffStrategy.defaultStrategy())
                .build())
        .build();
  }

  @Bean
  public AwsCredentialsProvider changeSourceCredentials() {
    if (!accessKey.isBlank() && !secretKey.isBlank()) {
      logger.info("Using static AWS credentials for the SQS change source");
      return StaticCredentialsProvider.create(AwsBasicCredentials.create(accessKey, secretKey));
    }
    return DefaultCredentialsProvider.create();
  }

  /** Receive, delete and dead-letter sends; never blocks the poll scheduler. */
  @Bean
  public SqsAsyncClient sqsAsyncClient(
      AwsCredentialsProvider credentials, ClientOverrideConfiguration overrides) {
    return connect(SqsAsyncClient.builder(), credentials, overrides).build();
  }

  /** Blocking client for the GetQueueAttributes health check. */
  @Bean
  public SqsClient sqsClient(
      AwsCredentialsProvider credentials, ClientOverrideConfiguration overrides) {
    return connect(SqsClient.builder(), credentials, overrides).build();
  }

  private <B extends AwsClientBuilder<B, ?>> B connect(
      B builder, AwsCredentialsProvider credentials, ClientOverrideConfiguration overrides) {
    builder.region(Region.of(region)).credentialsProvider(credentials).overrideConfiguration(overrides);
    if (!endpointUrl.isBlank()) {
      logger.info("SQS endpoint override: {}", endpointUrl);
      builder.endpointOverride(URI.create(endpointUrl));
    }
    return builder;
  }
}
