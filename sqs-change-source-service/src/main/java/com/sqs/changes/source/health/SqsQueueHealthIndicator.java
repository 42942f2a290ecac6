package com.sqs.changes.source.health;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import com.sqs.changes.source.config.properties.SqsConfigurationProperties;
import com.sqs.changes.source.service.ChangeSource;
import com.sqs.changes.source.service.PollingMonitoringService;

import software.amazon.awssdk.services.sqs.SqsClient;
import software.amazon.awssdk.services.sqs.model.GetQueueAttributesRequest;
import software.amazon.awssdk.services.sqs.model.GetQueueAttributesResponse;
import software.amazon.awssdk.services.sqs.model.QueueAttributeName;

/**
 * Readiness of the change source: the queue answers a GetQueueAttributes call and receives have
 * not been failing repeatedly.
 *
 * <p><strong>Health Status Criteria:</strong>
 *
 * <ul>
 *   <li><strong>UP:</strong> queue reachable and fewer than {@value #MAX_CONSECUTIVE_FAILURES}
 *       consecutive transient receive failures
 *   <li><strong>DOWN:</strong> queue unreachable or receives keep failing
 * </ul>
 *
 * <p>A stopped source is reported in the details but does not by itself make the service DOWN.
 */
@Component("sqsChangeSourceHealth")
public class SqsQueueHealthIndicator implements HealthIndicator {

  private static final Logger logger = LoggerFactory.getLogger(SqsQueueHealthIndicator.class);
  private static final String QUEUE_URL_KEY = "queueUrl";

  static final int MAX_CONSECUTIVE_FAILURES = 5;

  private final SqsClient sqsClient;
  private final PollingMonitoringService monitoringService;
  private final ChangeSource changeSource;
  private final String queueUrl;

  public SqsQueueHealthIndicator(
      SqsClient sqsClient,
      PollingMonitoringService monitoringService,
      ChangeSource changeSource,
      SqsConfigurationProperties sqsConfig) {
    this.sqsClient = sqsClient;
    this.monitoringService = monitoringService;
    this.changeSource = changeSource;
    this.queueUrl = sqsConfig.queueUrl();
  }

  @Override
  public Health health() {
    try {
      logger.debug("Performing SQS change source health check");

      GetQueueAttributesRequest request =
          GetQueueAttributesRequest.builder()
              .queueUrl(queueUrl)
              .attributeNames(
                  QueueAttributeName.APPROXIMATE_NUMBER_OF_MESSAGES,
                  QueueAttributeName.APPROXIMATE_NUMBER_OF_MESSAGES_NOT_VISIBLE)
              .build();
      GetQueueAttributesResponse response = sqsClient.getQueueAttributes(request);

      PollingMonitoringService.PollingMetrics metrics = monitoringService.getMetrics();
      boolean receivesHealthy = metrics.consecutiveReceiveFailures() < MAX_CONSECUTIVE_FAILURES;

      Health.Builder builder = receivesHealthy ? Health.up() : Health.down();
      return builder
          .withDetail(QUEUE_URL_KEY, queueUrl)
          .withDetail("source", changeSource.describe())
          .withDetail("running", changeSource.isRunning())
          .withDetail(
              "approximateMessages",
              response.attributes().get(QueueAttributeName.APPROXIMATE_NUMBER_OF_MESSAGES))
          .withDetail(
              "approximateNotVisibleMessages",
              response
                  .attributes()
                  .get(QueueAttributeName.APPROXIMATE_NUMBER_OF_MESSAGES_NOT_VISIBLE))
          .withDetail("totalPolls", metrics.totalPolls())
          .withDetail("changesEmitted", metrics.changesEmitted())
          .withDetail("duplicatesSuppressed", metrics.duplicatesSuppressed())
          .withDetail("processingFailures", metrics.processingFailures())
          .withDetail("consecutiveReceiveFailures", metrics.consecutiveReceiveFailures())
          .withDetail(
              "lastPollCompleted",
              metrics.lastPollCompleted() != null ? metrics.lastPollCompleted() : "Never")
          .build();

    } catch (Exception e) {
      logger.error("SQS change source health check failed", e);
      return Health.down()
          .withDetail(QUEUE_URL_KEY, queueUrl)
          .withDetail("running", changeSource.isRunning())
          .withDetail("error", e.getMessage())
          .withDetail("errorType", e.getClass().getSimpleName())
          .build();
    }
  }
}
