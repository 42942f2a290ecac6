package com.sqs.changes.source.config.properties;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the SQS change source.
 *
 * <p>Only the queue URL is mandatory. The long-poll wait is not configurable: every receive waits
 * up to {@link #LONG_POLL_WAIT_SECONDS}, the provider maximum, and asks for one message.
 */
@ConfigurationProperties(prefix = "sqs")
@Validated
public record SqsConfigurationProperties(

    @NotBlank(message = "SQS queue URL is required")
    String queueUrl,

    @Min(value = 1, message = "Poll interval must be at least 1 second")
    @Max(value = 86400, message = "Poll interval cannot exceed one day")
    Integer pollIntervalSeconds,

    String codebase,

    String project,

    BodyFormat bodyFormat,

    @Min(value = 1, message = "Worker threads must be at least 1")
    @Max(value = 16, message = "Worker threads cannot exceed 16")
    Integer workerThreads,

    @Min(value = 0, message = "Max receive count cannot be negative")
    Integer maxReceiveCount,

    String deadLetterQueueUrl,

    Boolean autoStart
) {

    public static final int LONG_POLL_WAIT_SECONDS = 20;
    public static final int MAX_MESSAGES_PER_RECEIVE = 1;
    public static final int DEFAULT_POLL_INTERVAL_SECONDS = 60;
    public static final int DEFAULT_WORKER_THREADS = 2;

    public SqsConfigurationProperties {
        pollIntervalSeconds = pollIntervalSeconds == null ? DEFAULT_POLL_INTERVAL_SECONDS : pollIntervalSeconds;
        bodyFormat = bodyFormat == null ? BodyFormat.RAW : bodyFormat;
        workerThreads = workerThreads == null ? DEFAULT_WORKER_THREADS : workerThreads;
        maxReceiveCount = maxReceiveCount == null ? 0 : maxReceiveCount;
        autoStart = autoStart == null ? Boolean.TRUE : autoStart;
        codebase = blankToNull(codebase);
        project = blankToNull(project);
        deadLetterQueueUrl = blankToNull(deadLetterQueueUrl);
    }

    /** Creates properties for a queue with every optional setting left at its default. */
    public static SqsConfigurationProperties forQueue(String queueUrl) {
        return new SqsConfigurationProperties(
            queueUrl, null, null, null, null, null, null, null, null);
    }

    /** Whether malformed payloads are moved to a dead-letter queue after a bounded number of receives. */
    public boolean isDeadLetteringEnabled() {
        return maxReceiveCount > 0 && deadLetterQueueUrl != null;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
