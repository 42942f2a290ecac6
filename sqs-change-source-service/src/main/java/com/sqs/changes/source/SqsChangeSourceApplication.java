package com.sqs.changes.source;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for the SQS Change Source Service.
 *
 * <p>The service long-polls a single SQS queue and turns every message into a change event for a
 * downstream change-tracking store. Messages are removed from the queue only once their change
 * has been recorded or recognised as a duplicate of an already recorded revision.
 *
 * <p><strong>Data Flow:</strong>
 *
 * <ol>
 *   <li>Timer fires and the poller issues a 20-second long-poll receive
 *   <li>The received message is transformed into a change event (raw or JSON body)
 *   <li>The revision is checked against the recorded change history
 *   <li>New changes are recorded in the change store
 *   <li>The message is deleted from the queue
 * </ol>
 *
 * @author SQS Change Source Team
 * @version 1.0
 * @since 2024
 */
@SpringBootApplication
@ConfigurationPropertiesScan("com.sqs.changes.source.config.properties")
public class SqsChangeSourceApplication {

  /**
   * Main entry point for the SQS Change Source Service.
   *
   * @param args Command line arguments passed to the application
   */
  public static void main(String[] args) {
    SpringApplication.run(SqsChangeSourceApplication.class, args);
  }
}
