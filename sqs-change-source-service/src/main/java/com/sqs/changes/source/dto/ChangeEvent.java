package com.sqs.changes.source.dto;

import java.util.Map;

/**
 * Normalized change produced from one queue message.
 *
 * <p>Instances are immutable; the properties map is copied on construction.
 *
 * @param source constant tag identifying the queue source
 * @param codebase configured codebase, may be null
 * @param repository queue identifier the message came from
 * @param project configured project, may be null
 * @param branch branch name, empty when unknown
 * @param author change author
 * @param comment change comment
 * @param timestamp enqueue time in seconds since the epoch, fractional part kept
 * @param revision revision identifier used for duplicate suppression
 * @param properties string properties attached to the change
 */
public record ChangeEvent(
    String source,
    String codebase,
    String repository,
    String project,
    String branch,
    String author,
    String comment,
    double timestamp,
    String revision,
    Map<String, String> properties) {

  public ChangeEvent {
    if (revision == null || revision.isBlank()) {
      throw new IllegalArgumentException("Revision cannot be null or blank");
    }
    if (repository == null) {
      throw new IllegalArgumentException("Repository cannot be null");
    }
    branch = branch == null ? "" : branch;
    properties = properties == null ? Map.of() : Map.copyOf(properties);
  }
}
