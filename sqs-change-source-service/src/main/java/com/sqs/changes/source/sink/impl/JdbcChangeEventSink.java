package com.sqs.changes.source.sink.impl;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sqs.changes.source.dto.ChangeEvent;
import com.sqs.changes.source.exception.SinkUnavailableException;
import com.sqs.changes.source.sink.ChangeEventSink;

/**
 * JDBC implementation of {@link ChangeEventSink}.
 *
 * <p>Changes live in {@code sqs_change_events}, keyed by revision. The primary key turns a
 * concurrent second insert of the same revision into a {@link DuplicateKeyException}, which is
 * reported as "already present" instead of a failure.
 */
@Repository
public class JdbcChangeEventSink implements ChangeEventSink {

  private static final Logger logger = LoggerFactory.getLogger(JdbcChangeEventSink.class);

  static final String EXISTS_SQL = "SELECT COUNT(*) FROM sqs_change_events WHERE revision = ?";

  static final String INSERT_SQL =
      "INSERT INTO sqs_change_events (revision, source, codebase, repository, project, branch,"
          + " author, comments, when_timestamp, properties_json, recorded_at)"
          + " VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";

  private final JdbcTemplate jdbcTemplate;
  private final ObjectMapper objectMapper;

  public JdbcChangeEventSink(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
    if (jdbcTemplate == null) {
      throw new IllegalArgumentException("JdbcTemplate cannot be null");
    }
    if (objectMapper == null) {
      throw new IllegalArgumentException("ObjectMapper cannot be null");
    }
    this.jdbcTemplate = jdbcTemplate;
    this.objectMapper = objectMapper;
  }

  @Override
  public boolean exists(String revision) {
    try {
      Integer count = jdbcTemplate.queryForObject(EXISTS_SQL, Integer.class, revision);
      return count != null && count > 0;
    } catch (DataAccessException e) {
      throw new SinkUnavailableException("Failed to look up revision " + revision, e);
    }
  }

  @Override
  public boolean record(ChangeEvent event) {
    String propertiesJson = serializeProperties(event.properties());
    try {
      jdbcTemplate.update(
          INSERT_SQL,
          event.revision(),
          event.source(),
          event.codebase(),
          event.repository(),
          event.project(),
          event.branch(),
          event.author(),
          event.comment(),
          event.timestamp(),
          propertiesJson,
          Timestamp.from(Instant.now()));
      logger.debug("Recorded change for revision {}", event.revision());
      return true;
    } catch (DuplicateKeyException e) {
      logger.info("Change for revision {} was recorded concurrently, skipping", event.revision());
      return false;
    } catch (DataAccessException e) {
      throw new SinkUnavailableException("Failed to record change " + event.revision(), e);
    }
  }

  private String serializeProperties(Map<String, String> properties) {
    try {
      return objectMapper.writeValueAsString(properties);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Failed to serialize change properties", e);
    }
  }
}
