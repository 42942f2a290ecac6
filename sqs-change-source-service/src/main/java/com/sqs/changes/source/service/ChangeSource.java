package com.sqs.changes.source.service;

/** A long-running producer of change events with an explicit start/stop lifecycle. */
public interface ChangeSource {

  /** Short name identifying the kind of source. */
  String getName();

  /** Starts producing changes. Has no effect if already running. */
  void start();

  /**
   * Stops producing changes. No new work is scheduled; work already in flight completes without
   * side effects. Has no effect if not running.
   */
  void stop();

  boolean isRunning();

  /** Human-readable description including the current state. */
  String describe();
}
