package com.gentoro.jobcontrol.events;

import java.time.Instant;

/** Lifecycle transition broadcast on the {@link EventBus}. Informational only. */
public sealed interface JobEvent {
  String jobId();

  Instant timestamp();

  record Started(String jobId, String jobName, Instant timestamp) implements JobEvent {}

  record Progress(String jobId, long total, long current, String message, Instant timestamp)
      implements JobEvent {}

  record Completed(String jobId, String message, Instant timestamp) implements JobEvent {}

  record Failed(String jobId, String error, Instant timestamp) implements JobEvent {}

  record Cancelled(String jobId, String reason, Instant timestamp) implements JobEvent {}

  static Started started(String jobId, String jobName) {
    return new Started(jobId, jobName, Instant.now());
  }

  static Progress progress(String jobId, long total, long current, String message) {
    return new Progress(jobId, total, current, message, Instant.now());
  }

  static Completed completed(String jobId, String message) {
    return new Completed(jobId, message, Instant.now());
  }

  static Failed failed(String jobId, String error) {
    return new Failed(jobId, error, Instant.now());
  }

  static Cancelled cancelled(String jobId, String reason) {
    return new Cancelled(jobId, reason, Instant.now());
  }
}
