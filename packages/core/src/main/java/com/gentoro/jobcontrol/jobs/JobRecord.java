package com.gentoro.jobcontrol.jobs;

import java.time.Instant;

/** Durable view of a job as kept by a {@link JobRepository}. */
public record JobRecord(
    String id,
    String name,
    JobStatus status,
    String message,
    Instant createdAt,
    Instant startedAt,
    Instant finishedAt) {

  public static JobRecord queued(String id, String name) {
    return new JobRecord(id, name, JobStatus.QUEUED, null, Instant.now(), null, null);
  }

  /** Copy with a new status, stamping the start or finish time where the status implies one. */
  public JobRecord withStatus(JobStatus newStatus, String newMessage) {
    Instant now = Instant.now();
    Instant started = startedAt == null && newStatus == JobStatus.RUNNING ? now : startedAt;
    Instant finished = newStatus.isTerminal() && finishedAt == null ? now : finishedAt;
    return new JobRecord(id, name, newStatus, newMessage, createdAt, started, finished);
  }
}
