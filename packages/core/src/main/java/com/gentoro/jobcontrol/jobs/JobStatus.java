package com.gentoro.jobcontrol.jobs;

/**
 * Lifecycle state of a job. Pausing is not a status of its own: a paused job is {@link #RUNNING}
 * with its pause flag raised.
 */
public enum JobStatus {
  /** Accepted and waiting for a free concurrency slot. */
  QUEUED,
  /** Handed to a worker. */
  RUNNING,
  /** Cancellation requested; waiting for the job to observe it. */
  CANCELLING,
  /** Finished successfully. */
  COMPLETED,
  /** The job's own execution failed. */
  FAILED,
  /** Stopped before completion, either before it started or after observing cancellation. */
  CANCELLED;

  public boolean isTerminal() {
    return this == COMPLETED || this == FAILED || this == CANCELLED;
  }
}
