package com.gentoro.jobcontrol.jobs;

/**
 * SPI implemented by every kind of background job (library scans, thumbnail generation, ...).
 *
 * <p>The manager only relies on this surface and never on the concrete kind. Cancellation and
 * pausing are cooperative: {@link #run(JobContext)} must call {@link JobContext#checkpoint()} (or
 * poll {@link JobContext#isCancelled()}) at bounded intervals.
 */
public interface JobExecutor {
  /** Stable unique identifier, used as the job id. */
  String id();

  /** Human readable name recorded with the job. */
  default String name() {
    return id();
  }

  /**
   * Executes the job. Returning normally completes it; throwing {@link InterruptedException}
   * reports it as cancelled; any other exception marks it as failed.
   */
  JobExecution run(JobContext ctx) throws Exception;
}
