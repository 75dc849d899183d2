package com.gentoro.jobcontrol.exception;

/**
 * Raised when a job is enqueued while another job with the same id is already queued or running.
 */
public class DuplicateJobException extends JobControlException {
  private final String jobId;

  public DuplicateJobException(String jobId) {
    super(JobControlErrorCode.DUPLICATE_ID, "Job already queued or running: " + jobId);
    this.jobId = jobId;
    withContext("jobId", jobId);
  }

  public String getJobId() {
    return jobId;
  }
}
