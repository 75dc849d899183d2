package com.gentoro.jobcontrol.exception;

/** Raised when an operation targets a job id that is neither queued nor running. */
public class JobNotFoundException extends JobControlException {
  private final String jobId;

  public JobNotFoundException(String jobId) {
    super(JobControlErrorCode.NOT_FOUND, "Job not found: " + jobId);
    this.jobId = jobId;
    withContext("jobId", jobId);
  }

  public String getJobId() {
    return jobId;
  }
}
