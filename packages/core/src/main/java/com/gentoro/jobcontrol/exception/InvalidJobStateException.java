package com.gentoro.jobcontrol.exception;

/** The requested operation is not valid for the job's current status. */
public class InvalidJobStateException extends JobControlException {
  private final String jobId;
  private final String state;

  public InvalidJobStateException(String jobId, String state, String operation) {
    super(
        JobControlErrorCode.INVALID_STATE,
        "Cannot %s job %s while it is %s".formatted(operation, jobId, state));
    this.jobId = jobId;
    this.state = state;
    withContext("jobId", jobId).withContext("state", state).withContext("operation", operation);
  }

  public String getJobId() {
    return jobId;
  }

  public String getState() {
    return state;
  }
}
