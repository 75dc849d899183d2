package com.gentoro.jobcontrol.exception;

/** Failure raised by, or on behalf of, a unit of work. */
public class ExecutionException extends JobControlException {
  public ExecutionException(String message) {
    super(JobControlErrorCode.EXECUTION_FAILURE, message);
  }

  public ExecutionException(String message, Throwable cause) {
    super(JobControlErrorCode.EXECUTION_FAILURE, message, cause);
  }
}
