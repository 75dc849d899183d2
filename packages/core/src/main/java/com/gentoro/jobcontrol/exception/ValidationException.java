package com.gentoro.jobcontrol.exception;

/** Malformed input supplied by a caller. */
public class ValidationException extends JobControlException {
  public ValidationException(String message) {
    super(JobControlErrorCode.VALIDATION_ERROR, message);
  }

  public ValidationException(String message, Throwable cause) {
    super(JobControlErrorCode.VALIDATION_ERROR, message, cause);
  }
}
