package com.gentoro.jobcontrol.exception;

/** A component was used outside of its lifecycle, e.g. after shutdown. */
public class StateException extends JobControlException {
  public StateException(String message) {
    super(JobControlErrorCode.STATE_ERROR, message);
  }

  public StateException(String message, Throwable cause) {
    super(JobControlErrorCode.STATE_ERROR, message, cause);
  }
}
