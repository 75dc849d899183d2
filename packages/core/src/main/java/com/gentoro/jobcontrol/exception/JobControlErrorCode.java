package com.gentoro.jobcontrol.exception;

/** Stable error codes attached to every {@link JobControlException}. */
public enum JobControlErrorCode {
  /** The operation targeted a job id that is neither queued nor running. */
  NOT_FOUND,
  /** The operation is not valid for the job's current status. */
  INVALID_STATE,
  /** An enqueue collided with a queued or running job of the same id. */
  DUPLICATE_ID,
  /** A reply could not be delivered to the waiting caller. */
  REPLY_DELIVERY_FAILURE,
  /** The unit of work itself failed. */
  EXECUTION_FAILURE,
  /** Invalid or unreadable configuration. */
  CONFIGURATION_ERROR,
  /** Malformed input supplied by a caller. */
  VALIDATION_ERROR,
  /** A component was used outside of its lifecycle. */
  STATE_ERROR,
  UNKNOWN
}
