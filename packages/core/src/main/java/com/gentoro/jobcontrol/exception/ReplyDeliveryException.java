package com.gentoro.jobcontrol.exception;

/** Failure to hand a result back through a reply slot. Only the affected request is impacted. */
public class ReplyDeliveryException extends JobControlException {
  public ReplyDeliveryException(String message) {
    super(JobControlErrorCode.REPLY_DELIVERY_FAILURE, message);
  }

  public ReplyDeliveryException(String message, Throwable cause) {
    super(JobControlErrorCode.REPLY_DELIVERY_FAILURE, message, cause);
  }
}
