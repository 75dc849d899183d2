package com.gentoro.jobcontrol.jobs;

/** Terminal result of one execution, produced by the worker and read by the manager. */
record JobOutcome(JobStatus status, String message) {

  static JobOutcome completed(JobExecution execution) {
    return new JobOutcome(JobStatus.COMPLETED, execution == null ? null : execution.message);
  }

  static JobOutcome failed(String error) {
    return new JobOutcome(JobStatus.FAILED, error);
  }

  static JobOutcome cancelled(String reason) {
    return new JobOutcome(JobStatus.CANCELLED, reason);
  }
}
