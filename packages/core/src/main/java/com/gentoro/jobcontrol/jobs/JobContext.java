package com.gentoro.jobcontrol.jobs;

import com.gentoro.jobcontrol.events.EventBus;
import com.gentoro.jobcontrol.events.JobEvent;
import com.gentoro.jobcontrol.logging.LoggingService;
import org.slf4j.Logger;

/** Context passed to {@link JobExecutor#run} with cooperative cancellation and pause hooks. */
public final class JobContext {
  private static final Logger log = LoggingService.getLogger(JobContext.class);

  private final String jobId;
  private final String jobName;
  private final JobSignal signal;
  private final EventBus events;

  JobContext(String jobId, String jobName, JobSignal signal, EventBus events) {
    this.jobId = jobId;
    this.jobName = jobName;
    this.signal = signal;
    this.events = events;
  }

  public String jobId() {
    return jobId;
  }

  public String jobName() {
    return jobName;
  }

  public boolean isCancelled() {
    return signal.isCancelled() || Thread.currentThread().isInterrupted();
  }

  public boolean isPaused() {
    return signal.isPaused();
  }

  /**
   * Cancellation and pause checkpoint. Blocks while the job is paused and throws once
   * cancellation has been requested.
   *
   * @throws InterruptedException when the job was cancelled, before or during a pause
   */
  public void checkpoint() throws InterruptedException {
    if (isCancelled()) throw new InterruptedException("Job " + jobId + " cancelled");
    if (signal.isPaused()) {
      log.debug("Job {} paused at checkpoint", jobId);
      signal.awaitResumed();
      if (isCancelled()) throw new InterruptedException("Job " + jobId + " cancelled while paused");
      log.debug("Job {} resumed", jobId);
    }
  }

  /**
   * Publish a progress update. Pass {@code -1} for {@code total} and {@code current} when the
   * amount of work is unknown.
   */
  public void reportProgress(long total, long current, String message) {
    if (events != null) {
      events.publish(JobEvent.progress(jobId, total, current, message));
    }
  }
}
