package com.gentoro.jobcontrol.jobs;

import com.gentoro.jobcontrol.JobControlConfig;
import com.gentoro.jobcontrol.events.EventBus;
import com.gentoro.jobcontrol.events.JobEvent;
import com.gentoro.jobcontrol.exception.DuplicateJobException;
import com.gentoro.jobcontrol.exception.ErrorDetails;
import com.gentoro.jobcontrol.exception.ExceptionUtil;
import com.gentoro.jobcontrol.exception.ExecutionException;
import com.gentoro.jobcontrol.exception.InvalidJobStateException;
import com.gentoro.jobcontrol.exception.JobNotFoundException;
import com.gentoro.jobcontrol.exception.StateException;
import com.gentoro.jobcontrol.exception.ValidationException;
import com.gentoro.jobcontrol.logging.LoggingService;
import com.gentoro.jobcontrol.utility.JacksonUtility;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;

/**
 * Owns the scheduling state: a FIFO queue of waiting jobs and the table of running jobs, bounded
 * by {@link JobControlConfig#maxConcurrency()}.
 *
 * <p>Not thread-safe. Every method must be called from the {@link JobController} loop; workers
 * never touch this state and report completion by pushing {@link JobCommand.CompleteJob}.
 */
final class JobManager {
  private static final Logger log = LoggingService.getLogger(JobManager.class);
  private static final Duration MAX_NANOS = Duration.ofNanos(Long.MAX_VALUE);

  private final JobControlConfig config;
  private final JobRepository repository;
  private final EventBus events;
  private final CommandSink commands;
  private final ExecutorService workers;

  private final LinkedHashMap<String, JobExecutor> queue = new LinkedHashMap<>();
  private final Map<String, RunningJob> running = new LinkedHashMap<>();
  private boolean shutdown;

  JobManager(
      JobControlConfig config, JobRepository repository, EventBus events, CommandSink commands) {
    this.config = config;
    this.repository = repository;
    this.events = events;
    this.commands = commands;
    AtomicInteger counter = new AtomicInteger();
    this.workers =
        Executors.newFixedThreadPool(
            config.maxConcurrency(),
            r -> {
              Thread t = new Thread(r, "job-worker-" + counter.incrementAndGet());
              t.setDaemon(true);
              return t;
            });
  }

  /**
   * Admit a job: start it when a slot is free, queue it otherwise.
   *
   * @throws DuplicateJobException when a job with the same id is queued or running
   * @throws StateException after {@link #shutdown()}
   */
  void enqueue(JobExecutor executor) {
    String id = executor.id();
    if (id == null || id.isBlank()) {
      throw new ValidationException("Job executor returned a blank id");
    }
    if (shutdown) {
      throw new StateException("Job manager is shut down, rejecting job " + id);
    }
    if (queue.containsKey(id) || running.containsKey(id)) {
      throw new DuplicateJobException(id);
    }

    repository.create(JobRecord.queued(id, executor.name()));
    if (running.size() < config.maxConcurrency()) {
      start(executor);
    } else {
      queue.put(id, executor);
      log.debug("Job {} queued at position {}", id, queue.size());
    }
  }

  /**
   * Remove a finished job from the running table and fill the freed capacity from the queue.
   * Completion reports for jobs that are not running are ignored.
   */
  void complete(String id) {
    RunningJob job = running.remove(id);
    if (job == null) {
      log.warn("Received completion for job {} which is not running, ignoring", id);
      return;
    }
    finish(job, job.outcome.getNow(JobOutcome.failed("Job finished without reporting an outcome")));
    fillToCapacity();
  }

  /**
   * Cancel a job. Queued jobs are dropped and never start; running jobs get their cancellation
   * signal raised and finish once they observe it.
   *
   * @throws JobNotFoundException when the id is neither queued nor running
   */
  void cancel(String id) {
    if (queue.remove(id) != null) {
      log.info("Cancelled queued job {} before it started", id);
      repository.updateStatus(id, JobStatus.CANCELLED, "Cancelled before start");
      events.publish(JobEvent.cancelled(id, "Cancelled before start"));
      return;
    }
    RunningJob job = running.get(id);
    if (job == null) {
      throw new JobNotFoundException(id);
    }
    if (!job.signal.isCancelled()) {
      job.signal.cancel();
      repository.updateStatus(id, JobStatus.CANCELLING, "Cancellation requested");
      log.info("Cancellation requested for running job {}", id);
    }
  }

  /**
   * Raise the pause flag of a running job.
   *
   * @throws JobNotFoundException for unknown ids
   * @throws InvalidJobStateException when the job is queued or already cancelling
   */
  void pause(String id) {
    RunningJob job = requireRunning(id, "pause");
    job.signal.pause();
    log.debug("Pause requested for job {}", id);
  }

  /**
   * Clear the pause flag of a running job.
   *
   * @throws JobNotFoundException for unknown ids
   * @throws InvalidJobStateException when the job is queued or already cancelling
   */
  void resume(String id) {
    RunningJob job = requireRunning(id, "resume");
    job.signal.resume();
    log.debug("Resume requested for job {}", id);
  }

  /**
   * Cancel every running job, discard the queue and wait up to the configured grace period for
   * the running jobs to stop. Jobs still running afterwards are abandoned. Idempotent.
   */
  void shutdown() {
    if (shutdown) {
      log.debug("Job manager already shut down");
      return;
    }
    shutdown = true;
    log.info(
        "Shutting down job manager: {} running, {} queued job(s)", running.size(), queue.size());

    for (String id : queue.keySet()) {
      repository.updateStatus(id, JobStatus.CANCELLED, "Discarded at shutdown");
      events.publish(JobEvent.cancelled(id, "Discarded at shutdown"));
    }
    queue.clear();

    for (RunningJob job : running.values()) {
      if (!job.signal.isCancelled()) {
        job.signal.cancel();
        repository.updateStatus(job.id, JobStatus.CANCELLING, "Cancelled at shutdown");
      }
    }

    Duration grace = config.shutdownGracePeriod();
    long graceNanos = saturatedNanos(grace);
    long started = System.nanoTime();
    List<RunningJob> pending = new ArrayList<>(running.values());
    running.clear();
    int abandoned = 0;
    for (RunningJob job : pending) {
      JobOutcome outcome = awaitOutcome(job, graceNanos - (System.nanoTime() - started));
      if (outcome == null) {
        abandoned++;
        if (job.worker != null) {
          job.worker.cancel(true);
        }
        outcome = JobOutcome.cancelled("Abandoned after shutdown grace period of " + grace);
        log.warn("Job {} did not stop within {}, abandoning it", job.id, grace);
      }
      finish(job, outcome);
    }

    workers.shutdownNow();
    log.info("Job manager shut down ({} job(s) abandoned)", abandoned);
  }

  JobQueueSnapshot snapshot() {
    return new JobQueueSnapshot(
        new ArrayList<>(queue.keySet()),
        running.values().stream().map(RunningJob::toEntry).toList(),
        shutdown);
  }

  private void start(JobExecutor executor) {
    String id = executor.id();
    String name = executor.name();
    RunningJob job = new RunningJob(id, name, new JobSignal());
    JobContext ctx = new JobContext(id, name, job.signal, events);
    running.put(id, job);
    repository.updateStatus(id, JobStatus.RUNNING, null);
    events.publish(JobEvent.started(id, name));
    job.worker = workers.submit(() -> execute(executor, ctx, job));
    log.info("Started job {} ({}/{} slots in use)", id, running.size(), config.maxConcurrency());
  }

  private void fillToCapacity() {
    Iterator<JobExecutor> head = queue.values().iterator();
    while (running.size() < config.maxConcurrency() && head.hasNext()) {
      JobExecutor next = head.next();
      head.remove();
      start(next);
    }
  }

  // Runs on a worker thread: only touches the job handle, then reports back through the channel.
  private void execute(JobExecutor executor, JobContext ctx, RunningJob job) {
    JobOutcome result = null;
    try {
      JobExecution execution = executor.run(ctx);
      result =
          ctx.isCancelled()
              ? JobOutcome.cancelled("Cancelled")
              : JobOutcome.completed(execution);
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
      result = JobOutcome.cancelled("Cancelled");
    } catch (Exception e) {
      ErrorDetails details = failureDetails(job, e);
      log.error(
          "Job {} failed: {} at {}",
          job.id,
          JacksonUtility.toJson(details),
          ExceptionUtil.formatCompactStackTrace(e, 5),
          e);
      result = JobOutcome.failed(ExceptionUtil.extractErrorMessage(e));
    } finally {
      job.outcome.complete(
          result != null ? result : JobOutcome.failed("Worker terminated abnormally"));
      if (!commands.push(new JobCommand.CompleteJob(job.id))) {
        log.debug("Completion of job {} not delivered, controller is closed", job.id);
      }
    }
  }

  static ErrorDetails failureDetails(RunningJob job, Exception cause) {
    ExecutionException failure = new ExecutionException("Job " + job.id + " failed", cause);
    failure
        .withContext("jobId", job.id)
        .withContext("jobName", job.name)
        .withContext("cause", ExceptionUtil.extractErrorMessage(cause));
    return ExceptionUtil.toErrorDetails(failure);
  }

  private void finish(RunningJob job, JobOutcome outcome) {
    repository.updateStatus(job.id, outcome.status(), outcome.message());
    switch (outcome.status()) {
      case COMPLETED -> events.publish(JobEvent.completed(job.id, outcome.message()));
      case FAILED -> events.publish(JobEvent.failed(job.id, outcome.message()));
      default -> events.publish(JobEvent.cancelled(job.id, outcome.message()));
    }
    log.info("Job {} finished with status {}", job.id, outcome.status());
  }

  private RunningJob requireRunning(String id, String operation) {
    RunningJob job = running.get(id);
    if (job == null) {
      if (queue.containsKey(id)) {
        throw new InvalidJobStateException(id, JobStatus.QUEUED.name(), operation);
      }
      throw new JobNotFoundException(id);
    }
    if (job.signal.isCancelled()) {
      throw new InvalidJobStateException(id, JobStatus.CANCELLING.name(), operation);
    }
    return job;
  }

  // Durations past ~292 years do not fit in a long of nanoseconds.
  private static long saturatedNanos(Duration duration) {
    return duration.compareTo(MAX_NANOS) >= 0 ? Long.MAX_VALUE : duration.toNanos();
  }

  private static JobOutcome awaitOutcome(RunningJob job, long remainingNanos) {
    try {
      return job.outcome.get(Math.max(0, remainingNanos), TimeUnit.NANOSECONDS);
    } catch (TimeoutException e) {
      return null;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return null;
    } catch (java.util.concurrent.ExecutionException e) {
      return JobOutcome.failed(ExceptionUtil.extractErrorMessage(e.getCause()));
    }
  }
}
