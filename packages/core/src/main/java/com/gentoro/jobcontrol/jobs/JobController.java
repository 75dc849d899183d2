package com.gentoro.jobcontrol.jobs;

import com.gentoro.jobcontrol.JobControlConfig;
import com.gentoro.jobcontrol.events.EventBus;
import com.gentoro.jobcontrol.exception.JobControlException;
import com.gentoro.jobcontrol.exception.ReplyDeliveryException;
import com.gentoro.jobcontrol.exception.StateException;
import com.gentoro.jobcontrol.logging.LoggingService;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.LinkedBlockingQueue;
import org.slf4j.Logger;

/**
 * Serialized command loop in front of the {@link JobManager}.
 *
 * <p>Producers on any thread push {@link JobCommand}s into an unbounded mailbox; a single
 * {@code job-controller} thread takes them one at a time and applies them to the manager, which
 * is therefore only ever mutated from that thread. Enqueue, pause and resume are fire-and-forget
 * (failures are logged); cancel, inspect and shutdown answer through a {@link ReplySlot} on every
 * path.
 *
 * <p>Once a {@link JobCommand.Shutdown} has been handled the loop stops. Commands still in the
 * mailbox, or pushed later, are rejected: their reply slots fail with {@link StateException}.
 */
public final class JobController implements CommandSink {
  private static final Logger log = LoggingService.getLogger(JobController.class);

  private final BlockingQueue<JobCommand> mailbox = new LinkedBlockingQueue<>();
  private final Object mailboxLock = new Object();
  private final JobManager manager;
  private final Thread loop;
  private boolean closed; // guarded by mailboxLock

  private JobController(JobControlConfig config, JobRepository repository, EventBus events) {
    this.manager = new JobManager(config, repository, events, this);
    this.loop = new Thread(this::watch, "job-controller");
    this.loop.setDaemon(true);
  }

  /** Create a controller and start its command loop. */
  public static JobController start(
      JobControlConfig config, JobRepository repository, EventBus events) {
    JobController controller = new JobController(config, repository, events);
    controller.loop.start();
    log.info(
        "Job controller started (max concurrency {}, shutdown grace period {})",
        config.maxConcurrency(),
        config.shutdownGracePeriod());
    return controller;
  }

  /** Pushes a command to the command loop. Never blocks. */
  @Override
  public boolean push(JobCommand command) {
    synchronized (mailboxLock) {
      if (!closed) {
        mailbox.add(command);
        return true;
      }
    }
    reject(command);
    return false;
  }

  public boolean enqueue(JobExecutor executor) {
    return push(new JobCommand.EnqueueJob(executor));
  }

  /**
   * Request cancellation of a job. The future completes once the request has been applied (for a
   * running job: once its cancellation signal is raised) and fails with a not-found error for
   * unknown ids.
   */
  public CompletableFuture<Void> cancel(String id) {
    ReplySlot<Void> reply = ReplySlot.create();
    push(new JobCommand.CancelJob(id, reply));
    return reply.future();
  }

  public boolean pause(String id) {
    return push(new JobCommand.PauseJob(id));
  }

  public boolean resume(String id) {
    return push(new JobCommand.ResumeJob(id));
  }

  public CompletableFuture<JobQueueSnapshot> inspect() {
    ReplySlot<JobQueueSnapshot> reply = ReplySlot.create();
    push(new JobCommand.InspectJobs(reply));
    return reply.future();
  }

  /** Shut down; the future completes once no job is queued or running anymore. */
  public CompletableFuture<Void> shutdown() {
    ReplySlot<Void> reply = ReplySlot.create();
    push(new JobCommand.Shutdown(reply));
    return reply.future();
  }

  public boolean isRunning() {
    return loop.isAlive();
  }

  /** Wait for the command loop to stop after a shutdown. */
  public boolean awaitTermination(Duration timeout) throws InterruptedException {
    loop.join(Math.max(1, timeout.toMillis()));
    return !loop.isAlive();
  }

  private void watch() {
    while (true) {
      JobCommand command;
      try {
        command = mailbox.take();
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        log.warn("Job controller interrupted, stopping command loop");
        break;
      }
      try {
        dispatch(command);
      } catch (RuntimeException e) {
        log.error("Unexpected failure while handling {}", describe(command), e);
        failReply(command, e);
      }
      if (command instanceof JobCommand.Shutdown) {
        break;
      }
    }
    closeMailbox();
  }

  private void dispatch(JobCommand command) {
    if (command instanceof JobCommand.EnqueueJob enqueue) {
      String id = enqueue.executor().id();
      log.trace("Received enqueue job command for {}", id);
      try {
        manager.enqueue(enqueue.executor());
        log.info("Successfully enqueued job {}", id);
      } catch (JobControlException e) {
        log.error("Failed to enqueue job {}: {}", id, e.getMessage());
      }
    } else if (command instanceof JobCommand.CompleteJob complete) {
      log.trace("Received complete job command for {}", complete.id());
      manager.complete(complete.id());
    } else if (command instanceof JobCommand.CancelJob cancel) {
      log.trace("Received cancel job command for {}", cancel.id());
      try {
        manager.cancel(cancel.id());
        deliver(cancel.reply(), null, "cancel");
      } catch (JobControlException e) {
        log.debug("Cancel of job {} rejected: {}", cancel.id(), e.getMessage());
        deliverFailure(cancel.reply(), e, "cancel");
      }
    } else if (command instanceof JobCommand.PauseJob pause) {
      try {
        manager.pause(pause.id());
        log.info("Successfully issued pause request for job {}", pause.id());
      } catch (JobControlException e) {
        log.error("Failed to pause job {}: {}", pause.id(), e.getMessage());
      }
    } else if (command instanceof JobCommand.ResumeJob resume) {
      try {
        manager.resume(resume.id());
        log.info("Successfully issued resume request for job {}", resume.id());
      } catch (JobControlException e) {
        log.error("Failed to resume job {}: {}", resume.id(), e.getMessage());
      }
    } else if (command instanceof JobCommand.InspectJobs inspect) {
      deliver(inspect.reply(), manager.snapshot(), "inspect");
    } else if (command instanceof JobCommand.Shutdown shutdown) {
      manager.shutdown();
      deliver(shutdown.reply(), null, "shutdown");
    }
  }

  private void closeMailbox() {
    List<JobCommand> leftover = new ArrayList<>();
    synchronized (mailboxLock) {
      closed = true;
      mailbox.drainTo(leftover);
    }
    leftover.forEach(this::reject);
    log.info("Job controller stopped ({} pending command(s) rejected)", leftover.size());
  }

  private void reject(JobCommand command) {
    StateException error = new StateException("Job controller is shut down");
    if (command instanceof JobCommand.CompleteJob complete) {
      log.debug("Ignoring completion of job {} after shutdown", complete.id());
    } else if (command instanceof JobCommand.Shutdown shutdown) {
      // Nothing is queued or running anymore.
      deliver(shutdown.reply(), null, "shutdown");
    } else if (command instanceof JobCommand.CancelJob
        || command instanceof JobCommand.InspectJobs) {
      failReply(command, error);
    } else {
      log.warn("Dropping {}: {}", describe(command), error.getMessage());
    }
  }

  private void failReply(JobCommand command, Throwable error) {
    if (command instanceof JobCommand.CancelJob cancel) {
      deliverFailure(cancel.reply(), error, "cancel");
    } else if (command instanceof JobCommand.InspectJobs inspect) {
      deliverFailure(inspect.reply(), error, "inspect");
    } else if (command instanceof JobCommand.Shutdown shutdown) {
      deliverFailure(shutdown.reply(), error, "shutdown");
    }
  }

  private static <T> void deliver(ReplySlot<T> reply, T value, String operation) {
    if (reply.isUsed()) return;
    try {
      reply.fulfill(value);
      log.trace("{} confirmation sent", operation);
    } catch (ReplyDeliveryException e) {
      log.error("Error while sending {} confirmation: {}", operation, e.getMessage());
    }
  }

  private static void deliverFailure(ReplySlot<?> reply, Throwable error, String operation) {
    if (reply.isUsed()) return;
    try {
      reply.fail(error);
    } catch (ReplyDeliveryException e) {
      log.error("Error while sending {} failure: {}", operation, e.getMessage());
    }
  }

  private static String describe(JobCommand command) {
    return command.getClass().getSimpleName();
  }
}
