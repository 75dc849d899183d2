package com.gentoro.jobcontrol.jobs;

import java.util.Objects;

/**
 * Commands accepted by the {@link JobController}. Commands carrying a {@link ReplySlot} expect an
 * answer; all others are fire-and-forget.
 */
public sealed interface JobCommand {

  /** Add a job to the queue to be run. */
  record EnqueueJob(JobExecutor executor) implements JobCommand {
    public EnqueueJob {
      Objects.requireNonNull(executor, "executor");
    }
  }

  /** A job has finished and should be removed from the running table. Sent by workers. */
  record CompleteJob(String id) implements JobCommand {
    public CompleteJob {
      Objects.requireNonNull(id, "id");
    }
  }

  /** Cancel a job by its id; the reply fails with a not-found error for unknown ids. */
  record CancelJob(String id, ReplySlot<Void> reply) implements JobCommand {
    public CancelJob {
      Objects.requireNonNull(id, "id");
      Objects.requireNonNull(reply, "reply");
    }
  }

  /** Pause a running job by its id. */
  record PauseJob(String id) implements JobCommand {
    public PauseJob {
      Objects.requireNonNull(id, "id");
    }
  }

  /** Resume a paused job by its id. */
  record ResumeJob(String id) implements JobCommand {
    public ResumeJob {
      Objects.requireNonNull(id, "id");
    }
  }

  /** Snapshot of the queue and running table as seen by the controller. */
  record InspectJobs(ReplySlot<JobQueueSnapshot> reply) implements JobCommand {
    public InspectJobs {
      Objects.requireNonNull(reply, "reply");
    }
  }

  /** Cancel all running jobs, clear the queue and stop the controller. */
  record Shutdown(ReplySlot<Void> reply) implements JobCommand {
    public Shutdown {
      Objects.requireNonNull(reply, "reply");
    }
  }
}
