package com.gentoro.jobcontrol.jobs;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Future;

/**
 * Handle the manager keeps for a running job. The executor itself lives on the worker; the
 * manager only holds the signal and a way to observe completion.
 */
final class RunningJob {
  final String id;
  final String name;
  final JobSignal signal;
  final CompletableFuture<JobOutcome> outcome = new CompletableFuture<>();

  // Assigned by the controller thread right after submission.
  Future<?> worker;

  RunningJob(String id, String name, JobSignal signal) {
    this.id = id;
    this.name = name;
    this.signal = signal;
  }

  JobQueueSnapshot.RunningEntry toEntry() {
    return new JobQueueSnapshot.RunningEntry(id, name, signal.isPaused(), signal.isCancelled());
  }
}
