package com.gentoro.jobcontrol.jobs;

import java.util.List;

/**
 * Point-in-time view of the manager's scheduling state.
 *
 * @param queued ids waiting for a slot, head first
 * @param running jobs currently handed to workers, in admission order
 * @param shutdown whether the manager has been shut down
 */
public record JobQueueSnapshot(List<String> queued, List<RunningEntry> running, boolean shutdown) {

  public JobQueueSnapshot {
    queued = List.copyOf(queued);
    running = List.copyOf(running);
  }

  public record RunningEntry(String id, String name, boolean paused, boolean cancelling) {}

  public List<String> runningIds() {
    return running.stream().map(RunningEntry::id).toList();
  }

  public boolean isIdle() {
    return queued.isEmpty() && running.isEmpty();
  }
}
