package com.gentoro.jobcontrol.jobs;

/** Write end of the controller's command channel. */
@FunctionalInterface
public interface CommandSink {
  /**
   * Hand a command over without blocking.
   *
   * @return {@code false} when the channel no longer accepts commands
   */
  boolean push(JobCommand command);
}
