package com.gentoro.jobcontrol.jobs;

import java.util.List;
import java.util.Objects;

/**
 * Base class for jobs made of a known sequence of steps. A checkpoint runs before every step, so
 * cancellation and pause take effect between steps, and progress is reported as
 * {@code [current / total]}.
 */
public abstract class StepwiseExecutor implements JobExecutor {
  private final String id;
  private final String name;

  protected StepwiseExecutor(String id, String name) {
    this.id = Objects.requireNonNull(id, "id");
    this.name = name == null ? id : name;
  }

  /** A named unit of work inside the job. */
  public record Step(String name, StepAction action) {
    public Step {
      Objects.requireNonNull(name, "name");
      Objects.requireNonNull(action, "action");
    }
  }

  @FunctionalInterface
  public interface StepAction {
    void run(JobContext ctx) throws Exception;
  }

  /** Steps to execute, computed once when the job starts. */
  protected abstract List<Step> steps(JobContext ctx) throws Exception;

  /** Result once every step ran. */
  protected JobExecution onCompleted(int stepCount) {
    return JobExecution.of("Completed %d step(s)".formatted(stepCount));
  }

  @Override
  public final String id() {
    return id;
  }

  @Override
  public final String name() {
    return name;
  }

  @Override
  public final JobExecution run(JobContext ctx) throws Exception {
    List<Step> steps = steps(ctx);
    int total = steps.size();
    for (int i = 0; i < total; i++) {
      ctx.checkpoint();
      Step step = steps.get(i);
      ctx.reportProgress(total, i, step.name());
      step.action().run(ctx);
    }
    ctx.reportProgress(total, total, "Done");
    return onCompleted(total);
  }
}
