package com.gentoro.jobcontrol.jobs;

import java.util.Map;

/** Result of a job execution. Contains a final message and an optional output payload. */
public final class JobExecution {
  public final String message; // may be null
  public final Map<String, Object> output; // never null

  public JobExecution(String message, Map<String, Object> output) {
    this.message = message;
    this.output = output == null ? Map.of() : Map.copyOf(output);
  }

  public static JobExecution of(String message) {
    return new JobExecution(message, Map.of());
  }

  public static JobExecution empty() {
    return new JobExecution(null, Map.of());
  }
}
