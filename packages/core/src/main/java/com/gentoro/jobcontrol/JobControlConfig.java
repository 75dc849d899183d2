package com.gentoro.jobcontrol;

import com.gentoro.jobcontrol.exception.ConfigurationException;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import org.apache.commons.configuration2.Configuration;
import org.apache.commons.configuration2.ex.ConversionException;

/**
 * Tunables of the job control core.
 *
 * @param maxConcurrency maximum number of jobs running at the same time ({@code N})
 * @param shutdownGracePeriod how long shutdown waits for cancelled jobs before abandoning them
 * @param eventBufferCapacity per-subscriber event buffer; older events are dropped beyond it
 */
public record JobControlConfig(
    int maxConcurrency, Duration shutdownGracePeriod, int eventBufferCapacity) {

  public static final String MAX_CONCURRENCY = "jobs.max-concurrency";
  public static final String SHUTDOWN_GRACE_PERIOD = "jobs.shutdown-grace-period";
  public static final String EVENT_BUFFER_CAPACITY = "events.buffer-capacity";

  static final int DEFAULT_MAX_CONCURRENCY = 4;
  static final Duration DEFAULT_SHUTDOWN_GRACE_PERIOD = Duration.ofSeconds(30);
  static final int DEFAULT_EVENT_BUFFER_CAPACITY = 256;

  public JobControlConfig {
    if (maxConcurrency < 1) {
      throw new ConfigurationException(
          MAX_CONCURRENCY + " must be at least 1, got " + maxConcurrency);
    }
    if (shutdownGracePeriod == null || shutdownGracePeriod.isNegative()) {
      throw new ConfigurationException(
          SHUTDOWN_GRACE_PERIOD + " must be a non-negative duration, got " + shutdownGracePeriod);
    }
    if (eventBufferCapacity < 1) {
      throw new ConfigurationException(
          EVENT_BUFFER_CAPACITY + " must be at least 1, got " + eventBufferCapacity);
    }
  }

  public static JobControlConfig defaults() {
    return new JobControlConfig(
        DEFAULT_MAX_CONCURRENCY, DEFAULT_SHUTDOWN_GRACE_PERIOD, DEFAULT_EVENT_BUFFER_CAPACITY);
  }

  /** Read the job control section of the application configuration, falling back to defaults. */
  public static JobControlConfig fromConfiguration(Configuration configuration) {
    try {
      int maxConcurrency = configuration.getInt(MAX_CONCURRENCY, DEFAULT_MAX_CONCURRENCY);
      int capacity = configuration.getInt(EVENT_BUFFER_CAPACITY, DEFAULT_EVENT_BUFFER_CAPACITY);
      String grace = configuration.getString(SHUTDOWN_GRACE_PERIOD, null);
      return new JobControlConfig(
          maxConcurrency,
          grace == null ? DEFAULT_SHUTDOWN_GRACE_PERIOD : parseDuration(grace),
          capacity);
    } catch (ConversionException e) {
      throw new ConfigurationException("Invalid job control configuration: " + e.getMessage(), e);
    }
  }

  private static Duration parseDuration(String raw) {
    String value = raw.trim();
    try {
      // Bare numbers are milliseconds.
      if (value.chars().allMatch(Character::isDigit) && !value.isEmpty()) {
        return Duration.ofMillis(Long.parseLong(value));
      }
      return Duration.parse(value);
    } catch (DateTimeParseException | NumberFormatException e) {
      throw new ConfigurationException(
          SHUTDOWN_GRACE_PERIOD + " is not an ISO-8601 duration: " + raw, e);
    }
  }
}
