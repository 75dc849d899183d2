package com.gentoro.jobcontrol;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.jobcontrol.exception.ConfigurationException;
import java.time.Duration;
import org.apache.commons.configuration2.BaseConfiguration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class JobControlConfigTest {

  @Test
  @DisplayName("Missing keys fall back to defaults")
  void defaultsWhenUnset() {
    JobControlConfig config = JobControlConfig.fromConfiguration(new BaseConfiguration());
    assertEquals(JobControlConfig.defaults(), config);
    assertEquals(4, config.maxConcurrency());
    assertEquals(Duration.ofSeconds(30), config.shutdownGracePeriod());
  }

  @Test
  @DisplayName("Reads concurrency, grace period and buffer capacity")
  void readsValues() {
    BaseConfiguration configuration = new BaseConfiguration();
    configuration.setProperty(JobControlConfig.MAX_CONCURRENCY, "2");
    configuration.setProperty(JobControlConfig.SHUTDOWN_GRACE_PERIOD, "PT5S");
    configuration.setProperty(JobControlConfig.EVENT_BUFFER_CAPACITY, 32);

    JobControlConfig config = JobControlConfig.fromConfiguration(configuration);
    assertEquals(new JobControlConfig(2, Duration.ofSeconds(5), 32), config);
  }

  @Test
  @DisplayName("A bare number grace period is read as milliseconds")
  void graceInMillis() {
    BaseConfiguration configuration = new BaseConfiguration();
    configuration.setProperty(JobControlConfig.SHUTDOWN_GRACE_PERIOD, "1500");
    assertEquals(
        Duration.ofMillis(1500),
        JobControlConfig.fromConfiguration(configuration).shutdownGracePeriod());
  }

  @Test
  @DisplayName("Invalid values are rejected with a configuration error")
  void rejectsInvalidValues() {
    assertThrows(
        ConfigurationException.class, () -> new JobControlConfig(0, Duration.ofSeconds(1), 1));
    assertThrows(
        ConfigurationException.class, () -> new JobControlConfig(1, Duration.ofSeconds(-1), 1));
    assertThrows(
        ConfigurationException.class, () -> new JobControlConfig(1, Duration.ofSeconds(1), 0));

    BaseConfiguration badNumber = new BaseConfiguration();
    badNumber.setProperty(JobControlConfig.MAX_CONCURRENCY, "many");
    assertThrows(ConfigurationException.class, () -> JobControlConfig.fromConfiguration(badNumber));

    BaseConfiguration badDuration = new BaseConfiguration();
    badDuration.setProperty(JobControlConfig.SHUTDOWN_GRACE_PERIOD, "soon");
    assertThrows(
        ConfigurationException.class, () -> JobControlConfig.fromConfiguration(badDuration));
  }
}
