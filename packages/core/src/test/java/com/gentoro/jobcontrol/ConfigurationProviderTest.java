package com.gentoro.jobcontrol;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.jobcontrol.exception.ConfigurationException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import org.apache.commons.configuration2.Configuration;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ConfigurationProviderTest {

  @TempDir Path temp;

  @Test
  void loadsBundledDefaults() {
    Configuration config = new ConfigurationProvider(null).config();
    assertEquals(4, config.getInt(JobControlConfig.MAX_CONCURRENCY));
    assertEquals("PT30S", config.getString(JobControlConfig.SHUTDOWN_GRACE_PERIOD));
    assertTrue(config.getBoolean("events.log-enabled"));
  }

  @Test
  void externalFileOverridesDefaults() throws Exception {
    Path file = temp.resolve("override.yaml");
    Files.writeString(
        file,
        """
        jobs:
          max-concurrency: 9
        """);

    Configuration config = new ConfigurationProvider(file).config();
    JobControlConfig jobs = JobControlConfig.fromConfiguration(config);
    assertEquals(9, jobs.maxConcurrency());
    assertEquals(Duration.ofSeconds(30), jobs.shutdownGracePeriod());
  }

  @Test
  void missingFileIsAConfigurationError() {
    assertThrows(
        ConfigurationException.class,
        () -> new ConfigurationProvider(temp.resolve("does-not-exist.yaml")));
  }
}
