package com.gentoro.jobcontrol;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.jobcontrol.exception.StateException;
import com.gentoro.jobcontrol.jobs.JobContext;
import com.gentoro.jobcontrol.jobs.JobExecution;
import com.gentoro.jobcontrol.jobs.JobExecutor;
import com.gentoro.jobcontrol.jobs.JobQueueSnapshot;
import com.gentoro.jobcontrol.jobs.JobStatus;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class JobControlTest {

  @TempDir Path temp;

  private static JobExecutor sleeper(String id) {
    return new JobExecutor() {
      @Override
      public String id() {
        return id;
      }

      @Override
      public JobExecution run(JobContext ctx) throws Exception {
        while (true) {
          ctx.checkpoint();
          Thread.sleep(5);
        }
      }
    };
  }

  @Test
  @DisplayName("Configuration is not available before initialize()")
  void requiresInitialization() {
    JobControl control = new JobControl(new String[0]);
    assertThrows(StateException.class, control::configuration);
    assertThrows(StateException.class, control::controller);
  }

  @Test
  @DisplayName("Initializes from a config file and shuts running jobs down")
  void initializesAndShutsDown() throws Exception {
    Path file = temp.resolve("jobs.yaml");
    Files.writeString(
        file,
        """
        jobs:
          max-concurrency: 1
          shutdown-grace-period: PT2S
        events:
          log-enabled: true
        """);

    JobControl control = new JobControl(new String[] {"--config-file", file.toString()});
    control.initialize();
    assertEquals(1, control.config().maxConcurrency());
    assertEquals(Duration.ofSeconds(2), control.config().shutdownGracePeriod());

    control.controller().enqueue(sleeper("a"));
    control.controller().enqueue(sleeper("b"));
    JobQueueSnapshot snapshot = control.controller().inspect().get(5, TimeUnit.SECONDS);
    assertEquals(1, snapshot.running().size());
    assertEquals(1, snapshot.queued().size());

    control.shutdown();
    assertTrue(control.isShutdown());
    assertTrue(control.controller().awaitTermination(Duration.ofSeconds(5)));
    assertEquals(JobStatus.CANCELLED, control.repository().get("a").orElseThrow().status());
    assertEquals(JobStatus.CANCELLED, control.repository().get("b").orElseThrow().status());
    assertEquals(0, control.eventBus().subscriberCount());

    // Safe to call again.
    control.shutdown();
  }

  @Test
  @DisplayName("The shutdown wait saturates instead of overflowing for huge grace periods")
  void shutdownWaitSaturates() {
    assertEquals(7_000, JobControl.ackWaitMillis(Duration.ofSeconds(2)));
    assertEquals(Long.MAX_VALUE, JobControl.ackWaitMillis(Duration.ofSeconds(Long.MAX_VALUE)));
  }

  @Test
  @DisplayName("A grace period of a thousand years does not break shutdown")
  void shutsDownWithVeryLongGracePeriod() throws Exception {
    Path file = temp.resolve("long-grace.yaml");
    Files.writeString(
        file,
        """
        jobs:
          max-concurrency: 1
          shutdown-grace-period: P365000D
        events:
          log-enabled: false
        """);

    JobControl control = new JobControl(new String[] {"--config-file", file.toString()});
    control.initialize();
    assertEquals(Duration.ofDays(365_000), control.config().shutdownGracePeriod());
    control.controller().enqueue(sleeper("long"));
    control.controller().inspect().get(5, TimeUnit.SECONDS);

    control.shutdown();
    assertTrue(control.isShutdown());
    assertTrue(control.controller().awaitTermination(Duration.ofSeconds(5)));
    assertEquals(JobStatus.CANCELLED, control.repository().get("long").orElseThrow().status());
  }
}
