package com.gentoro.jobcontrol;

import com.gentoro.jobcontrol.events.EventBus;
import com.gentoro.jobcontrol.events.JobEventLogger;
import com.gentoro.jobcontrol.exception.ExceptionUtil;
import com.gentoro.jobcontrol.exception.StateException;
import com.gentoro.jobcontrol.jobs.InMemoryJobRepository;
import com.gentoro.jobcontrol.jobs.JobController;
import com.gentoro.jobcontrol.jobs.JobRepository;
import com.gentoro.jobcontrol.logging.LoggingService;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import org.apache.commons.configuration2.Configuration;

/** Wires configuration, logging, the event bus and the job controller together. */
public class JobControl {

  private static final org.slf4j.Logger log = LoggingService.getLogger(JobControl.class);

  // Extra time on top of the grace period for the controller to acknowledge shutdown.
  private static final Duration SHUTDOWN_ACK_MARGIN = Duration.ofSeconds(5);
  private static final Duration MAX_ACK_WAIT = Duration.ofMillis(Long.MAX_VALUE);

  private final StartupParameters startupParameters;
  private ConfigurationProvider configurationProvider;
  private JobControlConfig config;
  private JobRepository repository;
  private EventBus eventBus;
  private JobEventLogger eventLogger;
  private JobController controller;
  private final AtomicBoolean shuttingDown = new AtomicBoolean(false);
  private final CountDownLatch shutdownLatch = new CountDownLatch(1);
  private volatile Thread shutdownHook;

  public JobControl(String[] applicationArgs) {
    this.startupParameters = new StartupParameters(applicationArgs);
  }

  public void initialize() {
    this.configurationProvider = new ConfigurationProvider(startupParameters.configFile());
    // Apply logging levels from application.yaml as early as possible
    LoggingService.applyConfiguration(configuration());
    this.config = JobControlConfig.fromConfiguration(configuration());

    this.repository = new InMemoryJobRepository();
    this.eventBus = new EventBus(config.eventBufferCapacity());
    if (configuration().getBoolean("events.log-enabled", true)) {
      this.eventLogger = JobEventLogger.start(eventBus);
    }
    this.controller = JobController.start(config, repository, eventBus);
  }

  /**
   * Block the current thread until a shutdown signal is received (e.g., Ctrl+C or JVM
   * termination). When signaled, this method invokes {@link #shutdown()} before returning.
   */
  public void waitShutdownSignal() {
    if (shutdownHook == null) {
      synchronized (this) {
        if (shutdownHook == null) {
          shutdownHook = new Thread(this::shutdown, "jobcontrol-shutdown-hook");
          Runtime.getRuntime().addShutdownHook(shutdownHook);
        }
      }
    }

    try {
      shutdownLatch.await();
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
    }
  }

  /** Stop all jobs and release resources. Safe to call multiple times; executed only once. */
  public void shutdown() {
    triggerShutdown("explicit");
  }

  private void triggerShutdown(String reason) {
    if (!shuttingDown.compareAndSet(false, true)) return;
    log.info("Shutting down job control ({})", reason);
    try {
      if (controller != null) {
        long waitMillis = ackWaitMillis(config.shutdownGracePeriod());
        controller.shutdown().get(waitMillis, TimeUnit.MILLISECONDS);
        if (!controller.awaitTermination(SHUTDOWN_ACK_MARGIN)) {
          log.warn("Job controller loop still running after shutdown was acknowledged");
        }
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      log.warn("Interrupted while waiting for the job controller to shut down");
    } catch (TimeoutException e) {
      log.error("Job controller did not acknowledge shutdown in time");
    } catch (java.util.concurrent.ExecutionException e) {
      throw ExceptionUtil.asJobControlException(
          e.getCause(), t -> new StateException("Job controller shutdown failed", t));
    } finally {
      if (eventLogger != null) {
        eventLogger.close();
      }
      shutdownLatch.countDown();
    }
  }

  static long ackWaitMillis(Duration gracePeriod) {
    Duration limit = MAX_ACK_WAIT.minus(SHUTDOWN_ACK_MARGIN);
    return gracePeriod.compareTo(limit) >= 0
        ? Long.MAX_VALUE
        : gracePeriod.plus(SHUTDOWN_ACK_MARGIN).toMillis();
  }

  /** Expose the application configuration to other components. */
  public Configuration configuration() {
    if (configurationProvider == null) {
      throw new StateException("JobControl not initialized. Call initialize() first.");
    }
    return configurationProvider.config();
  }

  public StartupParameters startupParameters() {
    return startupParameters;
  }

  public JobControlConfig config() {
    return config;
  }

  public JobRepository repository() {
    return repository;
  }

  public EventBus eventBus() {
    return eventBus;
  }

  public JobController controller() {
    if (controller == null) {
      throw new StateException("JobControl not initialized. Call initialize() first.");
    }
    return controller;
  }

  public boolean isShutdown() {
    return shuttingDown.get() && shutdownLatch.getCount() == 0;
  }
}
