package com.gentoro.jobcontrol;

public class JobControlApp {

  private static final org.slf4j.Logger log =
      com.gentoro.jobcontrol.logging.LoggingService.getLogger(JobControlApp.class);

  public static void main(String[] args) {
    try {
      JobControl app = new JobControl(args);
      app.initialize();
      // Keep the controller running until shutdown signal
      app.waitShutdownSignal();
    } catch (Exception e) {
      log.error("Application failed to start", e);
      System.exit(1);
    }
  }
}
