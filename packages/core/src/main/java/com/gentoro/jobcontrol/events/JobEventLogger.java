package com.gentoro.jobcontrol.events;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.jobcontrol.logging.LoggingService;
import com.gentoro.jobcontrol.utility.JacksonUtility;
import java.time.Duration;
import org.slf4j.Logger;

/** Subscriber that drains the {@link EventBus} on its own thread and logs every event as JSON. */
public final class JobEventLogger implements AutoCloseable {
  private static final Logger log = LoggingService.getLogger(JobEventLogger.class);
  private static final Duration POLL_INTERVAL = Duration.ofMillis(250);

  private final EventSubscription subscription;
  private final Thread thread;
  private volatile boolean running = true;
  private long reportedDrops;

  private JobEventLogger(EventSubscription subscription) {
    this.subscription = subscription;
    this.thread = new Thread(this::drain, "job-event-logger");
    this.thread.setDaemon(true);
  }

  public static JobEventLogger start(EventBus bus) {
    JobEventLogger logger = new JobEventLogger(bus.subscribe());
    logger.thread.start();
    log.debug(
        "Event logger subscribed ({} subscriber(s), buffer capacity {})",
        bus.subscriberCount(),
        bus.capacity());
    return logger;
  }

  /** Render an event as a single JSON object with a {@code type} discriminator. */
  public static String render(JobEvent event) {
    ObjectNode node = JacksonUtility.getJsonMapper().valueToTree(event);
    node.put("type", event.getClass().getSimpleName());
    return JacksonUtility.toJson(node);
  }

  private void drain() {
    while (running) {
      JobEvent event;
      try {
        event = subscription.poll(POLL_INTERVAL);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        break;
      }
      long drops = subscription.droppedCount();
      if (drops > reportedDrops) {
        log.warn("Event logger fell behind, {} event(s) dropped", drops - reportedDrops);
        reportedDrops = drops;
      }
      if (event == null) continue;
      if (event instanceof JobEvent.Progress) {
        log.debug("job-event {}", render(event));
      } else {
        log.info("job-event {}", render(event));
      }
    }
  }

  @Override
  public void close() {
    running = false;
    thread.interrupt();
    try {
      thread.join(POLL_INTERVAL.multipliedBy(4).toMillis());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    } finally {
      int unread = subscription.pending();
      if (unread > 0) {
        log.debug("Event logger closed with {} event(s) not logged", unread);
      }
      subscription.close();
    }
  }
}
