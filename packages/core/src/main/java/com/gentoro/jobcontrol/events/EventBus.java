package com.gentoro.jobcontrol.events;

import com.gentoro.jobcontrol.logging.LoggingService;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import org.slf4j.Logger;

/**
 * Fan-out broadcast of {@link JobEvent}s.
 *
 * <p>Every subscriber owns a bounded buffer. Publishing never blocks: when a subscriber's buffer
 * is full its oldest event is discarded and the subscriber's lag counter is incremented. A new
 * subscriber only observes events published after it subscribed.
 */
public final class EventBus {
  private static final Logger log = LoggingService.getLogger(EventBus.class);

  private final int capacity;
  private final List<EventSubscription> subscribers = new CopyOnWriteArrayList<>();

  public EventBus(int capacity) {
    if (capacity < 1) {
      throw new IllegalArgumentException("Event buffer capacity must be positive: " + capacity);
    }
    this.capacity = capacity;
  }

  public EventSubscription subscribe() {
    EventSubscription subscription = new EventSubscription(this, capacity);
    subscribers.add(subscription);
    log.debug("New event subscriber, {} active", subscribers.size());
    return subscription;
  }

  /**
   * Broadcast an event to the current subscribers.
   *
   * @return number of subscribers the event was handed to
   */
  public int publish(JobEvent event) {
    Objects.requireNonNull(event, "event");
    int delivered = 0;
    for (EventSubscription subscription : subscribers) {
      subscription.offer(event);
      delivered++;
    }
    if (delivered == 0) {
      log.trace("No subscribers for {} of job {}", event.getClass().getSimpleName(), event.jobId());
    }
    return delivered;
  }

  public int subscriberCount() {
    return subscribers.size();
  }

  public int capacity() {
    return capacity;
  }

  void unsubscribe(EventSubscription subscription) {
    subscribers.remove(subscription);
  }
}
