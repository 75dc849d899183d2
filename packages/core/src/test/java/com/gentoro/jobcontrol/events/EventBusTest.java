package com.gentoro.jobcontrol.events;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class EventBusTest {

  @Test
  @DisplayName("Every subscriber receives each published event")
  void fansOutToAllSubscribers() throws Exception {
    EventBus bus = new EventBus(8);
    try (EventSubscription first = bus.subscribe();
        EventSubscription second = bus.subscribe()) {
      assertEquals(2, bus.publish(JobEvent.started("a", "A")));

      assertEquals("a", first.poll(Duration.ofSeconds(1)).jobId());
      assertEquals("a", second.poll(Duration.ofSeconds(1)).jobId());
    }
  }

  @Test
  @DisplayName("Late subscribers only see events published after they subscribed")
  void lateSubscriberSeesNoHistory() throws Exception {
    EventBus bus = new EventBus(8);
    assertEquals(0, bus.publish(JobEvent.started("early", "early")));

    try (EventSubscription late = bus.subscribe()) {
      assertTrue(late.tryNext().isEmpty());
      bus.publish(JobEvent.completed("later", "ok"));
      assertEquals("later", late.poll(Duration.ofSeconds(1)).jobId());
    }
  }

  @Test
  @DisplayName("A slow subscriber loses its oldest events instead of blocking the publisher")
  void slowSubscriberDropsOldest() {
    EventBus bus = new EventBus(3);
    try (EventSubscription slow = bus.subscribe()) {
      for (int i = 0; i < 10; i++) {
        bus.publish(JobEvent.progress("a", 10, i, "step " + i));
      }
      assertEquals(3, slow.pending());
      assertEquals(7, slow.droppedCount());
      JobEvent.Progress oldestKept = (JobEvent.Progress) slow.tryNext().orElseThrow();
      assertEquals(7, oldestKept.current());
    }
  }

  @Test
  @DisplayName("Closed subscriptions stop receiving events")
  void closeUnsubscribes() {
    EventBus bus = new EventBus(4);
    EventSubscription subscription = bus.subscribe();
    subscription.close();

    assertTrue(subscription.isClosed());
    assertEquals(0, bus.subscriberCount());
    assertEquals(0, bus.publish(JobEvent.failed("a", "boom")));
    assertTrue(subscription.tryNext().isEmpty());
  }

  @Test
  void rejectsNonPositiveCapacity() {
    assertThrows(IllegalArgumentException.class, () -> new EventBus(0));
  }
}
