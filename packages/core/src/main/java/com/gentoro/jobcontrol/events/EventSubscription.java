package com.gentoro.jobcontrol.events;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/** Receiving end of an {@link EventBus} subscription. Close it to stop receiving events. */
public final class EventSubscription implements AutoCloseable {
  private final EventBus bus;
  private final BlockingQueue<JobEvent> buffer;
  private final AtomicLong dropped = new AtomicLong();
  private volatile boolean closed;

  EventSubscription(EventBus bus, int capacity) {
    this.bus = bus;
    this.buffer = new ArrayBlockingQueue<>(capacity);
  }

  void offer(JobEvent event) {
    if (closed) return;
    while (!buffer.offer(event)) {
      if (buffer.poll() != null) {
        dropped.incrementAndGet();
      }
    }
  }

  /** Wait up to {@code timeout} for the next event; {@code null} when none arrived. */
  public JobEvent poll(Duration timeout) throws InterruptedException {
    return buffer.poll(timeout.toNanos(), TimeUnit.NANOSECONDS);
  }

  public Optional<JobEvent> tryNext() {
    return Optional.ofNullable(buffer.poll());
  }

  /** Number of events discarded because this subscriber fell behind. */
  public long droppedCount() {
    return dropped.get();
  }

  public int pending() {
    return buffer.size();
  }

  public boolean isClosed() {
    return closed;
  }

  @Override
  public void close() {
    closed = true;
    bus.unsubscribe(this);
    buffer.clear();
  }
}
