package com.gentoro.jobcontrol.jobs;

import static org.junit.jupiter.api.Assertions.*;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class JobContextTest {

  @Test
  @DisplayName("A checkpoint passes while the job is neither paused nor cancelled")
  void checkpointPasses() throws Exception {
    JobContext ctx = new JobContext("j", "j", new JobSignal(), null);
    ctx.checkpoint();
    assertFalse(ctx.isCancelled());
    assertFalse(ctx.isPaused());
  }

  @Test
  @DisplayName("A paused checkpoint parks until resumed")
  void checkpointParksWhilePaused() throws Exception {
    JobSignal signal = new JobSignal();
    JobContext ctx = new JobContext("j", "j", signal, null);
    signal.pause();

    CountDownLatch passed = new CountDownLatch(1);
    Thread worker =
        new Thread(
            () -> {
              try {
                ctx.checkpoint();
                passed.countDown();
              } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
              }
            });
    worker.start();

    assertFalse(passed.await(100, TimeUnit.MILLISECONDS));
    signal.resume();
    assertTrue(passed.await(5, TimeUnit.SECONDS));
    worker.join(1_000);
  }

  @Test
  @DisplayName("Cancelling a paused job releases its checkpoint with an InterruptedException")
  void cancelReleasesPausedCheckpoint() throws Exception {
    JobSignal signal = new JobSignal();
    JobContext ctx = new JobContext("j", "j", signal, null);
    signal.pause();

    AtomicReference<Throwable> thrown = new AtomicReference<>();
    Thread worker =
        new Thread(
            () -> {
              try {
                ctx.checkpoint();
              } catch (InterruptedException e) {
                thrown.set(e);
              }
            });
    worker.start();
    Thread.sleep(50);
    signal.cancel();
    worker.join(5_000);

    assertFalse(worker.isAlive());
    assertInstanceOf(InterruptedException.class, thrown.get());
    assertTrue(ctx.isCancelled());
  }
}
