package com.gentoro.jobcontrol.jobs;

import com.gentoro.jobcontrol.exception.ReplyDeliveryException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Single-use reply channel bound to one request. The handling side fulfils it exactly once, with
 * a value, an error or an explicit drop; the requesting side waits on {@link #future()}.
 *
 * <p>Any attempt to use a slot a second time, or to answer a caller that already stopped waiting
 * (cancelled its future), raises {@link ReplyDeliveryException}.
 */
public final class ReplySlot<T> {
  private final CompletableFuture<T> future = new CompletableFuture<>();
  private final AtomicBoolean used = new AtomicBoolean();

  public static <T> ReplySlot<T> create() {
    return new ReplySlot<>();
  }

  /** Requesting side of the slot. */
  public CompletableFuture<T> future() {
    return future;
  }

  public void fulfill(T value) {
    claim("fulfill");
    if (!future.complete(value)) {
      throw new ReplyDeliveryException("Reply receiver is no longer waiting");
    }
  }

  public void fail(Throwable error) {
    claim("fail");
    if (!future.completeExceptionally(error)) {
      throw new ReplyDeliveryException("Reply receiver is no longer waiting", error);
    }
  }

  /** Fulfil the slot by cancelling the caller's wait without a result. */
  public void drop() {
    claim("drop");
    future.cancel(false);
  }

  public boolean isUsed() {
    return used.get();
  }

  private void claim(String operation) {
    if (!used.compareAndSet(false, true)) {
      throw new ReplyDeliveryException("Cannot " + operation + " a reply slot twice");
    }
  }
}
