package io.b2mash.reportengine.execution;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/** Cooperative cancellation shared between the caller and a running execution. */
public final class CancellationSignal {

  private final AtomicBoolean cancelled = new AtomicBoolean();
  private final CountDownLatch cancellation = new CountDownLatch(1);
  private final List<Runnable> listeners = new CopyOnWriteArrayList<>();

  /** Returns {@code true} if this call flipped the signal. */
  public boolean cancel() {
    if (!cancelled.compareAndSet(false, true)) {
      return false;
    }
    cancellation.countDown();
    listeners.forEach(Runnable::run);
    return true;
  }

  public boolean isCancelled() {
    return cancelled.get();
  }

  /**
   * Waits up to {@code timeout} for cancellation.
   *
   * @return {@code true} if the signal is cancelled
   */
  public boolean awaitCancellation(Duration timeout) throws InterruptedException {
    return cancellation.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
  }

  public void throwIfCancelled() {
    if (cancelled.get()) {
      throw ExecutionException.cancelled();
    }
  }

  /**
   * Runs {@code action} on cancellation, immediately if already cancelled. Closing the returned
   * registration removes the action.
   */
  public Registration onCancel(Runnable action) {
    listeners.add(action);
    if (cancelled.get()) {
      action.run();
    }
    return () -> listeners.remove(action);
  }

  @FunctionalInterface
  public interface Registration extends AutoCloseable {
    @Override
    void close();
  }
}
