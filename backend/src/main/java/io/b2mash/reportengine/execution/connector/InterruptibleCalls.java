package io.b2mash.reportengine.execution.connector;

/**
 * Tracks the thread blocked in a backend call so {@link #abort()} can interrupt it. The JDK HTTP
 * client and JNDI both give up a pending reply when the waiting thread is interrupted, which lets
 * a timeout or cancellation take effect while the backend is still silent.
 *
 * <p>The interrupt never outlives the call: it is cleared before {@link #call} returns.
 */
final class InterruptibleCalls {

  private final Object lock = new Object();
  private Thread caller;
  private boolean aborted;

  /** Runs {@code call} on the current thread; an abort while it runs interrupts it. */
  <T, E extends Exception> T call(BackendCall<T, E> call) throws E {
    synchronized (lock) {
      if (!aborted) {
        caller = Thread.currentThread();
      }
    }
    try {
      return call.run();
    } finally {
      synchronized (lock) {
        caller = null;
        if (aborted) {
          // the interrupt was ours; the caller sees the abort through the connection state
          Thread.interrupted();
        }
      }
    }
  }

  void abort() {
    synchronized (lock) {
      aborted = true;
      if (caller != null) {
        caller.interrupt();
      }
    }
  }

  @FunctionalInterface
  interface BackendCall<T, E extends Exception> {
    T run() throws E;
  }
}
