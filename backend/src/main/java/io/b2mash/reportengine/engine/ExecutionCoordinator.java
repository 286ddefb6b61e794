package io.b2mash.reportengine.engine;

import io.b2mash.reportengine.cache.ResultCache;
import io.b2mash.reportengine.credential.CredentialUnavailableException;
import io.b2mash.reportengine.execution.CancellationSignal;
import io.b2mash.reportengine.execution.ErrorKind;
import io.b2mash.reportengine.execution.ExecutionEngine;
import io.b2mash.reportengine.execution.ExecutionException;
import io.b2mash.reportengine.execution.ExecutionProperties;
import io.b2mash.reportengine.ledger.ExecutionLedger;
import jakarta.annotation.PreDestroy;
import java.time.Duration;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Component;

/**
 * Runs submitted executions on the worker pool and drives their ledger records. Work cancelled
 * while still queued never starts; running work is aborted at the backend call.
 */
@Component
public class ExecutionCoordinator {

  private static final Logger log = LoggerFactory.getLogger(ExecutionCoordinator.class);

  private final ExecutionEngine engine;
  private final ResultCache resultCache;
  private final ExecutionLedger ledger;
  private final ThreadPoolTaskExecutor executor;
  private final Duration shutdownGrace;
  private final ConcurrentHashMap<UUID, Running> running = new ConcurrentHashMap<>();

  public ExecutionCoordinator(
      ExecutionEngine engine,
      ResultCache resultCache,
      ExecutionLedger ledger,
      @Qualifier("reportExecutor") ThreadPoolTaskExecutor executor,
      ExecutionProperties properties) {
    this.engine = engine;
    this.resultCache = resultCache;
    this.ledger = ledger;
    this.executor = executor;
    this.shutdownGrace = properties.workers().shutdownGrace();
  }

  /** Queues a PENDING execution. */
  public void submit(UUID executionId, CompiledQuery compiled, Duration timeout) {
    var entry = new Running(new CancellationSignal());
    running.put(executionId, entry);
    try {
      executor.execute(() -> run(executionId, compiled, timeout, entry));
    } catch (RuntimeException e) {
      running.remove(executionId);
      entry.done.complete(null);
      log.error("Could not queue execution {}: {}", executionId, e.getMessage());
      ledger.cancel(executionId, "Worker pool rejected the execution: " + e.getMessage());
    }
  }

  /**
   * Requests cancellation. Returns {@code false} if the execution is not queued or running in
   * this process.
   */
  public boolean cancel(UUID executionId) {
    var entry = running.get(executionId);
    if (entry == null) {
      return false;
    }
    synchronized (entry) {
      if (!entry.signal.cancel()) {
        return true;
      }
      if (!entry.started) {
        ledger.cancel(executionId, "Cancelled before it started");
        running.remove(executionId);
        entry.done.complete(null);
      }
    }
    log.info("Cancellation requested: executionId={}", executionId);
    return true;
  }

  /** Blocks until the execution leaves this coordinator or {@code maxWait} elapses. */
  public void await(UUID executionId, Duration maxWait) {
    var entry = running.get(executionId);
    if (entry == null) {
      return;
    }
    try {
      entry.done.get(maxWait.toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      log.debug("Execution {} still running after {} ms", executionId, maxWait.toMillis());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    } catch (java.util.concurrent.ExecutionException e) {
      throw new IllegalStateException("Completion future failed", e);
    }
  }

  public boolean isActive(UUID executionId) {
    return running.containsKey(executionId);
  }

  public int activeCount() {
    return running.size();
  }

  private void run(UUID executionId, CompiledQuery compiled, Duration timeout, Running entry) {
    try {
      synchronized (entry) {
        if (entry.signal.isCancelled()) {
          return;
        }
        entry.started = true;
        ledger.markRunning(executionId);
      }
      var nativeQuery = compiled.nativeQuery();
      var lookup =
          resultCache.getOrCompute(
              compiled.fingerprint(),
              compiled.catalog().getVersion(),
              entry.signal,
              () -> engine.execute(nativeQuery, compiled.credential(), timeout, entry.signal));
      var cached = lookup.entry();
      ledger.complete(
          executionId,
          cached.rows().size(),
          cached.truncated(),
          cached.warnings(),
          lookup.cacheHit());
    } catch (ExecutionException e) {
      if (e.getKind() == ErrorKind.CANCELLED) {
        ledger.cancel(executionId, e.getMessage());
      } else {
        ledger.fail(executionId, e.getKind(), e.getMessage());
      }
    } catch (CredentialUnavailableException e) {
      ledger.fail(executionId, ErrorKind.AUTH_FAILED, e.getMessage());
    } catch (RuntimeException e) {
      log.error("Execution {} failed unexpectedly", executionId, e);
      ledger.fail(executionId, ErrorKind.INTERNAL, e.getMessage());
    } finally {
      running.remove(executionId);
      entry.done.complete(null);
    }
  }

  @PreDestroy
  public void shutdown() {
    log.info("Draining {} execution(s), waiting up to {}", running.size(), shutdownGrace);
    executor.getThreadPoolExecutor().shutdown();
    try {
      if (!executor
          .getThreadPoolExecutor()
          .awaitTermination(shutdownGrace.toMillis(), TimeUnit.MILLISECONDS)) {
        log.warn("Cancelling {} execution(s) still running at shutdown", running.size());
        running.keySet().forEach(this::cancel);
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      running.keySet().forEach(this::cancel);
    }
  }

  private static final class Running {
    private final CancellationSignal signal;
    private final CompletableFuture<Void> done = new CompletableFuture<>();
    private boolean started;

    private Running(CancellationSignal signal) {
      this.signal = signal;
    }
  }
}
