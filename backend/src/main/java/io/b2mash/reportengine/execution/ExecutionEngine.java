package io.b2mash.reportengine.execution;

import io.b2mash.reportengine.compiler.NativeQuery;
import io.b2mash.reportengine.credential.Credential;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.retry.RetryPolicy;
import org.springframework.retry.backoff.ExponentialBackOffPolicy;
import org.springframework.retry.policy.CompositeRetryPolicy;
import org.springframework.retry.policy.SimpleRetryPolicy;
import org.springframework.retry.policy.TimeoutRetryPolicy;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

/**
 * Runs native queries against their backends. Each attempt borrows a pooled connection, pages
 * through the result, normalizes records and applies the post-fetch plan. Transient backend
 * failures are retried with exponential backoff until the attempt cap or the timeout is reached.
 */
@Service
public class ExecutionEngine {

  private static final Logger log = LoggerFactory.getLogger(ExecutionEngine.class);

  private final ConnectionPoolRegistry connectionPools;
  private final ExecutionProperties properties;
  private final TaskScheduler timeoutScheduler;
  private final Clock clock;
  private final RowNormalizer normalizer = new RowNormalizer();
  private final PostFetchProcessor postFetchProcessor = new PostFetchProcessor();

  public ExecutionEngine(
      ConnectionPoolRegistry connectionPools,
      ExecutionProperties properties,
      TaskScheduler timeoutScheduler,
      Clock clock) {
    this.connectionPools = connectionPools;
    this.properties = properties;
    this.timeoutScheduler = timeoutScheduler;
    this.clock = clock;
  }

  /**
   * Executes {@code query} with {@code credential}.
   *
   * @throws ExecutionException with kind CONNECTION_FAILED, AUTH_FAILED, TIMEOUT or CANCELLED
   */
  public ExecutionResult execute(
      NativeQuery query, Credential credential, Duration timeout, CancellationSignal signal) {
    signal.throwIfCancelled();
    long started = System.nanoTime();
    var deadline = Instant.now(clock).plus(timeout);
    var retry = retryTemplate(timeout, signal);
    try {
      var result =
          retry.execute(
              context ->
                  attempt(
                      query, credential, deadline, timeout, signal, context.getRetryCount() + 1));
      var elapsed = Duration.ofNanos(System.nanoTime() - started);
      log.info(
          "Executed query: source={}, credentialId={}, rows={}, warnings={}, truncated={},"
              + " elapsedMs={}",
          query.source().slug(),
          credential.id(),
          result.rows().size(),
          result.warnings().size(),
          result.truncated(),
          elapsed.toMillis());
      return new ExecutionResult(
          result.rows(), result.groups(), result.warnings(), result.truncated(), elapsed);
    } catch (ExecutionException e) {
      throw e;
    } catch (BackendAuthException | BackendPermissionException e) {
      throw ExecutionException.authFailed(e.getMessage(), e);
    } catch (BackendException e) {
      if (signal.isCancelled()) {
        throw ExecutionException.cancelled();
      }
      if (!Instant.now(clock).isBefore(deadline)) {
        throw ExecutionException.timeout(timeout.toMillis());
      }
      throw ExecutionException.connectionFailed(e.getMessage(), e);
    }
  }

  RetryTemplate retryTemplate(Duration timeout, CancellationSignal signal) {
    var retry = properties.retry();
    var attempts =
        new SimpleRetryPolicy(
            retry.maxAttempts(), Map.of(BackendUnavailableException.class, true), true);
    var withinTimeout = new TimeoutRetryPolicy();
    withinTimeout.setTimeout(timeout.toMillis());
    var policy = new CompositeRetryPolicy();
    policy.setPolicies(new RetryPolicy[] {attempts, withinTimeout});

    var backOff = new ExponentialBackOffPolicy();
    backOff.setInitialInterval(retry.initialBackoff().toMillis());
    backOff.setMultiplier(retry.multiplier());
    backOff.setMaxInterval(retry.maxBackoff().toMillis());
    // a cancel ends the backoff early; the next attempt then reports the cancellation
    backOff.setSleeper(period -> signal.awaitCancellation(Duration.ofMillis(period)));

    var template = new RetryTemplate();
    template.setRetryPolicy(policy);
    template.setBackOffPolicy(backOff);
    template.setThrowLastExceptionOnExhausted(true);
    return template;
  }

  private ExecutionResult attempt(
      NativeQuery query,
      Credential credential,
      Instant deadline,
      Duration timeout,
      CancellationSignal signal,
      int attempt) {
    signal.throwIfCancelled();
    var remaining = Duration.between(Instant.now(clock), deadline);
    if (remaining.isNegative() || remaining.isZero()) {
      throw ExecutionException.timeout(timeout.toMillis());
    }
    if (attempt > 1) {
      log.info(
          "Retrying query: source={}, credentialId={}, attempt={}",
          query.source().slug(),
          credential.id(),
          attempt);
    }

    try (var lease = connectionPools.lease(credential)) {
      var connection = lease.connection();
      var timedOut = new AtomicBoolean();
      // cleared once the attempt ends, so late timers and cancels never touch a returned connection
      var inFlight = new AtomicBoolean(true);
      var timer =
          timeoutScheduler.schedule(
              () -> {
                if (inFlight.compareAndSet(true, false)) {
                  timedOut.set(true);
                  lease.discard();
                  connection.abort();
                }
              },
              deadline);
      try (var registration =
          signal.onCancel(
              () -> {
                if (inFlight.compareAndSet(true, false)) {
                  lease.discard();
                  connection.abort();
                }
              })) {
        var fetched = fetchAll(connection, query, signal);
        signal.throwIfCancelled();
        return materialize(query, fetched);
      } catch (RuntimeException e) {
        if (signal.isCancelled()) {
          lease.discard();
          throw ExecutionException.cancelled();
        }
        if (timedOut.get()) {
          lease.discard();
          throw ExecutionException.timeout(timeout.toMillis());
        }
        if (e instanceof BackendException) {
          lease.discard();
        }
        throw e;
      } finally {
        inFlight.set(false);
        if (timer != null) {
          timer.cancel(false);
        }
      }
    }
  }

  private Fetched fetchAll(
      SourceConnection connection, NativeQuery query, CancellationSignal signal) {
    int ceiling = properties.maxResultRows();
    boolean stopEarly = query.stopsAtRequestedPage();
    int needed = stopEarly ? (int) Math.min(query.pagination().rowsNeeded(), ceiling) : ceiling;
    int batchSize =
        stopEarly ? Math.min(properties.fetchBatchSize(), needed) : properties.fetchBatchSize();

    var records = new ArrayList<RawRecord>();
    String token = null;
    boolean moreAvailable;
    do {
      signal.throwIfCancelled();
      var page = connection.fetch(query, token, batchSize);
      records.addAll(page.records());
      token = page.nextToken();
      moreAvailable = page.hasMore();
    } while (moreAvailable && records.size() < needed);

    boolean truncated = false;
    if (records.size() > needed) {
      truncated = !stopEarly;
      moreAvailable = true;
      records.subList(needed, records.size()).clear();
    }
    if (!stopEarly && moreAvailable && records.size() >= ceiling) {
      truncated = true;
    }
    return new Fetched(records, truncated);
  }

  private ExecutionResult materialize(NativeQuery query, Fetched fetched) {
    var warnings = new ArrayList<ExecutionWarning>();
    for (var compilerWarning : query.warnings()) {
      warnings.add(
          new ExecutionWarning(
              compilerWarning.code(), null, compilerWarning.field(), compilerWarning.message()));
    }

    var rows = new ArrayList<Map<String, Object>>(fetched.records().size());
    for (int i = 0; i < fetched.records().size(); i++) {
      var normalized =
          normalizer.normalize(fetched.records().get(i), query.bindings(), query.source(), i);
      rows.add(normalized.values());
      warnings.addAll(normalized.warnings());
    }

    var processed = postFetchProcessor.apply(rows, query.postFetch());
    var projected = new ArrayList<Map<String, Object>>(processed.rows().size());
    for (var row : processed.rows()) {
      var out = new LinkedHashMap<String, Object>();
      for (var field : query.selectedFields()) {
        out.put(field, row.get(field));
      }
      projected.add(out);
    }

    if (fetched.truncated()) {
      warnings.add(
          new ExecutionWarning(
              ExecutionWarning.RESULT_TRUNCATED,
              null,
              null,
              "Result stopped at the limit of " + properties.maxResultRows() + " rows"));
    }
    return new ExecutionResult(projected, processed.groups(), warnings, fetched.truncated(), null);
  }

  private record Fetched(List<RawRecord> records, boolean truncated) {}
}
