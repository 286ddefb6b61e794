package io.b2mash.reportengine.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.b2mash.reportengine.execution.CancellationSignal;
import io.b2mash.reportengine.execution.ErrorKind;
import io.b2mash.reportengine.execution.ExecutionException;
import io.b2mash.reportengine.execution.ExecutionResult;
import io.b2mash.reportengine.source.SourceKind;
import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Materialized result sets keyed by fingerprint.
 *
 * <p>At most one computation runs per fingerprint. Concurrent callers for the same fingerprint
 * wait for the leader and share its result; when the leader is cancelled one of the waiters takes
 * over. Failed and cancelled computations are never stored. Expiry is checked against the clock on
 * every read; Caffeine bounds the number of entries.
 */
@Component
public class ResultCache {

  private static final Logger log = LoggerFactory.getLogger(ResultCache.class);

  private final Cache<String, CacheEntry> entries;
  private final ConcurrentHashMap<String, CompletableFuture<CacheEntry>> inFlight =
      new ConcurrentHashMap<>();
  private final ConcurrentHashMap<Scope, AtomicLong> generations = new ConcurrentHashMap<>();
  private final AtomicLong epoch = new AtomicLong();
  private final Duration ttl;
  private final Clock clock;

  public ResultCache(CacheProperties properties, Clock clock) {
    this.entries = Caffeine.newBuilder().maximumSize(properties.maxEntries()).build();
    this.ttl = properties.ttl();
    this.clock = clock;
  }

  public Optional<CacheEntry> get(String fingerprint) {
    var entry = entries.getIfPresent(fingerprint);
    if (entry == null) {
      return Optional.empty();
    }
    if (entry.isExpired(clock.instant())) {
      entries.asMap().remove(fingerprint, entry);
      log.debug("Cache entry expired: fingerprint={}", fingerprint);
      return Optional.empty();
    }
    return Optional.of(entry);
  }

  /**
   * Returns the stored entry for {@code key} or computes it. Only the leader runs {@code compute};
   * the entry is stored unless the scope was invalidated while it ran.
   *
   * @param signal the caller's cancellation; a cancelled waiter stops waiting, a cancelled leader
   *     hands the computation to a waiter
   * @throws ExecutionException if the computation failed or the caller was cancelled
   */
  public CacheLookup getOrCompute(
      QueryFingerprint key,
      long catalogVersion,
      CancellationSignal signal,
      Supplier<ExecutionResult> compute) {
    while (true) {
      signal.throwIfCancelled();
      var cached = get(key.value());
      if (cached.isPresent()) {
        return new CacheLookup(cached.get(), true);
      }
      var mine = new CompletableFuture<CacheEntry>();
      var leader = inFlight.putIfAbsent(key.value(), mine);
      if (leader == null) {
        return new CacheLookup(lead(key, catalogVersion, compute, mine), false);
      }
      var shared = await(key, leader, signal);
      if (shared.isPresent()) {
        return new CacheLookup(shared.get(), true);
      }
      log.debug("Leader for fingerprint={} was cancelled, taking over", key.value());
    }
  }

  /** Drops stored results for the scope and prevents running computations from storing theirs. */
  public void invalidate(SourceKind source, String credentialId) {
    generation(new Scope(source, credentialId)).incrementAndGet();
    entries.asMap().values().removeIf(entry -> entry.belongsTo(source, credentialId));
    log.info("Invalidated result cache: source={}, credentialId={}", source.slug(), credentialId);
  }

  public void invalidateAll() {
    epoch.incrementAndGet();
    entries.invalidateAll();
    log.info("Invalidated entire result cache");
  }

  public long size() {
    entries.cleanUp();
    return entries.estimatedSize();
  }

  private CacheEntry lead(
      QueryFingerprint key,
      long catalogVersion,
      Supplier<ExecutionResult> compute,
      CompletableFuture<CacheEntry> future) {
    var scope = new Scope(key.source(), key.credentialId());
    long generation = generation(scope).get();
    long startEpoch = epoch.get();
    try {
      var result = compute.get();
      var now = clock.instant();
      var entry =
          new CacheEntry(
              key.value(),
              key.source(),
              key.credentialId(),
              result.rows(),
              result.warnings(),
              result.groups(),
              result.truncated(),
              now,
              now.plus(ttl),
              catalogVersion);
      if (generation(scope).get() == generation && epoch.get() == startEpoch) {
        entries.put(key.value(), entry);
      } else {
        log.info("Discarding result computed during invalidation: fingerprint={}", key.value());
      }
      inFlight.remove(key.value(), future);
      future.complete(entry);
      return entry;
    } catch (RuntimeException | Error e) {
      inFlight.remove(key.value(), future);
      future.completeExceptionally(e);
      throw e;
    }
  }

  /** Waits for a leader. Empty when the leader was cancelled and the caller should retry. */
  private Optional<CacheEntry> await(
      QueryFingerprint key, CompletableFuture<CacheEntry> leader, CancellationSignal signal) {
    var waiting = leader.thenApply(Function.identity());
    try (var registration =
        signal.onCancel(() -> waiting.completeExceptionally(ExecutionException.cancelled()))) {
      log.debug("Waiting for in-flight computation: fingerprint={}", key.value());
      return Optional.of(waiting.join());
    } catch (CompletionException e) {
      var cause = e.getCause() != null ? e.getCause() : e;
      if (cause instanceof ExecutionException failure
          && failure.getKind() == ErrorKind.CANCELLED
          && !signal.isCancelled()) {
        return Optional.empty();
      }
      if (cause instanceof RuntimeException runtime) {
        throw runtime;
      }
      throw e;
    }
  }

  private AtomicLong generation(Scope scope) {
    return generations.computeIfAbsent(scope, s -> new AtomicLong());
  }

  private record Scope(SourceKind source, String credentialId) {}
}
