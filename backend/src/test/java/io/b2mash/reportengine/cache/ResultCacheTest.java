package io.b2mash.reportengine.cache;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.b2mash.reportengine.execution.CancellationSignal;
import io.b2mash.reportengine.execution.ErrorKind;
import io.b2mash.reportengine.execution.ExecutionException;
import io.b2mash.reportengine.execution.ExecutionResult;
import io.b2mash.reportengine.source.SourceKind;
import io.b2mash.reportengine.testutil.MutableClock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class ResultCacheTest {

  private static final QueryFingerprint KEY =
      new QueryFingerprint("a1b2", SourceKind.DIRECTORY, "corp-ldap");

  private final MutableClock clock = new MutableClock(Instant.parse("2024-06-15T10:00:00Z"));
  private final ResultCache cache =
      new ResultCache(new CacheProperties(Duration.ofMinutes(15), 100), clock);
  private final AtomicInteger computations = new AtomicInteger();
  private final ExecutorService threads = Executors.newCachedThreadPool();

  @AfterEach
  void tearDown() {
    threads.shutdownNow();
  }

  @Test
  void getOrCompute_runsSingleComputationForConcurrentCallers() throws Exception {
    var release = new CountDownLatch(1);
    var started = new CountDownLatch(1);
    Supplier<ExecutionResult> slow =
        () -> {
          started.countDown();
          await(release);
          return result(computations.incrementAndGet());
        };

    var lookups = new ArrayList<CompletableFuture<CacheLookup>>();
    lookups.add(CompletableFuture.supplyAsync(() -> lookup(KEY, slow), threads));
    assertThat(started.await(2, TimeUnit.SECONDS)).isTrue();
    for (int i = 0; i < 3; i++) {
      lookups.add(CompletableFuture.supplyAsync(() -> lookup(KEY, slow), threads));
    }
    release.countDown();

    var results = new ArrayList<CacheLookup>();
    for (var future : lookups) {
      results.add(future.get(5, TimeUnit.SECONDS));
    }
    assertThat(computations.get()).isEqualTo(1);
    assertThat(results).filteredOn(l -> !l.cacheHit()).hasSize(1);
    assertThat(results)
        .extracting(l -> l.entry().generatedAt())
        .containsOnly(results.get(0).entry().generatedAt());
  }

  @Test
  void getOrCompute_servesStoredEntryUntilItExpires() {
    var first = lookup(KEY, this::compute);
    clock.advance(Duration.ofMinutes(10));
    var second = lookup(KEY, this::compute);

    assertThat(first.cacheHit()).isFalse();
    assertThat(second.cacheHit()).isTrue();
    assertThat(second.entry().generatedAt()).isEqualTo(first.entry().generatedAt());
    assertThat(first.entry().expiresAt()).isEqualTo(Instant.parse("2024-06-15T10:15:00Z"));

    clock.advance(Duration.ofMinutes(5));
    assertThat(cache.get(KEY.value())).isEmpty();
    var third = lookup(KEY, this::compute);
    assertThat(third.cacheHit()).isFalse();
    assertThat(computations.get()).isEqualTo(2);
  }

  @Test
  void getOrCompute_neverStoresFailures() {
    Supplier<ExecutionResult> failing =
        () -> {
          computations.incrementAndGet();
          throw ExecutionException.connectionFailed("unreachable", null);
        };

    assertThatThrownBy(() -> lookup(KEY, failing))
        .isInstanceOfSatisfying(
            ExecutionException.class,
            e -> assertThat(e.getKind()).isEqualTo(ErrorKind.CONNECTION_FAILED));
    assertThat(cache.get(KEY.value())).isEmpty();

    var retried = lookup(KEY, this::compute);
    assertThat(retried.cacheHit()).isFalse();
    assertThat(computations.get()).isEqualTo(2);
  }

  @Test
  void getOrCompute_handsOverToWaiterWhenLeaderIsCancelled() throws Exception {
    var leaderStarted = new CountDownLatch(1);
    var leaderSignal = new CancellationSignal();
    Supplier<ExecutionResult> cancelledLeader =
        () -> {
          leaderStarted.countDown();
          var aborted = new CountDownLatch(1);
          try (var registration = leaderSignal.onCancel(aborted::countDown)) {
            await(aborted);
          }
          throw ExecutionException.cancelled();
        };

    var leader =
        CompletableFuture.supplyAsync(
            () -> cache.getOrCompute(KEY, 1, leaderSignal, cancelledLeader), threads);
    assertThat(leaderStarted.await(2, TimeUnit.SECONDS)).isTrue();
    var waiter = CompletableFuture.supplyAsync(() -> lookup(KEY, this::compute), threads);
    Thread.sleep(50);
    leaderSignal.cancel();

    var taken = waiter.get(5, TimeUnit.SECONDS);
    assertThat(taken.cacheHit()).isFalse();
    assertThat(computations.get()).isEqualTo(1);
    assertThat(cache.get(KEY.value())).contains(taken.entry());
    assertThatThrownBy(() -> leader.get(5, TimeUnit.SECONDS))
        .hasCauseInstanceOf(ExecutionException.class);
  }

  @Test
  void getOrCompute_stopsWaitingWhenWaiterIsCancelled() throws Exception {
    var release = new CountDownLatch(1);
    var started = new CountDownLatch(1);
    Supplier<ExecutionResult> slow =
        () -> {
          started.countDown();
          await(release);
          return compute();
        };
    var leader = CompletableFuture.supplyAsync(() -> lookup(KEY, slow), threads);
    assertThat(started.await(2, TimeUnit.SECONDS)).isTrue();

    var waiterSignal = new CancellationSignal();
    var waiter =
        CompletableFuture.supplyAsync(
            () -> cache.getOrCompute(KEY, 1, waiterSignal, this::compute), threads);
    Thread.sleep(50);
    waiterSignal.cancel();

    assertThatThrownBy(() -> waiter.get(5, TimeUnit.SECONDS))
        .hasCauseInstanceOf(ExecutionException.class);
    release.countDown();
    assertThat(leader.get(5, TimeUnit.SECONDS).cacheHit()).isFalse();
    assertThat(computations.get()).isEqualTo(1);
  }

  @Test
  void getOrCompute_discardsResultComputedDuringInvalidation() throws Exception {
    var release = new CountDownLatch(1);
    var started = new CountDownLatch(1);
    Supplier<ExecutionResult> slow =
        () -> {
          started.countDown();
          await(release);
          return compute();
        };
    var leader = CompletableFuture.supplyAsync(() -> lookup(KEY, slow), threads);
    assertThat(started.await(2, TimeUnit.SECONDS)).isTrue();

    cache.invalidate(SourceKind.DIRECTORY, "corp-ldap");
    release.countDown();

    assertThat(leader.get(5, TimeUnit.SECONDS).entry().rows()).hasSize(1);
    assertThat(cache.get(KEY.value())).isEmpty();
  }

  @Test
  void invalidate_dropsOnlyTheGivenScope() {
    var other = new QueryFingerprint("c3d4", SourceKind.DIRECTORY, "branch-ldap");
    lookup(KEY, this::compute);
    lookup(other, this::compute);

    cache.invalidate(SourceKind.DIRECTORY, "corp-ldap");

    assertThat(cache.get(KEY.value())).isEmpty();
    assertThat(cache.get(other.value())).isPresent();
    assertThat(cache.size()).isEqualTo(1);

    cache.invalidateAll();
    assertThat(cache.get(other.value())).isEmpty();
  }

  private CacheLookup lookup(QueryFingerprint key, Supplier<ExecutionResult> compute) {
    return cache.getOrCompute(key, 1, new CancellationSignal(), compute);
  }

  private ExecutionResult compute() {
    return result(computations.incrementAndGet());
  }

  private static ExecutionResult result(int run) {
    return new ExecutionResult(
        List.of(Map.of("displayName", "run " + run)), List.of(), List.of(), false, Duration.ZERO);
  }

  private static void await(CountDownLatch latch) {
    try {
      if (!latch.await(5, TimeUnit.SECONDS)) {
        throw new IllegalStateException("latch not released");
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException(e);
    }
  }
}
