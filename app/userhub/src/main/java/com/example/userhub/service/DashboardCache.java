/*
 * どこで: userhub サービス層
 * 何を: ユーザー単位のダッシュボードスナップショットをプロセス内に保持する
 * なぜ: fresh/stale の 2 段階 TTL で上流障害時にも鮮度上限付きの応答を返すため
 */
package com.example.userhub.service;

import com.example.userhub.model.Dashboard;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * In-memory dashboard snapshots with a fresh and a stale age threshold.
 *
 * <p>Ages are measured against the {@code now} passed by the caller. A snapshot older than the
 * stale threshold is never returned; it is left for Caffeine to expire. Dashboards are immutable
 * values, so neither the stored nor the returned instance can be changed through the other.
 *
 * <p>The store also holds at most {@code maxEntries} snapshots. Past that bound Caffeine may evict
 * a snapshot before its stale threshold, and the key then has no stale fallback.
 */
public class DashboardCache {

  static final Duration DEFAULT_FRESH_TTL = Duration.ofSeconds(15);
  static final Duration DEFAULT_STALE_TTL = Duration.ofMinutes(2);
  static final long DEFAULT_MAX_ENTRIES = 10_000L;

  private final Duration freshTtl;
  private final Duration staleTtl;
  private final Cache<DashboardCacheKey, Entry> entries;

  public DashboardCache(Duration freshTtl, Duration staleTtl) {
    this(freshTtl, staleTtl, DEFAULT_MAX_ENTRIES);
  }

  public DashboardCache(Duration freshTtl, Duration staleTtl, long maxEntries) {
    this.freshTtl = isPositive(freshTtl) ? freshTtl : DEFAULT_FRESH_TTL;
    final Duration stale = isPositive(staleTtl) ? staleTtl : DEFAULT_STALE_TTL;
    this.staleTtl = stale.compareTo(this.freshTtl) < 0 ? this.freshTtl : stale;
    this.entries =
        Caffeine.newBuilder()
            .maximumSize(maxEntries > 0 ? maxEntries : DEFAULT_MAX_ENTRIES)
            .expireAfterWrite(this.staleTtl)
            .executor(Runnable::run)
            .build();
  }

  public Optional<Dashboard> getFresh(DashboardCacheKey key, Instant now) {
    return lookup(key, now, freshTtl);
  }

  public Optional<Dashboard> getStale(DashboardCacheKey key, Instant now) {
    return lookup(key, now, staleTtl);
  }

  public void set(DashboardCacheKey key, Dashboard dashboard, Instant now) {
    if (key == null || dashboard == null || now == null) {
      return;
    }
    entries.put(key, new Entry(dashboard, now));
  }

  Duration freshTtl() {
    return freshTtl;
  }

  Duration staleTtl() {
    return staleTtl;
  }

  private Optional<Dashboard> lookup(DashboardCacheKey key, Instant now, Duration ttl) {
    if (key == null || now == null) {
      return Optional.empty();
    }
    final Entry entry = entries.getIfPresent(key);
    if (entry == null) {
      return Optional.empty();
    }
    final Duration age = Duration.between(entry.cachedAt(), now);
    // a snapshot from the future means the clock went backwards
    if (age.isNegative() || age.compareTo(ttl) > 0) {
      return Optional.empty();
    }
    return Optional.of(entry.dashboard());
  }

  private static boolean isPositive(Duration value) {
    return value != null && !value.isZero() && !value.isNegative();
  }

  private record Entry(Dashboard dashboard, Instant cachedAt) {}
}
