package com.example.userhub.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.TreeSet;

/**
 * Freshness and degradation status for one dashboard response.
 *
 * <p>{@code degradedDependencies} is always deduplicated and sorted; blank names are dropped.
 */
public record DashboardMetadata(
    Freshness freshness,
    boolean cacheHit,
    boolean degraded,
    List<String> degradedDependencies,
    Instant generatedAt) {

  public DashboardMetadata {
    freshness = freshness == null ? Freshness.UNSPECIFIED : freshness;
    degradedDependencies = normalizeDependencies(degradedDependencies);
  }

  public DashboardMetadata asFreshHit() {
    return new DashboardMetadata(
        Freshness.FRESH, true, degraded, degradedDependencies, generatedAt);
  }

  /** Marks a cached snapshot as a stale fallback, adding the dependencies that just failed. */
  public DashboardMetadata asStaleFallback(Collection<String> failedDependencies) {
    final List<String> merged = new ArrayList<>(degradedDependencies);
    merged.addAll(failedDependencies);
    return new DashboardMetadata(Freshness.STALE, true, true, merged, generatedAt);
  }

  static List<String> normalizeDependencies(Collection<String> values) {
    if (values == null || values.isEmpty()) {
      return List.of();
    }
    final TreeSet<String> normalized = new TreeSet<>();
    values.stream()
        .filter(Objects::nonNull)
        .map(String::trim)
        .filter(value -> !value.isEmpty())
        .forEach(normalized::add);
    return List.copyOf(normalized);
  }
}
