package com.example.userhub.service;

/** Partition of cached dashboards: one snapshot per user and locale. */
public record DashboardCacheKey(String userId, String locale) {

  public DashboardCacheKey {
    userId = userId == null ? "" : userId.trim();
    locale = locale == null ? "" : locale.trim();
  }
}
