package com.example.userhub.model;

/** Whether a dashboard response is a live assembly or a stale cache fallback. */
public enum Freshness {
  UNSPECIFIED,
  FRESH,
  STALE
}
