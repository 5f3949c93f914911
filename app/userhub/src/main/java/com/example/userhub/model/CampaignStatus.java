package com.example.userhub.model;

import java.util.Locale;

public enum CampaignStatus {
  UNSPECIFIED,
  DRAFT,
  ACTIVE,
  COMPLETED,
  ARCHIVED;

  /** Unknown or missing values resolve to {@link #UNSPECIFIED}. */
  public static CampaignStatus fromValue(String value) {
    if (value == null || value.isBlank()) {
      return UNSPECIFIED;
    }
    try {
      return valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      return UNSPECIFIED;
    }
  }
}
