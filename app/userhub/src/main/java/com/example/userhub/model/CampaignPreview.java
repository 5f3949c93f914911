package com.example.userhub.model;

import java.time.Instant;

public record CampaignPreview(
    String campaignId,
    String name,
    CampaignStatus status,
    int participantCount,
    int characterCount,
    Instant updatedAt) {

  public CampaignPreview {
    status = status == null ? CampaignStatus.UNSPECIFIED : status;
  }
}
