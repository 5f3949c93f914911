package com.example.userhub.model;

import java.util.List;

/** One page of campaign previews as returned by the campaign gateway. */
public record CampaignPage(List<CampaignPreview> campaigns, boolean hasMore) {

  public CampaignPage {
    campaigns = campaigns == null ? List.of() : List.copyOf(campaigns);
  }
}
