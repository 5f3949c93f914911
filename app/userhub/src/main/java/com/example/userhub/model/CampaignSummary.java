package com.example.userhub.model;

import java.util.List;

public record CampaignSummary(
    boolean available,
    int listedCount,
    int activeCount,
    boolean hasMore,
    List<CampaignPreview> campaigns) {

  public CampaignSummary {
    campaigns = campaigns == null ? List.of() : List.copyOf(campaigns);
  }

  public static CampaignSummary unavailable() {
    return new CampaignSummary(false, 0, 0, false, List.of());
  }

  /** Builds the section from one page, counting previews in {@link CampaignStatus#ACTIVE}. */
  public static CampaignSummary fromPage(CampaignPage page) {
    final int activeCount =
        (int)
            page.campaigns().stream()
                .filter(campaign -> campaign.status() == CampaignStatus.ACTIVE)
                .count();
    return new CampaignSummary(
        true, page.campaigns().size(), activeCount, page.hasMore(), page.campaigns());
  }
}
