package com.example.userhub.model;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class CampaignStatusTest {

  @Test
  void fromValueIsCaseInsensitive() {
    assertThat(CampaignStatus.fromValue("active")).isEqualTo(CampaignStatus.ACTIVE);
    assertThat(CampaignStatus.fromValue(" Archived ")).isEqualTo(CampaignStatus.ARCHIVED);
  }

  @Test
  void unknownValuesAreUnspecified() {
    assertThat(CampaignStatus.fromValue(null)).isEqualTo(CampaignStatus.UNSPECIFIED);
    assertThat(CampaignStatus.fromValue("")).isEqualTo(CampaignStatus.UNSPECIFIED);
    assertThat(CampaignStatus.fromValue("paused")).isEqualTo(CampaignStatus.UNSPECIFIED);
  }
}
