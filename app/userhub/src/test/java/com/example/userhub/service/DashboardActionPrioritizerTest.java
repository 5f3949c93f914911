package com.example.userhub.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.userhub.model.CampaignSummary;
import com.example.userhub.model.Dashboard;
import com.example.userhub.model.DashboardAction;
import com.example.userhub.model.DashboardActionId;
import com.example.userhub.model.DashboardMetadata;
import com.example.userhub.model.Freshness;
import com.example.userhub.model.InviteSummary;
import com.example.userhub.model.NotificationSummary;
import com.example.userhub.model.UserSummary;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;

class DashboardActionPrioritizerTest {

  @Test
  void newUserIsAskedToCompleteProfileThenCreateOrJoin() {
    final Dashboard dashboard =
        dashboard(
            new InviteSummary(true, 0, false, List.of()),
            new UserSummary("user-1", "", "", false, false, true),
            new CampaignSummary(true, 0, 0, false, List.of()),
            new NotificationSummary(true, false, 0));

    assertThat(ids(DashboardActionPrioritizer.prioritize(dashboard)))
        .containsExactly(
            DashboardActionId.COMPLETE_PROFILE, DashboardActionId.CREATE_OR_JOIN_CAMPAIGN);
  }

  @Test
  void createOrJoinIsSkippedWhenMoreCampaignPagesExist() {
    final Dashboard dashboard =
        dashboard(
            new InviteSummary(true, 0, false, List.of()),
            new UserSummary("user-1", "ari", "Ari", true, true, false),
            new CampaignSummary(true, 0, 0, true, List.of()),
            new NotificationSummary(true, false, 0));

    assertThat(DashboardActionPrioritizer.prioritize(dashboard)).isEmpty();
  }

  @Test
  void unavailableSectionsNeverTriggerActions() {
    final Dashboard dashboard =
        dashboard(
            new InviteSummary(false, 2, false, List.of()),
            new UserSummary("user-1", "ari", "Ari", true, true, false),
            new CampaignSummary(false, 0, 1, false, List.of()),
            new NotificationSummary(false, true, 3));

    assertThat(DashboardActionPrioritizer.prioritize(dashboard)).isEmpty();
  }

  @Test
  void everyTriggerProducesPriorityOrderedList() {
    final Dashboard dashboard =
        dashboard(
            new InviteSummary(true, 1, false, List.of()),
            new UserSummary("user-1", "", "", true, false, true),
            new CampaignSummary(true, 1, 1, false, List.of()),
            new NotificationSummary(true, true, 2));

    final List<DashboardAction> actions = DashboardActionPrioritizer.prioritize(dashboard);

    assertThat(actions)
        .containsExactly(
            new DashboardAction(DashboardActionId.REVIEW_PENDING_INVITES, 100),
            new DashboardAction(DashboardActionId.COMPLETE_PROFILE, 90),
            new DashboardAction(DashboardActionId.CONTINUE_ACTIVE_CAMPAIGN, 70),
            new DashboardAction(DashboardActionId.REVIEW_NOTIFICATIONS, 60));
  }

  @Test
  void equalPrioritiesKeepInputOrder() {
    final List<DashboardAction> sorted =
        DashboardActionPrioritizer.sortByPriority(
            List.of(
                new DashboardAction(DashboardActionId.REVIEW_NOTIFICATIONS, 50),
                new DashboardAction(DashboardActionId.COMPLETE_PROFILE, 80),
                new DashboardAction(DashboardActionId.CONTINUE_ACTIVE_CAMPAIGN, 50),
                new DashboardAction(DashboardActionId.CREATE_OR_JOIN_CAMPAIGN, 80)));

    assertThat(ids(sorted))
        .containsExactly(
            DashboardActionId.COMPLETE_PROFILE,
            DashboardActionId.CREATE_OR_JOIN_CAMPAIGN,
            DashboardActionId.REVIEW_NOTIFICATIONS,
            DashboardActionId.CONTINUE_ACTIVE_CAMPAIGN);
  }

  private static List<DashboardActionId> ids(List<DashboardAction> actions) {
    return actions.stream().map(DashboardAction::id).toList();
  }

  private static Dashboard dashboard(
      InviteSummary invites,
      UserSummary user,
      CampaignSummary campaigns,
      NotificationSummary notifications) {
    return new Dashboard(
        new DashboardMetadata(
            Freshness.FRESH, false, false, List.of(), Instant.parse("2026-02-26T04:00:00Z")),
        user,
        invites,
        notifications,
        campaigns,
        List.of());
  }
}
