package com.example.userhub.model;

import java.util.List;

/**
 * The at-a-glance aggregate for one user.
 *
 * <p>Every list reachable from a dashboard is an unmodifiable copy taken at construction, so a
 * cached instance and the instance handed to a caller never share mutable state.
 */
public record Dashboard(
    DashboardMetadata metadata,
    UserSummary user,
    InviteSummary invites,
    NotificationSummary notifications,
    CampaignSummary campaigns,
    List<DashboardAction> nextActions) {

  public Dashboard {
    nextActions = nextActions == null ? List.of() : List.copyOf(nextActions);
  }

  public Dashboard withMetadata(DashboardMetadata newMetadata) {
    return new Dashboard(newMetadata, user, invites, notifications, campaigns, nextActions);
  }

  public Dashboard withNextActions(List<DashboardAction> actions) {
    return new Dashboard(metadata, user, invites, notifications, campaigns, actions);
  }
}
