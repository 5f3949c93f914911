package com.example.userhub.api.response;

import com.example.userhub.model.CampaignPreview;
import com.example.userhub.model.CampaignSummary;
import com.example.userhub.model.Dashboard;
import com.example.userhub.model.DashboardAction;
import com.example.userhub.model.DashboardMetadata;
import com.example.userhub.model.InviteSummary;
import com.example.userhub.model.NotificationSummary;
import com.example.userhub.model.PendingInvite;
import com.example.userhub.model.UserSummary;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record DashboardResponse(
    Metadata metadata,
    User user,
    Invites invites,
    Notifications notifications,
    Campaigns campaigns,
    List<NextAction> nextActions) {

  public DashboardResponse {
    nextActions = nextActions == null ? List.of() : List.copyOf(nextActions);
  }

  public static DashboardResponse from(Dashboard dashboard) {
    return new DashboardResponse(
        Metadata.from(dashboard.metadata()),
        User.from(dashboard.user()),
        Invites.from(dashboard.invites()),
        Notifications.from(dashboard.notifications()),
        Campaigns.from(dashboard.campaigns()),
        dashboard.nextActions().stream().map(NextAction::from).toList());
  }

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public record Metadata(
      String freshness,
      boolean cacheHit,
      boolean degraded,
      List<String> degradedDependencies,
      String generatedAt) {

    public Metadata {
      degradedDependencies =
          degradedDependencies == null ? List.of() : List.copyOf(degradedDependencies);
    }

    static Metadata from(DashboardMetadata metadata) {
      return new Metadata(
          metadata.freshness().name(),
          metadata.cacheHit(),
          metadata.degraded(),
          metadata.degradedDependencies(),
          format(metadata.generatedAt()));
    }
  }

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public record User(
      String userId,
      String username,
      String name,
      boolean profileAvailable,
      boolean discoverable,
      boolean needsProfileCompletion) {

    static User from(UserSummary summary) {
      return new User(
          summary.userId(),
          summary.username(),
          summary.name(),
          summary.profileAvailable(),
          summary.discoverable(),
          summary.needsProfileCompletion());
    }
  }

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public record Invites(
      boolean available, int listedCount, boolean hasMore, List<Invite> pending) {

    public Invites {
      pending = pending == null ? List.of() : List.copyOf(pending);
    }

    static Invites from(InviteSummary summary) {
      return new Invites(
          summary.available(),
          summary.listedCount(),
          summary.hasMore(),
          summary.pending().stream().map(Invite::from).toList());
    }
  }

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public record Invite(
      String inviteId,
      String campaignId,
      String campaignName,
      String participantId,
      String createdAt) {

    static Invite from(PendingInvite invite) {
      return new Invite(
          invite.inviteId(),
          invite.campaignId(),
          invite.campaignName(),
          invite.participantId(),
          format(invite.createdAt()));
    }
  }

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public record Notifications(boolean available, boolean hasUnread, int unreadCount) {

    static Notifications from(NotificationSummary summary) {
      return new Notifications(summary.available(), summary.hasUnread(), summary.unreadCount());
    }
  }

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public record Campaigns(
      boolean available,
      int listedCount,
      int activeCount,
      boolean hasMore,
      List<Campaign> campaigns) {

    public Campaigns {
      campaigns = campaigns == null ? List.of() : List.copyOf(campaigns);
    }

    static Campaigns from(CampaignSummary summary) {
      return new Campaigns(
          summary.available(),
          summary.listedCount(),
          summary.activeCount(),
          summary.hasMore(),
          summary.campaigns().stream().map(Campaign::from).toList());
    }
  }

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public record Campaign(
      String campaignId,
      String name,
      String status,
      int participantCount,
      int characterCount,
      String updatedAt) {

    static Campaign from(CampaignPreview preview) {
      return new Campaign(
          preview.campaignId(),
          preview.name(),
          preview.status().name(),
          preview.participantCount(),
          preview.characterCount(),
          format(preview.updatedAt()));
    }
  }

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public record NextAction(String id, int priority) {

    static NextAction from(DashboardAction action) {
      return new NextAction(action.id().name(), action.priority());
    }
  }

  private static String format(Instant value) {
    return value == null ? null : value.toString();
  }
}
