/*
 * どこで: userhub サービス層
 * 何を: campaign/invite/profile/notification を集約し 1 件のダッシュボードを組み立てる
 * なぜ: 上流の一部が落ちていても、作り物のデータを返さずに鮮度上限付きの応答を返すため
 */
package com.example.userhub.service;

import com.example.userhub.model.CallContext;
import com.example.userhub.model.CampaignPage;
import com.example.userhub.model.CampaignSummary;
import com.example.userhub.model.Dashboard;
import com.example.userhub.model.DashboardMetadata;
import com.example.userhub.model.DashboardRequest;
import com.example.userhub.model.Freshness;
import com.example.userhub.model.InvitePage;
import com.example.userhub.model.InviteSummary;
import com.example.userhub.model.NotificationSummary;
import com.example.userhub.model.UnreadStatus;
import com.example.userhub.model.UserProfile;
import com.example.userhub.model.UserSummary;
import com.example.userhub.service.gateway.CampaignGateway;
import com.example.userhub.service.gateway.NotificationGateway;
import com.example.userhub.service.gateway.ProfileGateway;
import com.example.userhub.service.gateway.ProfileNotFoundException;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Assembles one user dashboard from the upstream gateways.
 *
 * <p>Gateways are called one at a time in a fixed order on the caller's thread. A failing
 * {@link UpstreamDependency#critical() critical} read (campaign previews) fails the request when
 * no stale snapshot exists. Every other read degrades its own section instead. Whenever a stale
 * snapshot exists, the first failing dependency returns that snapshot and skips the remaining
 * calls. Only non-degraded results are cached.
 *
 * <p>Concurrent cache misses for one key are not coalesced; each request reads the upstreams and
 * the last write to the cache wins.
 */
@Service
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "gateway/cache/clock は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
public class DashboardService {

  private static final Logger logger = LoggerFactory.getLogger(DashboardService.class);

  static final int DEFAULT_PREVIEW_LIMIT = 3;
  static final int MAX_PREVIEW_LIMIT = 10;

  private final CampaignGateway campaignGateway;
  private final ProfileGateway profileGateway;
  private final NotificationGateway notificationGateway;
  private final DashboardCache dashboardCache;
  private final DashboardMetrics dashboardMetrics;
  private final Clock clock;

  public DashboardService(
      CampaignGateway campaignGateway,
      ProfileGateway profileGateway,
      NotificationGateway notificationGateway,
      DashboardCache dashboardCache,
      DashboardMetrics dashboardMetrics,
      Clock clock) {
    this.campaignGateway =
        Objects.requireNonNull(campaignGateway, "campaign gateway is not configured");
    this.profileGateway =
        Objects.requireNonNull(profileGateway, "profile gateway is not configured");
    this.notificationGateway =
        Objects.requireNonNull(notificationGateway, "notification gateway is not configured");
    this.dashboardCache =
        Objects.requireNonNull(dashboardCache, "dashboard cache is not configured");
    this.dashboardMetrics =
        Objects.requireNonNull(dashboardMetrics, "dashboard metrics is not configured");
    this.clock = Objects.requireNonNull(clock, "clock is not configured");
  }

  /**
   * Returns the dashboard for one user.
   *
   * @throws IllegalArgumentException when the user id is blank
   * @throws DependencyUnavailableException when campaign previews fail and no stale snapshot exists
   */
  public Dashboard getDashboard(CallContext context, DashboardRequest request) {
    final String userId = request == null ? "" : trimToEmpty(request.userId());
    if (userId.isEmpty()) {
      dashboardMetrics.recordDashboardResult(DashboardMetrics.RESULT_ERROR);
      throw new IllegalArgumentException("userId is required");
    }
    final CallContext callContext = context == null ? CallContext.none() : context;
    final Instant now = clock.instant();
    final DashboardCacheKey cacheKey = new DashboardCacheKey(userId, request.locale());

    final Optional<Dashboard> fresh = dashboardCache.getFresh(cacheKey, now);
    if (fresh.isPresent()) {
      logger.debug("dashboard served from fresh cache userId={}", userId);
      dashboardMetrics.recordDashboardResult(DashboardMetrics.RESULT_FRESH_HIT);
      return fresh.get().withMetadata(fresh.get().metadata().asFreshHit());
    }
    final Optional<Dashboard> stale = dashboardCache.getStale(cacheKey, now);

    final int campaignLimit = clampPreviewLimit(request.campaignPreviewLimit());
    final int inviteLimit = clampPreviewLimit(request.invitePreviewLimit());

    final Outcome<CampaignPage> campaigns =
        call(
            UpstreamDependency.GAME_CAMPAIGNS,
            () -> campaignGateway.listCampaignPreviews(callContext, userId, campaignLimit));
    final List<String> degradedDependencies = new ArrayList<>(4);
    final CampaignSummary campaignSummary;
    if (campaigns.failed()) {
      if (stale.isPresent()) {
        return staleFallback(userId, stale.get(), UpstreamDependency.GAME_CAMPAIGNS);
      }
      campaignSummary = CampaignSummary.unavailable();
      degradeOrFail(
          degradedDependencies, UpstreamDependency.GAME_CAMPAIGNS, campaigns.failure(), userId);
    } else {
      campaignSummary = CampaignSummary.fromPage(campaigns.value());
    }

    final Outcome<InvitePage> invites =
        call(
            UpstreamDependency.GAME_INVITES,
            () -> campaignGateway.listPendingInvitePreviews(callContext, userId, inviteLimit));
    final InviteSummary inviteSummary;
    if (invites.failed()) {
      if (stale.isPresent()) {
        return staleFallback(userId, stale.get(), UpstreamDependency.GAME_INVITES);
      }
      inviteSummary = InviteSummary.unavailable();
      degradeOrFail(
          degradedDependencies, UpstreamDependency.GAME_INVITES, invites.failure(), userId);
    } else {
      final InvitePage page = invites.value();
      inviteSummary =
          new InviteSummary(true, page.invites().size(), page.hasMore(), page.invites());
    }

    final Outcome<UserProfile> profile =
        call(
            UpstreamDependency.SOCIAL_PROFILE,
            () -> profileGateway.getUserProfile(callContext, userId));
    String username = "";
    String name = "";
    boolean profileAvailable = false;
    if (!profile.failed()) {
      username = trimToEmpty(profile.value().username());
      name = trimToEmpty(profile.value().name());
      profileAvailable = true;
    } else if (!(profile.failure() instanceof ProfileNotFoundException)) {
      if (stale.isPresent()) {
        return staleFallback(userId, stale.get(), UpstreamDependency.SOCIAL_PROFILE);
      }
      degradeOrFail(
          degradedDependencies, UpstreamDependency.SOCIAL_PROFILE, profile.failure(), userId);
    }
    final boolean discoverable = !username.isBlank();
    final UserSummary userSummary =
        new UserSummary(userId, username, name, profileAvailable, discoverable, !discoverable);

    final Outcome<UnreadStatus> unread =
        call(
            UpstreamDependency.NOTIFICATIONS_UNREAD,
            () -> notificationGateway.getUnreadStatus(callContext, userId));
    final NotificationSummary notificationSummary;
    if (unread.failed()) {
      if (stale.isPresent()) {
        return staleFallback(userId, stale.get(), UpstreamDependency.NOTIFICATIONS_UNREAD);
      }
      notificationSummary = NotificationSummary.unavailable();
      degradeOrFail(
          degradedDependencies, UpstreamDependency.NOTIFICATIONS_UNREAD, unread.failure(), userId);
    } else {
      notificationSummary =
          new NotificationSummary(
              true, unread.value().hasUnread(), Math.max(0, unread.value().unreadCount()));
    }

    final DashboardMetadata metadata =
        new DashboardMetadata(
            Freshness.FRESH, false, !degradedDependencies.isEmpty(), degradedDependencies, now);
    final Dashboard assembled =
        new Dashboard(
            metadata,
            userSummary,
            inviteSummary,
            notificationSummary,
            campaignSummary,
            List.of());
    final Dashboard result =
        assembled.withNextActions(DashboardActionPrioritizer.prioritize(assembled));

    if (metadata.degraded()) {
      dashboardMetrics.recordDashboardResult(DashboardMetrics.RESULT_DEGRADED);
    } else {
      dashboardCache.set(cacheKey, result, now);
      dashboardMetrics.recordDashboardResult(DashboardMetrics.RESULT_ASSEMBLED);
    }
    return result;
  }

  static int clampPreviewLimit(int limit) {
    if (limit <= 0) {
      return DEFAULT_PREVIEW_LIMIT;
    }
    return Math.min(limit, MAX_PREVIEW_LIMIT);
  }

  private Dashboard staleFallback(String userId, Dashboard stale, UpstreamDependency failed) {
    logger.warn(
        "dashboard served from stale cache dependency={} userId={} generatedAt={}",
        failed.dependencyName(),
        userId,
        stale.metadata().generatedAt());
    dashboardMetrics.recordDashboardResult(DashboardMetrics.RESULT_STALE_FALLBACK);
    return stale.withMetadata(stale.metadata().asStaleFallback(List.of(failed.dependencyName())));
  }

  /** Critical dependencies fail the request; the rest only mark their section degraded. */
  private void degradeOrFail(
      List<String> degradedDependencies,
      UpstreamDependency dependency,
      RuntimeException failure,
      String userId) {
    if (dependency.critical()) {
      dashboardMetrics.recordDashboardResult(DashboardMetrics.RESULT_ERROR);
      throw new DependencyUnavailableException(dependency, failure);
    }
    logger.warn(
        "dashboard section degraded dependency={} userId={}", dependency.dependencyName(), userId);
    degradedDependencies.add(dependency.dependencyName());
  }

  private <T> Outcome<T> call(UpstreamDependency dependency, Supplier<T> upstreamCall) {
    final long startedAt = System.nanoTime();
    try {
      final T value = upstreamCall.get();
      if (value == null) {
        throw new UpstreamIntegrationException(
            dependency,
            UpstreamIntegrationException.Reason.INVALID_RESPONSE,
            dependency.dependencyName() + " returned no result");
      }
      recordDuration(dependency, "success", startedAt);
      return Outcome.success(value);
    } catch (ProfileNotFoundException ex) {
      recordDuration(dependency, "not_found", startedAt);
      return Outcome.failure(ex);
    } catch (RuntimeException ex) {
      recordDuration(dependency, "error", startedAt);
      dashboardMetrics.recordDependencyError(dependency.dependencyName(), reasonOf(ex));
      logger.warn(
          "dashboard dependency call failed dependency={}", dependency.dependencyName(), ex);
      return Outcome.failure(ex);
    }
  }

  private void recordDuration(UpstreamDependency dependency, String result, long startedAt) {
    dashboardMetrics.recordDependencyDuration(
        dependency.dependencyName(), result, Duration.ofNanos(System.nanoTime() - startedAt));
  }

  private static String reasonOf(RuntimeException ex) {
    if (ex instanceof UpstreamIntegrationException integration && integration.reason() != null) {
      return integration.reason().name();
    }
    return "UNEXPECTED";
  }

  private static String trimToEmpty(String value) {
    return value == null ? "" : value.trim();
  }

  /** Result of one upstream call: either a value or the failure it raised. */
  private record Outcome<T>(T value, RuntimeException failure) {

    static <T> Outcome<T> success(T value) {
      return new Outcome<>(value, null);
    }

    static <T> Outcome<T> failure(RuntimeException failure) {
      return new Outcome<>(null, failure);
    }

    boolean failed() {
      return failure != null;
    }
  }
}
