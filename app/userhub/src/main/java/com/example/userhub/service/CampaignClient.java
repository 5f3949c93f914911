/*
 * どこで: userhub サービス層
 * 何を: game サービスから campaign と保留中招待のプレビューを取得するクライアント
 * なぜ: ダッシュボード集約時に campaign/invite セクションを埋めるため
 */
package com.example.userhub.service;

import com.example.userhub.config.CampaignClientProperties;
import com.example.userhub.model.CallContext;
import com.example.userhub.model.CampaignPage;
import com.example.userhub.model.CampaignPreview;
import com.example.userhub.model.CampaignStatus;
import com.example.userhub.model.InvitePage;
import com.example.userhub.model.PendingInvite;
import com.example.userhub.service.dto.CampaignPreviewItem;
import com.example.userhub.service.dto.CampaignPreviewsResponse;
import com.example.userhub.service.dto.InvitePreviewsResponse;
import com.example.userhub.service.dto.PendingInviteItem;
import com.example.userhub.service.gateway.CampaignGateway;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.time.Clock;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

@Service
public class CampaignClient implements CampaignGateway {

  private static final Logger logger = LoggerFactory.getLogger(CampaignClient.class);

  private final RestClient campaignRestClient;
  private final CampaignClientProperties properties;
  private final Clock clock;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "RestClient/Clock は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  public CampaignClient(
      RestClient campaignRestClient, CampaignClientProperties properties, Clock clock) {
    this.campaignRestClient = campaignRestClient;
    this.properties = properties;
    this.clock = clock;
  }

  @Override
  public CampaignPage listCampaignPreviews(CallContext context, String userId, int limit) {
    final UpstreamDependency dependency = UpstreamDependency.GAME_CAMPAIGNS;
    UpstreamCalls.validateUserId(userId);
    UpstreamCalls.ensureNotExpired(context, clock, dependency);
    try {
      final CampaignPreviewsResponse response =
          UpstreamCalls.boundedBy(campaignRestClient, context, clock)
              .get()
              .uri(properties.listCampaignPreviewsPath(), userId, limit)
              .retrieve()
              .body(CampaignPreviewsResponse.class);
      if (response == null || response.campaigns() == null) {
        throw UpstreamCalls.invalidResponse(
            dependency, "campaign previews response is invalid", null);
      }
      return new CampaignPage(
          response.campaigns().stream()
              .filter(Objects::nonNull)
              .map(this::toCampaignPreview)
              .toList(),
          Boolean.TRUE.equals(response.hasMore()));
    } catch (RestClientResponseException ex) {
      throw UpstreamCalls.mapResponseException(dependency, ex, logger);
    } catch (ResourceAccessException ex) {
      throw UpstreamCalls.mapResourceException(dependency, ex, logger);
    } catch (UpstreamIntegrationException ex) {
      throw ex;
    } catch (RuntimeException ex) {
      logger.warn("campaign previews response parse failed", ex);
      throw UpstreamCalls.invalidResponse(
          dependency, "campaign previews response parse failed", ex);
    }
  }

  @Override
  public InvitePage listPendingInvitePreviews(CallContext context, String userId, int limit) {
    final UpstreamDependency dependency = UpstreamDependency.GAME_INVITES;
    UpstreamCalls.validateUserId(userId);
    UpstreamCalls.ensureNotExpired(context, clock, dependency);
    try {
      final InvitePreviewsResponse response =
          UpstreamCalls.boundedBy(campaignRestClient, context, clock)
              .get()
              .uri(properties.listInvitePreviewsPath(), userId, limit)
              .retrieve()
              .body(InvitePreviewsResponse.class);
      if (response == null || response.invites() == null) {
        throw UpstreamCalls.invalidResponse(
            dependency, "invite previews response is invalid", null);
      }
      return new InvitePage(
          response.invites().stream()
              .filter(Objects::nonNull)
              .map(this::toPendingInvite)
              .toList(),
          Boolean.TRUE.equals(response.hasMore()));
    } catch (RestClientResponseException ex) {
      throw UpstreamCalls.mapResponseException(dependency, ex, logger);
    } catch (ResourceAccessException ex) {
      throw UpstreamCalls.mapResourceException(dependency, ex, logger);
    } catch (UpstreamIntegrationException ex) {
      throw ex;
    } catch (RuntimeException ex) {
      logger.warn("invite previews response parse failed", ex);
      throw UpstreamCalls.invalidResponse(dependency, "invite previews response parse failed", ex);
    }
  }

  private CampaignPreview toCampaignPreview(CampaignPreviewItem item) {
    return new CampaignPreview(
        item.campaignId(),
        item.name(),
        CampaignStatus.fromValue(item.status()),
        Math.max(0, item.participantCount()),
        Math.max(0, item.characterCount()),
        UpstreamCalls.parseInstant(UpstreamDependency.GAME_CAMPAIGNS, item.updatedAt()));
  }

  private PendingInvite toPendingInvite(PendingInviteItem item) {
    return new PendingInvite(
        item.inviteId(),
        item.campaignId(),
        item.campaignName(),
        item.participantId(),
        UpstreamCalls.parseInstant(UpstreamDependency.GAME_INVITES, item.createdAt()));
  }
}
