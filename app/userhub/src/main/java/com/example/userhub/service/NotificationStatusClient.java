/*
 * どこで: userhub サービス層
 * 何を: notification サービスから未読状態を取得するクライアント
 * なぜ: ダッシュボードの未読通知セクションを埋めるため
 */
package com.example.userhub.service;

import com.example.userhub.config.NotificationClientProperties;
import com.example.userhub.model.CallContext;
import com.example.userhub.model.UnreadStatus;
import com.example.userhub.service.dto.UnreadStatusResponse;
import com.example.userhub.service.gateway.NotificationGateway;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

@Service
public class NotificationStatusClient implements NotificationGateway {

  private static final Logger logger = LoggerFactory.getLogger(NotificationStatusClient.class);

  private final RestClient notificationRestClient;
  private final NotificationClientProperties properties;
  private final Clock clock;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "RestClient/Clock は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  public NotificationStatusClient(
      RestClient notificationRestClient, NotificationClientProperties properties, Clock clock) {
    this.notificationRestClient = notificationRestClient;
    this.properties = properties;
    this.clock = clock;
  }

  @Override
  public UnreadStatus getUnreadStatus(CallContext context, String userId) {
    final UpstreamDependency dependency = UpstreamDependency.NOTIFICATIONS_UNREAD;
    UpstreamCalls.validateUserId(userId);
    UpstreamCalls.ensureNotExpired(context, clock, dependency);
    try {
      final UnreadStatusResponse response =
          UpstreamCalls.boundedBy(notificationRestClient, context, clock)
              .get()
              .uri(properties.getUnreadStatusPath(), userId)
              .retrieve()
              .body(UnreadStatusResponse.class);
      if (response == null || response.hasUnread() == null || response.unreadCount() == null) {
        throw UpstreamCalls.invalidResponse(dependency, "unread status response is invalid", null);
      }
      return new UnreadStatus(response.hasUnread(), response.unreadCount());
    } catch (RestClientResponseException ex) {
      throw UpstreamCalls.mapResponseException(dependency, ex, logger);
    } catch (ResourceAccessException ex) {
      throw UpstreamCalls.mapResourceException(dependency, ex, logger);
    } catch (UpstreamIntegrationException ex) {
      throw ex;
    } catch (RuntimeException ex) {
      logger.warn("unread status response parse failed", ex);
      throw UpstreamCalls.invalidResponse(dependency, "unread status response parse failed", ex);
    }
  }
}
