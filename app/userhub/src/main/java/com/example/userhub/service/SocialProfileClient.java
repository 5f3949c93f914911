/*
 * どこで: userhub サービス層
 * 何を: social サービスからユーザープロフィールを取得するクライアント
 * なぜ: ダッシュボードの discoverable 判定にユーザー名を使うため
 */
package com.example.userhub.service;

import com.example.userhub.config.SocialClientProperties;
import com.example.userhub.model.CallContext;
import com.example.userhub.model.UserProfile;
import com.example.userhub.service.dto.SocialProfileResponse;
import com.example.userhub.service.gateway.ProfileGateway;
import com.example.userhub.service.gateway.ProfileNotFoundException;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

@Service
public class SocialProfileClient implements ProfileGateway {

  private static final Logger logger = LoggerFactory.getLogger(SocialProfileClient.class);

  private final RestClient socialRestClient;
  private final SocialClientProperties properties;
  private final Clock clock;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "RestClient/Clock は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  public SocialProfileClient(
      RestClient socialRestClient, SocialClientProperties properties, Clock clock) {
    this.socialRestClient = socialRestClient;
    this.properties = properties;
    this.clock = clock;
  }

  @Override
  public UserProfile getUserProfile(CallContext context, String userId) {
    final UpstreamDependency dependency = UpstreamDependency.SOCIAL_PROFILE;
    UpstreamCalls.validateUserId(userId);
    UpstreamCalls.ensureNotExpired(context, clock, dependency);
    try {
      final SocialProfileResponse response =
          UpstreamCalls.boundedBy(socialRestClient, context, clock)
              .get()
              .uri(properties.getUserProfilePath(), userId)
              .retrieve()
              .body(SocialProfileResponse.class);
      if (response == null) {
        throw UpstreamCalls.invalidResponse(dependency, "social profile response is invalid", null);
      }
      return new UserProfile(response.username(), response.name());
    } catch (RestClientResponseException ex) {
      if (ex.getStatusCode().value() == 404) {
        throw new ProfileNotFoundException("user profile not found", ex);
      }
      throw UpstreamCalls.mapResponseException(dependency, ex, logger);
    } catch (ResourceAccessException ex) {
      throw UpstreamCalls.mapResourceException(dependency, ex, logger);
    } catch (UpstreamIntegrationException ex) {
      throw ex;
    } catch (RuntimeException ex) {
      logger.warn("social profile response parse failed", ex);
      throw UpstreamCalls.invalidResponse(dependency, "social profile response parse failed", ex);
    }
  }
}
