package com.example.userhub.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.http.HttpMethod.GET;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import com.example.userhub.config.SocialClientProperties;
import com.example.userhub.model.CallContext;
import com.example.userhub.model.UserProfile;
import com.example.userhub.service.gateway.ProfileNotFoundException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

class SocialProfileClientTest {

  private static final Instant NOW = Instant.parse("2026-02-26T04:00:00Z");

  @Test
  void getUserProfileCallsSocial() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo("http://social.test/v1/users/user-1/profile"))
        .andExpect(method(GET))
        .andRespond(
            withSuccess(
                "{\"user_id\":\"user-1\",\"username\":\"ari\",\"name\":\"Ari\"}",
                MediaType.APPLICATION_JSON));

    final UserProfile profile = fixture.client.getUserProfile(CallContext.none(), "user-1");

    assertThat(profile.username()).isEqualTo("ari");
    assertThat(profile.name()).isEqualTo("Ari");
  }

  @Test
  void getUserProfileMaps404ToProfileNotFound() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo("http://social.test/v1/users/user-404/profile"))
        .andRespond(withStatus(HttpStatus.NOT_FOUND));

    assertThatThrownBy(() -> fixture.client.getUserProfile(CallContext.none(), "user-404"))
        .isInstanceOf(ProfileNotFoundException.class);
  }

  @Test
  void getUserProfileMaps5xxToBadGateway() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo("http://social.test/v1/users/user-1/profile"))
        .andRespond(withServerError());

    assertThatThrownBy(() -> fixture.client.getUserProfile(CallContext.none(), "user-1"))
        .isInstanceOf(UpstreamIntegrationException.class)
        .extracting(ex -> ((UpstreamIntegrationException) ex).reason())
        .isEqualTo(UpstreamIntegrationException.Reason.BAD_GATEWAY);
  }

  @Test
  void expiredContextFailsWithoutNetworkCall() {
    final ClientFixture fixture = newFixture();

    assertThatThrownBy(
            () -> fixture.client.getUserProfile(new CallContext(NOW.minusSeconds(1)), "user-1"))
        .isInstanceOf(UpstreamIntegrationException.class)
        .extracting(ex -> ((UpstreamIntegrationException) ex).reason())
        .isEqualTo(UpstreamIntegrationException.Reason.TIMEOUT);
    fixture.server.verify();
  }

  private ClientFixture newFixture() {
    final RestClient.Builder builder = RestClient.builder();
    final MockRestServiceServer server = MockRestServiceServer.bindTo(builder).build();
    final RestClient restClient = builder.baseUrl("http://social.test").build();
    final SocialClientProperties properties = new SocialClientProperties("http://social.test", null);
    return new ClientFixture(
        new SocialProfileClient(restClient, properties, Clock.fixed(NOW, ZoneOffset.UTC)), server);
  }

  private record ClientFixture(SocialProfileClient client, MockRestServiceServer server) {}
}
