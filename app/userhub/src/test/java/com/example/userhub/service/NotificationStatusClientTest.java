package com.example.userhub.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.http.HttpMethod.GET;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import com.example.userhub.config.NotificationClientProperties;
import com.example.userhub.model.CallContext;
import com.example.userhub.model.UnreadStatus;
import java.io.IOException;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.net.SocketTimeoutException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;

class NotificationStatusClientTest {

  private static final Instant NOW = Instant.parse("2026-02-26T04:00:00Z");

  @Test
  void getUnreadStatusCallsNotification() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo("http://notification.test/v1/users/user-1/notifications/unread-status"))
        .andExpect(method(GET))
        .andRespond(
            withSuccess(
                "{\"has_unread\":true,\"unread_count\":7}", MediaType.APPLICATION_JSON));

    final UnreadStatus status = fixture.client.getUnreadStatus(CallContext.none(), "user-1");

    assertThat(status.hasUnread()).isTrue();
    assertThat(status.unreadCount()).isEqualTo(7);
  }

  @Test
  void getUnreadStatusMapsMissingFieldsToInvalidResponse() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo("http://notification.test/v1/users/user-1/notifications/unread-status"))
        .andRespond(withSuccess("{\"has_unread\":true}", MediaType.APPLICATION_JSON));

    assertThatThrownBy(() -> fixture.client.getUnreadStatus(CallContext.none(), "user-1"))
        .isInstanceOf(UpstreamIntegrationException.class)
        .extracting(ex -> ((UpstreamIntegrationException) ex).reason())
        .isEqualTo(UpstreamIntegrationException.Reason.INVALID_RESPONSE);
  }

  @Test
  void getUnreadStatusMaps4xxToBadGateway() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo("http://notification.test/v1/users/user-1/notifications/unread-status"))
        .andRespond(withStatus(HttpStatus.FORBIDDEN));

    assertThatThrownBy(() -> fixture.client.getUnreadStatus(CallContext.none(), "user-1"))
        .isInstanceOf(UpstreamIntegrationException.class)
        .extracting(ex -> ((UpstreamIntegrationException) ex).reason())
        .isEqualTo(UpstreamIntegrationException.Reason.BAD_GATEWAY);
  }

  @Test
  void getUnreadStatusMapsTimeoutToTimeout() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo("http://notification.test/v1/users/user-1/notifications/unread-status"))
        .andRespond(
            request -> {
              throw new ResourceAccessException(
                  "read timeout", new SocketTimeoutException("Read timed out"));
            });

    assertThatThrownBy(() -> fixture.client.getUnreadStatus(CallContext.none(), "user-1"))
        .isInstanceOf(UpstreamIntegrationException.class)
        .extracting(ex -> ((UpstreamIntegrationException) ex).reason())
        .isEqualTo(UpstreamIntegrationException.Reason.TIMEOUT);
  }

  @Test
  void expiredContextFailsWithoutNetworkCall() {
    final ClientFixture fixture = newFixture();

    assertThatThrownBy(() -> fixture.client.getUnreadStatus(new CallContext(NOW), "user-1"))
        .isInstanceOf(UpstreamIntegrationException.class)
        .hasMessage("notifications.unread request deadline exceeded");
    fixture.server.verify();
  }

  @Test
  void getUnreadStatusTimesOutAtRequestDeadlineWhenUpstreamNeverReplies() throws IOException {
    // backlog に積まれた接続は accept されず、応答も返らない
    try (ServerSocket silentUpstream = new ServerSocket(0, 1, InetAddress.getLoopbackAddress())) {
      final String baseUrl =
          "http://" + InetAddress.getLoopbackAddress().getHostAddress() + ":"
              + silentUpstream.getLocalPort();
      final Clock systemClock = Clock.systemUTC();
      final NotificationStatusClient client =
          new NotificationStatusClient(
              RestClient.builder().baseUrl(baseUrl).build(),
              new NotificationClientProperties(baseUrl, null),
              systemClock);
      final CallContext context = CallContext.withTimeout(systemClock, Duration.ofMillis(300));
      final long startedAt = System.nanoTime();

      assertThatThrownBy(() -> client.getUnreadStatus(context, "user-1"))
          .isInstanceOf(UpstreamIntegrationException.class)
          .extracting(ex -> ((UpstreamIntegrationException) ex).reason())
          .isEqualTo(UpstreamIntegrationException.Reason.TIMEOUT);
      assertThat(Duration.ofNanos(System.nanoTime() - startedAt))
          .isGreaterThanOrEqualTo(Duration.ofMillis(250))
          .isLessThan(Duration.ofSeconds(2));
    }
  }

  private ClientFixture newFixture() {
    final RestClient.Builder builder = RestClient.builder();
    final MockRestServiceServer server = MockRestServiceServer.bindTo(builder).build();
    final RestClient restClient = builder.baseUrl("http://notification.test").build();
    final NotificationClientProperties properties =
        new NotificationClientProperties("http://notification.test", null);
    return new ClientFixture(
        new NotificationStatusClient(restClient, properties, Clock.fixed(NOW, ZoneOffset.UTC)),
        server);
  }

  private record ClientFixture(NotificationStatusClient client, MockRestServiceServer server) {}
}
