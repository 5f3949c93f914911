/*
 * どこで: userhub サービス層
 * 何を: 上流 HTTP 呼び出しの失敗を UpstreamIntegrationException へ変換する共通処理
 * なぜ: campaign/social/notification の各クライアントで失敗理由の判定を揃えるため
 */
package com.example.userhub.service;

import com.example.userhub.model.CallContext;
import java.net.SocketTimeoutException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import org.slf4j.Logger;
import org.springframework.http.client.ClientHttpRequestFactory;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

final class UpstreamCalls {

  private UpstreamCalls() {}

  /** Fails before any network I/O once the request deadline has passed. */
  static void ensureNotExpired(CallContext context, Clock clock, UpstreamDependency dependency) {
    if (context != null && context.isExpired(clock.instant())) {
      throw new UpstreamIntegrationException(
          dependency,
          UpstreamIntegrationException.Reason.TIMEOUT,
          dependency.dependencyName() + " request deadline exceeded");
    }
  }

  /**
   * Returns a client whose connect and read timeouts end at the request deadline. A context
   * without a deadline keeps the configured client.
   */
  static RestClient boundedBy(RestClient restClient, CallContext context, Clock clock) {
    if (context == null) {
      return restClient;
    }
    return context
        .remaining(clock.instant())
        .map(remaining -> restClient.mutate().requestFactory(deadlineRequestFactory(remaining)))
        .map(RestClient.Builder::build)
        .orElse(restClient);
  }

  // 0 は無制限を意味するため最低 1ms に切り上げる
  static ClientHttpRequestFactory deadlineRequestFactory(Duration remaining) {
    final Duration timeout = Duration.ofMillis(Math.max(1L, remaining.toMillis()));
    final SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
    requestFactory.setConnectTimeout(timeout);
    requestFactory.setReadTimeout(timeout);
    return requestFactory;
  }

  static UpstreamIntegrationException mapResponseException(
      UpstreamDependency dependency, RestClientResponseException ex, Logger logger) {
    logger.warn(
        "{} call failed with http status={} statusText={}",
        dependency.dependencyName(),
        ex.getStatusCode().value(),
        ex.getStatusText());
    if (ex.getStatusCode().value() == 404) {
      return new UpstreamIntegrationException(
          dependency,
          UpstreamIntegrationException.Reason.NOT_FOUND,
          dependency.dependencyName() + " not found",
          ex);
    }
    if (ex.getStatusCode().is5xxServerError()) {
      return new UpstreamIntegrationException(
          dependency,
          UpstreamIntegrationException.Reason.BAD_GATEWAY,
          dependency.dependencyName() + " server error",
          ex);
    }
    return new UpstreamIntegrationException(
        dependency,
        UpstreamIntegrationException.Reason.BAD_GATEWAY,
        dependency.dependencyName() + " request failed",
        ex);
  }

  static UpstreamIntegrationException mapResourceException(
      UpstreamDependency dependency, ResourceAccessException ex, Logger logger) {
    if (isTimeout(ex)) {
      logger.warn("{} call timed out", dependency.dependencyName());
      return new UpstreamIntegrationException(
          dependency,
          UpstreamIntegrationException.Reason.TIMEOUT,
          dependency.dependencyName() + " request timeout",
          ex);
    }
    logger.warn("{} connection failed", dependency.dependencyName(), ex);
    return new UpstreamIntegrationException(
        dependency,
        UpstreamIntegrationException.Reason.BAD_GATEWAY,
        dependency.dependencyName() + " connection failed",
        ex);
  }

  static UpstreamIntegrationException invalidResponse(
      UpstreamDependency dependency, String message, Throwable cause) {
    return new UpstreamIntegrationException(
        dependency, UpstreamIntegrationException.Reason.INVALID_RESPONSE, message, cause);
  }

  /** Parses an ISO-8601 instant; blank values are absent, malformed values are invalid. */
  static Instant parseInstant(UpstreamDependency dependency, String value) {
    if (value == null || value.isBlank()) {
      return null;
    }
    try {
      return Instant.parse(value.trim());
    } catch (DateTimeParseException ex) {
      throw invalidResponse(
          dependency, dependency.dependencyName() + " timestamp is invalid: " + value, ex);
    }
  }

  static void validateUserId(String userId) {
    if (userId == null || userId.isBlank()) {
      throw new IllegalArgumentException("userId is required");
    }
  }

  private static boolean isTimeout(ResourceAccessException ex) {
    Throwable current = ex;
    while (current != null) {
      if (current instanceof SocketTimeoutException) {
        return true;
      }
      current = current.getCause();
    }
    return false;
  }
}
