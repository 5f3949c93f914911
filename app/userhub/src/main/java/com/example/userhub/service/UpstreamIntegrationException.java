/*
 * どこで: userhub サービス層
 * 何を: 上流サービス呼び出し失敗を表現する
 * なぜ: 依存ごとの失敗理由をメトリクスと縮退判定で一貫して扱うため
 */
package com.example.userhub.service;

public class UpstreamIntegrationException extends RuntimeException {

  public enum Reason {
    NOT_FOUND,
    TIMEOUT,
    INVALID_RESPONSE,
    BAD_GATEWAY
  }

  private final UpstreamDependency dependency;
  private final Reason reason;

  public UpstreamIntegrationException(
      UpstreamDependency dependency, Reason reason, String message) {
    super(message);
    this.dependency = dependency;
    this.reason = reason;
  }

  public UpstreamIntegrationException(
      UpstreamDependency dependency, Reason reason, String message, Throwable cause) {
    super(message, cause);
    this.dependency = dependency;
    this.reason = reason;
  }

  public UpstreamDependency dependency() {
    return dependency;
  }

  public Reason reason() {
    return reason;
  }
}
