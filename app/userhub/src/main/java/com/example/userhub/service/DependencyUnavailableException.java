/*
 * どこで: userhub サービス層
 * 何を: クリティカルな上流依存の失敗を表現する
 * なぜ: stale キャッシュが無いとき、作り物のサマリを返さずに失敗させるため
 */
package com.example.userhub.service;

public class DependencyUnavailableException extends RuntimeException {

  private final UpstreamDependency dependency;

  public DependencyUnavailableException(UpstreamDependency dependency, Throwable cause) {
    super(buildMessage(dependency, cause), cause);
    this.dependency = dependency;
  }

  public UpstreamDependency dependency() {
    return dependency;
  }

  public String dependencyName() {
    return dependency == null ? "" : dependency.dependencyName();
  }

  private static String buildMessage(UpstreamDependency dependency, Throwable cause) {
    if (dependency == null) {
      return "dependency unavailable";
    }
    if (cause == null || cause.getMessage() == null) {
      return dependency.dependencyName() + " unavailable";
    }
    return dependency.dependencyName() + " unavailable: " + cause.getMessage();
  }
}
