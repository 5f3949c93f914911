/*
 * どこで: userhub 設定
 * 何を: ダッシュボードのキャッシュ TTL とリクエスト期限を保持する
 * なぜ: 鮮度と上流待ち時間の上限を環境ごとに調整できるようにするため
 */
package com.example.userhub.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "userhub.dashboard")
public record DashboardProperties(Duration requestTimeout, Cache cache) {

  public DashboardProperties {
    requestTimeout = requestTimeout == null ? Duration.ofSeconds(3) : requestTimeout;
    cache = cache == null ? new Cache(null, null, 0) : cache;
  }

  /** Non-positive values fall back to the cache defaults. */
  public record Cache(Duration freshTtl, Duration staleTtl, long maxEntries) {}
}
