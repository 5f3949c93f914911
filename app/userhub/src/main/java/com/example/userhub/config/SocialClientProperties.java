/*
 * どこで: userhub 設定
 * 何を: social サービス呼び出し設定を保持する
 * なぜ: 下流 URL とパスを外部化するため
 */
package com.example.userhub.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "social")
public record SocialClientProperties(String baseUrl, String getUserProfilePath) {

  public SocialClientProperties {
    baseUrl = baseUrl == null ? "http://social:80" : baseUrl;
    getUserProfilePath =
        getUserProfilePath == null || getUserProfilePath.isBlank()
            ? "/v1/users/{userId}/profile"
            : getUserProfilePath;
  }
}
