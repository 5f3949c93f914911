/*
 * どこで: userhub 設定
 * 何を: notification サービス呼び出し設定を保持する
 * なぜ: 下流 URL とパスを外部化するため
 */
package com.example.userhub.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "notification")
public record NotificationClientProperties(String baseUrl, String getUnreadStatusPath) {

  public NotificationClientProperties {
    baseUrl = baseUrl == null ? "http://notification:80" : baseUrl;
    getUnreadStatusPath =
        getUnreadStatusPath == null || getUnreadStatusPath.isBlank()
            ? "/v1/users/{userId}/notifications/unread-status"
            : getUnreadStatusPath;
  }
}
