/*
 * どこで: userhub 設定
 * 何を: campaign(game) サービス呼び出し設定を保持する
 * なぜ: 下流 URL とパスを外部化するため
 */
package com.example.userhub.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "campaign")
public record CampaignClientProperties(
    String baseUrl, String listCampaignPreviewsPath, String listInvitePreviewsPath) {

  public CampaignClientProperties {
    baseUrl = baseUrl == null ? "http://game:80" : baseUrl;
    listCampaignPreviewsPath =
        listCampaignPreviewsPath == null || listCampaignPreviewsPath.isBlank()
            ? "/v1/users/{userId}/campaign-previews?limit={limit}"
            : listCampaignPreviewsPath;
    listInvitePreviewsPath =
        listInvitePreviewsPath == null || listInvitePreviewsPath.isBlank()
            ? "/v1/users/{userId}/invite-previews?limit={limit}"
            : listInvitePreviewsPath;
  }
}
