/*
 * どこで: userhub 設定
 * 何を: 上流サービスごとの RestClient を提供する
 * なぜ: 下流サービスごとに baseUrl 設定責務を分離するため
 */
package com.example.userhub.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestClient;

@Configuration
@EnableConfigurationProperties({
  CampaignClientProperties.class,
  SocialClientProperties.class,
  NotificationClientProperties.class
})
public class UpstreamClientConfig {

  @Bean
  RestClient campaignRestClient(RestClient.Builder builder, CampaignClientProperties properties) {
    return builder.baseUrl(properties.baseUrl()).build();
  }

  @Bean
  RestClient socialRestClient(RestClient.Builder builder, SocialClientProperties properties) {
    return builder.baseUrl(properties.baseUrl()).build();
  }

  @Bean
  RestClient notificationRestClient(
      RestClient.Builder builder, NotificationClientProperties properties) {
    return builder.baseUrl(properties.baseUrl()).build();
  }
}
