package com.example.userhub.config;

import com.example.userhub.service.DashboardCache;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(DashboardProperties.class)
public class DashboardConfig {

  @Bean
  DashboardCache dashboardCache(DashboardProperties properties) {
    final DashboardProperties.Cache cache = properties.cache();
    return new DashboardCache(cache.freshTtl(), cache.staleTtl(), cache.maxEntries());
  }
}
