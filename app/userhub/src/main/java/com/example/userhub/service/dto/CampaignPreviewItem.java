/*
 * どこで: userhub 下流 DTO
 * 何を: campaign プレビュー一覧の要素を表現する
 * なぜ: game 応答を型安全に扱うため
 */
package com.example.userhub.service.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CampaignPreviewItem(
    String campaignId,
    String name,
    String status,
    int participantCount,
    int characterCount,
    String updatedAt) {}
