/*
 * どこで: userhub 下流 DTO
 * 何を: campaign プレビュー一覧 API の応答を表現する
 * なぜ: ダッシュボードの campaign セクションへ渡すため
 */
package com.example.userhub.service.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CampaignPreviewsResponse(List<CampaignPreviewItem> campaigns, Boolean hasMore) {}
