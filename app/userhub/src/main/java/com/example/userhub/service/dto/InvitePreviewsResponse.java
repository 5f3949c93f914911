/*
 * どこで: userhub 下流 DTO
 * 何を: 保留中招待プレビュー一覧 API の応答を表現する
 * なぜ: ダッシュボードの invite セクションへ渡すため
 */
package com.example.userhub.service.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record InvitePreviewsResponse(List<PendingInviteItem> invites, Boolean hasMore) {}
