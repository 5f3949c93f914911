package com.example.userhub.service.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record PendingInviteItem(
    String inviteId,
    String campaignId,
    String campaignName,
    String participantId,
    String createdAt) {}
