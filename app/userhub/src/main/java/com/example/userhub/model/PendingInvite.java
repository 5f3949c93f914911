package com.example.userhub.model;

import java.time.Instant;

public record PendingInvite(
    String inviteId,
    String campaignId,
    String campaignName,
    String participantId,
    Instant createdAt) {}
