package com.example.userhub.model;

/** One dashboard request; preview limits of zero or less select the default. */
public record DashboardRequest(
    String userId, String locale, int campaignPreviewLimit, int invitePreviewLimit) {}
