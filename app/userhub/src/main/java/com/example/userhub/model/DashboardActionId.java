package com.example.userhub.model;

public enum DashboardActionId {
  UNSPECIFIED,
  REVIEW_PENDING_INVITES,
  COMPLETE_PROFILE,
  CREATE_OR_JOIN_CAMPAIGN,
  CONTINUE_ACTIVE_CAMPAIGN,
  REVIEW_NOTIFICATIONS
}
