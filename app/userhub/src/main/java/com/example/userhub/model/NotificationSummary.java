package com.example.userhub.model;

public record NotificationSummary(boolean available, boolean hasUnread, int unreadCount) {

  public static NotificationSummary unavailable() {
    return new NotificationSummary(false, false, 0);
  }
}
