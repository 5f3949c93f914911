package com.example.userhub.service;

/** Upstream reads the dashboard depends on, named as they appear in degradation metadata. */
public enum UpstreamDependency {
  GAME_CAMPAIGNS("game.campaigns", true),
  GAME_INVITES("game.invites", false),
  SOCIAL_PROFILE("social.profile", false),
  NOTIFICATIONS_UNREAD("notifications.unread", false);

  private final String dependencyName;
  private final boolean critical;

  UpstreamDependency(String dependencyName, boolean critical) {
    this.dependencyName = dependencyName;
    this.critical = critical;
  }

  public String dependencyName() {
    return dependencyName;
  }

  /** A critical dependency fails the whole request when no stale snapshot is available. */
  public boolean critical() {
    return critical;
  }
}
