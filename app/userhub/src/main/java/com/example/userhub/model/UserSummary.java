package com.example.userhub.model;

public record UserSummary(
    String userId,
    String username,
    String name,
    boolean profileAvailable,
    boolean discoverable,
    boolean needsProfileCompletion) {

  public UserSummary {
    username = username == null ? "" : username;
    name = name == null ? "" : name;
  }
}
