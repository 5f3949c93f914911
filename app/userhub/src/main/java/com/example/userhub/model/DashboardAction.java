package com.example.userhub.model;

public record DashboardAction(DashboardActionId id, int priority) {

  public DashboardAction {
    id = id == null ? DashboardActionId.UNSPECIFIED : id;
  }
}
