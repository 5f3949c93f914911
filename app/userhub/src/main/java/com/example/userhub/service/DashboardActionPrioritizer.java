package com.example.userhub.service;

import com.example.userhub.model.Dashboard;
import com.example.userhub.model.DashboardAction;
import com.example.userhub.model.DashboardActionId;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/** Derives the suggested next actions from assembled dashboard state. */
public final class DashboardActionPrioritizer {

  static final int PRIORITY_REVIEW_PENDING_INVITES = 100;
  static final int PRIORITY_COMPLETE_PROFILE = 90;
  static final int PRIORITY_CREATE_OR_JOIN_CAMPAIGN = 80;
  static final int PRIORITY_CONTINUE_ACTIVE_CAMPAIGN = 70;
  static final int PRIORITY_REVIEW_NOTIFICATIONS = 60;

  private DashboardActionPrioritizer() {}

  /**
   * Returns the actions whose trigger holds, highest priority first. Equal priorities keep the
   * order in which they were computed.
   */
  public static List<DashboardAction> prioritize(Dashboard dashboard) {
    final List<DashboardAction> actions = new ArrayList<>(5);
    if (dashboard.invites().available() && dashboard.invites().listedCount() > 0) {
      actions.add(
          new DashboardAction(
              DashboardActionId.REVIEW_PENDING_INVITES, PRIORITY_REVIEW_PENDING_INVITES));
    }
    if (dashboard.user().needsProfileCompletion()) {
      actions.add(
          new DashboardAction(DashboardActionId.COMPLETE_PROFILE, PRIORITY_COMPLETE_PROFILE));
    }
    if (dashboard.campaigns().available()
        && dashboard.campaigns().listedCount() == 0
        && !dashboard.campaigns().hasMore()) {
      actions.add(
          new DashboardAction(
              DashboardActionId.CREATE_OR_JOIN_CAMPAIGN, PRIORITY_CREATE_OR_JOIN_CAMPAIGN));
    }
    if (dashboard.campaigns().available() && dashboard.campaigns().activeCount() > 0) {
      actions.add(
          new DashboardAction(
              DashboardActionId.CONTINUE_ACTIVE_CAMPAIGN, PRIORITY_CONTINUE_ACTIVE_CAMPAIGN));
    }
    if (dashboard.notifications().available() && dashboard.notifications().hasUnread()) {
      actions.add(
          new DashboardAction(
              DashboardActionId.REVIEW_NOTIFICATIONS, PRIORITY_REVIEW_NOTIFICATIONS));
    }
    return sortByPriority(actions);
  }

  // List.sort is stable
  static List<DashboardAction> sortByPriority(List<DashboardAction> actions) {
    final List<DashboardAction> sorted = new ArrayList<>(actions);
    sorted.sort(Comparator.comparingInt(DashboardAction::priority).reversed());
    return List.copyOf(sorted);
  }
}
