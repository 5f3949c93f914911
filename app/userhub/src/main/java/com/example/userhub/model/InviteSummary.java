package com.example.userhub.model;

import java.util.List;

/** Pending invite section; only {@code available} is meaningful when unavailable. */
public record InviteSummary(
    boolean available, int listedCount, boolean hasMore, List<PendingInvite> pending) {

  public InviteSummary {
    pending = pending == null ? List.of() : List.copyOf(pending);
  }

  public static InviteSummary unavailable() {
    return new InviteSummary(false, 0, false, List.of());
  }
}
