package com.example.userhub.model;

import java.util.List;

/** One page of pending invite previews as returned by the campaign gateway. */
public record InvitePage(List<PendingInvite> invites, boolean hasMore) {

  public InvitePage {
    invites = invites == null ? List.of() : List.copyOf(invites);
  }
}
