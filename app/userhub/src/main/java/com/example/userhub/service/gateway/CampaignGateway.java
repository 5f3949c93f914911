package com.example.userhub.service.gateway;

import com.example.userhub.model.CallContext;
import com.example.userhub.model.CampaignPage;
import com.example.userhub.model.InvitePage;

/** Resolves user-scoped campaign and pending invite previews. */
public interface CampaignGateway {

  CampaignPage listCampaignPreviews(CallContext context, String userId, int limit);

  InvitePage listPendingInvitePreviews(CallContext context, String userId, int limit);
}
