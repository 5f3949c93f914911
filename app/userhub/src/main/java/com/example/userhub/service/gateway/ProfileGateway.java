package com.example.userhub.service.gateway;

import com.example.userhub.model.CallContext;
import com.example.userhub.model.UserProfile;

/** Resolves the social profile of one user. */
public interface ProfileGateway {

  /**
   * @throws ProfileNotFoundException when the user has no profile
   */
  UserProfile getUserProfile(CallContext context, String userId);
}
