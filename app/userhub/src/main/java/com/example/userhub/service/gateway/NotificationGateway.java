package com.example.userhub.service.gateway;

import com.example.userhub.model.CallContext;
import com.example.userhub.model.UnreadStatus;

/** Resolves unread-notification status of one user. */
public interface NotificationGateway {

  UnreadStatus getUnreadStatus(CallContext context, String userId);
}
