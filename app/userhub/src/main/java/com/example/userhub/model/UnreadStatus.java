package com.example.userhub.model;

public record UnreadStatus(boolean hasUnread, int unreadCount) {}
