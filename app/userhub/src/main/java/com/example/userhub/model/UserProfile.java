package com.example.userhub.model;

public record UserProfile(String username, String name) {}
