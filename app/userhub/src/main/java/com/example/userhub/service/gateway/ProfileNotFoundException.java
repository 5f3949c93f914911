package com.example.userhub.service.gateway;

/** No social profile exists for the user. A business state, not an upstream failure. */
public class ProfileNotFoundException extends RuntimeException {

  public ProfileNotFoundException(String message) {
    super(message);
  }

  public ProfileNotFoundException(String message, Throwable cause) {
    super(message, cause);
  }
}
