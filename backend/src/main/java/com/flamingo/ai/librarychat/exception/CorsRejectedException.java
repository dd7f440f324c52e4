package com.flamingo.ai.librarychat.exception;

/** Thrown when a request's Origin matches neither localhost nor the site allow-list. */
public class CorsRejectedException extends RuntimeException {

  private final String origin;

  public CorsRejectedException(String origin) {
    super("CORS blocked request from origin: " + origin);
    this.origin = origin;
  }

  public String getOrigin() {
    return origin;
  }

  public String getUserMessage() {
    return "CORS policy: No access from this origin";
  }
}
