package com.flamingo.ai.librarychat.exception;

/** Thrown when a client has used up its query allowance for the current window. */
public class RateLimitExceededException extends RuntimeException {

  private final String clientKey;

  public RateLimitExceededException(String clientKey) {
    super("Rate limit exceeded for " + clientKey);
    this.clientKey = clientKey;
  }

  public String getClientKey() {
    return clientKey;
  }

  public String getUserMessage() {
    return "Daily query limit reached. Please try again tomorrow.";
  }
}
