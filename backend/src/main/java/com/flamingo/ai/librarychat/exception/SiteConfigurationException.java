package com.flamingo.ai.librarychat.exception;

/** Thrown when the site configuration cannot be loaded or does not contain the active site. */
public class SiteConfigurationException extends RuntimeException {

  public SiteConfigurationException(String message) {
    super(message);
  }

  public SiteConfigurationException(String message, Throwable cause) {
    super(message, cause);
  }

  public String getUserMessage() {
    return "Failed to load site configuration";
  }
}
