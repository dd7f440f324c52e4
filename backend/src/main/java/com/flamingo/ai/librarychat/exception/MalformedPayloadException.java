package com.flamingo.ai.librarychat.exception;

/** Thrown when the request body is not valid JSON or does not fit the request shape. */
public class MalformedPayloadException extends RuntimeException {

  public MalformedPayloadException(String message, Throwable cause) {
    super(message, cause);
  }

  public String getUserMessage() {
    return "Invalid JSON in request body";
  }
}
