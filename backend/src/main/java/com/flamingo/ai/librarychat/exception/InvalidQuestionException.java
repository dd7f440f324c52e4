package com.flamingo.ai.librarychat.exception;

/** Thrown when the question is missing, not a string, or outside the allowed length. */
public class InvalidQuestionException extends RuntimeException {

  private final String userMessage;

  public InvalidQuestionException(int minLength, int maxLength) {
    super("Question failed length validation");
    this.userMessage =
        String.format(
            "Invalid question. Must be between %d and %d characters.", minLength, maxLength);
  }

  public String getUserMessage() {
    return userMessage;
  }
}
