package com.flamingo.ai.librarychat.exception;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;
import lombok.Builder;
import lombok.Getter;

/**
 * Error body returned before a chat stream is opened.
 *
 * <p>Clients read {@code error}; the remaining fields are for log correlation.
 */
@Getter
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiError {

  public static final String MALFORMED_PAYLOAD = "REQUEST_001";
  public static final String INVALID_QUESTION = "REQUEST_002";
  public static final String INVALID_COLLECTION = "REQUEST_003";
  public static final String CORS_REJECTED = "ADMISSION_001";
  public static final String RATE_LIMITED = "ADMISSION_002";
  public static final String SITE_CONFIG_ERROR = "CONFIG_001";
  public static final String INTERNAL_ERROR = "INTERNAL_001";

  /** User-facing message. */
  private final String error;

  /** Machine-readable error code. */
  private final String code;

  /** Unique error ID for log correlation. */
  private final String errorId;

  private final Instant timestamp;

  private final String path;
}
