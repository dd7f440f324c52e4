package com.flamingo.ai.librarychat.service.chat;

/** Categories a stream failure is reported under. */
public enum FailureKind {
  INDEX_NOT_FOUND("index_not_found"),
  PROVIDER_QUOTA_EXCEEDED("provider_quota"),
  GENERIC_FAILURE("generic"),
  UNKNOWN_FAILURE("unknown");

  private final String metricTag;

  FailureKind(String metricTag) {
    this.metricTag = metricTag;
  }

  public String getMetricTag() {
    return metricTag;
  }
}
