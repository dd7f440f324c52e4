package com.flamingo.ai.librarychat.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/** Configuration properties for the chat pipeline. */
@Configuration
@ConfigurationProperties(prefix = "chat")
@Validated
@Getter
@Setter
public class ChatProperties {

  /** Collection identifiers a request may name. */
  @NotEmpty
  private List<String> collections = new ArrayList<>(List.of("master_swami", "whole_library"));

  @Valid private Validation validation = new Validation();
  @Valid private Retrieval retrieval = new Retrieval();
  @Valid private Generation generation = new Generation();
  @Valid private Stream stream = new Stream();
  @Valid private RateLimit rateLimit = new RateLimit();

  @Getter
  @Setter
  public static class Validation {
    @Min(1) private int minQuestionLength = 1;
    @Min(1) private int maxQuestionLength = 4000;
  }

  @Getter
  @Setter
  public static class Retrieval {
    @NotBlank private String indexName = "library-sources";
    private int vectorDimensions = 1536;
    @Min(1) private int defaultSourceCount = 4;

    /** Source count used by comparison requests that ask for extra sources. */
    @Min(1) private int extraSourceCount = 10;
  }

  @Getter
  @Setter
  public static class Generation {
    @NotBlank private String model = "gpt-4o";
    private double temperature = 0.0;
    private Duration timeout = Duration.ofSeconds(120);
  }

  @Getter
  @Setter
  public static class Stream {
    @NotNull private Duration timeout = Duration.ofSeconds(240);
  }

  @Getter
  @Setter
  public static class RateLimit {
    private String name = "query";
    @NotNull private Duration window = Duration.ofHours(24);
  }
}
