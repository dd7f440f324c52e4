package com.flamingo.ai.librarychat.api.dto.request;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;
import lombok.experimental.SuperBuilder;

/**
 * Chat request that runs two models side by side over the same sources.
 *
 * <p>A body is treated as a comparison request whenever it carries a {@code modelA} field.
 */
@Data
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
@SuperBuilder
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ComparisonRequest extends ChatRequest {

  private String modelA;

  private String modelB;

  private Double temperatureA;

  private Double temperatureB;

  private boolean useExtraSources;
}
