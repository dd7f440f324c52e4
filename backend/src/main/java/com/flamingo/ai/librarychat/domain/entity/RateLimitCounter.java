package com.flamingo.ai.librarychat.domain.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** Request count for one client under one named limit, keyed {@code <name>_<client>}. */
@Entity
@Table(name = "rate_limits")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RateLimitCounter {

  @Id
  @Column(length = 255)
  private String id;

  @Column(nullable = false)
  private int count;

  /** Start of the current window. */
  @Column(nullable = false)
  private Instant firstRequestAt;
}
