package com.flamingo.ai.librarychat.domain.entity;

import com.flamingo.ai.librarychat.domain.converter.HistoryListConverter;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** A completed, non-private answer together with the sources and history it was built from. */
@Entity
@Table(name = "chat_logs")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Answer {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(columnDefinition = "TEXT", nullable = false)
  private String question;

  @Column(columnDefinition = "TEXT", nullable = false)
  private String answer;

  @Column(nullable = false)
  private String collection;

  /** JSON-serialized source documents shown with the answer. */
  @Column(columnDefinition = "TEXT")
  private String sources;

  @Builder.Default private int likeCount = 0;

  @Convert(converter = HistoryListConverter.class)
  @Column(columnDefinition = "TEXT")
  @Builder.Default
  private List<HistoryEntry> history = new ArrayList<>();

  private String ip;

  @Column(nullable = false, updatable = false)
  private Instant createdAt;

  @PrePersist
  protected void onCreate() {
    if (createdAt == null) {
      createdAt = Instant.now();
    }
  }

  /** One earlier exchange of the conversation. */
  public record HistoryEntry(String question, String answer) {}
}
