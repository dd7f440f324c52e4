package com.flamingo.ai.librarychat.api.dto.response;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.flamingo.ai.librarychat.service.retrieval.SourceDocument;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One server-sent event on the chat stream.
 *
 * <p>Exactly one of the payload fields is set. {@code done} and {@code error} are terminal. In
 * comparison mode {@code model} tags the event with "A" or "B".
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class StreamEvent {

  private String token;

  private List<SourceDocument> sourceDocs;

  private Boolean done;

  private String error;

  private String docId;

  /** Answer was delivered but could not be stored. Not terminal. */
  private String saveError;

  private String model;

  public static StreamEvent token(String token) {
    return StreamEvent.builder().token(token).build();
  }

  public static StreamEvent token(String token, String model) {
    return StreamEvent.builder().token(token).model(model).build();
  }

  public static StreamEvent sourceDocs(List<SourceDocument> documents) {
    return StreamEvent.builder().sourceDocs(documents).build();
  }

  public static StreamEvent sourceDocs(List<SourceDocument> documents, String model) {
    return StreamEvent.builder().sourceDocs(documents).model(model).build();
  }

  public static StreamEvent done() {
    return StreamEvent.builder().done(true).build();
  }

  public static StreamEvent error(String message) {
    return StreamEvent.builder().error(message).build();
  }

  public static StreamEvent docId(String docId) {
    return StreamEvent.builder().docId(docId).build();
  }

  public static StreamEvent saveError(String message) {
    return StreamEvent.builder().saveError(message).build();
  }

  @JsonIgnore
  public boolean isTerminal() {
    return Boolean.TRUE.equals(done) || error != null;
  }
}
