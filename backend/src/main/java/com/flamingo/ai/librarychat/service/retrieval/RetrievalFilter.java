package com.flamingo.ai.librarychat.service.retrieval;

import java.util.List;
import java.util.stream.Collectors;

/** A conjunction of inclusion constraints applied to the vector search. */
public record RetrievalFilter(List<Constraint> constraints) {

  public static final String TYPE_FIELD = "type";
  public static final String AUTHOR_FIELD = "author";
  public static final String LIBRARY_FIELD = "library";

  public RetrievalFilter {
    constraints = List.copyOf(constraints);
  }

  /** Allowed values for {@code field}, or an empty list when the field is unconstrained. */
  public List<String> valuesFor(String field) {
    return constraints.stream()
        .filter(c -> c.field().equals(field))
        .findFirst()
        .map(Constraint::values)
        .orElse(List.of());
  }

  public List<String> typeValues() {
    return valuesFor(TYPE_FIELD);
  }

  @Override
  public String toString() {
    return constraints.stream().map(Constraint::toString).collect(Collectors.joining(" AND "));
  }

  /** Field value must be one of {@code values}. */
  public record Constraint(String field, List<String> values) {

    public Constraint {
      values = List.copyOf(values);
    }

    @Override
    public String toString() {
      return field + " IN " + values;
    }
  }
}
