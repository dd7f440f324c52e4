package com.flamingo.ai.librarychat.service.retrieval;

import com.flamingo.ai.librarychat.service.retrieval.RetrievalFilter.Constraint;
import com.flamingo.ai.librarychat.service.site.SitePolicy;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Derives the retrieval filter from the request's collection and media-type choices and the site
 * policy.
 *
 * <p>The type constraint is never empty: when the request enables none of the site's media types,
 * every site-enabled type is searched.
 */
@Component
public class FilterBuilder {

  public RetrievalFilter build(
      String collection, Map<String, Boolean> mediaTypes, SitePolicy policy) {
    List<String> enabledTypes = policy.enabledMediaTypes();

    List<String> types = new ArrayList<>();
    for (String type : enabledTypes) {
      if (mediaTypes != null && Boolean.TRUE.equals(mediaTypes.get(type))) {
        types.add(type);
      }
    }
    if (types.isEmpty()) {
      types.addAll(enabledTypes);
    }

    List<Constraint> constraints = new ArrayList<>();
    constraints.add(new Constraint(RetrievalFilter.TYPE_FIELD, types));

    List<String> authors = policy.authorsFor(collection);
    if (!authors.isEmpty()) {
      constraints.add(new Constraint(RetrievalFilter.AUTHOR_FIELD, authors));
    }

    if (!policy.includedLibraries().isEmpty()) {
      constraints.add(new Constraint(RetrievalFilter.LIBRARY_FIELD, policy.includedLibraries()));
    }

    return new RetrievalFilter(constraints);
  }
}
