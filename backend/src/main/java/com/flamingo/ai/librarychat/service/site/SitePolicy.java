package com.flamingo.ai.librarychat.service.site;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable view of a site's configuration, passed explicitly to each pipeline stage.
 *
 * @param siteId the site identifier
 * @param allowedFrontEndDomains origin patterns, each with at most one {@code *} wildcard
 * @param collectionAuthors author restrictions for collections that have one enabled
 * @param includedLibraries library allow-list; empty means no restriction
 * @param enabledMediaTypes media types retrieval may return; never empty
 * @param queriesPerUserPerDay rate-limit ceiling per client in the rolling window
 */
public record SitePolicy(
    String siteId,
    List<String> allowedFrontEndDomains,
    Map<String, List<String>> collectionAuthors,
    List<String> includedLibraries,
    List<String> enabledMediaTypes,
    int queriesPerUserPerDay) {

  public static final List<String> DEFAULT_MEDIA_TYPES = List.of("text", "audio", "youtube");

  public SitePolicy {
    allowedFrontEndDomains = List.copyOf(allowedFrontEndDomains);
    collectionAuthors = Map.copyOf(collectionAuthors);
    includedLibraries = List.copyOf(includedLibraries);
    enabledMediaTypes =
        enabledMediaTypes.isEmpty() ? DEFAULT_MEDIA_TYPES : List.copyOf(enabledMediaTypes);
  }

  /** Returns the author restriction for a collection, or an empty list when it has none. */
  public List<String> authorsFor(String collection) {
    return collectionAuthors.getOrDefault(collection, List.of());
  }

  /**
   * Builds a policy from the on-disk form.
   *
   * <p>An author list only applies to collections that also appear in {@code collectionConfig}.
   */
  public static SitePolicy from(String siteId, SiteConfig config) {
    Map<String, String> enabledCollections =
        config.getCollectionConfig() != null ? config.getCollectionConfig() : Map.of();
    Map<String, List<String>> authors = new LinkedHashMap<>();
    if (config.getCollectionAuthors() != null) {
      config
          .getCollectionAuthors()
          .forEach(
              (collection, names) -> {
                if (enabledCollections.containsKey(collection)
                    && names != null
                    && !names.isEmpty()) {
                  authors.put(collection, List.copyOf(names));
                }
              });
    }

    return new SitePolicy(
        siteId,
        config.getAllowedFrontEndDomains() != null
            ? config.getAllowedFrontEndDomains()
            : List.of(),
        authors,
        libraryNames(config.getIncludedLibraries()),
        config.getEnabledMediaTypes() != null ? config.getEnabledMediaTypes() : List.of(),
        config.getQueriesPerUserPerDay() != null ? config.getQueriesPerUserPerDay() : 0);
  }

  private static List<String> libraryNames(List<Object> libraries) {
    List<String> names = new ArrayList<>();
    if (libraries == null) {
      return names;
    }
    for (Object library : libraries) {
      if (library instanceof String name) {
        names.add(name);
      } else if (library instanceof Map<?, ?> map
          && map.get("name") instanceof String mappedName) {
        names.add(mappedName);
      }
    }
    return names;
  }
}
