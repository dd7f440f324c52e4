package com.flamingo.ai.librarychat.service.site;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;
import java.util.Map;
import lombok.Data;
import lombok.NoArgsConstructor;

/** One site's entry in the site configuration document, as written on disk. */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class SiteConfig {

  private String siteId;

  private String name;

  private List<String> allowedFrontEndDomains;

  /** Collection identifier to display label. A present key enables the collection's policy. */
  private Map<String, String> collectionConfig;

  /** Collection identifier to the fixed author list retrieval is restricted to. */
  private Map<String, List<String>> collectionAuthors;

  /** Library names, either plain strings or objects with a {@code name} field. */
  private List<Object> includedLibraries;

  private List<String> enabledMediaTypes;

  private Integer queriesPerUserPerDay;
}
