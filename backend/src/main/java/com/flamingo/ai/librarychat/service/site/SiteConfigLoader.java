package com.flamingo.ai.librarychat.service.site;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.librarychat.exception.SiteConfigurationException;
import java.io.IOException;
import java.io.InputStream;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Service;

/**
 * Loads the active site's settings from the site configuration document.
 *
 * <p>The document maps site ids to {@link SiteConfig} entries. A successful load is cached for the
 * lifetime of the process; a failed load is retried on the next request.
 */
@Service
@Slf4j
public class SiteConfigLoader {

  private static final TypeReference<Map<String, SiteConfig>> CONFIG_TYPE =
      new TypeReference<>() {};

  private final ObjectMapper objectMapper;
  private final Resource configLocation;
  private final String siteId;
  private final AtomicReference<SitePolicy> cached = new AtomicReference<>();

  public SiteConfigLoader(
      ObjectMapper objectMapper,
      @Value("${app.site.config-location:classpath:site-config/config.json}")
          Resource configLocation,
      @Value("${app.site.id:default}") String siteId) {
    this.objectMapper = objectMapper;
    this.configLocation = configLocation;
    this.siteId = siteId;
  }

  /**
   * Returns the active site's policy.
   *
   * @throws SiteConfigurationException if the document cannot be read or lacks the active site
   */
  public SitePolicy load() {
    SitePolicy policy = cached.get();
    if (policy != null) {
      return policy;
    }

    Map<String, SiteConfig> configs;
    try (InputStream in = configLocation.getInputStream()) {
      configs = objectMapper.readValue(in, CONFIG_TYPE);
    } catch (IOException e) {
      log.error("Failed to read site configuration from {}: {}", configLocation, e.getMessage());
      throw new SiteConfigurationException(
          "Failed to read site configuration from " + configLocation, e);
    }

    SiteConfig config = configs != null ? configs.get(siteId) : null;
    if (config == null) {
      throw new SiteConfigurationException(
          "Site '" + siteId + "' not found in " + configLocation);
    }

    policy = SitePolicy.from(siteId, config);
    if (policy.queriesPerUserPerDay() <= 0) {
      throw new SiteConfigurationException(
          "Site '" + siteId + "' must set a positive queriesPerUserPerDay");
    }
    cached.compareAndSet(null, policy);
    log.info(
        "Loaded site configuration '{}': mediaTypes={}, libraries={}, authorRestricted={}",
        siteId,
        policy.enabledMediaTypes(),
        policy.includedLibraries(),
        policy.collectionAuthors().keySet());
    return cached.get();
  }
}
