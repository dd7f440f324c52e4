package com.flamingo.ai.librarychat.service.site;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.librarychat.exception.SiteConfigurationException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.core.io.ClassPathResource;

@DisplayName("SiteConfigLoader")
class SiteConfigLoaderTest {

  private static final String CONFIG =
      """
      {
        "ananda": {
          "allowedFrontEndDomains": ["*.ananda.org"],
          "collectionConfig": {"master_swami": "Master and Swami"},
          "collectionAuthors": {
            "master_swami": ["Paramhansa Yogananda", "Swami Kriyananda"],
            "whole_library": ["Somebody Else"]
          },
          "includedLibraries": ["Ananda Library", {"name": "Treasures"}, {"weight": 2}],
          "queriesPerUserPerDay": 50,
          "unusedSetting": true
        },
        "other": {"queriesPerUserPerDay": 0}
      }
      """;

  private final ObjectMapper objectMapper = new ObjectMapper();

  @Test
  @DisplayName("Should build the policy for the active site")
  void shouldLoadActiveSite() {
    SitePolicy policy = loader(CONFIG, "ananda").load();

    assertThat(policy.siteId()).isEqualTo("ananda");
    assertThat(policy.allowedFrontEndDomains()).containsExactly("*.ananda.org");
    assertThat(policy.includedLibraries()).containsExactly("Ananda Library", "Treasures");
    assertThat(policy.queriesPerUserPerDay()).isEqualTo(50);
  }

  @Test
  @DisplayName("Should apply author lists only to collections enabled in collectionConfig")
  void shouldGateAuthorsOnCollectionConfig() {
    SitePolicy policy = loader(CONFIG, "ananda").load();

    assertThat(policy.authorsFor("master_swami"))
        .containsExactly("Paramhansa Yogananda", "Swami Kriyananda");
    assertThat(policy.authorsFor("whole_library")).isEmpty();
  }

  @Test
  @DisplayName("Should default media types when the site names none")
  void shouldDefaultMediaTypes() {
    assertThat(loader(CONFIG, "ananda").load().enabledMediaTypes())
        .containsExactly("text", "audio", "youtube");
  }

  @Test
  @DisplayName("Should fail when the active site is missing")
  void shouldFailForMissingSite() {
    assertThatThrownBy(() -> loader(CONFIG, "unknown").load())
        .isInstanceOf(SiteConfigurationException.class)
        .hasMessageContaining("unknown");
  }

  @Test
  @DisplayName("Should fail when the site sets no usable query limit")
  void shouldFailWithoutQueryLimit() {
    assertThatThrownBy(() -> loader(CONFIG, "other").load())
        .isInstanceOf(SiteConfigurationException.class)
        .extracting(e -> ((SiteConfigurationException) e).getUserMessage())
        .isEqualTo("Failed to load site configuration");
  }

  @Test
  @DisplayName("Should fail on an unreadable document")
  void shouldFailOnBadJson() {
    assertThatThrownBy(() -> loader("{ not json", "ananda").load())
        .isInstanceOf(SiteConfigurationException.class)
        .hasCauseInstanceOf(IOException.class);
  }

  @Test
  @DisplayName("Should read the document once and reuse the policy")
  void shouldCachePolicy() {
    AtomicInteger reads = new AtomicInteger();
    ByteArrayResource resource =
        new ByteArrayResource(CONFIG.getBytes(StandardCharsets.UTF_8)) {
          @Override
          public InputStream getInputStream() throws IOException {
            reads.incrementAndGet();
            return super.getInputStream();
          }
        };
    SiteConfigLoader loader = new SiteConfigLoader(objectMapper, resource, "ananda");

    SitePolicy first = loader.load();
    SitePolicy second = loader.load();

    assertThat(second).isSameAs(first);
    assertThat(reads).hasValue(1);
  }

  @Test
  @DisplayName("Should load the bundled default site")
  void shouldLoadBundledDefault() {
    SiteConfigLoader loader =
        new SiteConfigLoader(
            objectMapper, new ClassPathResource("site-config/config.json"), "default");

    SitePolicy policy = loader.load();

    assertThat(policy.collectionAuthors()).containsOnlyKeys("master_swami");
    assertThat(policy.includedLibraries()).isEqualTo(List.of());
  }

  private SiteConfigLoader loader(String json, String siteId) {
    return new SiteConfigLoader(
        objectMapper, new ByteArrayResource(json.getBytes(StandardCharsets.UTF_8)), siteId);
  }
}
