package com.flamingo.ai.librarychat.service.admission;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.flamingo.ai.librarychat.api.dto.request.ChatRequest;
import com.flamingo.ai.librarychat.api.dto.request.ComparisonRequest;
import com.flamingo.ai.librarychat.config.ChatProperties;
import com.flamingo.ai.librarychat.exception.CorsRejectedException;
import com.flamingo.ai.librarychat.exception.RateLimitExceededException;
import com.flamingo.ai.librarychat.service.chat.ValidatedRequest;
import com.flamingo.ai.librarychat.service.site.SitePolicy;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("AdmissionGate")
class AdmissionGateTest {

  private static final SitePolicy POLICY =
      new SitePolicy("test", List.of("*.ananda.org"), Map.of(), List.of(), List.of(), 10);

  @Mock private RateLimiter rateLimiter;

  private AdmissionGate gate;

  @BeforeEach
  void setUp() {
    gate = new AdmissionGate(new OriginPolicy(), rateLimiter, new ChatProperties());
  }

  @Test
  @DisplayName("Should reject a disallowed origin before touching the rate limiter")
  void shouldRejectOriginFirst() {
    assertThatThrownBy(() -> gate.admit("https://evil.com", "1.2.3.4", single(), POLICY))
        .isInstanceOf(CorsRejectedException.class);
    verifyNoInteractions(rateLimiter);
  }

  @Test
  @DisplayName("Should count single requests against the site's daily limit")
  void shouldApplyRateLimit() {
    when(rateLimiter.tryAcquire("query", "1.2.3.4", Duration.ofHours(24), 10)).thenReturn(true);

    assertThatCode(() -> gate.admit("https://www.ananda.org", "1.2.3.4", single(), POLICY))
        .doesNotThrowAnyException();
    verify(rateLimiter).tryAcquire(eq("query"), eq("1.2.3.4"), any(Duration.class), eq(10));
  }

  @Test
  @DisplayName("Should reject with 429 semantics when the limiter refuses")
  void shouldRejectOverLimit() {
    when(rateLimiter.tryAcquire(anyString(), anyString(), any(Duration.class), anyInt()))
        .thenReturn(false);

    assertThatThrownBy(() -> gate.admit(null, "1.2.3.4", single(), POLICY))
        .isInstanceOf(RateLimitExceededException.class)
        .hasMessageContaining("1.2.3.4");
  }

  @Test
  @DisplayName("Should not rate-limit comparison requests")
  void shouldSkipRateLimitForComparison() {
    ComparisonRequest request =
        ComparisonRequest.builder()
            .question("q")
            .collection("whole_library")
            .modelA("gpt-4o")
            .modelB("gpt-4o-mini")
            .build();

    gate.admit("http://localhost:3000", "1.2.3.4", new ValidatedRequest(request, "q", "q"), POLICY);

    verifyNoInteractions(rateLimiter);
  }

  private static ValidatedRequest single() {
    ChatRequest request = ChatRequest.builder().question("q").collection("whole_library").build();
    return new ValidatedRequest(request, "q", "q");
  }
}
