package com.flamingo.ai.librarychat.service.admission;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;

@DisplayName("ClientIpResolver")
class ClientIpResolverTest {

  private final ClientIpResolver resolver = new ClientIpResolver();

  @Test
  @DisplayName("Should use the connection address")
  void shouldUseRemoteAddress() {
    MockHttpServletRequest request = new MockHttpServletRequest();
    request.setRemoteAddr("192.0.2.10");

    assertThat(resolver.resolve(request)).isEqualTo("192.0.2.10");
  }

  @Test
  @DisplayName("Should ignore client-supplied forwarding headers")
  void shouldIgnoreForwardingHeaders() {
    MockHttpServletRequest request = new MockHttpServletRequest();
    request.setRemoteAddr("192.0.2.10");
    request.addHeader("X-Forwarded-For", "203.0.113.7, 10.0.0.1");
    request.addHeader("X-Real-IP", "198.51.100.2");

    assertThat(resolver.resolve(request)).isEqualTo("192.0.2.10");
  }

  @Test
  @DisplayName("Should fall back to 'unknown' without an address")
  void shouldFallBackToUnknown() {
    MockHttpServletRequest request = new MockHttpServletRequest();
    request.setRemoteAddr(null);

    assertThat(resolver.resolve(request)).isEqualTo("unknown");
  }
}
