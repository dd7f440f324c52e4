package com.flamingo.ai.librarychat.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.librarychat.exception.ApiError;
import com.flamingo.ai.librarychat.exception.SiteConfigurationException;
import com.flamingo.ai.librarychat.service.admission.OriginPolicy;
import com.flamingo.ai.librarychat.service.site.SiteConfigLoader;
import com.flamingo.ai.librarychat.service.site.SitePolicy;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Adds CORS headers to {@code /chat} responses for allowed origins and answers preflight requests.
 *
 * <p>Disallowed origins get no CORS headers here; the controller rejects their POSTs with 403.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CorsHeaderFilter extends OncePerRequestFilter {

  static final String CHAT_PATH = "/chat";

  private final SiteConfigLoader siteConfigLoader;
  private final OriginPolicy originPolicy;
  private final ObjectMapper objectMapper;

  @Override
  protected boolean shouldNotFilter(HttpServletRequest request) {
    return !CHAT_PATH.equals(request.getServletPath());
  }

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    String origin = request.getHeader(HttpHeaders.ORIGIN);
    boolean preflight = HttpMethod.OPTIONS.matches(request.getMethod());

    SitePolicy policy;
    try {
      policy = siteConfigLoader.load();
    } catch (SiteConfigurationException e) {
      if (preflight) {
        log.error("Preflight failed, site configuration unavailable: {}", e.getMessage());
        writeConfigError(request, response, e);
        return;
      }
      // The controller reports this as a 500 after validating the body.
      log.debug("Skipping CORS headers, site configuration unavailable: {}", e.getMessage());
      filterChain.doFilter(request, response);
      return;
    }

    if (originPolicy.shouldEchoOrigin(origin, policy.allowedFrontEndDomains())) {
      addCorsHeaders(response, origin);
    }

    if (preflight) {
      response.setStatus(HttpServletResponse.SC_NO_CONTENT);
      return;
    }
    filterChain.doFilter(request, response);
  }

  private static void addCorsHeaders(HttpServletResponse response, String origin) {
    response.setHeader(HttpHeaders.ACCESS_CONTROL_ALLOW_ORIGIN, origin);
    response.setHeader(HttpHeaders.ACCESS_CONTROL_ALLOW_METHODS, "GET, POST, OPTIONS");
    response.setHeader(HttpHeaders.ACCESS_CONTROL_ALLOW_HEADERS, "Content-Type, Authorization");
    response.setHeader(HttpHeaders.ACCESS_CONTROL_ALLOW_CREDENTIALS, "true");
  }

  private void writeConfigError(
      HttpServletRequest request, HttpServletResponse response, SiteConfigurationException e)
      throws IOException {
    response.setStatus(HttpServletResponse.SC_INTERNAL_SERVER_ERROR);
    response.setContentType(MediaType.APPLICATION_JSON_VALUE);
    ApiError body =
        ApiError.builder()
            .error(e.getUserMessage())
            .code(ApiError.SITE_CONFIG_ERROR)
            .path(request.getRequestURI())
            .timestamp(Instant.now())
            .build();
    objectMapper.writeValue(response.getOutputStream(), body);
  }
}
