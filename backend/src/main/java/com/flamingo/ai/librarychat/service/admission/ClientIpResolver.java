package com.flamingo.ai.librarychat.service.admission;

import jakarta.servlet.http.HttpServletRequest;
import org.springframework.stereotype.Component;

/**
 * Resolves the calling client's address for rate limiting.
 *
 * <p>Only the connection address is used. Forwarding headers are applied by the servlet container
 * ({@code server.forward-headers-strategy: native}), which trusts them from internal proxies only,
 * so a client cannot pick its own key by sending {@code X-Forwarded-For}.
 */
@Component
public class ClientIpResolver {

  public String resolve(HttpServletRequest request) {
    String remoteAddr = request.getRemoteAddr();
    return remoteAddr != null && !remoteAddr.isBlank() ? remoteAddr : "unknown";
  }
}
