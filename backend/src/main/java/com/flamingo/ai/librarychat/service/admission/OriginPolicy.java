package com.flamingo.ai.librarychat.service.admission;

import java.util.List;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Decides whether a browser origin may call the chat endpoint.
 *
 * <p>Requests without an Origin header are server-to-server calls and always pass. Plain-http
 * localhost passes on any port. Everything else must match an allow-list pattern, where {@code *}
 * stands for any run of characters and matching ignores case.
 */
@Component
public class OriginPolicy {

  private static final String LOCALHOST = "http://localhost";

  public boolean isAllowed(String origin, List<String> allowedPatterns) {
    if (origin == null || origin.isEmpty()) {
      return true;
    }
    if (isLocalhost(origin)) {
      return true;
    }
    return allowedPatterns.stream().anyMatch(pattern -> matches(origin, pattern));
  }

  /** Returns true only for a present origin that passes; used to decide on CORS headers. */
  public boolean shouldEchoOrigin(String origin, List<String> allowedPatterns) {
    return origin != null && !origin.isEmpty() && isAllowed(origin, allowedPatterns);
  }

  static boolean isLocalhost(String origin) {
    return origin.equals(LOCALHOST) || origin.startsWith(LOCALHOST + ":");
  }

  static boolean matches(String origin, String pattern) {
    StringBuilder regex = new StringBuilder();
    String[] literals = pattern.split("\\*", -1);
    for (int i = 0; i < literals.length; i++) {
      if (i > 0) {
        regex.append(".*");
      }
      if (!literals[i].isEmpty()) {
        regex.append(Pattern.quote(literals[i]));
      }
    }
    return Pattern.compile(regex.toString(), Pattern.CASE_INSENSITIVE).matcher(origin).matches();
  }
}
