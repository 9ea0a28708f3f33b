package com.responseready.apigateway.common.ratelimit;

import jakarta.servlet.http.HttpServletRequest;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Derives the rate-limit identifier for a request: {@code user:<id>} for a known subject,
 * otherwise the client IP from proxy headers ({@code X-Forwarded-For} first hop, then {@code
 * X-Real-IP}), otherwise {@code ip:unknown}.
 */
@Component
public class ClientIdentifierResolver {

  static final String FORWARDED_FOR = "X-Forwarded-For";
  static final String REAL_IP = "X-Real-IP";

  public String resolve(HttpServletRequest request) {
    return resolve(request, null);
  }

  public String resolve(HttpServletRequest request, String userId) {
    if (StringUtils.hasText(userId)) {
      return "user:" + userId;
    }
    return "ip:" + clientIp(request);
  }

  /** Client IP as reported by the proxy chain, {@code unknown} when no header carries one. */
  public String clientIp(HttpServletRequest request) {
    String forwardedFor = request.getHeader(FORWARDED_FOR);
    if (StringUtils.hasText(forwardedFor)) {
      String first = forwardedFor.split(",")[0].trim();
      if (!first.isEmpty()) {
        return first;
      }
    }
    String realIp = request.getHeader(REAL_IP);
    if (StringUtils.hasText(realIp)) {
      return realIp.trim();
    }
    return "unknown";
  }
}
