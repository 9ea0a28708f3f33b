package com.responseready.apigateway.common.pipeline;

import com.responseready.apigateway.common.ratelimit.RateLimitDecision;
import jakarta.servlet.http.HttpServletRequest;

/** Per-request state the stages fill in and the handler reads. */
public class RequestContext {

  private final HttpServletRequest request;
  private final EndpointPolicy policy;

  private RateLimitDecision rateLimit;
  private String userId;
  private boolean admin;
  private String email;

  public RequestContext(HttpServletRequest request, EndpointPolicy policy) {
    this.request = request;
    this.policy = policy;
  }

  public HttpServletRequest getRequest() {
    return request;
  }

  public EndpointPolicy getPolicy() {
    return policy;
  }

  public RateLimitDecision getRateLimit() {
    return rateLimit;
  }

  void setRateLimit(RateLimitDecision rateLimit) {
    this.rateLimit = rateLimit;
  }

  /** Remaining quota when a limiter ran, otherwise {@code null}. */
  public Integer getRateLimitRemaining() {
    return rateLimit == null ? null : rateLimit.remaining();
  }

  public String getUserId() {
    return userId;
  }

  public boolean isAdmin() {
    return admin;
  }

  public String getEmail() {
    return email;
  }

  public boolean isAuthenticated() {
    return userId != null;
  }

  void authenticate(String userId, boolean admin, String email) {
    this.userId = userId;
    this.admin = admin;
    this.email = email;
  }
}
