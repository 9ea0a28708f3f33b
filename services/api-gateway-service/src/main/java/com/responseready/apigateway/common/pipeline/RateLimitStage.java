package com.responseready.apigateway.common.pipeline;

import com.responseready.apigateway.common.ratelimit.ClientIdentifierResolver;
import com.responseready.apigateway.common.ratelimit.RateLimitDecision;
import com.responseready.apigateway.common.ratelimit.RateLimitService;
import com.responseready.apigateway.common.web.ErrorResponse;
import java.time.Clock;
import java.time.Duration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;

/** Charges the endpoint's tier against the caller's IP and answers 429 once it is spent. */
@Component
public class RateLimitStage implements PipelineStage {

  public static final String HEADER_LIMIT = "X-RateLimit-Limit";
  public static final String HEADER_REMAINING = "X-RateLimit-Remaining";
  public static final String HEADER_RESET = "X-RateLimit-Reset";

  static final String TOO_MANY_REQUESTS = "Too many requests. Please try again later.";

  private final RateLimitService rateLimitService;
  private final ClientIdentifierResolver identifiers;
  private final Clock clock;

  public RateLimitStage(
      RateLimitService rateLimitService, ClientIdentifierResolver identifiers, Clock clock) {
    this.rateLimitService = rateLimitService;
    this.identifiers = identifiers;
    this.clock = clock;
  }

  @Override
  public StageResult apply(RequestContext context) {
    if (context.getPolicy().rateLimit() == null) {
      return StageResult.proceed();
    }
    String identifier = identifiers.resolve(context.getRequest());
    RateLimitDecision decision =
        rateLimitService.checkRateLimit(identifier, context.getPolicy().rateLimit());
    context.setRateLimit(decision);
    if (decision.allowed()) {
      return StageResult.proceed();
    }

    long retryAfter = retryAfterSeconds(decision);
    HttpHeaders headers = new HttpHeaders();
    headers.set(HEADER_LIMIT, String.valueOf(decision.limit()));
    headers.set(HEADER_REMAINING, "0");
    headers.set(HEADER_RESET, decision.resetAt().toString());
    headers.set(HttpHeaders.RETRY_AFTER, String.valueOf(retryAfter));
    return StageResult.shortCircuit(
        ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS)
            .headers(headers)
            .body(new ErrorResponse(TOO_MANY_REQUESTS, retryAfter)));
  }

  private long retryAfterSeconds(RateLimitDecision decision) {
    long millis = Duration.between(clock.instant(), decision.resetAt()).toMillis();
    return Math.max(1, (millis + 999) / 1000);
  }
}
