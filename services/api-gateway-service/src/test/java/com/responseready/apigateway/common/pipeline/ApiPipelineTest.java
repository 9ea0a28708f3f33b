package com.responseready.apigateway.common.pipeline;

import static org.assertj.core.api.Assertions.assertThat;

import com.responseready.apigateway.common.ratelimit.ClientIdentifierResolver;
import com.responseready.apigateway.common.ratelimit.RateLimitPolicy;
import com.responseready.apigateway.common.ratelimit.RateLimitService;
import com.responseready.apigateway.common.store.InMemoryCounterStore;
import com.responseready.apigateway.common.time.MutableClock;
import com.responseready.apigateway.common.web.ErrorResponse;
import com.responseready.apigateway.common.web.ForbiddenException;
import com.responseready.apigateway.common.web.SafeErrorMessages;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.mock.web.MockHttpServletRequest;

class ApiPipelineTest {

  private static final RateLimitPolicy TWO_PER_MINUTE =
      new RateLimitPolicy("test", 2, Duration.ofMinutes(1));

  private MutableClock clock;
  private RateLimitStage rateLimitStage;
  private List<String> trace;

  @BeforeEach
  void setUp() {
    clock = MutableClock.startingAt("2024-01-01T00:00:00Z");
    rateLimitStage =
        new RateLimitStage(
            new RateLimitService(new InMemoryCounterStore(clock)),
            new ClientIdentifierResolver(),
            clock);
    trace = new ArrayList<>();
  }

  @Test
  void wrapsPlainResultInOkAndReportsRemainingQuota() {
    ApiPipeline pipeline = pipeline(false, rateLimitStage);

    ResponseEntity<?> response =
        pipeline.execute(
            EndpointPolicy.open(TWO_PER_MINUTE, "Test"),
            request("1.1.1.1"),
            ctx -> Map.of("ok", 1));

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
    assertThat(response.getBody()).isEqualTo(Map.of("ok", 1));
    assertThat(response.getHeaders().getFirst(RateLimitStage.HEADER_REMAINING)).isEqualTo("1");
  }

  @Test
  void remainingHeaderIsSetEvenWhenZero() {
    ApiPipeline pipeline = pipeline(false, rateLimitStage);
    EndpointPolicy policy = EndpointPolicy.open(TWO_PER_MINUTE, "Test");
    pipeline.execute(policy, request("2.2.2.2"), ctx -> "first");

    ResponseEntity<?> second = pipeline.execute(policy, request("2.2.2.2"), ctx -> "second");

    assertThat(second.getHeaders().getFirst(RateLimitStage.HEADER_REMAINING)).isEqualTo("0");
  }

  @Test
  void rateLimitDenialShortCircuitsWithRetryHeaders() {
    AtomicInteger handled = new AtomicInteger();
    ApiPipeline pipeline = pipeline(false, rateLimitStage, recording("auth"));
    EndpointPolicy policy = EndpointPolicy.open(TWO_PER_MINUTE, "Test");
    for (int i = 0; i < 2; i++) {
      pipeline.execute(policy, request("3.3.3.3"), ctx -> handled.incrementAndGet());
    }
    trace.clear();
    clock.advance(Duration.ofSeconds(20));

    ResponseEntity<?> denied =
        pipeline.execute(policy, request("3.3.3.3"), ctx -> handled.incrementAndGet());

    assertThat(denied.getStatusCode()).isEqualTo(HttpStatus.TOO_MANY_REQUESTS);
    assertThat(denied.getBody())
        .isEqualTo(new ErrorResponse("Too many requests. Please try again later.", 40L));
    assertThat(denied.getHeaders().getFirst("Retry-After")).isEqualTo("40");
    assertThat(denied.getHeaders().getFirst(RateLimitStage.HEADER_LIMIT)).isEqualTo("2");
    assertThat(denied.getHeaders().getFirst(RateLimitStage.HEADER_REMAINING)).isEqualTo("0");
    assertThat(denied.getHeaders().getFirst(RateLimitStage.HEADER_RESET))
        .isEqualTo("2024-01-01T00:01:00Z");
    assertThat(handled).hasValue(2);
    assertThat(trace).isEmpty();
  }

  @Test
  void stagesRunInOrderAndStopAtFirstRejection() {
    ApiPipeline pipeline =
        pipeline(
            false,
            recording("first"),
            ctx -> {
              trace.add("second");
              throw new ForbiddenException("Admin access required");
            },
            recording("third"));

    ResponseEntity<?> response =
        pipeline.execute(
            EndpointPolicy.open(null, "Test"),
            request("4.4.4.4"),
            ctx -> {
              trace.add("handler");
              return "unreachable";
            });

    assertThat(trace).containsExactly("first", "second");
    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.FORBIDDEN);
    assertThat(response.getBody()).isEqualTo(ErrorResponse.of("Admin access required"));
    assertThat(response.getHeaders().containsKey(RateLimitStage.HEADER_REMAINING)).isFalse();
  }

  @Test
  void handlerResponseEntityIsKeptAsIs() {
    ApiPipeline pipeline = pipeline(false);

    ResponseEntity<?> response =
        pipeline.execute(
            EndpointPolicy.open(null, "Test"),
            request("5.5.5.5"),
            ctx -> ResponseEntity.status(HttpStatus.CREATED).body("made"));

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CREATED);
    assertThat(response.getBody()).isEqualTo("made");
  }

  @Test
  void unexpectedErrorsBecomeGenericServerErrors() {
    ResponseEntity<?> hidden =
        pipeline(false)
            .execute(
                EndpointPolicy.open(null, "Test"),
                request("6.6.6.6"),
                ctx -> {
                  throw new IllegalStateException("connection string leaked");
                });
    ResponseEntity<?> exposed =
        pipeline(true)
            .execute(
                EndpointPolicy.open(null, "Test"),
                request("6.6.6.6"),
                ctx -> {
                  throw new IllegalStateException("connection string leaked");
                });

    assertThat(hidden.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
    assertThat(hidden.getBody())
        .isEqualTo(ErrorResponse.of("An error occurred. Please try again later."));
    assertThat(exposed.getBody()).isEqualTo(ErrorResponse.of("connection string leaked"));
  }

  @Test
  void adminPolicyImpliesAuthentication() {
    EndpointPolicy policy = new EndpointPolicy(null, false, true, null);

    assertThat(policy.requireAuth()).isTrue();
    assertThat(policy.errorContext()).isEqualTo("API error");
  }

  private ApiPipeline pipeline(boolean exposeDetails, PipelineStage... stages) {
    return new ApiPipeline(List.of(stages), new SafeErrorMessages(exposeDetails));
  }

  private PipelineStage recording(String name) {
    return ctx -> {
      trace.add(name);
      return StageResult.proceed();
    };
  }

  private static MockHttpServletRequest request(String ip) {
    MockHttpServletRequest request = new MockHttpServletRequest();
    request.addHeader("X-Forwarded-For", ip);
    return request;
  }
}
