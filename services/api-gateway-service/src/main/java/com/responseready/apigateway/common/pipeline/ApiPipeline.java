package com.responseready.apigateway.common.pipeline;

import com.responseready.apigateway.common.web.ApiException;
import com.responseready.apigateway.common.web.ErrorResponse;
import com.responseready.apigateway.common.web.SafeErrorMessages;
import jakarta.servlet.http.HttpServletRequest;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;

/**
 * Runs an endpoint through rate limiting, authentication, the admin check and the database
 * connection, in that order, then the handler.
 *
 * <p>The first stage that rejects ends the request; later stages and the handler do not run. Known
 * failures become {@code {"error": message}} with their status. Anything else is logged and
 * answered with a generic 500. The remaining rate-limit quota is reported on every response.
 */
@Component
@Slf4j
public class ApiPipeline {

  static final String GENERIC_ERROR = "An error occurred. Please try again later.";

  private final List<PipelineStage> stages;
  private final SafeErrorMessages safeErrorMessages;

  @Autowired
  public ApiPipeline(
      RateLimitStage rateLimitStage,
      AuthenticationStage authenticationStage,
      AdminStage adminStage,
      ConnectDependencyStage connectDependencyStage,
      SafeErrorMessages safeErrorMessages) {
    this(
        List.of(rateLimitStage, authenticationStage, adminStage, connectDependencyStage),
        safeErrorMessages);
  }

  ApiPipeline(List<PipelineStage> stages, SafeErrorMessages safeErrorMessages) {
    this.stages = List.copyOf(stages);
    this.safeErrorMessages = safeErrorMessages;
  }

  public ResponseEntity<?> execute(
      EndpointPolicy policy, HttpServletRequest request, RouteHandler handler) {
    RequestContext context = new RequestContext(request, policy);
    ResponseEntity<?> response;
    try {
      response = runStagesAndHandler(context, handler);
    } catch (ApiException e) {
      log.debug("{}: {} {}", policy.errorContext(), e.getStatus().value(), e.getMessage());
      response = ErrorResponse.entity(e.getStatus(), e.getMessage());
    } catch (Exception e) {
      log.error(policy.errorContext(), e);
      response =
          ErrorResponse.entity(
              HttpStatus.INTERNAL_SERVER_ERROR, safeErrorMessages.forClient(e, GENERIC_ERROR));
    }
    return withRateLimitHeader(response, context);
  }

  private ResponseEntity<?> runStagesAndHandler(RequestContext context, RouteHandler handler)
      throws Exception {
    for (PipelineStage stage : stages) {
      StageResult result = stage.apply(context);
      if (result.isShortCircuit()) {
        return result.response();
      }
    }
    Object body = handler.handle(context);
    if (body instanceof ResponseEntity<?> entity) {
      return entity;
    }
    return ResponseEntity.ok(body);
  }

  private static ResponseEntity<?> withRateLimitHeader(
      ResponseEntity<?> response, RequestContext context) {
    Integer remaining = context.getRateLimitRemaining();
    if (remaining == null || response.getHeaders().containsKey(RateLimitStage.HEADER_REMAINING)) {
      return response;
    }
    HttpHeaders headers = new HttpHeaders();
    headers.putAll(response.getHeaders());
    headers.set(RateLimitStage.HEADER_REMAINING, String.valueOf(remaining));
    Object body = response.getBody();
    return new ResponseEntity<>(body, headers, response.getStatusCode());
  }
}
