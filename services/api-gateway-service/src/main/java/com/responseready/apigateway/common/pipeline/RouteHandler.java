package com.responseready.apigateway.common.pipeline;

/**
 * Endpoint body run after every stage has passed. Returning a {@code ResponseEntity} keeps its
 * status and headers; any other value is sent as 200.
 */
@FunctionalInterface
public interface RouteHandler {

  Object handle(RequestContext context) throws Exception;
}
