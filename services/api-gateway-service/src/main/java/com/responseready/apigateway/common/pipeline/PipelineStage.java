package com.responseready.apigateway.common.pipeline;

/**
 * One guard of the request pipeline. A stage may enrich the context, throw an {@link
 * com.responseready.apigateway.common.web.ApiException}, or short-circuit with its own response.
 */
public interface PipelineStage {

  StageResult apply(RequestContext context);
}
