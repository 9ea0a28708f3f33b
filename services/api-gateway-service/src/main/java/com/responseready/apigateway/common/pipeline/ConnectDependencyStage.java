package com.responseready.apigateway.common.pipeline;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/** Last guard: the database must answer before any handler touches it. */
@Component
@RequiredArgsConstructor
public class ConnectDependencyStage implements PipelineStage {

  private final PersistenceConnector connector;

  @Override
  public StageResult apply(RequestContext context) {
    connector.ensureConnected();
    return StageResult.proceed();
  }
}
