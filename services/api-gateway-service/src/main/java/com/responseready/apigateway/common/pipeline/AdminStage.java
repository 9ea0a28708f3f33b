package com.responseready.apigateway.common.pipeline;

import com.responseready.apigateway.common.web.ForbiddenException;
import org.springframework.stereotype.Component;

@Component
public class AdminStage implements PipelineStage {

  static final String ADMIN_REQUIRED = "Admin access required";

  @Override
  public StageResult apply(RequestContext context) {
    if (context.getPolicy().requireAdmin() && !context.isAdmin()) {
      throw new ForbiddenException(ADMIN_REQUIRED);
    }
    return StageResult.proceed();
  }
}
