package com.responseready.apigateway.auth.api;

import com.responseready.apigateway.auth.api.dto.AccountListResponse;
import com.responseready.apigateway.auth.api.dto.AccountResponse;
import com.responseready.apigateway.auth.api.dto.CreateAccountRequest;
import com.responseready.apigateway.auth.api.dto.MessageResponse;
import com.responseready.apigateway.auth.api.dto.UpdateAccountRequest;
import com.responseready.apigateway.auth.api.mapper.AccountApiMapper;
import com.responseready.apigateway.auth.service.AccountService;
import com.responseready.apigateway.common.pipeline.ApiPipeline;
import com.responseready.apigateway.common.pipeline.EndpointPolicy;
import com.responseready.apigateway.common.ratelimit.RateLimitProperties;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/** Account administration; every route requires an admin. */
@RestController
@RequestMapping("/api/auth/users")
public class AdminAccountsController {

  private final ApiPipeline pipeline;
  private final AccountService accountService;
  private final AccountApiMapper mapper;
  private final RateLimitProperties rateLimits;

  public AdminAccountsController(
      ApiPipeline pipeline,
      AccountService accountService,
      AccountApiMapper mapper,
      RateLimitProperties rateLimits) {
    this.pipeline = pipeline;
    this.accountService = accountService;
    this.mapper = mapper;
    this.rateLimits = rateLimits;
  }

  @GetMapping
  public ResponseEntity<?> list(HttpServletRequest request) {
    return pipeline.execute(
        EndpointPolicy.admin(rateLimits.readPolicy(), "Get users"),
        request,
        ctx -> new AccountListResponse(mapper.toViews(accountService.listAccounts())));
  }

  @PostMapping
  public ResponseEntity<?> create(
      @Valid @RequestBody CreateAccountRequest req, HttpServletRequest request) {
    return pipeline.execute(
        EndpointPolicy.admin(rateLimits.apiPolicy(), "Create user"),
        request,
        ctx ->
            ResponseEntity.status(HttpStatus.CREATED)
                .body(
                    new AccountResponse(
                        mapper.toView(
                            accountService.createAccount(
                                req.username(),
                                req.password(),
                                req.email(),
                                req.admin(),
                                request)))));
  }

  @PutMapping("/{id}")
  public ResponseEntity<?> update(
      @PathVariable("id") String id,
      @Valid @RequestBody UpdateAccountRequest req,
      HttpServletRequest request) {
    return pipeline.execute(
        EndpointPolicy.admin(rateLimits.apiPolicy(), "Update user"),
        request,
        ctx ->
            new AccountResponse(
                mapper.toView(
                    accountService.updateAccount(ctx.getUserId(), id, mapper.toUpdate(req)))));
  }

  @DeleteMapping("/{id}")
  public ResponseEntity<?> deactivate(@PathVariable("id") String id, HttpServletRequest request) {
    return pipeline.execute(
        EndpointPolicy.admin(rateLimits.apiPolicy(), "Delete user"),
        request,
        ctx -> {
          accountService.deactivateAccount(ctx.getUserId(), id);
          return new MessageResponse(true, "User deactivated");
        });
  }
}
