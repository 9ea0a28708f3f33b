package com.responseready.apigateway.auth.api;

import com.responseready.apigateway.auth.api.dto.ChangePasswordRequest;
import com.responseready.apigateway.auth.api.dto.CurrentUserResponse;
import com.responseready.apigateway.auth.api.dto.ForcePasswordChangeRequest;
import com.responseready.apigateway.auth.api.dto.LoginRequest;
import com.responseready.apigateway.auth.api.dto.PasswordChangedResponse;
import com.responseready.apigateway.auth.api.dto.RefreshRequest;
import com.responseready.apigateway.auth.api.dto.RegisterRequest;
import com.responseready.apigateway.auth.api.dto.SuccessResponse;
import com.responseready.apigateway.auth.api.mapper.AccountApiMapper;
import com.responseready.apigateway.auth.service.AccountService;
import com.responseready.apigateway.auth.service.LoginService;
import com.responseready.apigateway.common.pipeline.ApiPipeline;
import com.responseready.apigateway.common.pipeline.EndpointPolicy;
import com.responseready.apigateway.common.ratelimit.RateLimitProperties;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/auth")
public class AuthController {

  private final ApiPipeline pipeline;
  private final LoginService loginService;
  private final AccountService accountService;
  private final AccountApiMapper mapper;
  private final RateLimitProperties rateLimits;

  public AuthController(
      ApiPipeline pipeline,
      LoginService loginService,
      AccountService accountService,
      AccountApiMapper mapper,
      RateLimitProperties rateLimits) {
    this.pipeline = pipeline;
    this.loginService = loginService;
    this.accountService = accountService;
    this.mapper = mapper;
    this.rateLimits = rateLimits;
  }

  @PostMapping("/login")
  public ResponseEntity<?> login(
      @Valid @RequestBody LoginRequest req, HttpServletRequest request) {
    return pipeline.execute(
        EndpointPolicy.open(rateLimits.authPolicy(), "Login"),
        request,
        ctx ->
            mapper.toCredentials(loginService.login(req.username(), req.password(), request)));
  }

  @PostMapping("/register")
  public ResponseEntity<?> register(
      @Valid @RequestBody RegisterRequest req, HttpServletRequest request) {
    return pipeline.execute(
        EndpointPolicy.open(rateLimits.authPolicy(), "Registration"),
        request,
        ctx ->
            ResponseEntity.status(HttpStatus.CREATED)
                .body(
                    mapper.toCredentials(
                        accountService.register(
                            req.username(), req.password(), req.email(), request))));
  }

  @PostMapping("/refresh")
  public ResponseEntity<?> refresh(
      @Valid @RequestBody RefreshRequest req, HttpServletRequest request) {
    return pipeline.execute(
        EndpointPolicy.open(rateLimits.authPolicy(), "Refresh token"),
        request,
        ctx -> mapper.toCredentials(loginService.refresh(req.refreshToken())));
  }

  @GetMapping("/me")
  public ResponseEntity<?> me(HttpServletRequest request) {
    return pipeline.execute(
        EndpointPolicy.authenticated(rateLimits.readPolicy(), "Get user"),
        request,
        ctx ->
            new CurrentUserResponse(
                new CurrentUserResponse.User(ctx.getUserId(), ctx.getEmail(), ctx.isAdmin())));
  }

  @PostMapping("/change-password")
  public ResponseEntity<?> changePassword(
      @Valid @RequestBody ChangePasswordRequest req, HttpServletRequest request) {
    return pipeline.execute(
        EndpointPolicy.authenticated(rateLimits.authPolicy(), "Change password"),
        request,
        ctx -> {
          accountService.changePassword(
              Long.valueOf(ctx.getUserId()), req.currentPassword(), req.newPassword(), request);
          return new SuccessResponse(true);
        });
  }

  /** First sign-in with an admin-issued temporary password. */
  @PostMapping("/force-password-change")
  public ResponseEntity<?> forcePasswordChange(
      @Valid @RequestBody ForcePasswordChangeRequest req, HttpServletRequest request) {
    return pipeline.execute(
        EndpointPolicy.authenticated(rateLimits.authPolicy(), "Force password change"),
        request,
        ctx ->
            new PasswordChangedResponse(
                true,
                mapper.toView(
                    accountService.forcePasswordChange(
                        Long.valueOf(ctx.getUserId()), req.newPassword(), request))));
  }
}
