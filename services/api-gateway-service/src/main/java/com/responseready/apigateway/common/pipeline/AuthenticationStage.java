package com.responseready.apigateway.common.pipeline;

import com.responseready.apigateway.auth.domain.AccountEntity;
import com.responseready.apigateway.auth.repository.AccountRepository;
import com.responseready.apigateway.auth.service.TokenClaims;
import com.responseready.apigateway.auth.service.TokenService;
import com.responseready.apigateway.auth.service.VerifiedToken;
import com.responseready.apigateway.common.web.UnauthorizedException;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

/**
 * Resolves the bearer token to an active account. Admin status always comes from the stored
 * account; the token's claims are only used when the store is down on a non-admin route.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AuthenticationStage implements PipelineStage {

  static final String AUTH_REQUIRED = "Authentication required";
  static final String INVALID_TOKEN = "Invalid or expired token";
  static final String INACTIVE = "User account is inactive";

  private final TokenService tokenService;
  private final AccountRepository accounts;

  @Override
  public StageResult apply(RequestContext context) {
    if (!context.getPolicy().requireAuth()) {
      return StageResult.proceed();
    }
    String token = tokenService.getTokenFromRequest(context.getRequest());
    if (token == null || token.isBlank()) {
      throw new UnauthorizedException(AUTH_REQUIRED);
    }
    TokenClaims claims =
        tokenService
            .verifyToken(token)
            .map(VerifiedToken::claims)
            .orElseThrow(() -> new UnauthorizedException(INVALID_TOKEN));

    Long accountId = parseId(claims.userId());
    Optional<AccountEntity> account;
    try {
      account = accounts.findById(accountId);
    } catch (DataAccessException e) {
      if (context.getPolicy().requireAdmin()) {
        throw e;
      }
      log.warn("Account lookup failed, falling back to token claims: {}", e.getMessage());
      context.authenticate(claims.userId(), claims.admin(), claims.email());
      return StageResult.proceed();
    }

    AccountEntity entity =
        account
            .filter(AccountEntity::isActive)
            .orElseThrow(() -> new UnauthorizedException(INACTIVE));
    context.authenticate(String.valueOf(entity.getId()), entity.isAdmin(), entity.getUsername());
    return StageResult.proceed();
  }

  private static Long parseId(String subject) {
    try {
      return Long.valueOf(subject);
    } catch (NumberFormatException e) {
      throw new UnauthorizedException(INVALID_TOKEN);
    }
  }
}
