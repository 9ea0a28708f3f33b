package com.responseready.apigateway.auth.service;

import com.responseready.apigateway.auth.domain.AccountEntity;
import com.responseready.apigateway.auth.lockout.AccountLockedException;
import com.responseready.apigateway.auth.lockout.AccountLockoutService;
import com.responseready.apigateway.auth.lockout.LockoutStatus;
import com.responseready.apigateway.auth.repository.AccountRepository;
import com.responseready.apigateway.common.web.UnauthorizedException;
import jakarta.servlet.http.HttpServletRequest;
import java.time.Clock;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Password login guarded by the lockout tracker, and refresh-token exchange.
 *
 * <p>Unknown usernames, inactive accounts and wrong passwords fail the same way: one recorded
 * attempt and the same 401 message. A password hash is checked in every case.
 */
@Service
@Slf4j
public class LoginService {

  static final String INVALID_CREDENTIALS = "Invalid username or password";
  static final String INVALID_REFRESH = "Invalid or expired refresh token";
  static final String INACTIVE = "User account is inactive";

  private final AccountRepository accounts;
  private final PasswordEncoder passwordEncoder;
  private final AccountLockoutService lockout;
  private final AccountService accountService;
  private final TokenService tokenService;
  private final AuthAuditService audit;
  private final Clock clock;
  private final String dummyHash;

  public LoginService(
      AccountRepository accounts,
      PasswordEncoder passwordEncoder,
      AccountLockoutService lockout,
      AccountService accountService,
      TokenService tokenService,
      AuthAuditService audit,
      Clock clock) {
    this.accounts = accounts;
    this.passwordEncoder = passwordEncoder;
    this.lockout = lockout;
    this.accountService = accountService;
    this.tokenService = tokenService;
    this.audit = audit;
    this.clock = clock;
    this.dummyHash = passwordEncoder.encode("timing-equalizer-not-a-password");
  }

  @Transactional
  public IssuedCredentials login(String username, String password, HttpServletRequest request) {
    String login = AccountService.normalizeEmail(username);

    LockoutStatus status = lockout.isAccountLocked(login);
    if (status.locked()) {
      throw new AccountLockedException(status.minutesRemaining(clock.instant()));
    }

    Optional<AccountEntity> account = accounts.findByUsernameAndActiveTrue(login);
    String hash = account.map(AccountEntity::getPasswordHash).orElse(dummyHash);
    boolean matches = passwordEncoder.matches(password, hash);
    if (account.isEmpty() || !matches) {
      LockoutStatus after = lockout.recordFailedAttempt(login);
      if (after.locked()) {
        throw new AccountLockedException(after.minutesRemaining(clock.instant()));
      }
      throw new UnauthorizedException(INVALID_CREDENTIALS);
    }

    lockout.clearFailedAttempts(login);
    AccountEntity entity = account.get();
    entity.setLastLoginAt(clock.instant());
    accounts.save(entity);
    audit.log(entity, AuthAuditService.LOGIN, request);
    log.info("Login succeeded for account {}", entity.getId());
    return accountService.issue(entity);
  }

  /** Exchanges a refresh token for a new pair carrying the account's current admin flag. */
  @Transactional(readOnly = true)
  public IssuedCredentials refresh(String refreshToken) {
    TokenClaims claims =
        tokenService
            .verifyRefreshToken(refreshToken)
            .map(VerifiedToken::claims)
            .orElseThrow(() -> new UnauthorizedException(INVALID_REFRESH));

    Long id;
    try {
      id = Long.valueOf(claims.userId());
    } catch (NumberFormatException e) {
      throw new UnauthorizedException(INVALID_REFRESH);
    }
    AccountEntity account =
        accounts
            .findById(id)
            .filter(AccountEntity::isActive)
            .orElseThrow(() -> new UnauthorizedException(INACTIVE));
    return accountService.issue(account);
  }
}
