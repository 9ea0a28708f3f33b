package com.responseready.apigateway.auth.service;

import com.responseready.apigateway.auth.domain.AccountEntity;
import com.responseready.apigateway.auth.repository.AccountRepository;
import com.responseready.apigateway.common.web.BadRequestException;
import com.responseready.apigateway.common.web.NotFoundException;
import com.responseready.apigateway.common.web.UnauthorizedException;
import jakarta.servlet.http.HttpServletRequest;
import java.time.Clock;
import java.util.List;
import java.util.Locale;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Account lifecycle: self-registration, admin provisioning, edits and password changes. */
@Service
@Slf4j
public class AccountService {

  private static final int MIN_TEMPORARY_PASSWORD = 6;

  private final AccountRepository accounts;
  private final PasswordEncoder passwordEncoder;
  private final PasswordPolicy passwordPolicy;
  private final TokenService tokenService;
  private final AuthAuditService audit;
  private final Clock clock;

  public AccountService(
      AccountRepository accounts,
      PasswordEncoder passwordEncoder,
      PasswordPolicy passwordPolicy,
      TokenService tokenService,
      AuthAuditService audit,
      Clock clock) {
    this.accounts = accounts;
    this.passwordEncoder = passwordEncoder;
    this.passwordPolicy = passwordPolicy;
    this.tokenService = tokenService;
    this.audit = audit;
    this.clock = clock;
  }

  @Transactional
  public IssuedCredentials register(
      String username, String rawPassword, String email, HttpServletRequest request) {
    passwordPolicy.check(rawPassword);
    String login = normalizeEmail(username);
    if (accounts.existsByUsername(login)) {
      throw new BadRequestException("An account with this email already exists");
    }

    AccountEntity account =
        new AccountEntity(login, email == null ? login : normalizeEmail(email), hash(rawPassword));
    account.setCreatedAt(clock.instant());
    AccountEntity saved = accounts.save(account);
    audit.log(saved, AuthAuditService.REGISTER, request);
    log.info("Registered account {}", saved.getId());
    return issue(saved);
  }

  /** Admin-provisioned account; the holder must pick a new password on first login. */
  @Transactional
  public AccountEntity createAccount(
      String username,
      String temporaryPassword,
      String email,
      boolean admin,
      HttpServletRequest request) {
    String login = normalizeEmail(username);
    if (accounts.existsByUsername(login)) {
      throw new BadRequestException("User with this email already exists");
    }

    AccountEntity account =
        new AccountEntity(
            login, email == null ? login : normalizeEmail(email), hash(temporaryPassword));
    account.setCreatedAt(clock.instant());
    account.setAdmin(admin);
    account.setMustChangePassword(true);
    AccountEntity saved = accounts.save(account);
    audit.log(saved, AuthAuditService.ACCOUNT_CREATED, request);
    log.info("Account {} created by admin (admin={})", saved.getId(), admin);
    return saved;
  }

  @Transactional(readOnly = true)
  public List<AccountEntity> listAccounts() {
    return accounts.findAllByOrderByCreatedAtDesc();
  }

  @Transactional
  public void changePassword(
      Long accountId, String currentPassword, String newPassword, HttpServletRequest request) {
    passwordPolicy.check(newPassword);
    AccountEntity account =
        accounts
            .findById(accountId)
            .filter(AccountEntity::isActive)
            .orElseThrow(() -> new NotFoundException("User not found"));
    if (!passwordEncoder.matches(currentPassword, account.getPasswordHash())) {
      throw new UnauthorizedException("Current password is incorrect");
    }

    account.setPasswordHash(hash(newPassword));
    account.setMustChangePassword(false);
    accounts.save(account);
    audit.log(account, AuthAuditService.PASSWORD_CHANGE, request);
  }

  /**
   * Applies an admin edit to account {@code accountId}. An admin cannot revoke their own admin
   * flag.
   */
  @Transactional
  public AccountEntity updateAccount(
      String actingAccountId, String accountId, AccountUpdate update) {
    AccountEntity account = findAccount(accountId);
    boolean self = account.getId().toString().equals(actingAccountId);
    if (self && Boolean.FALSE.equals(update.admin())) {
      throw new BadRequestException("Cannot remove your own admin status");
    }

    if (update.username() != null) {
      String login = normalizeEmail(update.username());
      boolean taken =
          accounts
              .findByUsername(login)
              .filter(other -> !other.getId().equals(account.getId()))
              .isPresent();
      if (taken) {
        throw new BadRequestException("Username already exists");
      }
      account.setUsername(login);
    }
    if (update.email() != null) {
      account.setEmail(normalizeEmail(update.email()));
    }
    if (update.password() != null && !update.password().isBlank()) {
      if (update.password().length() < MIN_TEMPORARY_PASSWORD) {
        throw new BadRequestException("Password must be at least 6 characters");
      }
      account.setPasswordHash(hash(update.password()));
    }
    if (update.active() != null) {
      account.setActive(update.active());
    }
    if (update.admin() != null) {
      account.setAdmin(update.admin());
    }

    AccountEntity saved = accounts.save(account);
    log.info(
        "Account {} updated by {} (active={}, admin={})",
        saved.getId(),
        actingAccountId,
        saved.isActive(),
        saved.isAdmin());
    return saved;
  }

  /** Soft delete: the account stays on record but can no longer sign in. */
  @Transactional
  public void deactivateAccount(String actingAccountId, String accountId) {
    if (accountId.equals(actingAccountId)) {
      throw new BadRequestException("Cannot delete your own account");
    }
    AccountEntity account = findAccount(accountId);
    account.setActive(false);
    accounts.save(account);
    log.info("Account {} deactivated by {}", account.getId(), actingAccountId);
  }

  /**
   * Replaces an admin-issued temporary password. Only allowed while the account is flagged as
   * having to change it, so the current password is not asked for.
   */
  @Transactional
  public AccountEntity forcePasswordChange(
      Long accountId, String newPassword, HttpServletRequest request) {
    passwordPolicy.check(newPassword);
    AccountEntity account =
        accounts
            .findById(accountId)
            .filter(AccountEntity::isActive)
            .orElseThrow(() -> new NotFoundException("User not found"));
    if (!account.isMustChangePassword()) {
      throw new BadRequestException(
          "Password change not required. Use the regular password change feature.");
    }

    account.setPasswordHash(hash(newPassword));
    account.setMustChangePassword(false);
    AccountEntity saved = accounts.save(account);
    audit.log(saved, AuthAuditService.PASSWORD_CHANGE_FORCED, request);
    return saved;
  }

  private AccountEntity findAccount(String accountId) {
    Long id;
    try {
      id = Long.valueOf(accountId);
    } catch (NumberFormatException e) {
      throw new NotFoundException("User not found");
    }
    return accounts.findById(id).orElseThrow(() -> new NotFoundException("User not found"));
  }

  IssuedCredentials issue(AccountEntity account) {
    TokenClaims claims =
        new TokenClaims(String.valueOf(account.getId()), account.isAdmin(), account.getUsername());
    return new IssuedCredentials(
        account, tokenService.signAccessToken(claims), tokenService.signRefreshToken(claims));
  }

  private String hash(String rawPassword) {
    return passwordEncoder.encode(rawPassword);
  }

  static String normalizeEmail(String value) {
    return value.trim().toLowerCase(Locale.ROOT);
  }
}
