package com.responseready.apigateway.auth.service;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.responseready.apigateway.auth.lockout.AccountLockedException;
import com.responseready.apigateway.auth.lockout.AccountLockoutService;
import com.responseready.apigateway.auth.lockout.LockoutProperties;
import com.responseready.apigateway.auth.repository.AccountRepository;
import com.responseready.apigateway.common.store.InMemoryCounterStore;
import com.responseready.apigateway.common.time.MutableClock;
import com.responseready.apigateway.common.web.UnauthorizedException;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.security.crypto.password.PasswordEncoder;

class LoginServiceTest {

  private final AccountRepository accounts = mock(AccountRepository.class);
  private final PasswordEncoder encoder = mock(PasswordEncoder.class);
  private final AccountService accountService = mock(AccountService.class);
  private final TokenService tokenService = mock(TokenService.class);
  private final AuthAuditService audit = mock(AuthAuditService.class);
  private final MockHttpServletRequest request = new MockHttpServletRequest();

  private LoginService service;

  @BeforeEach
  void setUp() {
    MutableClock clock = MutableClock.startingAt("2024-02-01T09:00:00Z");
    when(encoder.encode(anyString())).thenReturn("$dummy$");
    AccountLockoutService lockout =
        new AccountLockoutService(
            new InMemoryCounterStore(clock), new LockoutProperties(3, null, null), clock);
    service =
        new LoginService(accounts, encoder, lockout, accountService, tokenService, audit, clock);
  }

  @Test
  void unknownAccountStillChecksAHash() {
    when(accounts.findByUsernameAndActiveTrue("nobody@example.com")).thenReturn(Optional.empty());

    assertThatThrownBy(() -> service.login("nobody@example.com", "pw", request))
        .isInstanceOf(UnauthorizedException.class)
        .hasMessage("Invalid username or password");
    verify(encoder).matches("pw", "$dummy$");
  }

  @Test
  void lockedAccountIsRejectedBeforeLookup() {
    when(accounts.findByUsernameAndActiveTrue("locked@example.com")).thenReturn(Optional.empty());
    assertThatThrownBy(() -> service.login("locked@example.com", "pw", request))
        .isInstanceOf(UnauthorizedException.class);
    assertThatThrownBy(() -> service.login("locked@example.com", "pw", request))
        .isInstanceOf(UnauthorizedException.class);
    assertThatThrownBy(() -> service.login("locked@example.com", "pw", request))
        .isInstanceOf(AccountLockedException.class)
        .hasMessageContaining("15 minute(s)");

    assertThatThrownBy(() -> service.login("LOCKED@example.com", "pw", request))
        .isInstanceOf(AccountLockedException.class);
    verify(audit, never()).log(any(), anyString(), any());
  }
}
