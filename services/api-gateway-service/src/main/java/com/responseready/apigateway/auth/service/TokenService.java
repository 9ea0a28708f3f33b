package com.responseready.apigateway.auth.service;

import com.nimbusds.jwt.JWTParser;
import jakarta.servlet.http.HttpServletRequest;
import java.text.ParseException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import java.util.Optional;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.security.oauth2.jose.jws.MacAlgorithm;
import org.springframework.security.oauth2.jwt.JwsHeader;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.jwt.JwtClaimsSet;
import org.springframework.security.oauth2.jwt.JwtDecoder;
import org.springframework.security.oauth2.jwt.JwtEncoder;
import org.springframework.security.oauth2.jwt.JwtEncoderParameters;
import org.springframework.security.oauth2.jwt.JwtException;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Issues and verifies the short-lived access token and the long-lived refresh token.
 *
 * <p>Both are stateless HS256 JWTs. Verification never throws: anything that is not a valid,
 * unexpired token of the expected kind comes back empty.
 */
@Service
@Slf4j
public class TokenService {

  static final String CLAIM_ADMIN = "adm";
  static final String CLAIM_EMAIL = "email";
  static final String CLAIM_TOKEN_USE = "token_use";
  static final String USE_ACCESS = "access";
  static final String USE_REFRESH = "refresh";

  private static final String BEARER_PREFIX = "Bearer ";

  private final JwtEncoder jwtEncoder;
  private final JwtDecoder jwtDecoder;
  private final Clock clock;
  private final String issuer;
  private final Duration accessTtl;
  private final Duration refreshTtl;

  public TokenService(
      JwtEncoder jwtEncoder,
      JwtDecoder jwtDecoder,
      Clock clock,
      @Value("${security.jwt.issuer:response-ready}") String issuer,
      @Value("${security.jwt.access-ttl:PT15M}") Duration accessTtl,
      @Value("${security.jwt.refresh-ttl:P7D}") Duration refreshTtl) {
    this.jwtEncoder = jwtEncoder;
    this.jwtDecoder = jwtDecoder;
    this.clock = clock;
    this.issuer = issuer;
    this.accessTtl = accessTtl;
    this.refreshTtl = refreshTtl;
  }

  public String signAccessToken(TokenClaims claims) {
    return sign(claims, USE_ACCESS, accessTtl);
  }

  public String signRefreshToken(TokenClaims claims) {
    return sign(claims, USE_REFRESH, refreshTtl);
  }

  public Optional<VerifiedToken> verifyToken(String token) {
    return verify(token, USE_ACCESS);
  }

  public Optional<VerifiedToken> verifyRefreshToken(String token) {
    return verify(token, USE_REFRESH);
  }

  /** Reads {@code exp} without checking the signature. Unreadable tokens count as expired. */
  public boolean isTokenExpired(String token) {
    if (!StringUtils.hasText(token)) {
      return true;
    }
    try {
      Date exp = JWTParser.parse(token).getJWTClaimsSet().getExpirationTime();
      return exp == null || exp.toInstant().isBefore(clock.instant());
    } catch (ParseException e) {
      return true;
    }
  }

  /**
   * @return the text after {@code "Bearer "} in the Authorization header, or null
   */
  public String getTokenFromRequest(HttpServletRequest request) {
    String header = request.getHeader(HttpHeaders.AUTHORIZATION);
    if (header == null || !header.startsWith(BEARER_PREFIX)) {
      return null;
    }
    return header.substring(BEARER_PREFIX.length());
  }

  private String sign(TokenClaims claims, String use, Duration ttl) {
    Instant now = clock.instant();
    JwtClaimsSet.Builder builder =
        JwtClaimsSet.builder()
            .issuer(issuer)
            .issuedAt(now)
            .expiresAt(now.plus(ttl))
            .subject(claims.userId())
            .id(UUID.randomUUID().toString())
            .claim(CLAIM_ADMIN, claims.admin())
            .claim(CLAIM_TOKEN_USE, use);
    if (claims.email() != null) {
      builder.claim(CLAIM_EMAIL, claims.email());
    }

    JwsHeader header = JwsHeader.with(MacAlgorithm.HS256).build();
    return jwtEncoder.encode(JwtEncoderParameters.from(header, builder.build())).getTokenValue();
  }

  private Optional<VerifiedToken> verify(String token, String expectedUse) {
    if (!StringUtils.hasText(token)) {
      return Optional.empty();
    }
    try {
      Jwt jwt = jwtDecoder.decode(token);
      String use = jwt.getClaimAsString(CLAIM_TOKEN_USE);
      if (!expectedUse.equals(use)) {
        log.debug("Rejected {} token where {} was expected", use, expectedUse);
        return Optional.empty();
      }
      if (!StringUtils.hasText(jwt.getSubject())) {
        return Optional.empty();
      }
      Boolean admin = jwt.getClaimAsBoolean(CLAIM_ADMIN);
      String email = jwt.getClaimAsString(CLAIM_EMAIL);
      TokenClaims claims = new TokenClaims(jwt.getSubject(), Boolean.TRUE.equals(admin), email);
      return Optional.of(new VerifiedToken(claims, jwt.getIssuedAt(), jwt.getExpiresAt()));
    } catch (JwtException | IllegalArgumentException e) {
      log.debug("Token rejected: {}", e.getMessage());
      return Optional.empty();
    }
  }
}
