package com.responseready.apigateway.auth.security;

import com.nimbusds.jose.jwk.source.ImmutableSecret;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.security.oauth2.core.DelegatingOAuth2TokenValidator;
import org.springframework.security.oauth2.jose.jws.MacAlgorithm;
import org.springframework.security.oauth2.jwt.JwtDecoder;
import org.springframework.security.oauth2.jwt.JwtEncoder;
import org.springframework.security.oauth2.jwt.JwtIssuerValidator;
import org.springframework.security.oauth2.jwt.JwtTimestampValidator;
import org.springframework.security.oauth2.jwt.NimbusJwtDecoder;
import org.springframework.security.oauth2.jwt.NimbusJwtEncoder;

/**
 * JWT signing/verification keys and the password encoder.
 *
 * <p>Request authentication itself is done by the request pipeline, not by a servlet security
 * filter chain.
 */
@Configuration
@Slf4j
public class SecurityConfig {

  static final String DEV_SECRET = "dev-only-change-me-dev-only-change-me";

  @Bean
  public SecretKey jwtSigningKey(@Value("${security.jwt.secret}") String secret) {
    if (DEV_SECRET.equals(secret)) {
      log.warn("Using the development JWT secret. Set JWT_SECRET for any shared environment!");
    }
    return hmacKey(secret);
  }

  @Bean
  public JwtDecoder jwtDecoder(
      SecretKey jwtSigningKey,
      @Value("${security.jwt.issuer:response-ready}") String issuer,
      Clock clock) {
    return hmacDecoder(jwtSigningKey, issuer, clock);
  }

  @Bean
  public JwtEncoder jwtEncoder(SecretKey jwtSigningKey) {
    return new NimbusJwtEncoder(new ImmutableSecret<>(jwtSigningKey));
  }

  @Bean
  public PasswordEncoder passwordEncoder(
      @Value("${security.password.bcrypt-strength:12}") int strength) {
    return new BCryptPasswordEncoder(strength);
  }

  /** HS256 decoder that checks signature, issuer and expiry against {@code clock}, no skew. */
  public static JwtDecoder hmacDecoder(SecretKey key, String issuer, Clock clock) {
    NimbusJwtDecoder decoder =
        NimbusJwtDecoder.withSecretKey(key).macAlgorithm(MacAlgorithm.HS256).build();
    JwtTimestampValidator timestamps = new JwtTimestampValidator(Duration.ZERO);
    timestamps.setClock(clock);
    decoder.setJwtValidator(
        new DelegatingOAuth2TokenValidator<>(timestamps, new JwtIssuerValidator(issuer)));
    return decoder;
  }

  public static SecretKey hmacKey(String secret) {
    byte[] bytes = secret == null ? new byte[0] : secret.getBytes(StandardCharsets.UTF_8);
    if (bytes.length < 32) {
      throw new IllegalStateException(
          "security.jwt.secret is too short. Provide at least 32 bytes.");
    }
    return new SecretKeySpec(bytes, "HmacSHA256");
  }
}
