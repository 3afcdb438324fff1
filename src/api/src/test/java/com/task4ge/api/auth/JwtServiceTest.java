package com.task4ge.api.auth;

import com.auth0.jwt.JWT;
import com.auth0.jwt.algorithms.Algorithm;
import com.auth0.jwt.exceptions.JWTVerificationException;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JwtServiceTest {

  private static final String SECRET = "unit-test-secret";
  private final JwtService jwtService = new JwtService(
      new AuthProperties(null, "https://tenant.example.com/", "task4ge-api", SECRET));

  @Test
  void acceptsTokenWithMatchingIssuerAndAudience() {
    String token = JWT.create()
        .withSubject("auth0|alice")
        .withIssuer("https://tenant.example.com/")
        .withAudience("task4ge-api")
        .sign(Algorithm.HMAC256(SECRET));

    assertThat(jwtService.parsePrincipal(jwtService.verify(token))).isEqualTo(new AuthPrincipal("auth0|alice"));
  }

  @Test
  void rejectsWrongAudience() {
    String token = JWT.create()
        .withSubject("auth0|alice")
        .withIssuer("https://tenant.example.com/")
        .withAudience("someone-else")
        .sign(Algorithm.HMAC256(SECRET));

    assertThatThrownBy(() -> jwtService.verify(token)).isInstanceOf(JWTVerificationException.class);
  }

  @Test
  void rejectsExpiredToken() {
    String token = JWT.create()
        .withSubject("auth0|alice")
        .withIssuer("https://tenant.example.com/")
        .withAudience("task4ge-api")
        .withExpiresAt(Instant.now().minusSeconds(60))
        .sign(Algorithm.HMAC256(SECRET));

    assertThatThrownBy(() -> jwtService.verify(token)).isInstanceOf(JWTVerificationException.class);
  }

  @Test
  void rejectsTokenWithoutSubject() {
    String token = JWT.create()
        .withIssuer("https://tenant.example.com/")
        .withAudience("task4ge-api")
        .sign(Algorithm.HMAC256(SECRET));

    assertThatThrownBy(() -> jwtService.parsePrincipal(jwtService.verify(token)))
        .isInstanceOf(JWTVerificationException.class);
  }

  @Test
  void refusesToStartWithoutKeyMaterial() {
    assertThatThrownBy(() -> new JwtService(new AuthProperties(null, null, null, " ")))
        .isInstanceOf(IllegalStateException.class);
  }
}
