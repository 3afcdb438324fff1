package com.task4ge.api.auth;

import com.auth0.jwk.JwkException;
import com.auth0.jwk.JwkProvider;
import com.auth0.jwk.JwkProviderBuilder;
import com.auth0.jwt.JWT;
import com.auth0.jwt.JWTVerifier;
import com.auth0.jwt.algorithms.Algorithm;
import com.auth0.jwt.exceptions.JWTVerificationException;
import com.auth0.jwt.interfaces.DecodedJWT;
import com.auth0.jwt.interfaces.RSAKeyProvider;
import com.auth0.jwt.interfaces.Verification;
import org.springframework.stereotype.Component;

import java.net.MalformedURLException;
import java.net.URL;
import java.security.interfaces.RSAPrivateKey;
import java.security.interfaces.RSAPublicKey;
import java.util.concurrent.TimeUnit;

@Component
public class JwtService {

  private final JWTVerifier verifier;

  public JwtService(AuthProperties props) {
    Verification verification = JWT.require(algorithm(props));
    if (hasText(props.issuer())) {
      verification = verification.withIssuer(props.issuer());
    }
    if (hasText(props.audience())) {
      verification = verification.withAudience(props.audience());
    }
    this.verifier = verification.build();
  }

  public DecodedJWT verify(String token) {
    return verifier.verify(token);
  }

  public AuthPrincipal parsePrincipal(DecodedJWT jwt) {
    String subject = jwt.getSubject();
    if (!hasText(subject)) {
      throw new JWTVerificationException("Token has no subject");
    }
    return new AuthPrincipal(subject);
  }

  private static Algorithm algorithm(AuthProperties props) {
    if (hasText(props.jwksUrl())) {
      JwkProvider provider;
      try {
        provider = new JwkProviderBuilder(new URL(props.jwksUrl()))
            .cached(10, 24, TimeUnit.HOURS)
            .rateLimited(10, 1, TimeUnit.MINUTES)
            .build();
      } catch (MalformedURLException e) {
        throw new IllegalStateException("Invalid task4ge.auth.jwks-url: " + props.jwksUrl(), e);
      }
      return Algorithm.RSA256(new JwksKeyProvider(provider));
    }
    if (!hasText(props.secret())) {
      throw new IllegalStateException("Either task4ge.auth.jwks-url or task4ge.auth.secret must be set");
    }
    return Algorithm.HMAC256(props.secret());
  }

  private static boolean hasText(String s) {
    return s != null && !s.isBlank();
  }

  /** Verification-only key provider backed by the identity provider's JWKS endpoint. */
  private record JwksKeyProvider(JwkProvider provider) implements RSAKeyProvider {

    @Override
    public RSAPublicKey getPublicKeyById(String keyId) {
      try {
        return (RSAPublicKey) provider.get(keyId).getPublicKey();
      } catch (JwkException e) {
        throw new IllegalStateException("No signing key for kid " + keyId, e);
      }
    }

    @Override
    public RSAPrivateKey getPrivateKey() {
      return null;
    }

    @Override
    public String getPrivateKeyId() {
      return null;
    }
  }
}
