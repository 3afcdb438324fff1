package com.task4ge.api.auth;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Bearer token validation settings.
 *
 * <p>When {@code jwksUrl} is set, tokens must be RS256-signed by one of the identity provider's
 * published keys. Otherwise {@code secret} is used as an HMAC256 key, which is meant for local
 * development and tests only.
 */
@ConfigurationProperties(prefix = "task4ge.auth")
public record AuthProperties(
    String jwksUrl,
    String issuer,
    String audience,
    String secret
) {
}
