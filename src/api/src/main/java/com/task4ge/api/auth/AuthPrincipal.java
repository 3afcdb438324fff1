package com.task4ge.api.auth;

/**
 * Identity of the caller as asserted by a verified bearer token.
 *
 * @param userId subject claim of the token; owns every task the caller creates
 */
public record AuthPrincipal(String userId) {
}
