package com.task4ge.api.user;

public record IdentityUser(String userId, String email, String name, String picture) {
}
