package com.task4ge.api.auth;

public class UnauthorizedException extends RuntimeException {
}
