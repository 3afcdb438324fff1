package com.task4ge.api.user;

public class IdentityDirectoryException extends RuntimeException {

  public IdentityDirectoryException(String message, Throwable cause) {
    super(message, cause);
  }
}
