package com.task4ge.api.infra.s3;

public class BlobStoreException extends RuntimeException {

  public BlobStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
