package com.task4ge.api.infra.s3;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.ObjectCannedACL;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;

import java.io.InputStream;
import java.util.UUID;

@Slf4j
@Component
public class S3Storage implements BlobStore {

  private static final String DEFAULT_CONTENT_TYPE = "application/octet-stream";

  private final S3Client s3;
  private final String bucket;
  private final String publicUrlBase;
  private final boolean publicRead;

  public S3Storage(S3Client s3,
                   @Value("${task4ge.s3.bucket}") String bucket,
                   @Value("${task4ge.s3.public-url-base:}") String publicUrlBase,
                   @Value("${task4ge.s3.public-read:false}") boolean publicRead) {
    this.s3 = s3;
    this.bucket = bucket;
    this.publicUrlBase = publicUrlBase == null || publicUrlBase.isBlank()
        ? "https://" + bucket + ".s3.amazonaws.com"
        : stripTrailingSlash(publicUrlBase);
    this.publicRead = publicRead;
  }

  @Override
  public StoredBlob upload(InputStream content, long contentLength, String contentType) {
    String key = UUID.randomUUID().toString();
    var req = PutObjectRequest.builder()
        .bucket(bucket)
        .key(key)
        .contentType(contentType == null || contentType.isBlank() ? DEFAULT_CONTENT_TYPE : contentType);
    if (publicRead) {
      req.acl(ObjectCannedACL.PUBLIC_READ);
    }
    try {
      s3.putObject(req.build(), RequestBody.fromInputStream(content, contentLength));
    } catch (SdkException e) {
      throw new BlobStoreException("Upload to bucket " + bucket + " failed", e);
    }
    log.debug("Uploaded blob {} ({} bytes)", key, contentLength);
    return new StoredBlob(key, publicUrlBase + "/" + key);
  }

  @Override
  public void delete(String key) {
    try {
      s3.deleteObject(DeleteObjectRequest.builder().bucket(bucket).key(key).build());
    } catch (SdkException e) {
      throw new BlobStoreException("Delete of " + key + " from bucket " + bucket + " failed", e);
    }
    log.debug("Deleted blob {}", key);
  }

  private static String stripTrailingSlash(String s) {
    return s.endsWith("/") ? s.substring(0, s.length() - 1) : s;
  }
}
