package com.task4ge.api.user;

import com.task4ge.api.auth.AuthPrincipal;
import com.task4ge.api.infra.ValidationException;
import com.task4ge.api.infra.s3.BlobStore;
import com.task4ge.api.user.dto.UserPictureResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;

@Slf4j
@Service
@RequiredArgsConstructor
public class UserService {

  private final IdentityDirectory directory;
  private final BlobStore blobStore;

  public IdentityUser me(AuthPrincipal principal) {
    return directory.getUser(principal.userId());
  }

  public UserPictureResponse updatePicture(AuthPrincipal principal, MultipartFile image) {
    if (image == null || image.isEmpty()) {
      throw ValidationException.of("image", "Image is required.");
    }
    BlobStore.StoredBlob blob;
    try (InputStream in = image.getInputStream()) {
      blob = blobStore.upload(in, image.getSize(), image.getContentType());
    } catch (IOException e) {
      throw new UncheckedIOException("Could not read uploaded picture", e);
    }
    directory.setUserPicture(principal.userId(), blob.url());
    log.info("Updated profile picture of {} to blob {}", principal.userId(), blob.key());
    return new UserPictureResponse(blob.url());
  }
}
