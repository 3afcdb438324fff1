package com.task4ge.api.user;

import com.task4ge.api.auth.AuthPrincipal;
import com.task4ge.api.infra.ValidationException;
import com.task4ge.api.support.RecordingBlobStore;
import com.task4ge.api.user.dto.UserPictureResponse;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockMultipartFile;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class UserServiceTest {

  private final IdentityDirectory directory = mock(IdentityDirectory.class);
  private final RecordingBlobStore blobs = new RecordingBlobStore();
  private final UserService service = new UserService(directory, blobs);
  private final AuthPrincipal alice = new AuthPrincipal("auth0|alice");

  @Test
  void meDelegatesToDirectory() {
    IdentityUser profile = new IdentityUser("auth0|alice", "a@example.com", "Alice", null);
    when(directory.getUser("auth0|alice")).thenReturn(profile);

    assertThat(service.me(alice)).isEqualTo(profile);
  }

  @Test
  void pictureIsUploadedThenLinked() {
    UserPictureResponse resp = service.updatePicture(alice,
        new MockMultipartFile("image", "me.png", "image/png", new byte[]{9, 9}));

    assertThat(resp.url()).isEqualTo("https://blobs.test/blob-1");
    assertThat(blobs.objectCount()).isEqualTo(1);
    verify(directory).setUserPicture("auth0|alice", "https://blobs.test/blob-1");
  }

  @Test
  void missingPictureIsRejected() {
    assertThatThrownBy(() -> service.updatePicture(alice, new MockMultipartFile("image", new byte[0])))
        .isInstanceOf(ValidationException.class);
    assertThatThrownBy(() -> service.updatePicture(alice, null)).isInstanceOf(ValidationException.class);
    assertThat(blobs.uploadedKeys).isEmpty();
    verifyNoInteractions(directory);
  }
}
