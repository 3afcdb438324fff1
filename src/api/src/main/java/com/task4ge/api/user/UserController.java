package com.task4ge.api.user;

import com.task4ge.api.auth.AuthContext;
import com.task4ge.api.user.dto.UserPictureResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

@RestController
@RequiredArgsConstructor
@RequestMapping("/user")
public class UserController {

  private final UserService userService;

  @GetMapping
  public ResponseEntity<IdentityUser> me() {
    return ResponseEntity.ok(userService.me(AuthContext.getRequired()));
  }

  @PutMapping(path = "/picture", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
  public ResponseEntity<UserPictureResponse> picture(@RequestParam(name = "image", required = false) MultipartFile image) {
    return ResponseEntity.ok(userService.updatePicture(AuthContext.getRequired(), image));
  }
}
