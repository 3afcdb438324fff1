package com.task4ge.api.user;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class Auth0IdentityDirectoryTest {

  private MockRestServiceServer server;
  private Auth0IdentityDirectory directory;

  @BeforeEach
  void setUp() {
    RestClient.Builder builder = RestClient.builder();
    server = MockRestServiceServer.bindTo(builder).build();
    directory = new Auth0IdentityDirectory(builder, new IdentityProperties("tenant.example.com", "mgmt-token"));
  }

  @Test
  void getUserReadsProfile() {
    server.expect(requestTo("https://tenant.example.com/api/v2/users/user-1"))
        .andExpect(method(HttpMethod.GET))
        .andExpect(header("Authorization", "Bearer mgmt-token"))
        .andRespond(withSuccess("""
            {"user_id":"user-1","email":"a@example.com","name":"Alice","picture":"https://p/a.png","logins_count":3}
            """, MediaType.APPLICATION_JSON));

    IdentityUser user = directory.getUser("user-1");

    assertThat(user).isEqualTo(new IdentityUser("user-1", "a@example.com", "Alice", "https://p/a.png"));
    server.verify();
  }

  @Test
  void setUserPicturePatchesProfile() {
    server.expect(requestTo("https://tenant.example.com/api/v2/users/user-1"))
        .andExpect(method(HttpMethod.PATCH))
        .andExpect(jsonPath("$.picture").value("https://blobs.test/blob-1"))
        .andRespond(withSuccess());

    directory.setUserPicture("user-1", "https://blobs.test/blob-1");

    server.verify();
  }

  @Test
  void providerErrorsAreWrapped() {
    server.expect(requestTo("https://tenant.example.com/api/v2/users/user-1")).andRespond(withServerError());

    assertThatThrownBy(() -> directory.getUser("user-1")).isInstanceOf(IdentityDirectoryException.class);
  }
}
