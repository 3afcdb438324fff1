package com.task4ge.api.user;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.Map;

/**
 * Identity directory backed by the Auth0 Management API v2.
 */
@Component
public class Auth0IdentityDirectory implements IdentityDirectory {

  private final RestClient rest;

  public Auth0IdentityDirectory(RestClient.Builder builder, IdentityProperties props) {
    this.rest = builder
        .baseUrl(props.baseUrl())
        .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + (props.managementToken() == null ? "" : props.managementToken()))
        .build();
  }

  @Override
  public IdentityUser getUser(String userId) {
    Auth0User user;
    try {
      user = rest.get()
          .uri("/api/v2/users/{id}", userId)
          .accept(MediaType.APPLICATION_JSON)
          .retrieve()
          .body(Auth0User.class);
    } catch (RestClientException e) {
      throw new IdentityDirectoryException("Lookup of user " + userId + " failed", e);
    }
    if (user == null) {
      throw new IdentityDirectoryException("Empty profile for user " + userId, null);
    }
    return new IdentityUser(user.userId(), user.email(), user.name(), user.picture());
  }

  @Override
  public void setUserPicture(String userId, String pictureUrl) {
    try {
      rest.patch()
          .uri("/api/v2/users/{id}", userId)
          .contentType(MediaType.APPLICATION_JSON)
          .body(Map.of("picture", pictureUrl))
          .retrieve()
          .toBodilessEntity();
    } catch (RestClientException e) {
      throw new IdentityDirectoryException("Picture update of user " + userId + " failed", e);
    }
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  record Auth0User(
      @JsonProperty("user_id") String userId,
      String email,
      String name,
      String picture
  ) {
  }
}
