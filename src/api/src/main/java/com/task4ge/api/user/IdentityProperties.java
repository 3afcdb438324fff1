package com.task4ge.api.user;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "task4ge.identity")
public record IdentityProperties(String domain, String managementToken) {

  public String baseUrl() {
    if (domain == null || domain.isBlank()) {
      return "https://localhost";
    }
    return domain.startsWith("http://") || domain.startsWith("https://") ? domain : "https://" + domain;
  }
}
