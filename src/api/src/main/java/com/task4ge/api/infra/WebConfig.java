package com.task4ge.api.infra;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import java.time.Clock;

@Configuration
public class WebConfig implements WebMvcConfigurer {

  @Value("${task4ge.cors.allowed-origins:}")
  private String[] allowedOrigins;

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Override
  public void addCorsMappings(CorsRegistry registry) {
    if (allowedOrigins == null || allowedOrigins.length == 0) {
      return;
    }
    registry.addMapping("/**")
        .allowedOriginPatterns(allowedOrigins)
        .allowedMethods("GET", "POST", "PUT", "DELETE", "OPTIONS")
        .allowedHeaders("*")
        .allowCredentials(true);
  }
}
