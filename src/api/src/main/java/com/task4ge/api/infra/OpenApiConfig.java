package com.task4ge.api.infra;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.security.SecurityRequirement;
import io.swagger.v3.oas.models.security.SecurityScheme;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

  public static final String BEARER_SCHEME = "Bearer";

  @Bean
  public OpenAPI task4geOpenApi() {
    SecurityScheme jwt = new SecurityScheme()
        .name("JWT Authentication")
        .type(SecurityScheme.Type.HTTP)
        .scheme("bearer")
        .bearerFormat("JWT")
        .in(SecurityScheme.In.HEADER)
        .description("Access token issued by the identity provider");
    return new OpenAPI()
        .info(new Info().title("Task4ge.API - v1").version("v1"))
        .components(new Components().addSecuritySchemes(BEARER_SCHEME, jwt))
        .addSecurityItem(new SecurityRequirement().addList(BEARER_SCHEME));
  }
}
