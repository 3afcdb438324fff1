package com.task4ge.api.infra.s3;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.http.urlconnection.UrlConnectionHttpClient;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3Configuration;

import java.net.URI;

@Configuration
public class S3Config {

  @Bean
  public S3Client s3Client(
      @Value("${task4ge.s3.endpoint:}") String endpoint,
      @Value("${task4ge.s3.region:us-east-1}") String region,
      @Value("${task4ge.s3.access-key:}") String accessKey,
      @Value("${task4ge.s3.secret-key:}") String secretKey,
      @Value("${task4ge.s3.path-style:false}") boolean pathStyle
  ) {
    var builder = S3Client.builder()
        .httpClient(UrlConnectionHttpClient.create())
        .region(Region.of(region))
        .serviceConfiguration(S3Configuration.builder().pathStyleAccessEnabled(pathStyle).build());

    if (endpoint != null && !endpoint.isBlank()) {
      builder.endpointOverride(URI.create(endpoint));
    }

    if (accessKey != null && !accessKey.isBlank()) {
      builder.credentialsProvider(StaticCredentialsProvider.create(AwsBasicCredentials.create(accessKey, secretKey)));
    }

    return builder.build();
  }
}
