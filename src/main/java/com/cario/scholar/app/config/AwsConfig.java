package com.cario.scholar.app.config;

import java.net.URI;
import lombok.extern.log4j.Log4j2;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.DynamoDbClientBuilder;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3ClientBuilder;

/**
 * AWS clients used by the DynamoDB progress backend and by {@code s3://} prompt locations.
 *
 * <p>Active only when {@code aws.enabled=true}. Static credentials are used when {@code
 * aws.accessKeyId} is set (local development); otherwise the default provider chain applies. An
 * {@code aws.endpoint} override points both clients at a local emulator.
 */
@Log4j2
@Configuration
@ConditionalOnProperty(prefix = "aws", name = "enabled", havingValue = "true")
public class AwsConfig {

  /** AWS region in which the clients will operate. */
  @Value("${aws.region:us-east-1}")
  private String region;

  @Value("${aws.accessKeyId:}")
  private String accessKeyId;

  @Value("${aws.secretAccessKey:}")
  private String secretAccessKey;

  @Value("${aws.endpoint:}")
  private String endpoint;

  @Bean
  AwsCredentialsProvider awsCredentialsProvider() {
    if (accessKeyId != null && !accessKeyId.isBlank()) {
      log.info("config.aws credentials=static region={}", region);
      return StaticCredentialsProvider.create(
          AwsBasicCredentials.create(accessKeyId, secretAccessKey));
    }
    log.info("config.aws credentials=default region={}", region);
    return DefaultCredentialsProvider.create();
  }

  @Bean
  public S3Client s3Client(AwsCredentialsProvider creds) {
    S3ClientBuilder builder =
        S3Client.builder().region(Region.of(region)).credentialsProvider(creds);
    if (hasEndpoint()) {
      builder.endpointOverride(URI.create(endpoint)).forcePathStyle(true);
    }
    return builder.build();
  }

  @Bean
  public DynamoDbClient dynamoDbClient(AwsCredentialsProvider creds) {
    DynamoDbClientBuilder builder =
        DynamoDbClient.builder().region(Region.of(region)).credentialsProvider(creds);
    if (hasEndpoint()) {
      builder.endpointOverride(URI.create(endpoint));
    }
    return builder.build();
  }

  private boolean hasEndpoint() {
    return endpoint != null && !endpoint.isBlank();
  }
}
