package com.example.rdsbroker.core.aws;

import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.services.rds.RdsClient;
import software.amazon.awssdk.services.secretsmanager.SecretsManagerClient;

/** Builds SDK clients honoring region, endpoint and credential overrides. */
public final class AwsClients {

  private AwsClients() {}

  public static RdsClient rds(final AwsSettings settings) {
    final var builder =
        RdsClient.builder().region(settings.region()).credentialsProvider(credentials(settings));
    settings.rdsEndpointOverride().ifPresent(builder::endpointOverride);
    return builder.build();
  }

  public static SecretsManagerClient secretsManager(final AwsSettings settings) {
    final var builder =
        SecretsManagerClient.builder()
            .region(settings.region())
            .credentialsProvider(credentials(settings));
    settings.secretsManagerEndpointOverride().ifPresent(builder::endpointOverride);
    return builder.build();
  }

  static AwsCredentialsProvider credentials(final AwsSettings settings) {
    if (settings.accessKeyId() != null) {
      return StaticCredentialsProvider.create(
          AwsBasicCredentials.create(settings.accessKeyId(), settings.secretAccessKey()));
    }
    return DefaultCredentialsProvider.builder().build();
  }
}
