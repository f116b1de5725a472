package com.example.rdsbroker.core.aws;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

import java.net.URI;
import java.time.Duration;
import org.junit.jupiter.api.*;
import software.amazon.awssdk.regions.Region;

public class AwsSettingsTest {

  private static final String[] PROPERTIES = {
    "aws.region",
    "aws.rds.endpoint",
    "aws.sm.endpoint",
    "aws.accessKeyId",
    "aws.secretAccessKey",
    "rds.broker.tag.cache.ttl.seconds"
  };

  @AfterEach
  void clearProperties() {
    for (final var property : PROPERTIES) System.clearProperty(property);
  }

  @Test
  @DisplayName("System properties should override defaults")
  void shouldReadSystemProperties() {
    System.setProperty("aws.region", "eu-west-1");
    System.setProperty("aws.rds.endpoint", "http://localhost:4566");
    System.setProperty("aws.accessKeyId", "AKIA");
    System.setProperty("aws.secretAccessKey", "secret");
    System.setProperty("rds.broker.tag.cache.ttl.seconds", "60");

    final var settings = AwsSettings.fromEnvironment();

    assertEquals(Region.EU_WEST_1, settings.region());
    assertEquals(URI.create("http://localhost:4566"), settings.rdsEndpointOverride().orElseThrow());
    assertEquals("AKIA", settings.accessKeyId());
    assertEquals("secret", settings.secretAccessKey());
    assertEquals(Duration.ofSeconds(60), settings.tagCacheTtl());
  }

  @Test
  @DisplayName("Unparseable TTL should fall back to one week")
  void badTtlShouldFallBack() {
    System.setProperty("rds.broker.tag.cache.ttl.seconds", "soon");

    assertEquals(Duration.ofDays(7), AwsSettings.fromEnvironment().tagCacheTtl());
  }

  @Test
  @DisplayName("Access key without secret key should be ignored")
  void halfCredentialsShouldBeIgnored() {
    assumeTrue(System.getenv("AWS_SECRET_ACCESS_KEY") == null, "secret key set in environment");
    System.setProperty("aws.accessKeyId", "AKIA");

    assertNull(AwsSettings.fromEnvironment().accessKeyId());
  }

  @Test
  void constructorShouldValidate() {
    assertThrows(
        IllegalArgumentException.class,
        () -> new AwsSettings(Region.US_EAST_1, null, null, "a", null, Duration.ZERO));
    assertThrows(
        IllegalArgumentException.class,
        () -> new AwsSettings(Region.US_EAST_1, null, null, null, null, Duration.ofSeconds(-1)));
  }
}
