package com.sqs.changes.source.config;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import software.amazon.awssdk.auth.credentials.AwsCredentials;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;
import software.amazon.awssdk.services.sqs.SqsAsyncClient;
import software.amazon.awssdk.services.sqs.SqsClient;

class AwsConfigurationTest {

  private AwsConfiguration awsConfiguration;

  @BeforeEach
  void setUp() {
    awsConfiguration = new AwsConfiguration();
    ReflectionTestUtils.setField(awsConfiguration, "region", AwsConfiguration.DEFAULT_REGION);
    ReflectionTestUtils.setField(awsConfiguration, "endpointUrl", "");
    ReflectionTestUtils.setField(awsConfiguration, "accessKey", "");
    ReflectionTestUtils.setField(awsConfiguration, "secretKey", "");
  }

  @Test
  void shouldAllowReceiveAttemptLongerThanLongPoll() {
    ClientOverrideConfiguration overrides = awsConfiguration.changeSourceClientOverrides();

    assertThat(overrides.apiCallAttemptTimeout()).contains(Duration.ofSeconds(30));
    assertThat(overrides.apiCallTimeout()).contains(Duration.ofSeconds(90));
  }

  @Test
  void shouldUseDefaultChainWithoutStaticKeys() {
    assertThat(awsConfiguration.changeSourceCredentials()).isInstanceOf(DefaultCredentialsProvider.class);
  }

  @Test
  void shouldUseStaticKeysWhenBothSet() {
    ReflectionTestUtils.setField(awsConfiguration, "accessKey", "test");
    ReflectionTestUtils.setField(awsConfiguration, "secretKey", "secret");

    var provider = awsConfiguration.changeSourceCredentials();

    assertThat(provider).isInstanceOf(StaticCredentialsProvider.class);
    AwsCredentials credentials = provider.resolveCredentials();
    assertThat(credentials.accessKeyId()).isEqualTo("test");
    assertThat(credentials.secretAccessKey()).isEqualTo("secret");
  }

  @Test
  void shouldBuildClientsAgainstEndpointOverride() {
    ReflectionTestUtils.setField(awsConfiguration, "endpointUrl", "http://localhost:4566");
    ReflectionTestUtils.setField(awsConfiguration, "accessKey", "test");
    ReflectionTestUtils.setField(awsConfiguration, "secretKey", "test");
    var credentials = awsConfiguration.changeSourceCredentials();
    var overrides = awsConfiguration.changeSourceClientOverrides();

    try (SqsAsyncClient asyncClient = awsConfiguration.sqsAsyncClient(credentials, overrides);
        SqsClient syncClient = awsConfiguration.sqsClient(credentials, overrides)) {
      assertThat(asyncClient.serviceClientConfiguration().region().id()).isEqualTo("eu-central-1");
      assertThat(syncClient.serviceClientConfiguration().endpointOverride())
          .hasValueSatisfying(uri -> assertThat(uri.toString()).isEqualTo("http://localhost:4566"));
    }
  }
}
