/*
 * Copyright 2026 Yellowbrick Data, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package ai.floedb.conduit.connector.aws.impl;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;

import ai.floedb.conduit.connector.spi.ConfigurationException;
import ai.floedb.conduit.connector.spi.ConnectorContext;
import ai.floedb.conduit.connector.spi.ConnectorDescriptor;
import ai.floedb.conduit.connector.spi.ConnectorRegistry;
import ai.floedb.conduit.connector.spi.ServiceConnector;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class AwsConnectorProviderTest {
  @TempDir Path home;

  private ConnectorRegistry registry;

  @BeforeEach
  void setUp() {
    registry = new ConnectorRegistry();
    registry.register(new AwsConnectorProvider(mock(AwsClientFactory.class)));
  }

  private ConnectorContext context(Map<String, String> env) {
    return new ConnectorContext(
        env,
        home,
        null,
        null,
        (command, stdin) -> {
          throw new AssertionError("unexpected local tool call");
        });
  }

  private void writeAwsFile(String name, String content) throws IOException {
    Path dir = Files.createDirectories(home.resolve(".aws"));
    Files.writeString(dir.resolve(name), content, StandardCharsets.UTF_8);
  }

  private ConnectorDescriptor autoConfigure(
      String authMethod, String resourceType, String resourceId, Map<String, String> env) {
    ServiceConnector c =
        registry.autoConfigure(
            AwsServiceConnector.TYPE, authMethod, resourceType, resourceId, context(env));
    return c.descriptor();
  }

  @Test
  void picksUpKeysFromEnvironment() {
    ConnectorDescriptor d =
        autoConfigure(
            null,
            null,
            null,
            Map.of(
                "AWS_ACCESS_KEY_ID", "AKIAENV",
                "AWS_SECRET_ACCESS_KEY", "env-secret",
                "AWS_REGION", "ap-south-1"));

    assertThat(d.authMethod()).isEqualTo(AwsServiceConnector.AUTH_SECRET_KEY);
    assertThat(d.config().requireSecret(AwsServiceConnector.ACCESS_KEY_ID).reveal())
        .isEqualTo("AKIAENV");
    assertThat(d.config().value(AwsServiceConnector.REGION)).contains("ap-south-1");
    assertThat(d.resourceType()).isNull();
    assertThat(d.expiresAt()).isNull();
  }

  @Test
  void sessionTokenInEnvironmentSelectsStsToken() {
    ConnectorDescriptor d =
        autoConfigure(
            null,
            AwsServiceConnector.S3_RESOURCE_TYPE,
            "s3://data",
            Map.of(
                "AWS_ACCESS_KEY_ID", "ASIAENV",
                "AWS_SECRET_ACCESS_KEY", "env-secret",
                "AWS_SESSION_TOKEN", "env-token",
                "AWS_CREDENTIAL_EXPIRATION", "2030-01-01T00:00:00Z"));

    assertThat(d.authMethod()).isEqualTo(AwsServiceConnector.AUTH_STS_TOKEN);
    assertThat(d.config().requireSecret(AwsServiceConnector.SESSION_TOKEN).reveal())
        .isEqualTo("env-token");
    assertThat(d.expiresAt()).isEqualTo(Instant.parse("2030-01-01T00:00:00Z"));
    assertThat(d.resourceId()).isEqualTo("s3://data");
  }

  @Test
  void requestedMethodMustFitTheCredentialsFound() {
    Map<String, String> temporary =
        Map.of(
            "AWS_ACCESS_KEY_ID", "ASIAENV",
            "AWS_SECRET_ACCESS_KEY", "env-secret",
            "AWS_SESSION_TOKEN", "env-token");
    assertThatThrownBy(
            () -> autoConfigure(AwsServiceConnector.AUTH_SECRET_KEY, null, null, temporary))
        .isInstanceOf(ConfigurationException.class)
        .hasMessageContaining(AwsServiceConnector.AUTH_STS_TOKEN);

    Map<String, String> longLived =
        Map.of("AWS_ACCESS_KEY_ID", "AKIAENV", "AWS_SECRET_ACCESS_KEY", "env-secret");
    assertThatThrownBy(
            () -> autoConfigure(AwsServiceConnector.AUTH_STS_TOKEN, null, null, longLived))
        .isInstanceOf(ConfigurationException.class);
    assertThatThrownBy(
            () -> autoConfigure(AwsServiceConnector.AUTH_IAM_ROLE, null, null, longLived))
        .isInstanceOf(ConfigurationException.class)
        .hasMessageContaining("role_arn");
  }

  @Test
  void readsNamedProfileFromSharedFiles() throws Exception {
    writeAwsFile(
        "credentials",
        "[default]\n"
            + "aws_access_key_id = AKIADEFAULT\n"
            + "aws_secret_access_key = default-secret\n"
            + "\n"
            + "[ci]\n"
            + "aws_access_key_id = AKIACI\n"
            + "aws_secret_access_key = ci-secret\n");
    writeAwsFile("config", "[profile ci]\nregion = us-west-2\n");

    ConnectorDescriptor d = autoConfigure(null, null, null, Map.of("AWS_PROFILE", "ci"));

    assertThat(d.authMethod()).isEqualTo(AwsServiceConnector.AUTH_SECRET_KEY);
    assertThat(d.config().requireSecret(AwsServiceConnector.ACCESS_KEY_ID).reveal())
        .isEqualTo("AKIACI");
    assertThat(d.config().value(AwsServiceConnector.REGION)).contains("us-west-2");
  }

  @Test
  void roleProfileSelectsIamRoleWithSourceProfileKeys() throws Exception {
    writeAwsFile(
        "credentials",
        "[base]\naws_access_key_id = AKIABASE\naws_secret_access_key = base-secret\n");
    writeAwsFile(
        "config",
        "[default]\n"
            + "role_arn = arn:aws:iam::123456789012:role/deployer\n"
            + "source_profile = base\n"
            + "external_id = ext-42\n"
            + "role_session_name = ci-run\n"
            + "region = eu-north-1\n");

    ConnectorDescriptor d = autoConfigure(null, null, null, Map.of());

    assertThat(d.authMethod()).isEqualTo(AwsServiceConnector.AUTH_IAM_ROLE);
    assertThat(d.config().value(AwsServiceConnector.ROLE_ARN))
        .contains("arn:aws:iam::123456789012:role/deployer");
    assertThat(d.config().value(AwsServiceConnector.EXTERNAL_ID)).contains("ext-42");
    assertThat(d.config().value(AwsServiceConnector.SESSION_NAME)).contains("ci-run");
    assertThat(d.config().requireSecret(AwsServiceConnector.ACCESS_KEY_ID).reveal())
        .isEqualTo("AKIABASE");
  }

  @Test
  void noCredentialsAnywhereIsAConfigurationError() {
    assertThatThrownBy(() -> autoConfigure(null, null, null, Map.of()))
        .isInstanceOf(ConfigurationException.class)
        .hasMessageContaining("No AWS credentials");
  }

  @Test
  void providerIsServiceLoaded() {
    ConnectorRegistry installed = ConnectorRegistry.installed();
    assertThat(installed.connectorType(AwsServiceConnector.TYPE).supportsAutoConfiguration())
        .isTrue();
    assertThat(installed.findConnectorTypes(AwsServiceConnector.S3_RESOURCE_TYPE, null))
        .extracting(spec -> spec.typeId())
        .containsExactly(AwsServiceConnector.TYPE);
  }
}
