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

package ai.floedb.conduit.connector.common.record;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ai.floedb.conduit.connector.spi.ConfigurationException;
import ai.floedb.conduit.connector.spi.ConnectorRecord;
import ai.floedb.conduit.connector.spi.SecretResolver;
import ai.floedb.conduit.connector.spi.SecretValue;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class ConnectorRecordCodecTest {
  private static final ConnectorRecord RECORD =
      new ConnectorRecord(
          "registry-prod",
          "docker",
          "password",
          "docker-registry",
          "myhost:5000/team/app",
          Map.of(),
          Map.of("username", SecretValue.of("bot"), "password", SecretValue.of("hunter2")),
          "vault/registry-prod",
          Instant.parse("2030-06-01T00:00:00Z"));

  @Test
  void writeMasksEverySecret() throws Exception {
    String json = ConnectorRecordCodec.write(RECORD);

    assertThat(json).doesNotContain("hunter2").doesNotContain("\"bot\"");
    JsonNode root = new ObjectMapper().readTree(json);
    assertThat(root.path("type").asText()).isEqualTo("docker");
    assertThat(root.path("secrets").path("password").asText()).isEqualTo(SecretValue.MASK);
    assertThat(root.path("secretRef").asText()).isEqualTo("vault/registry-prod");
    assertThat(root.path("expiresAt").asText()).isEqualTo("2030-06-01T00:00:00Z");
  }

  @Test
  void readRehydratesSecretsThroughResolver() {
    Map<String, String> vault = Map.of("username", "bot", "password", "hunter2");
    SecretResolver resolver =
        (ref, field) ->
            "vault/registry-prod".equals(ref)
                ? Optional.ofNullable(vault.get(field))
                : Optional.empty();

    ConnectorRecord read = ConnectorRecordCodec.read(ConnectorRecordCodec.write(RECORD), resolver);

    assertThat(read.values()).containsEntry("password", "hunter2").containsEntry("username", "bot");
    assertThat(read.resourceId()).isEqualTo("myhost:5000/team/app");
    assertThat(read.expiresAt()).isEqualTo(RECORD.expiresAt());
    assertThat(read.name()).isEqualTo("registry-prod");
  }

  @Test
  void unresolvableSecretIsAConfigurationError() {
    String json = ConnectorRecordCodec.write(RECORD);
    assertThatThrownBy(() -> ConnectorRecordCodec.read(json, SecretResolver.none()))
        .isInstanceOf(ConfigurationException.class)
        .hasMessageContaining("vault/registry-prod")
        .hasMessageNotContaining("hunter2");
  }

  @Test
  void rejectsMalformedRecords() {
    assertThatThrownBy(() -> ConnectorRecordCodec.read("{not json", SecretResolver.none()))
        .isInstanceOf(ConfigurationException.class);
    assertThatThrownBy(() -> ConnectorRecordCodec.read("[1,2]", SecretResolver.none()))
        .isInstanceOf(ConfigurationException.class);
    assertThatThrownBy(
            () -> ConnectorRecordCodec.read("{\"authMethod\":\"password\"}", SecretResolver.none()))
        .isInstanceOf(ConfigurationException.class)
        .hasMessageContaining("type");
    assertThatThrownBy(
            () ->
                ConnectorRecordCodec.read(
                    "{\"type\":\"docker\",\"authMethod\":\"password\",\"expiresAt\":\"soon\"}",
                    SecretResolver.none()))
        .isInstanceOf(ConfigurationException.class);
  }
}
