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

import ai.floedb.conduit.connector.spi.ConfigurationException;
import ai.floedb.conduit.connector.spi.ConnectorRecord;
import ai.floedb.conduit.connector.spi.SecretResolver;
import ai.floedb.conduit.connector.spi.SecretValue;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * JSON form of {@link ConnectorRecord}. Secret values are always written as {@link
 * SecretValue#MASK}; reading a record asks a {@link SecretResolver} for their cleartext.
 */
public final class ConnectorRecordCodec {
  private static final ObjectMapper M =
      new ObjectMapper()
          .registerModule(
              new SimpleModule().addSerializer(SecretValue.class, new MaskingSerializer()));

  private ConnectorRecordCodec() {}

  public static String write(ConnectorRecord record) {
    ObjectNode root = M.createObjectNode();
    putIfNotNull(root, "name", record.name());
    root.put("type", record.typeId());
    root.put("authMethod", record.authMethod());
    putIfNotNull(root, "resourceType", record.resourceType());
    putIfNotNull(root, "resourceId", record.resourceId());
    root.set("configuration", M.valueToTree(record.configuration()));
    root.set("secrets", M.valueToTree(record.secrets()));
    root.put("secretRef", record.secretRef());
    if (record.expiresAt() != null) {
      root.put("expiresAt", record.expiresAt().toString());
    }
    try {
      return M.writeValueAsString(root);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Failed to serialize connector record", e);
    }
  }

  /**
   * @throws ConfigurationException if the JSON is malformed or a secret cannot be resolved
   */
  public static ConnectorRecord read(String json, SecretResolver secrets) {
    JsonNode root;
    try {
      root = M.readTree(json);
    } catch (JsonProcessingException e) {
      throw new ConfigurationException("Malformed connector record", e);
    }
    if (root == null || !root.isObject()) {
      throw new ConfigurationException("Connector record must be a JSON object");
    }
    String name = text(root, "name");
    String type = require(root, "type");
    String authMethod = require(root, "authMethod");
    String secretRef = root.path("secretRef").asText("");

    Map<String, String> configuration = new LinkedHashMap<>();
    for (Iterator<Map.Entry<String, JsonNode>> it = root.path("configuration").fields();
        it.hasNext(); ) {
      var e = it.next();
      configuration.put(e.getKey(), e.getValue().asText());
    }

    Map<String, SecretValue> secretValues = new LinkedHashMap<>();
    for (Iterator<String> it = root.path("secrets").fieldNames(); it.hasNext(); ) {
      String field = it.next();
      String value =
          secrets
              .resolve(secretRef, field)
              .orElseThrow(
                  () ->
                      new ConfigurationException(
                          "Secret "
                              + field
                              + " of connector "
                              + (name == null ? type : name)
                              + " not found under reference '"
                              + secretRef
                              + "'"));
      secretValues.put(field, SecretValue.of(value));
    }

    Instant expiresAt = null;
    String expires = text(root, "expiresAt");
    if (expires != null) {
      try {
        expiresAt = Instant.parse(expires);
      } catch (DateTimeParseException e) {
        throw new ConfigurationException("Invalid expiresAt in connector record: " + expires, e);
      }
    }

    return new ConnectorRecord(
        name,
        type,
        authMethod,
        text(root, "resourceType"),
        text(root, "resourceId"),
        configuration,
        secretValues,
        secretRef,
        expiresAt);
  }

  private static void putIfNotNull(ObjectNode node, String field, String value) {
    if (value != null) {
      node.put(field, value);
    }
  }

  private static String text(JsonNode root, String field) {
    JsonNode n = root.get(field);
    return (n == null || n.isNull()) ? null : n.asText();
  }

  private static String require(JsonNode root, String field) {
    String v = text(root, field);
    if (v == null || v.isBlank()) {
      throw new ConfigurationException("Connector record is missing '" + field + "'");
    }
    return v;
  }

  static final class MaskingSerializer extends JsonSerializer<SecretValue> {
    @Override
    public void serialize(SecretValue value, JsonGenerator gen, SerializerProvider serializers)
        throws IOException {
      gen.writeString(SecretValue.MASK);
    }
  }
}
