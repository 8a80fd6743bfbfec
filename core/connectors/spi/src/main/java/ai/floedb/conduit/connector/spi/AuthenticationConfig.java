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

package ai.floedb.conduit.connector.spi;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Validated credentials for one authentication method. Secret fields are held as {@link
 * SecretValue}s; {@link #toString()} and {@link #maskedValues()} never expose them.
 */
public final class AuthenticationConfig {
  private final ConfigSchema schema;
  private final Map<String, String> plain;
  private final Map<String, SecretValue> secrets;
  private final String fingerprint;

  private AuthenticationConfig(
      ConfigSchema schema, Map<String, String> plain, Map<String, SecretValue> secrets) {
    this.schema = schema;
    this.plain = Collections.unmodifiableMap(plain);
    this.secrets = Collections.unmodifiableMap(secrets);
    this.fingerprint = computeFingerprint();
  }

  /**
   * Validates {@code values} against {@code schema} and splits them into plain and secret fields.
   * Optional fields given as blank strings are dropped.
   *
   * @throws ConfigurationException if the values do not match the schema
   */
  public static AuthenticationConfig of(ConfigSchema schema, Map<String, String> values) {
    Objects.requireNonNull(schema, "schema");
    Map<String, String> raw = values == null ? Map.of() : values;
    schema.validate(raw);

    Map<String, String> plain = new LinkedHashMap<>();
    Map<String, SecretValue> secrets = new LinkedHashMap<>();
    for (ConfigField f : schema.fields()) {
      String v = raw.get(f.name());
      if (v == null || v.isBlank()) {
        continue;
      }
      if (f.secret()) {
        secrets.put(f.name(), SecretValue.of(v));
      } else {
        plain.put(f.name(), v);
      }
    }
    return new AuthenticationConfig(schema, plain, secrets);
  }

  public ConfigSchema schema() {
    return schema;
  }

  public String schemaId() {
    return schema.id();
  }

  public Optional<String> value(String name) {
    return Optional.ofNullable(plain.get(name));
  }

  public String requireValue(String name) {
    return value(name)
        .orElseThrow(
            () -> new ConfigurationException("Missing field " + name + " in " + schema.id()));
  }

  public Optional<SecretValue> secret(String name) {
    return Optional.ofNullable(secrets.get(name));
  }

  public SecretValue requireSecret(String name) {
    return secret(name)
        .orElseThrow(
            () -> new ConfigurationException("Missing secret " + name + " in " + schema.id()));
  }

  public Map<String, String> plainValues() {
    return plain;
  }

  public Map<String, SecretValue> secretValues() {
    return secrets;
  }

  /** Every field, secrets replaced by {@link SecretValue#MASK}. Safe to log. */
  public Map<String, String> maskedValues() {
    Map<String, String> out = new LinkedHashMap<>(plain);
    secrets.keySet().forEach(k -> out.put(k, SecretValue.MASK));
    return out;
  }

  /** Every field in cleartext. Only for handing credentials to a provider or a secret store. */
  public Map<String, String> revealAll() {
    Map<String, String> out = new HashMap<>(plain);
    secrets.forEach((k, v) -> out.put(k, v.reveal()));
    return out;
  }

  /** Stable digest of the schema id and all values; changes whenever any credential changes. */
  public String fingerprint() {
    return fingerprint;
  }

  private String computeFingerprint() {
    MessageDigest digest;
    try {
      digest = MessageDigest.getInstance("SHA-256");
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 not available", e);
    }
    digest.update(schema.id().getBytes(StandardCharsets.UTF_8));
    for (var e : new TreeMap<>(revealAll()).entrySet()) {
      digest.update((byte) 0);
      digest.update(e.getKey().getBytes(StandardCharsets.UTF_8));
      digest.update((byte) '=');
      digest.update(e.getValue().getBytes(StandardCharsets.UTF_8));
    }
    StringBuilder hex = new StringBuilder();
    for (byte b : digest.digest()) {
      hex.append(String.format("%02x", b));
    }
    return hex.toString();
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof AuthenticationConfig other && fingerprint.equals(other.fingerprint);
  }

  @Override
  public int hashCode() {
    return fingerprint.hashCode();
  }

  @Override
  public String toString() {
    return "AuthenticationConfig{" + schema.id() + ", " + maskedValues() + "}";
  }
}
