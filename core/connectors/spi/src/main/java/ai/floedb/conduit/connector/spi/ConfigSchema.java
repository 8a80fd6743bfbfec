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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/** Ordered set of fields an {@link AuthenticationConfig} for one auth method may carry. */
public final class ConfigSchema {
  private final String id;
  private final Map<String, ConfigField> fields;

  private ConfigSchema(String id, Map<String, ConfigField> fields) {
    this.id = id;
    this.fields = fields;
  }

  public static ConfigSchema of(String id, ConfigField... fields) {
    return of(id, List.of(fields));
  }

  public static ConfigSchema of(String id, List<ConfigField> fields) {
    Objects.requireNonNull(id, "id");
    Map<String, ConfigField> byName = new LinkedHashMap<>();
    for (ConfigField f : fields) {
      if (byName.putIfAbsent(f.name(), f) != null) {
        throw new IllegalArgumentException("duplicate field " + f.name() + " in schema " + id);
      }
    }
    return new ConfigSchema(id, Collections.unmodifiableMap(byName));
  }

  public String id() {
    return id;
  }

  public List<ConfigField> fields() {
    return new ArrayList<>(fields.values());
  }

  public Optional<ConfigField> field(String name) {
    return Optional.ofNullable(fields.get(name));
  }

  public boolean isSecret(String name) {
    ConfigField f = fields.get(name);
    return f != null && f.secret();
  }

  /**
   * Checks raw values against this schema.
   *
   * @throws ConfigurationException on unknown fields or missing/blank required fields
   */
  public void validate(Map<String, String> values) {
    List<String> problems = new ArrayList<>();
    for (String name : values.keySet()) {
      if (!fields.containsKey(name)) {
        problems.add("unknown field '" + name + "'");
      }
    }
    for (ConfigField f : fields.values()) {
      String v = values.get(f.name());
      if (f.required() && (v == null || v.isBlank())) {
        problems.add("missing required field '" + f.name() + "'");
      }
    }
    if (!problems.isEmpty()) {
      throw new ConfigurationException(
          "Invalid configuration for " + id + ": " + String.join(", ", problems));
    }
  }

  @Override
  public String toString() {
    return "ConfigSchema{" + id + ", fields=" + fields.keySet() + "}";
  }
}
