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

import java.util.Objects;

public record ConfigField(String name, String description, boolean secret, boolean required) {
  public ConfigField {
    Objects.requireNonNull(name, "name");
    if (name.isBlank()) {
      throw new IllegalArgumentException("config field name must not be blank");
    }
    description = Objects.requireNonNullElse(description, "");
  }

  public static ConfigField required(String name, String description) {
    return new ConfigField(name, description, false, true);
  }

  public static ConfigField optional(String name, String description) {
    return new ConfigField(name, description, false, false);
  }

  public static ConfigField secret(String name, String description) {
    return new ConfigField(name, description, true, true);
  }

  public static ConfigField optionalSecret(String name, String description) {
    return new ConfigField(name, description, true, false);
  }
}
