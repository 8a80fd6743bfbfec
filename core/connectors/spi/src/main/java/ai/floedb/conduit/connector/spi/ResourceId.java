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

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A caller supplied resource identifier together with its canonical form and the fields it
 * decomposes into (e.g. {@code registry} for a container repository).
 */
public record ResourceId(
    String resourceType, String raw, String canonical, Map<String, String> fields) {
  public ResourceId {
    Objects.requireNonNull(resourceType, "resourceType");
    Objects.requireNonNull(raw, "raw");
    Objects.requireNonNull(canonical, "canonical");
    fields = fields == null ? Map.of() : Map.copyOf(fields);
  }

  public Optional<String> field(String name) {
    return Optional.ofNullable(fields.get(name));
  }
}
