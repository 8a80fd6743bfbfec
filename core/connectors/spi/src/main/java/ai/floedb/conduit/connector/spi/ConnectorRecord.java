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

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Storable form of a connector instance. Never carries live clients. Secrets are kept as {@link
 * SecretValue}s; serializers must mask them and store only {@code secretRef}, the handle under
 * which the caller's secret store keeps the cleartext.
 */
public record ConnectorRecord(
    String name,
    String typeId,
    String authMethod,
    String resourceType,
    String resourceId,
    Map<String, String> configuration,
    Map<String, SecretValue> secrets,
    String secretRef,
    Instant expiresAt) {

  public ConnectorRecord {
    Objects.requireNonNull(typeId, "typeId");
    Objects.requireNonNull(authMethod, "authMethod");
    configuration =
        configuration == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(configuration));
    secrets =
        secrets == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(secrets));
    secretRef = Objects.requireNonNullElse(secretRef, "");
  }

  /** Plain and secret values merged, secrets in cleartext. */
  public Map<String, String> values() {
    Map<String, String> out = new LinkedHashMap<>(configuration);
    secrets.forEach((k, v) -> out.put(k, v.reveal()));
    return out;
  }
}
