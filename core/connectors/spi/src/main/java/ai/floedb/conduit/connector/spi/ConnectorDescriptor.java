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
import java.util.Objects;

/**
 * The data that defines one connector instance. {@code resourceType == null} describes a
 * multi-type connector, {@code resourceId == null} a connector not bound to one resource.
 */
public record ConnectorDescriptor(
    String typeId,
    String authMethod,
    AuthenticationConfig config,
    String resourceType,
    String resourceId,
    Instant expiresAt) {
  public ConnectorDescriptor {
    Objects.requireNonNull(typeId, "typeId");
    Objects.requireNonNull(authMethod, "authMethod");
    Objects.requireNonNull(config, "config");
    resourceType = blankToNull(resourceType);
    resourceId = blankToNull(resourceId);
  }

  public ConnectorDescriptor(
      String typeId,
      String authMethod,
      AuthenticationConfig config,
      String resourceType,
      String resourceId) {
    this(typeId, authMethod, config, resourceType, resourceId, null);
  }

  /** Replaces the credentials together with their expiration, {@code null} for none. */
  public ConnectorDescriptor withConfig(AuthenticationConfig newConfig, Instant newExpiresAt) {
    return new ConnectorDescriptor(
        typeId, authMethod, newConfig, resourceType, resourceId, newExpiresAt);
  }

  public ConnectorDescriptor withResourceType(String newResourceType) {
    return new ConnectorDescriptor(
        typeId, authMethod, config, newResourceType, resourceId, expiresAt);
  }

  private static String blankToNull(String value) {
    return (value == null || value.isBlank()) ? null : value;
  }
}
