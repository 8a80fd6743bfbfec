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

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * A category of target a connector can reach.
 *
 * <p>{@code supportsInstances == false} means the connector always targets one implicit resource
 * and never accepts a resource id. {@code supportsDiscovery == false} means the ids reachable with
 * a set of credentials cannot be listed and have to be supplied by the caller.
 */
public record ResourceTypeSpec(
    String resourceTypeId,
    String displayName,
    String description,
    boolean supportsInstances,
    boolean supportsDiscovery,
    Set<String> allowedAuthMethods) {
  public ResourceTypeSpec {
    Objects.requireNonNull(resourceTypeId, "resourceTypeId");
    displayName = Objects.requireNonNullElse(displayName, resourceTypeId);
    description = Objects.requireNonNullElse(description, "").strip();
    allowedAuthMethods =
        allowedAuthMethods == null
            ? Set.of()
            : Collections.unmodifiableSet(new LinkedHashSet<>(allowedAuthMethods));
    if (supportsDiscovery && !supportsInstances) {
      throw new IllegalArgumentException(
          "resource type " + resourceTypeId + " cannot support discovery without instances");
    }
  }

  public boolean allows(String authMethod) {
    return allowedAuthMethods.contains(authMethod);
  }
}
