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

import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable description of a connector implementation: the authentication methods it accepts and
 * the resource types it can reach. Created once when the type is registered and shared by every
 * instance of that type.
 */
public record ConnectorTypeSpec(
    String typeId,
    String displayName,
    String description,
    List<AuthMethodSpec> authMethods,
    List<ResourceTypeSpec> resourceTypes,
    boolean supportsAutoConfiguration) {

  public ConnectorTypeSpec {
    Objects.requireNonNull(typeId, "typeId");
    displayName = Objects.requireNonNullElse(displayName, typeId);
    description = Objects.requireNonNullElse(description, "").strip();
    authMethods = authMethods == null ? List.of() : List.copyOf(authMethods);
    resourceTypes = resourceTypes == null ? List.of() : List.copyOf(resourceTypes);

    Set<String> methodIds = new HashSet<>();
    for (AuthMethodSpec m : authMethods) {
      if (!methodIds.add(m.methodId())) {
        throw new ConfigurationException(
            "Duplicate auth method " + m.methodId() + " in connector type " + typeId);
      }
    }
    Set<String> resourceIds = new HashSet<>();
    for (ResourceTypeSpec r : resourceTypes) {
      if (!resourceIds.add(r.resourceTypeId())) {
        throw new ConfigurationException(
            "Duplicate resource type " + r.resourceTypeId() + " in connector type " + typeId);
      }
      for (String allowed : r.allowedAuthMethods()) {
        if (!methodIds.contains(allowed)) {
          throw new ConfigurationException(
              "Resource type "
                  + r.resourceTypeId()
                  + " allows undeclared auth method "
                  + allowed
                  + " in connector type "
                  + typeId);
        }
      }
    }
  }

  public Optional<AuthMethodSpec> authMethod(String methodId) {
    return authMethods.stream().filter(m -> m.methodId().equals(methodId)).findFirst();
  }

  public AuthMethodSpec requireAuthMethod(String methodId) {
    return authMethod(methodId)
        .orElseThrow(
            () ->
                new ConfigurationException(
                    "Connector type " + typeId + " does not support auth method " + methodId));
  }

  public Optional<ResourceTypeSpec> resourceType(String resourceTypeId) {
    return resourceTypes.stream()
        .filter(r -> r.resourceTypeId().equals(resourceTypeId))
        .findFirst();
  }

  public ResourceTypeSpec requireResourceType(String resourceTypeId) {
    return resourceType(resourceTypeId)
        .orElseThrow(
            () ->
                new ConfigurationException(
                    "Connector type "
                        + typeId
                        + " does not support resource type "
                        + resourceTypeId));
  }

  /** Resource types reachable with {@code methodId}, in declaration order. */
  public List<ResourceTypeSpec> resourceTypesFor(String methodId) {
    return resourceTypes.stream().filter(r -> r.allows(methodId)).toList();
  }

  /**
   * Checks the scope invariants of a connector instance: the auth method is declared, the config
   * was built from that method's schema and the resource type (if bound) allows the method.
   *
   * @throws ConfigurationException on any mismatch
   */
  public void checkDescriptor(ConnectorDescriptor d) {
    if (!typeId.equals(d.typeId())) {
      throw new ConfigurationException(
          "Descriptor for connector type " + d.typeId() + " used with type " + typeId);
    }
    AuthMethodSpec method = requireAuthMethod(d.authMethod());
    if (!method.schema().id().equals(d.config().schemaId())) {
      throw new ConfigurationException(
          "Auth method "
              + d.authMethod()
              + " expects configuration "
              + method.schema().id()
              + " but got "
              + d.config().schemaId());
    }
    if (d.resourceType() == null) {
      if (d.resourceId() != null) {
        throw new ConfigurationException("A resource id requires a resource type");
      }
      if (resourceTypesFor(d.authMethod()).isEmpty()) {
        throw new ConfigurationException(
            "Auth method " + d.authMethod() + " cannot reach any resource type of " + typeId);
      }
      return;
    }
    ResourceTypeSpec rt = requireResourceType(d.resourceType());
    if (!rt.allows(d.authMethod())) {
      throw new ConfigurationException(
          "Resource type "
              + rt.resourceTypeId()
              + " does not allow auth method "
              + d.authMethod());
    }
    if (d.resourceId() != null && !rt.supportsInstances()) {
      throw new ConfigurationException(
          "Resource type " + rt.resourceTypeId() + " does not accept a resource id");
    }
  }
}
