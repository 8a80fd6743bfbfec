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
import java.util.ServiceLoader;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.jboss.logging.Logger;

/**
 * Lookup table of connector types and of named connector instances.
 *
 * <p>Types are registered during startup and never removed. Registration is serialized on a single
 * lock and publishes a fresh immutable snapshot, so lookups never block.
 */
public final class ConnectorRegistry {
  private static final Logger LOG = Logger.getLogger(ConnectorRegistry.class);

  private final Object writeLock = new Object();
  private volatile Map<String, ConnectorProvider> providers = Map.of();
  private final ConcurrentMap<String, ServiceConnector> connectors = new ConcurrentHashMap<>();

  public ConnectorRegistry() {}

  /** A registry holding every {@link ConnectorProvider} visible to the service loader. */
  public static ConnectorRegistry installed() {
    ConnectorRegistry registry = new ConnectorRegistry();
    registry.loadInstalled();
    return registry;
  }

  /** The process-wide registry, populated from the service loader on first use. */
  public static ConnectorRegistry shared() {
    return Shared.INSTANCE;
  }

  private static final class Shared {
    private static final ConnectorRegistry INSTANCE = installed();
  }

  /**
   * Registers every service-loaded provider whose type is not registered yet.
   *
   * @return number of newly registered types
   */
  public int loadInstalled() {
    int added = 0;
    for (ConnectorProvider provider : ServiceLoader.load(ConnectorProvider.class)) {
      synchronized (writeLock) {
        if (providers.containsKey(provider.typeId())) {
          LOG.debugf("Connector type %s already registered, skipping", provider.typeId());
          continue;
        }
        register(provider);
        added++;
      }
    }
    return added;
  }

  /**
   * @throws DuplicateConnectorTypeException if the type id is already registered
   */
  public void register(ConnectorProvider provider) {
    Objects.requireNonNull(provider, "provider");
    ConnectorTypeSpec spec = Objects.requireNonNull(provider.spec(), "provider.spec()");
    synchronized (writeLock) {
      if (providers.containsKey(spec.typeId())) {
        throw new DuplicateConnectorTypeException(spec.typeId());
      }
      Map<String, ConnectorProvider> next = new LinkedHashMap<>(providers);
      next.put(spec.typeId(), provider);
      providers = Collections.unmodifiableMap(next);
    }
    LOG.infof(
        "Registered connector type %s (auth methods=%s, resource types=%s)",
        spec.typeId(),
        spec.authMethods().stream().map(AuthMethodSpec::methodId).toList(),
        spec.resourceTypes().stream().map(ResourceTypeSpec::resourceTypeId).toList());
  }

  public boolean isRegistered(String typeId) {
    return providers.containsKey(typeId);
  }

  /**
   * @throws UnknownConnectorTypeException if no such type is registered
   */
  public ConnectorTypeSpec connectorType(String typeId) {
    return provider(typeId).spec();
  }

  public ConnectorProvider provider(String typeId) {
    ConnectorProvider p = providers.get(typeId);
    if (p == null) {
      throw new UnknownConnectorTypeException(typeId);
    }
    return p;
  }

  public List<ConnectorTypeSpec> connectorTypes() {
    return providers.values().stream().map(ConnectorProvider::spec).toList();
  }

  /**
   * Connector types that can reach {@code resourceType} with {@code authMethod}. Either filter may
   * be {@code null}.
   */
  public List<ConnectorTypeSpec> findConnectorTypes(String resourceType, String authMethod) {
    List<ConnectorTypeSpec> out = new ArrayList<>();
    for (ConnectorTypeSpec spec : connectorTypes()) {
      boolean match =
          spec.resourceTypes().stream()
              .anyMatch(
                  rt ->
                      (resourceType == null || rt.resourceTypeId().equals(resourceType))
                          && (authMethod == null || rt.allows(authMethod)));
      if (match) {
        out.add(spec);
      }
    }
    return out;
  }

  /**
   * Validates raw credential values against the auth method schema and builds a connector.
   *
   * @throws UnknownConnectorTypeException if the type is not registered
   * @throws ConfigurationException if the values or the scope do not fit the type
   */
  public ServiceConnector create(
      String typeId,
      String authMethod,
      Map<String, String> values,
      String resourceType,
      String resourceId,
      ConnectorContext context) {
    ConnectorProvider provider = provider(typeId);
    AuthMethodSpec method = provider.spec().requireAuthMethod(authMethod);
    AuthenticationConfig config = AuthenticationConfig.of(method.schema(), values);
    return provider.create(
        new ConnectorDescriptor(typeId, authMethod, config, resourceType, resourceId), context);
  }

  public ServiceConnector create(ConnectorDescriptor descriptor, ConnectorContext context) {
    return provider(descriptor.typeId()).create(descriptor, context);
  }

  /**
   * @throws NotSupportedException if the type does not declare auto-configuration
   */
  public ServiceConnector autoConfigure(
      String typeId,
      String authMethod,
      String resourceType,
      String resourceId,
      ConnectorContext context) {
    ConnectorProvider provider = provider(typeId);
    if (!provider.spec().supportsAutoConfiguration()) {
      throw new NotSupportedException(
          "Auto-configuration is not supported by the " + provider.spec().displayName());
    }
    ServiceConnector connector =
        provider.autoConfigure(authMethod, resourceType, resourceId, context);
    LOG.infof(
        "Auto-configured %s connector with auth method %s",
        typeId, connector.descriptor().authMethod());
    return connector;
  }

  /** Rebuilds a connector from its stored form. */
  public ServiceConnector restore(ConnectorRecord record, ConnectorContext context) {
    ConnectorProvider provider = provider(record.typeId());
    AuthMethodSpec method = provider.spec().requireAuthMethod(record.authMethod());
    AuthenticationConfig config = AuthenticationConfig.of(method.schema(), record.values());
    return provider.create(
        new ConnectorDescriptor(
            record.typeId(),
            record.authMethod(),
            config,
            record.resourceType(),
            record.resourceId(),
            record.expiresAt()),
        context);
  }

  /**
   * @throws ConfigurationException if the name is blank or already taken
   */
  public void registerConnector(String name, ServiceConnector connector) {
    Objects.requireNonNull(connector, "connector");
    if (name == null || name.isBlank()) {
      throw new ConfigurationException("Connector name must not be blank");
    }
    if (connectors.putIfAbsent(name, connector) != null) {
      throw new ConfigurationException("Connector already registered: " + name);
    }
    LOG.debugf("Registered connector %s of type %s", name, connector.type().typeId());
  }

  public ServiceConnector connector(String name) {
    ServiceConnector c = connectors.get(name);
    if (c == null) {
      throw new ConfigurationException("No connector registered under name " + name);
    }
    return c;
  }

  public Map<String, ServiceConnector> connectors() {
    return Map.copyOf(connectors);
  }

  /** Unregisters the named connector and disconnects it. */
  public boolean removeConnector(String name) {
    ServiceConnector removed = connectors.remove(name);
    if (removed == null) {
      return false;
    }
    removed.disconnect();
    return true;
  }
}
