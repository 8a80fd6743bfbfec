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

package ai.floedb.conduit.connector.common;

import ai.floedb.conduit.connector.common.cache.ClientCache;
import ai.floedb.conduit.connector.common.cache.ClientCache.ClientKey;
import ai.floedb.conduit.connector.spi.AmbiguousResourceException;
import ai.floedb.conduit.connector.spi.AuthenticationConfig;
import ai.floedb.conduit.connector.spi.AuthorizationException;
import ai.floedb.conduit.connector.spi.ConfigurationException;
import ai.floedb.conduit.connector.spi.ConnectorContext;
import ai.floedb.conduit.connector.spi.ConnectorDescriptor;
import ai.floedb.conduit.connector.spi.ConnectorState;
import ai.floedb.conduit.connector.spi.ConnectorTypeSpec;
import ai.floedb.conduit.connector.spi.NotSupportedException;
import ai.floedb.conduit.connector.spi.ProviderUnavailableException;
import ai.floedb.conduit.connector.spi.ResourceId;
import ai.floedb.conduit.connector.spi.ResourceIdResolver;
import ai.floedb.conduit.connector.spi.ResourceTypeSpec;
import ai.floedb.conduit.connector.spi.ServiceConnector;
import java.time.Instant;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.jboss.logging.Logger;

/**
 * Base class for connectors. Resolves the effective resource type and id, owns the client cache and
 * leaves the provider specific work to four hooks: {@link #openClient}, {@link #checkAccess},
 * {@link #discover} and {@link #configureLocal}.
 */
public abstract class AbstractServiceConnector implements ServiceConnector {
  private static final Logger LOG = Logger.getLogger(AbstractServiceConnector.class);

  private final ConnectorTypeSpec type;
  private final Map<String, ResourceIdResolver> resolvers;
  private final ConnectorContext context;
  private final ClientCache clients;
  private final ResourceId boundResource;
  private volatile ConnectorDescriptor descriptor;

  /**
   * @throws ConfigurationException if the descriptor does not fit {@code type}
   * @throws ai.floedb.conduit.connector.spi.InvalidResourceIdException if the bound resource id is
   *     malformed
   */
  protected AbstractServiceConnector(
      ConnectorTypeSpec type,
      List<? extends ResourceIdResolver> resolvers,
      ConnectorDescriptor descriptor,
      ConnectorContext context) {
    this.type = Objects.requireNonNull(type, "type");
    this.context = Objects.requireNonNull(context, "context");
    Objects.requireNonNull(descriptor, "descriptor");

    Map<String, ResourceIdResolver> byType = new HashMap<>();
    for (ResourceIdResolver r : resolvers) {
      byType.put(r.resourceType(), r);
    }
    for (ResourceTypeSpec rt : type.resourceTypes()) {
      if (rt.supportsInstances() && !byType.containsKey(rt.resourceTypeId())) {
        throw new IllegalStateException(
            "Connector type " + type.typeId() + " has no resolver for " + rt.resourceTypeId());
      }
    }
    this.resolvers = Map.copyOf(byType);

    if (descriptor.resourceType() == null) {
      List<ResourceTypeSpec> reachable = type.resourceTypesFor(descriptor.authMethod());
      if (reachable.size() == 1) {
        descriptor = descriptor.withResourceType(reachable.get(0).resourceTypeId());
      }
    }
    type.checkDescriptor(descriptor);

    if (descriptor.resourceId() != null) {
      this.boundResource = resolver(descriptor.resourceType()).parse(descriptor.resourceId());
      descriptor =
          new ConnectorDescriptor(
              descriptor.typeId(),
              descriptor.authMethod(),
              descriptor.config(),
              descriptor.resourceType(),
              boundResource.canonical(),
              descriptor.expiresAt());
    } else {
      this.boundResource = null;
    }
    this.descriptor = descriptor;
    this.clients =
        new ClientCache(
            type.typeId(),
            context.settings().clientCacheMaxSize(),
            context.settings().clientCacheIdleTimeout());
  }

  /**
   * Performs the provider handshake and returns an authenticated client. {@code resource} is
   * {@code null} for resource types without instances.
   *
   * @throws AuthorizationException if the provider rejects the credentials
   * @throws ProviderUnavailableException if the provider cannot be reached
   */
  protected abstract Object openClient(
      ResourceTypeSpec resourceType, ResourceId resource, AuthenticationConfig config);

  /**
   * Cheapest check that {@code config} grants access to {@code resource}; must not create a client
   * that outlives the call.
   */
  protected abstract void checkAccess(
      ResourceTypeSpec resourceType, ResourceId resource, AuthenticationConfig config);

  /** Raw ids of every resource reachable with {@code config}. Only called with discovery. */
  protected List<String> discover(ResourceTypeSpec resourceType, AuthenticationConfig config) {
    throw new NotSupportedException(
        "Resource discovery is not implemented for " + resourceType.resourceTypeId());
  }

  /** Name reported by {@link #verify} for a resource type without instances. */
  protected String implicitResourceId(ResourceTypeSpec resourceType, AuthenticationConfig config) {
    return resourceType.resourceTypeId();
  }

  protected void configureLocal(
      ResourceTypeSpec resourceType, ResourceId resource, AuthenticationConfig config) {
    throw new NotSupportedException(
        "Local client configuration is not supported by the "
            + type.displayName()
            + " for resource type "
            + resourceType.resourceTypeId());
  }

  @Override
  public ConnectorTypeSpec type() {
    return type;
  }

  @Override
  public ConnectorDescriptor descriptor() {
    return descriptor;
  }

  protected ConnectorContext context() {
    return context;
  }

  protected AuthenticationConfig config() {
    return descriptor.config();
  }

  /** The parsed resource this connector is bound to, or {@code null}. */
  protected ResourceId boundResource() {
    return boundResource;
  }

  @Override
  public ConnectorState state() {
    return clients.containsFingerprint(config().fingerprint())
        ? ConnectorState.CONNECTED
        : ConnectorState.CONFIGURED;
  }

  @Override
  public Object connect(String resourceType, String resourceId) {
    ResourceTypeSpec rt = effectiveResourceType(resourceType);
    ResourceId resource = effectiveResource(rt, resourceId, true);
    checkNotExpired();
    AuthenticationConfig config = config();
    ClientKey key =
        resource == null
            ? ClientKey.implicit(rt.resourceTypeId())
            : new ClientKey(rt.resourceTypeId(), resource.canonical());
    return clients.get(
        key,
        config.fingerprint(),
        () -> {
          LOG.debugf("Opening %s client for %s", type.typeId(), key);
          return openClient(rt, resource, config);
        });
  }

  @Override
  public List<String> verify(String resourceType, String resourceId) {
    ResourceTypeSpec rt = effectiveResourceType(resourceType);
    ResourceId resource = effectiveResource(rt, resourceId, false);
    checkNotExpired();
    AuthenticationConfig config = config();
    try {
      if (!rt.supportsInstances()) {
        checkAccess(rt, null, config);
        return List.of(implicitResourceId(rt, config));
      }
      if (resource != null) {
        checkAccess(rt, resource, config);
        return List.of(resource.canonical());
      }
      if (!rt.supportsDiscovery()) {
        LOG.debugf(
            "Resource type %s cannot be discovered and no resource id was given, nothing verified",
            rt.resourceTypeId());
        return List.of();
      }
      ResourceIdResolver resolver = resolver(rt.resourceTypeId());
      return discover(rt, config).stream().map(resolver::canonicalize).distinct().toList();
    } catch (ProviderUnavailableException e) {
      LOG.warnf(
          "Could not reach %s provider, skipping verification of %s: %s",
          type.typeId(), rt.resourceTypeId(), e.getMessage());
      return List.of();
    }
  }

  @Override
  public Map<String, List<String>> verifyAll() {
    Map<String, List<String>> out = new LinkedHashMap<>();
    if (descriptor.resourceType() != null) {
      out.put(descriptor.resourceType(), verify(descriptor.resourceType(), null));
      return out;
    }
    for (ResourceTypeSpec rt : type.resourceTypesFor(descriptor.authMethod())) {
      out.put(rt.resourceTypeId(), verify(rt.resourceTypeId(), null));
    }
    return out;
  }

  @Override
  public void configureLocalClient(String resourceType, String resourceId) {
    ResourceTypeSpec rt = effectiveResourceType(resourceType);
    ResourceId resource = effectiveResource(rt, resourceId, true);
    checkNotExpired();
    configureLocal(rt, resource, config());
    LOG.infof(
        "Configured local client for %s %s",
        rt.resourceTypeId(), resource == null ? "" : resource.canonical());
  }

  @Override
  public ResourceId parseResourceId(String resourceType, String resourceId) {
    String rtId = resourceType != null ? resourceType : descriptor.resourceType();
    if (rtId == null) {
      throw new AmbiguousResourceException(
          "A resource type is required for the multi-type " + type.typeId() + " connector");
    }
    ResourceTypeSpec rt = type.requireResourceType(rtId);
    if (!rt.supportsInstances()) {
      throw new ConfigurationException(
          "Resource type " + rtId + " has no resource ids to canonicalize");
    }
    if (resourceId == null) {
      throw new ConfigurationException("A resource id is required");
    }
    return resolver(rtId).parse(resourceId);
  }

  @Override
  public void rotateCredentials(AuthenticationConfig config, Instant expiresAt) {
    Objects.requireNonNull(config, "config");
    if (!config.schemaId().equals(descriptor.config().schemaId())) {
      throw new ConfigurationException(
          "Auth method "
              + descriptor.authMethod()
              + " expects configuration "
              + descriptor.config().schemaId()
              + " but got "
              + config.schemaId());
    }
    descriptor = descriptor.withConfig(config, expiresAt);
    LOG.infof(
        "Rotated credentials of %s connector, expiring %s",
        type.typeId(), expiresAt == null ? "never" : expiresAt);
  }

  @Override
  public void disconnect() {
    long n = clients.size();
    clients.invalidateAll();
    if (n > 0) {
      LOG.debugf("Disconnected %d %s client(s)", n, type.typeId());
    }
  }

  protected ResourceIdResolver resolver(String resourceType) {
    ResourceIdResolver r = resolvers.get(resourceType);
    if (r == null) {
      throw new ConfigurationException("Resource type " + resourceType + " has no resource ids");
    }
    return r;
  }

  private ResourceTypeSpec effectiveResourceType(String requested) {
    String bound = descriptor.resourceType();
    if (requested == null) {
      if (bound == null) {
        throw new AmbiguousResourceException(
            "The "
                + type.typeId()
                + " connector can reach several resource types, one must be specified");
      }
      return type.requireResourceType(bound);
    }
    if (bound != null && !bound.equals(requested)) {
      throw new ConfigurationException(
          "The connector is configured for resource type "
              + bound
              + " and cannot be used for "
              + requested);
    }
    ResourceTypeSpec rt = type.requireResourceType(requested);
    if (!rt.allows(descriptor.authMethod())) {
      throw new ConfigurationException(
          "Resource type "
              + requested
              + " does not allow auth method "
              + descriptor.authMethod());
    }
    return rt;
  }

  private ResourceId effectiveResource(ResourceTypeSpec rt, String requested, boolean required) {
    if (!rt.supportsInstances()) {
      if (requested != null) {
        throw new ConfigurationException(
            "Resource type " + rt.resourceTypeId() + " does not accept a resource id");
      }
      return null;
    }
    if (requested != null) {
      return resolver(rt.resourceTypeId()).parse(requested);
    }
    if (boundResource != null) {
      return boundResource;
    }
    if (required) {
      throw new AmbiguousResourceException(
          "Resource type "
              + rt.resourceTypeId()
              + " supports multiple instances and no resource id was given");
    }
    return null;
  }

  private void checkNotExpired() {
    Instant expiresAt = descriptor.expiresAt();
    if (expiresAt != null && !context.clock().instant().isBefore(expiresAt)) {
      throw new AuthorizationException(
          "The credentials of the " + type.typeId() + " connector expired at " + expiresAt);
    }
  }
}
