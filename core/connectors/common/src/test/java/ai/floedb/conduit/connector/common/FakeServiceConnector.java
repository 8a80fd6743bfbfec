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

import ai.floedb.conduit.connector.common.resolver.ShapeResourceIdResolver;
import ai.floedb.conduit.connector.common.resolver.ShapeResourceIdResolver.Parsed;
import ai.floedb.conduit.connector.spi.AuthMethodSpec;
import ai.floedb.conduit.connector.spi.AuthenticationConfig;
import ai.floedb.conduit.connector.spi.AuthorizationException;
import ai.floedb.conduit.connector.spi.ConfigField;
import ai.floedb.conduit.connector.spi.ConfigSchema;
import ai.floedb.conduit.connector.spi.ConnectorContext;
import ai.floedb.conduit.connector.spi.ConnectorDescriptor;
import ai.floedb.conduit.connector.spi.ConnectorTypeSpec;
import ai.floedb.conduit.connector.spi.ProviderUnavailableException;
import ai.floedb.conduit.connector.spi.ResourceId;
import ai.floedb.conduit.connector.spi.ResourceTypeSpec;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/** In-memory connector whose provider accepts every token except the ones in {@link #rejected}. */
final class FakeServiceConnector extends AbstractServiceConnector {
  static final ConfigSchema TOKEN_SCHEMA =
      ConfigSchema.of("fake-token", ConfigField.secret("token", "Access token"));
  static final ConfigSchema ADMIN_SCHEMA =
      ConfigSchema.of(
          "fake-admin",
          ConfigField.required("user", "Admin user"),
          ConfigField.secret("password", "Admin password"));

  static final ConnectorTypeSpec SPEC =
      new ConnectorTypeSpec(
          "fake",
          "Fake Connector",
          null,
          List.of(
              new AuthMethodSpec("token", null, null, TOKEN_SCHEMA),
              new AuthMethodSpec("admin", null, null, ADMIN_SCHEMA)),
          List.of(
              new ResourceTypeSpec("fake-repo", null, null, true, false, Set.of("token", "admin")),
              new ResourceTypeSpec("fake-bucket", null, null, true, true, Set.of("admin")),
              new ResourceTypeSpec("fake-account", null, null, false, false, Set.of("admin"))),
          false);

  static final ShapeResourceIdResolver REPOS =
      ShapeResourceIdResolver.builder("fake-repo")
          .shape("uri", "^repo://([a-z0-9-]+)$", m -> new Parsed(m.group(1), Map.of()))
          .shape("name", "^[a-z0-9-]+$", m -> new Parsed(m.group(), Map.of()))
          .hint("expected repo://<name> or <name>")
          .build();

  static final ShapeResourceIdResolver BUCKETS =
      ShapeResourceIdResolver.builder("fake-bucket")
          .shape(
              "uri",
              "^bucket://([a-z0-9-]+)$",
              m -> new Parsed(m.group(), Map.of("bucket", m.group(1))))
          .shape(
              "name",
              "^[a-z0-9-]+$",
              m -> new Parsed("bucket://" + m.group(), Map.of("bucket", m.group())))
          .build();

  static final class Client implements AutoCloseable {
    final String target;
    volatile boolean closed;

    Client(String target) {
      this.target = target;
    }

    @Override
    public void close() {
      closed = true;
    }
  }

  final AtomicInteger handshakes = new AtomicInteger();
  final AtomicInteger checks = new AtomicInteger();
  final List<String> configured = new CopyOnWriteArrayList<>();
  volatile Set<String> rejected = Set.of();
  volatile boolean unreachable;
  volatile List<String> discoverable = List.of();

  FakeServiceConnector(ConnectorDescriptor descriptor, ConnectorContext context) {
    super(SPEC, List.of(REPOS, BUCKETS), descriptor, context);
  }

  @Override
  protected Object openClient(
      ResourceTypeSpec resourceType, ResourceId resource, AuthenticationConfig config) {
    authenticate(config);
    handshakes.incrementAndGet();
    return new Client(resource == null ? resourceType.resourceTypeId() : resource.canonical());
  }

  @Override
  protected void checkAccess(
      ResourceTypeSpec resourceType, ResourceId resource, AuthenticationConfig config) {
    authenticate(config);
    checks.incrementAndGet();
  }

  @Override
  protected List<String> discover(ResourceTypeSpec resourceType, AuthenticationConfig config) {
    authenticate(config);
    return discoverable;
  }

  @Override
  protected void configureLocal(
      ResourceTypeSpec resourceType, ResourceId resource, AuthenticationConfig config) {
    if (!resourceType.resourceTypeId().equals("fake-repo")) {
      super.configureLocal(resourceType, resource, config);
    }
    authenticate(config);
    configured.add(resource.canonical());
  }

  private void authenticate(AuthenticationConfig config) {
    if (unreachable) {
      throw new ProviderUnavailableException("fake provider is down");
    }
    String secret =
        config.secret("token").or(() -> config.secret("password")).orElseThrow().reveal();
    if (rejected.contains(secret)) {
      throw new AuthorizationException("credentials rejected");
    }
  }
}
