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
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A configured connector instance: credentials for one auth method bound to a resource type and,
 * optionally, one resource. Hands out authenticated provider clients and checks that the
 * credentials work.
 *
 * <p>Arguments documented as optional may be {@code null}; the bound resource type or id is used
 * instead.
 */
public interface ServiceConnector extends AutoCloseable {

  ConnectorTypeSpec type();

  ConnectorDescriptor descriptor();

  ConnectorState state();

  default Optional<Instant> expiresAt() {
    return Optional.ofNullable(descriptor().expiresAt());
  }

  /** Returns an authenticated client for the bound resource. */
  default Object connect() {
    return connect(null, null);
  }

  default Object connect(String resourceId) {
    return connect(null, resourceId);
  }

  /**
   * Returns a cached client for the resource or performs the provider handshake and caches the
   * result.
   *
   * @throws AmbiguousResourceException if no resource type or id can be determined
   * @throws AuthorizationException if the provider rejects the credentials
   * @throws ProviderUnavailableException if the provider cannot be reached
   */
  Object connect(String resourceType, String resourceId);

  default <T> T connect(Class<T> clientType, String resourceType, String resourceId) {
    Object client = connect(resourceType, resourceId);
    if (!clientType.isInstance(client)) {
      throw new ConfigurationException(
          "Connector "
              + type().typeId()
              + " produced "
              + client.getClass().getName()
              + ", not "
              + clientType.getName());
    }
    return clientType.cast(client);
  }

  default List<String> verify() {
    return verify(null, null);
  }

  /**
   * Checks the credentials as cheaply as possible without caching a client.
   *
   * <p>With a resource id, returns that canonical id, or an empty list when the provider could not
   * be reached. Without one, returns every reachable id if the resource type supports discovery
   * and an empty list otherwise; an empty list therefore does not distinguish "nothing accessible"
   * from "nothing to check".
   *
   * @throws AuthorizationException if the provider rejects the credentials
   */
  List<String> verify(String resourceType, String resourceId);

  /** Runs {@link #verify(String, String)} for every resource type the auth method can reach. */
  Map<String, List<String>> verifyAll();

  /**
   * Writes the credentials into the configuration of a local tool (for example {@code docker
   * login}).
   *
   * @throws NotSupportedException if the connector has no local configuration routine
   * @throws AuthorizationException if the credentials are rejected
   * @throws LocalToolException if the tool cannot be run or fails
   */
  void configureLocalClient(String resourceType, String resourceId);

  default void configureLocalClient() {
    configureLocalClient(null, null);
  }

  ResourceId parseResourceId(String resourceType, String resourceId);

  default String canonicalResourceId(String resourceType, String resourceId) {
    return parseResourceId(resourceType, resourceId).canonical();
  }

  /**
   * Replaces the credentials with ones that do not expire. Clients created with the old
   * credentials are evicted the next time they are requested.
   */
  default void rotateCredentials(AuthenticationConfig config) {
    rotateCredentials(config, null);
  }

  /**
   * Replaces the credentials and their expiration; {@code expiresAt} may be {@code null}. The
   * previous expiration never carries over.
   */
  void rotateCredentials(AuthenticationConfig config, Instant expiresAt);

  /** Evicts and closes every cached client before returning. */
  void disconnect();

  default ConnectorRecord toRecord(String name, String secretRef) {
    ConnectorDescriptor d = descriptor();
    return new ConnectorRecord(
        name,
        d.typeId(),
        d.authMethod(),
        d.resourceType(),
        d.resourceId(),
        d.config().plainValues(),
        d.config().secretValues(),
        secretRef,
        d.expiresAt());
  }

  @Override
  default void close() {
    disconnect();
  }
}
