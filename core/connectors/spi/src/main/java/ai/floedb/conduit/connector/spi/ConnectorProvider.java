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

/**
 * Service-loadable factory for one connector type. Implementations are listed in {@code
 * META-INF/services/ai.floedb.conduit.connector.spi.ConnectorProvider}.
 */
public interface ConnectorProvider {

  ConnectorTypeSpec spec();

  default String typeId() {
    return spec().typeId();
  }

  /**
   * Builds a connector instance.
   *
   * @throws ConfigurationException if the descriptor does not fit the connector type
   * @throws InvalidResourceIdException if the bound resource id is malformed
   */
  ServiceConnector create(ConnectorDescriptor descriptor, ConnectorContext context);

  /**
   * Builds a connector from credentials found in the environment (provider config files,
   * environment variables). Only consulted when {@link
   * ConnectorTypeSpec#supportsAutoConfiguration()} is set.
   */
  default ServiceConnector autoConfigure(
      String authMethod, String resourceType, String resourceId, ConnectorContext context) {
    throw new NotSupportedException(
        "Auto-configuration is not supported by the " + spec().displayName());
  }
}
