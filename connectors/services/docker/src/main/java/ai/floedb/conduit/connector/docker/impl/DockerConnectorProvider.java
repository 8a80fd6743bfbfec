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

package ai.floedb.conduit.connector.docker.impl;

import ai.floedb.conduit.connector.spi.ConnectorContext;
import ai.floedb.conduit.connector.spi.ConnectorDescriptor;
import ai.floedb.conduit.connector.spi.ConnectorProvider;
import ai.floedb.conduit.connector.spi.ConnectorTypeSpec;
import ai.floedb.conduit.connector.spi.ServiceConnector;

public final class DockerConnectorProvider implements ConnectorProvider {
  private final DockerClientFactory clientFactory;

  public DockerConnectorProvider() {
    this(new HttpDockerClientFactory());
  }

  public DockerConnectorProvider(DockerClientFactory clientFactory) {
    this.clientFactory = clientFactory;
  }

  @Override
  public ConnectorTypeSpec spec() {
    return DockerServiceConnector.SPEC;
  }

  @Override
  public ServiceConnector create(ConnectorDescriptor descriptor, ConnectorContext context) {
    return new DockerServiceConnector(descriptor, context, clientFactory);
  }
}
