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
import java.net.http.HttpClient;

/** Talks to registries directly over the Docker Registry HTTP API V2. */
public final class HttpDockerClientFactory implements DockerClientFactory {
  @Override
  public DockerRegistryClient fromEnvironment(ConnectorContext context) {
    var settings = context.settings();
    HttpClient http =
        HttpClient.newBuilder()
            .connectTimeout(settings.dockerRegistryTimeout())
            // requests carry credentials, which must not follow a redirect to another host
            .followRedirects(HttpClient.Redirect.NEVER)
            .build();
    return new HttpDockerRegistryClient(
        http, settings.dockerRegistryTimeout(), settings.dockerInsecureRegistries());
  }
}
