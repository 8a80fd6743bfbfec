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

import ai.floedb.conduit.connector.spi.SecretValue;
import java.net.http.HttpRequest;

/** Client of one Docker/OCI registry, authenticated by {@link #login}. */
public interface DockerRegistryClient extends AutoCloseable {

  /**
   * Authenticates against {@code registry}, or Docker Hub when {@code registry} is {@code null}.
   *
   * @throws ai.floedb.conduit.connector.spi.AuthorizationException if the credentials are rejected
   * @throws ai.floedb.conduit.connector.spi.ProviderUnavailableException if the registry cannot be
   *     reached
   */
  void login(SecretValue username, SecretValue password, String registry);

  boolean isAuthenticated();

  /** Host (and port) of the registry this client logged in to. */
  String registry();

  /** Request to {@code path} of the registry API carrying the login credentials. */
  HttpRequest.Builder newRequest(String path);

  @Override
  void close();
}
