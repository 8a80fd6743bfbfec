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

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/** Tunables shared by all connectors. */
public record ConnectorSettings(
    long clientCacheMaxSize,
    Duration clientCacheIdleTimeout,
    String dockerBinary,
    Duration dockerRegistryTimeout,
    List<String> dockerInsecureRegistries,
    String awsBinary,
    String awsDefaultRegion,
    String awsLocalProfile) {

  public ConnectorSettings {
    if (clientCacheMaxSize <= 0) {
      throw new IllegalArgumentException("clientCacheMaxSize must be positive");
    }
    Objects.requireNonNull(clientCacheIdleTimeout, "clientCacheIdleTimeout");
    Objects.requireNonNull(dockerBinary, "dockerBinary");
    Objects.requireNonNull(dockerRegistryTimeout, "dockerRegistryTimeout");
    dockerInsecureRegistries =
        dockerInsecureRegistries == null ? List.of() : List.copyOf(dockerInsecureRegistries);
    Objects.requireNonNull(awsBinary, "awsBinary");
    Objects.requireNonNull(awsDefaultRegion, "awsDefaultRegion");
    Objects.requireNonNull(awsLocalProfile, "awsLocalProfile");
  }

  public static ConnectorSettings defaults() {
    return new ConnectorSettings(
        64,
        Duration.ofMinutes(15),
        "docker",
        Duration.ofMillis(15000),
        List.of("localhost", "127.0.0.1"),
        "aws",
        "us-east-1",
        "default");
  }
}
