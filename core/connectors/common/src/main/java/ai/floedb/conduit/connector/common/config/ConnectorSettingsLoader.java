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

package ai.floedb.conduit.connector.common.config;

import ai.floedb.conduit.connector.spi.ConnectorSettings;
import java.time.Duration;
import java.util.List;
import org.eclipse.microprofile.config.Config;
import org.eclipse.microprofile.config.ConfigProvider;

/** Reads {@link ConnectorSettings} from MicroProfile Config, falling back to the defaults. */
public final class ConnectorSettingsLoader {
  public static final String CACHE_MAX_SIZE = "conduit.connector.client-cache.max-size";
  public static final String CACHE_IDLE_TIMEOUT_SECONDS =
      "conduit.connector.client-cache.idle-timeout-seconds";
  public static final String DOCKER_BINARY = "conduit.docker.binary";
  public static final String DOCKER_REGISTRY_TIMEOUT_MS = "conduit.docker.registry.timeout-ms";
  public static final String DOCKER_INSECURE_REGISTRIES = "conduit.docker.insecure-registries";
  public static final String AWS_BINARY = "conduit.aws.binary";
  public static final String AWS_DEFAULT_REGION = "conduit.aws.default-region";
  public static final String AWS_LOCAL_PROFILE = "conduit.aws.local-profile";

  private ConnectorSettingsLoader() {}

  public static ConnectorSettings load() {
    return load(ConfigProvider.getConfig());
  }

  public static ConnectorSettings load(Config config) {
    ConnectorSettings d = ConnectorSettings.defaults();
    long maxSize =
        config.getOptionalValue(CACHE_MAX_SIZE, Long.class).orElse(d.clientCacheMaxSize());
    long idleSeconds =
        config
            .getOptionalValue(CACHE_IDLE_TIMEOUT_SECONDS, Long.class)
            .orElse(d.clientCacheIdleTimeout().toSeconds());
    long dockerTimeoutMs =
        config
            .getOptionalValue(DOCKER_REGISTRY_TIMEOUT_MS, Long.class)
            .orElse(d.dockerRegistryTimeout().toMillis());
    List<String> insecure =
        config
            .getOptionalValues(DOCKER_INSECURE_REGISTRIES, String.class)
            .orElse(d.dockerInsecureRegistries());

    return new ConnectorSettings(
        maxSize,
        Duration.ofSeconds(idleSeconds),
        config.getOptionalValue(DOCKER_BINARY, String.class).orElse(d.dockerBinary()),
        Duration.ofMillis(dockerTimeoutMs),
        insecure.stream().map(String::trim).filter(s -> !s.isEmpty()).toList(),
        config.getOptionalValue(AWS_BINARY, String.class).orElse(d.awsBinary()),
        config.getOptionalValue(AWS_DEFAULT_REGION, String.class).orElse(d.awsDefaultRegion()),
        config.getOptionalValue(AWS_LOCAL_PROFILE, String.class).orElse(d.awsLocalProfile()));
  }
}
