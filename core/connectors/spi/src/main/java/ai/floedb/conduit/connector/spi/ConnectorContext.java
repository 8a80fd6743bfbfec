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

import java.nio.file.Path;
import java.time.Clock;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Everything a connector may read from its surroundings. Connectors never consult {@link
 * System#getenv()} or system properties directly, which keeps them testable and keeps one caller's
 * environment from leaking into another's connectors.
 */
public record ConnectorContext(
    Map<String, String> environment,
    Path homeDirectory,
    Clock clock,
    ConnectorSettings settings,
    LocalToolRunner toolRunner) {

  public ConnectorContext {
    environment = environment == null ? Map.of() : Map.copyOf(environment);
    Objects.requireNonNull(homeDirectory, "homeDirectory");
    clock = clock == null ? Clock.systemUTC() : clock;
    settings = settings == null ? ConnectorSettings.defaults() : settings;
    Objects.requireNonNull(toolRunner, "toolRunner");
  }

  public Optional<String> env(String name) {
    String v = environment.get(name);
    return (v == null || v.isBlank()) ? Optional.empty() : Optional.of(v.trim());
  }

  public ConnectorContext withEnvironment(Map<String, String> newEnvironment) {
    return new ConnectorContext(newEnvironment, homeDirectory, clock, settings, toolRunner);
  }

  public ConnectorContext withToolRunner(LocalToolRunner runner) {
    return new ConnectorContext(environment, homeDirectory, clock, settings, runner);
  }
}
