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

import ai.floedb.conduit.connector.common.process.ProcessLocalToolRunner;
import ai.floedb.conduit.connector.spi.ConnectorContext;
import java.nio.file.Path;
import java.time.Clock;

public final class ConnectorContexts {
  private ConnectorContexts() {}

  /** Context backed by this process: its environment, home directory and configuration. */
  public static ConnectorContext system() {
    return new ConnectorContext(
        System.getenv(),
        Path.of(System.getProperty("user.home")),
        Clock.systemUTC(),
        ConnectorSettingsLoader.load(),
        new ProcessLocalToolRunner());
  }
}
