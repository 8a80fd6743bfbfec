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

import java.util.List;
import java.util.Set;

final class TestSpecs {
  static final ConfigSchema TOKEN_SCHEMA =
      ConfigSchema.of(
          "demo-token",
          ConfigField.secret("token", "API token"),
          ConfigField.optional("endpoint", "API endpoint"));

  static final ConfigSchema KEY_SCHEMA =
      ConfigSchema.of(
          "demo-key",
          ConfigField.required("key_id", "Key id"),
          ConfigField.secret("key_secret", "Key secret"));

  static final ResourceTypeSpec PROJECT =
      new ResourceTypeSpec(
          "demo-project", "Project", null, true, true, Set.of("token", "key"));

  static final ResourceTypeSpec ACCOUNT =
      new ResourceTypeSpec("demo-account", "Account", null, false, false, Set.of("key"));

  static final ConnectorTypeSpec DEMO =
      new ConnectorTypeSpec(
          "demo",
          "Demo Connector",
          null,
          List.of(
              new AuthMethodSpec("token", "Token", null, TOKEN_SCHEMA),
              new AuthMethodSpec("key", "Key pair", null, KEY_SCHEMA)),
          List.of(PROJECT, ACCOUNT),
          false);

  private TestSpecs() {}
}
