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

import ai.floedb.conduit.connector.common.resolver.ShapeResourceIdResolver;
import ai.floedb.conduit.connector.common.resolver.ShapeResourceIdResolver.Parsed;
import java.util.Map;

/**
 * Docker repository ids. Accepted, in this order:
 *
 * <ul>
 *   <li>repository URI {@code [http[s]://]host[:port]/<repository-name>}: canonical id is the
 *       input without scheme, {@code registry} is {@code host[:port]}
 *   <li>Docker Hub repository name {@code <repository-name>}: canonical id is the input, no
 *       registry
 * </ul>
 */
public final class DockerResourceIds {
  public static final String REGISTRY = "registry";
  public static final String REPOSITORY = "repository";

  public static final ShapeResourceIdResolver RESOLVER =
      ShapeResourceIdResolver.builder(DockerServiceConnector.RESOURCE_TYPE)
          .shape(
              "repository-uri",
              "^(?:https?://)?([a-zA-Z0-9-]+(?:\\.[a-zA-Z0-9-]+)*(?::[0-9]+)?)/(.+)$",
              m ->
                  new Parsed(
                      m.group(1) + "/" + m.group(2),
                      Map.of(REGISTRY, m.group(1), REPOSITORY, m.group(2))))
          .shape(
              "dockerhub-repository",
              "^[a-zA-Z0-9-]+$",
              m -> new Parsed(m.group(), Map.of(REPOSITORY, m.group())))
          .hint(
              "Please provide a valid repository name or URL in one of the formats"
                  + " [https://]host[:port]/<repository-name> or <repository-name>")
          .build();

  private DockerResourceIds() {}
}
