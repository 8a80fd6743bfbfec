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

import ai.floedb.conduit.connector.common.AbstractServiceConnector;
import ai.floedb.conduit.connector.spi.AuthMethodSpec;
import ai.floedb.conduit.connector.spi.AuthenticationConfig;
import ai.floedb.conduit.connector.spi.AuthorizationException;
import ai.floedb.conduit.connector.spi.ConfigField;
import ai.floedb.conduit.connector.spi.ConfigSchema;
import ai.floedb.conduit.connector.spi.ConnectorContext;
import ai.floedb.conduit.connector.spi.ConnectorDescriptor;
import ai.floedb.conduit.connector.spi.ConnectorTypeSpec;
import ai.floedb.conduit.connector.spi.LocalToolException;
import ai.floedb.conduit.connector.spi.LocalToolRunner;
import ai.floedb.conduit.connector.spi.ResourceId;
import ai.floedb.conduit.connector.spi.ResourceTypeSpec;
import ai.floedb.conduit.connector.spi.SecretValue;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import org.jboss.logging.Logger;

/**
 * Docker registry connector. Authenticates with a username and password against the registry
 * named by the repository id, or Docker Hub for bare repository names. Clients are {@link
 * DockerRegistryClient}s.
 */
public final class DockerServiceConnector extends AbstractServiceConnector {
  private static final Logger LOG = Logger.getLogger(DockerServiceConnector.class);

  public static final String TYPE = "docker";
  public static final String RESOURCE_TYPE = "docker-registry";
  public static final String AUTH_PASSWORD = "password";

  public static final String USERNAME = "username";
  public static final String PASSWORD = "password";

  // position of the user name in "docker login -u <user>"
  private static final int USERNAME_ARG = 3;

  private static final List<String> AUTH_FAILURE_MARKERS =
      List.of("unauthorized", "denied", "incorrect username or password");

  public static final ConnectorTypeSpec SPEC =
      new ConnectorTypeSpec(
          TYPE,
          "Docker Service Connector",
          "Connects to Docker and OCI container registries.",
          List.of(
              new AuthMethodSpec(
                  AUTH_PASSWORD,
                  "Docker username and password",
                  "Username and password or access token for a Docker registry.",
                  ConfigSchema.of(
                      "docker-password",
                      ConfigField.secret(USERNAME, "The username"),
                      ConfigField.secret(PASSWORD, "The password or access token")))),
          List.of(
              new ResourceTypeSpec(
                  RESOURCE_TYPE,
                  "Docker/OCI container repository",
                  "A repository in Docker Hub or another registry.",
                  true,
                  false,
                  Set.of(AUTH_PASSWORD))),
          false);

  private final DockerClientFactory clientFactory;

  public DockerServiceConnector(ConnectorDescriptor descriptor, ConnectorContext context) {
    this(descriptor, context, new HttpDockerClientFactory());
  }

  public DockerServiceConnector(
      ConnectorDescriptor descriptor, ConnectorContext context, DockerClientFactory clientFactory) {
    super(SPEC, List.of(DockerResourceIds.RESOLVER), descriptor, context);
    this.clientFactory = Objects.requireNonNull(clientFactory, "clientFactory");
  }

  @Override
  protected Object openClient(
      ResourceTypeSpec resourceType, ResourceId resource, AuthenticationConfig config) {
    return login(resource, config);
  }

  @Override
  protected void checkAccess(
      ResourceTypeSpec resourceType, ResourceId resource, AuthenticationConfig config) {
    try (DockerRegistryClient ignored = login(resource, config)) {
      LOG.debugf("Credentials accepted by registry for %s", resource.canonical());
    }
  }

  @Override
  protected void configureLocal(
      ResourceTypeSpec resourceType, ResourceId resource, AuthenticationConfig config) {
    SecretValue username = config.requireSecret(USERNAME);
    String registry = resource.field(DockerResourceIds.REGISTRY).orElse(null);

    List<String> command = new ArrayList<>();
    command.add(context().settings().dockerBinary());
    command.add("login");
    command.add("-u");
    command.add(username.reveal());
    command.add("--password-stdin");
    if (registry != null) {
      command.add(registry);
    }

    LocalToolRunner.Result result;
    try {
      result = context().toolRunner().run(command, config.requireSecret(PASSWORD).reveal());
    } catch (LocalToolException e) {
      throw e.masking(USERNAME_ARG);
    }
    if (result.succeeded()) {
      return;
    }
    String stderr = result.stderr();
    String lower = stderr.toLowerCase(Locale.ROOT);
    String target = registry == null ? "Docker Hub" : registry;
    for (String marker : AUTH_FAILURE_MARKERS) {
      if (lower.contains(marker)) {
        throw new AuthorizationException(
            "Failed to authenticate the local Docker client to " + target + ": " + stderr.strip());
      }
    }
    throw new LocalToolException(command, result.exitCode(), stderr).masking(USERNAME_ARG);
  }

  private DockerRegistryClient login(ResourceId resource, AuthenticationConfig config) {
    String registry = resource.field(DockerResourceIds.REGISTRY).orElse(null);
    DockerRegistryClient client = clientFactory.fromEnvironment(context());
    try {
      client.login(config.requireSecret(USERNAME), config.requireSecret(PASSWORD), registry);
    } catch (RuntimeException e) {
      client.close();
      throw e;
    }
    return client;
  }
}
