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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

import ai.floedb.conduit.connector.common.process.ProcessLocalToolRunner;
import ai.floedb.conduit.connector.spi.AuthorizationException;
import ai.floedb.conduit.connector.spi.ConnectorContext;
import ai.floedb.conduit.connector.spi.ConnectorRegistry;
import ai.floedb.conduit.connector.spi.ConnectorSettings;
import ai.floedb.conduit.connector.spi.ConnectorState;
import ai.floedb.conduit.connector.spi.LocalToolException;
import ai.floedb.conduit.connector.spi.LocalToolRunner;
import ai.floedb.conduit.connector.spi.NotSupportedException;
import ai.floedb.conduit.connector.spi.ProviderUnavailableException;
import ai.floedb.conduit.connector.spi.SecretValue;
import ai.floedb.conduit.connector.spi.ServiceConnector;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class DockerServiceConnectorTest {
  private static final Map<String, String> CREDS = Map.of("username", "bot", "password", "hunter2");

  private final AtomicInteger clientsCreated = new AtomicInteger();
  private final List<DockerRegistryClient> clients = new ArrayList<>();
  private volatile RuntimeException loginFailure;
  private ConnectorRegistry registry;

  private final AtomicReference<List<String>> lastCommand = new AtomicReference<>();
  private final AtomicReference<String> lastStdin = new AtomicReference<>();
  private volatile LocalToolRunner.Result toolResult = new LocalToolRunner.Result(0, "", "");

  @BeforeEach
  void setUp() {
    registry = new ConnectorRegistry();
    registry.register(new DockerConnectorProvider(this::newClient));
  }

  private synchronized DockerRegistryClient newClient(ConnectorContext ctx) {
    clientsCreated.incrementAndGet();
    DockerRegistryClient client = mock(DockerRegistryClient.class);
    doAnswer(
            inv -> {
              Thread.sleep(20);
              if (loginFailure != null) {
                throw loginFailure;
              }
              return null;
            })
        .when(client)
        .login(any(), any(), any());
    clients.add(client);
    return client;
  }

  private ConnectorContext context() {
    return new ConnectorContext(
        Map.of(),
        Path.of("/tmp"),
        null,
        null,
        (command, stdin) -> {
          lastCommand.set(command);
          lastStdin.set(stdin);
          return toolResult;
        });
  }

  private ServiceConnector connector(String resourceId) {
    return registry.create(
        DockerServiceConnector.TYPE,
        DockerServiceConnector.AUTH_PASSWORD,
        CREDS,
        DockerServiceConnector.RESOURCE_TYPE,
        resourceId,
        context());
  }

  @Test
  void privateRegistryIdEndToEnd() {
    ServiceConnector c = connector("https://myhost:5000/team/app");
    assertThat(c.descriptor().resourceId()).isEqualTo("myhost:5000/team/app");
    assertThat(c.canonicalResourceId(null, "myhost:5000/team/app"))
        .isEqualTo("myhost:5000/team/app");

    DockerRegistryClient client = (DockerRegistryClient) c.connect();

    verify(client).login(SecretValue.of("bot"), SecretValue.of("hunter2"), "myhost:5000");
    assertThat(c.state()).isEqualTo(ConnectorState.CONNECTED);
  }

  @Test
  void dockerHubIdEndToEnd() {
    ServiceConnector c = connector("my-public-repo");
    assertThat(c.canonicalResourceId(null, "my-public-repo")).isEqualTo("my-public-repo");

    DockerRegistryClient client = (DockerRegistryClient) c.connect();

    verify(client).login(any(), any(), isNull());
  }

  @Test
  void resourceTypeDefaultsToTheRegistryType() {
    ServiceConnector c =
        registry.create(
            DockerServiceConnector.TYPE,
            DockerServiceConnector.AUTH_PASSWORD,
            CREDS,
            null,
            "my-public-repo",
            context());
    assertThat(c.descriptor().resourceType()).isEqualTo(DockerServiceConnector.RESOURCE_TYPE);
  }

  @Test
  void autoConfigurationIsNotSupported() {
    assertThat(DockerServiceConnector.SPEC.supportsAutoConfiguration()).isFalse();
    assertThatThrownBy(
            () ->
                registry.autoConfigure(
                    DockerServiceConnector.TYPE, null, null, "my-public-repo", context()))
        .isInstanceOf(NotSupportedException.class);
    assertThatThrownBy(
            () ->
                new DockerConnectorProvider()
                    .autoConfigure(
                        DockerServiceConnector.AUTH_PASSWORD,
                        DockerServiceConnector.RESOURCE_TYPE,
                        null,
                        context()))
        .isInstanceOf(NotSupportedException.class);
  }

  @Test
  void concurrentConnectsShareOneHandshake() throws Exception {
    ServiceConnector c = connector("myhost:5000/team/app");
    ExecutorService pool = Executors.newFixedThreadPool(6);
    CountDownLatch start = new CountDownLatch(1);
    try {
      List<Future<Object>> futures = new ArrayList<>();
      for (int i = 0; i < 6; i++) {
        futures.add(
            pool.submit(
                () -> {
                  start.await();
                  return c.connect();
                }));
      }
      start.countDown();
      Object first = futures.get(0).get(10, TimeUnit.SECONDS);
      for (Future<Object> f : futures) {
        assertThat(f.get(10, TimeUnit.SECONDS)).isSameAs(first);
      }
    } finally {
      pool.shutdownNow();
    }
    assertThat(clientsCreated).hasValue(1);
  }

  @Test
  void rejectedCredentialsAreReportedAndNotCached() {
    ServiceConnector c = connector("myhost:5000/team/app");
    loginFailure = new AuthorizationException("unauthorized");

    assertThatThrownBy(c::connect).isInstanceOf(AuthorizationException.class);
    verify(clients.get(0)).close();
    assertThat(c.state()).isEqualTo(ConnectorState.CONFIGURED);

    loginFailure = null;
    c.connect();
    assertThat(clientsCreated).hasValue(2);
  }

  @Test
  void verifyReportsCanonicalIdAndReleasesClient() {
    ServiceConnector c = connector(null);

    assertThat(c.verify(null, "http://myhost:5000/team/app"))
        .containsExactly("myhost:5000/team/app");
    verify(clients.get(0)).close();
    assertThat(c.state()).isEqualTo(ConnectorState.CONFIGURED);

    // no discovery for registries
    assertThat(c.verify()).isEmpty();
  }

  @Test
  void verifyDistinguishesUnreachableFromRejected() {
    ServiceConnector c = connector("myhost:5000/team/app");

    loginFailure = new ProviderUnavailableException("connection refused");
    assertThat(c.verify()).isEmpty();

    loginFailure = new AuthorizationException("unauthorized");
    assertThatThrownBy(c::verify).isInstanceOf(AuthorizationException.class);
  }

  @Test
  void configureLocalClientRunsDockerLogin() {
    ServiceConnector c = connector("myhost:5000/team/app");

    c.configureLocalClient();

    assertThat(lastCommand.get())
        .containsExactly("docker", "login", "-u", "bot", "--password-stdin", "myhost:5000");
    assertThat(lastStdin.get()).isEqualTo("hunter2");
  }

  @Test
  void configureLocalClientForDockerHubOmitsRegistry() {
    connector("my-public-repo").configureLocalClient();
    assertThat(lastCommand.get())
        .containsExactly("docker", "login", "-u", "bot", "--password-stdin");
  }

  @Test
  void localLoginRejectionIsAnAuthorizationFailure() {
    toolResult =
        new LocalToolRunner.Result(1, "", "Error response from daemon: unauthorized: bad creds");
    ServiceConnector c = connector("myhost:5000/team/app");

    assertThatThrownBy(c::configureLocalClient).isInstanceOf(AuthorizationException.class);
  }

  @Test
  void localToolFailureCarriesExitCodeAndStderr() {
    toolResult = new LocalToolRunner.Result(127, "", "docker: command not found");
    ServiceConnector c = connector("myhost:5000/team/app");

    assertThatThrownBy(c::configureLocalClient)
        .isInstanceOfSatisfying(
            LocalToolException.class,
            e -> {
              assertThat(e.exitCode()).isEqualTo(127);
              assertThat(e.stderr()).contains("command not found");
              assertThat(e.command()).doesNotContain("bot", "hunter2");
              assertThat(e.program()).isEqualTo("docker");
            });
  }

  @Test
  void missingDockerBinaryDoesNotExposeUserName() {
    ConnectorSettings d = ConnectorSettings.defaults();
    ConnectorSettings settings =
        new ConnectorSettings(
            d.clientCacheMaxSize(),
            d.clientCacheIdleTimeout(),
            "/nonexistent/docker-cli",
            d.dockerRegistryTimeout(),
            d.dockerInsecureRegistries(),
            d.awsBinary(),
            d.awsDefaultRegion(),
            d.awsLocalProfile());
    ServiceConnector c =
        registry.create(
            DockerServiceConnector.TYPE,
            DockerServiceConnector.AUTH_PASSWORD,
            CREDS,
            DockerServiceConnector.RESOURCE_TYPE,
            "myhost:5000/team/app",
            new ConnectorContext(
                Map.of(), Path.of("/tmp"), null, settings, new ProcessLocalToolRunner()));

    assertThatThrownBy(c::configureLocalClient)
        .isInstanceOfSatisfying(
            LocalToolException.class,
            e -> {
              assertThat(e.exitCode()).isEqualTo(LocalToolException.NOT_STARTED);
              assertThat(e.command())
                  .containsExactly(
                      "/nonexistent/docker-cli",
                      "login",
                      "-u",
                      SecretValue.MASK,
                      "--password-stdin",
                      "myhost:5000");
              assertThat(e.getMessage()).doesNotContain("bot", "hunter2");
            });
  }

  @Test
  void disconnectClosesCachedClients() {
    ServiceConnector c = connector("myhost:5000/team/app");
    c.connect();

    c.disconnect();

    verify(clients.get(0)).close();
    assertThat(c.state()).isEqualTo(ConnectorState.CONFIGURED);
  }

  @Test
  void providerIsServiceLoaded() {
    ConnectorRegistry installed = ConnectorRegistry.installed();
    assertThat(installed.isRegistered(DockerServiceConnector.TYPE)).isTrue();
    assertThat(installed.connectorType(DockerServiceConnector.TYPE).resourceTypes())
        .extracting(rt -> rt.resourceTypeId())
        .containsExactly(DockerServiceConnector.RESOURCE_TYPE);
  }

  @Test
  void descriptorNeverPrintsSecrets() {
    ServiceConnector c = connector("my-public-repo");
    assertThat(c.descriptor().toString()).doesNotContain("hunter2").doesNotContain("=bot");
  }
}
