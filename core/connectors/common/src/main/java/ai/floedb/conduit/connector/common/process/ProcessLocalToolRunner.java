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

package ai.floedb.conduit.connector.common.process;

import ai.floedb.conduit.connector.spi.LocalToolException;
import ai.floedb.conduit.connector.spi.LocalToolRunner;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import org.jboss.logging.Logger;

/** Runs tools with {@link ProcessBuilder}, capturing stdout and stderr separately. */
public final class ProcessLocalToolRunner implements LocalToolRunner {
  private static final Logger LOG = Logger.getLogger(ProcessLocalToolRunner.class);

  private final Map<String, String> environment;

  public ProcessLocalToolRunner() {
    this(Map.of());
  }

  /** {@code environment} entries are added to the inherited process environment. */
  public ProcessLocalToolRunner(Map<String, String> environment) {
    this.environment = Map.copyOf(environment);
  }

  @Override
  public Result run(List<String> command, String stdin) {
    if (command == null || command.isEmpty()) {
      throw new IllegalArgumentException("command must not be empty");
    }
    ProcessBuilder builder = new ProcessBuilder(command);
    builder.environment().putAll(environment);

    Process process;
    try {
      process = builder.start();
    } catch (IOException e) {
      throw new LocalToolException(command, "Failed to start " + command.get(0), e);
    }
    LOG.debugf("Started %s (pid=%d)", command.get(0), process.pid());

    CompletableFuture<String> stdout =
        CompletableFuture.supplyAsync(() -> drain(process.getInputStream()));
    CompletableFuture<String> stderr =
        CompletableFuture.supplyAsync(() -> drain(process.getErrorStream()));

    try (OutputStream in = process.getOutputStream()) {
      if (stdin != null) {
        in.write(stdin.getBytes(StandardCharsets.UTF_8));
      }
    } catch (IOException e) {
      // the exit code reports what went wrong
      LOG.debugf("Could not write stdin of %s: %s", command.get(0), e.getMessage());
    }

    try {
      int exit = process.waitFor();
      Result result = new Result(exit, stdout.get(), stderr.get());
      LOG.debugf("%s exited with %d", command.get(0), exit);
      return result;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      process.destroyForcibly();
      throw new LocalToolException(command, "Interrupted while waiting for " + command.get(0), e);
    } catch (ExecutionException e) {
      throw new LocalToolException(
          command, "Failed to read output of " + command.get(0), e.getCause());
    }
  }

  private static String drain(InputStream stream) {
    try (stream) {
      return new String(stream.readAllBytes(), StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }
}
