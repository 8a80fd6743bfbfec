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

import java.util.ArrayList;
import java.util.List;

/** An external tool could not be started or exited with a non-zero status. */
public class LocalToolException extends ConnectorException {
  public static final int NOT_STARTED = -1;

  private final List<String> command;
  private final int exitCode;
  private final String stderr;

  public LocalToolException(List<String> command, int exitCode, String stderr) {
    super(describe(command, exitCode, stderr));
    this.command = List.copyOf(command);
    this.exitCode = exitCode;
    this.stderr = stderr == null ? "" : stderr;
  }

  public LocalToolException(List<String> command, String message, Throwable cause) {
    super(message + ": " + cause.getMessage(), cause);
    this.command = List.copyOf(command);
    this.exitCode = NOT_STARTED;
    this.stderr = "";
  }

  private LocalToolException(LocalToolException source, List<String> command) {
    super(source.getMessage(), source.getCause());
    this.command = List.copyOf(command);
    this.exitCode = source.exitCode;
    this.stderr = source.stderr;
    setStackTrace(source.getStackTrace());
  }

  /**
   * Returns a copy whose command has the arguments at {@code indexes} replaced by {@link
   * SecretValue#MASK}. Indexes past the end of the command are ignored.
   */
  public LocalToolException masking(int... indexes) {
    List<String> masked = new ArrayList<>(command);
    for (int i : indexes) {
      if (i >= 0 && i < masked.size()) {
        masked.set(i, SecretValue.MASK);
      }
    }
    return new LocalToolException(this, masked);
  }

  /** The command line, program first. Arguments are never logged by this class. */
  public List<String> command() {
    return command;
  }

  public String program() {
    return command.isEmpty() ? "" : command.get(0);
  }

  public int exitCode() {
    return exitCode;
  }

  public String stderr() {
    return stderr;
  }

  private static String describe(List<String> command, int exitCode, String stderr) {
    String program = command.isEmpty() ? "<none>" : command.get(0);
    String diag = stderr == null || stderr.isBlank() ? "" : ": " + stderr.strip();
    return "Local tool '" + program + "' failed with exit code " + exitCode + diag;
  }
}
