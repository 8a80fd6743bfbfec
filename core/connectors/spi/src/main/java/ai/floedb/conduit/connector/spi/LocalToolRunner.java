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

/** Runs external command line tools on behalf of a connector. */
public interface LocalToolRunner {

  /**
   * Runs {@code command} to completion, writing {@code stdin} (may be {@code null}) to its input.
   * A non-zero exit code is reported in the result, not thrown.
   *
   * @throws LocalToolException if the program cannot be started
   */
  Result run(List<String> command, String stdin);

  record Result(int exitCode, String stdout, String stderr) {
    public Result {
      stdout = stdout == null ? "" : stdout;
      stderr = stderr == null ? "" : stderr;
    }

    public boolean succeeded() {
      return exitCode == 0;
    }
  }
}
