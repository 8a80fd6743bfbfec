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

public class InvalidResourceIdException extends ConfigurationException {
  private final String resourceType;
  private final String resourceId;

  public InvalidResourceIdException(String resourceType, String resourceId, String hint) {
    super(
        "Invalid resource ID for resource type "
            + resourceType
            + ": '"
            + resourceId
            + "'"
            + (hint == null || hint.isBlank() ? "" : ". " + hint));
    this.resourceType = resourceType;
    this.resourceId = resourceId;
  }

  public String resourceType() {
    return resourceType;
  }

  public String resourceId() {
    return resourceId;
  }
}
