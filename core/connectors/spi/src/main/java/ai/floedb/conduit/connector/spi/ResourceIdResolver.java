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

/** Parses and canonicalizes resource ids of one resource type. */
public interface ResourceIdResolver {
  String resourceType();

  /**
   * Classifies {@code raw} into one accepted shape and decomposes it. Implementations must be
   * idempotent: parsing the canonical id again yields the same canonical id.
   *
   * @throws InvalidResourceIdException when no shape matches
   */
  ResourceId parse(String raw);

  default String canonicalize(String raw) {
    return parse(raw).canonical();
  }
}
