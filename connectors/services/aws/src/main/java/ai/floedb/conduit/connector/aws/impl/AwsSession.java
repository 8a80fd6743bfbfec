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

package ai.floedb.conduit.connector.aws.impl;

import java.net.URI;
import java.util.Objects;
import java.util.Optional;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.regions.Region;

/**
 * Client of the {@code aws-generic} resource type: credentials and region from which SDK clients
 * for any AWS service can be built.
 */
public record AwsSession(
    Region region, AwsCredentialsProvider credentials, Optional<URI> endpointOverride) {
  public AwsSession {
    Objects.requireNonNull(region, "region");
    Objects.requireNonNull(credentials, "credentials");
    endpointOverride = endpointOverride == null ? Optional.empty() : endpointOverride;
  }
}
