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

import ai.floedb.conduit.connector.spi.ConnectorContext;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import software.amazon.awssdk.profiles.Profile;
import software.amazon.awssdk.profiles.ProfileFile;

/**
 * Reads the shared AWS credentials and config files of a {@link ConnectorContext}. Properties of
 * the credentials file win over the config file.
 */
final class AwsProfileSupport {
  static final String DEFAULT_PROFILE = "default";

  private final Optional<ProfileFile> credentials;
  private final Optional<ProfileFile> config;

  private AwsProfileSupport(Optional<ProfileFile> credentials, Optional<ProfileFile> config) {
    this.credentials = credentials;
    this.config = config;
  }

  static AwsProfileSupport load(ConnectorContext context) {
    Path awsDir = context.homeDirectory().resolve(".aws");
    Path credentialsPath =
        context
            .env("AWS_SHARED_CREDENTIALS_FILE")
            .map(Path::of)
            .orElse(awsDir.resolve("credentials"));
    Path configPath = context.env("AWS_CONFIG_FILE").map(Path::of).orElse(awsDir.resolve("config"));
    return new AwsProfileSupport(
        read(credentialsPath, ProfileFile.Type.CREDENTIALS),
        read(configPath, ProfileFile.Type.CONFIGURATION));
  }

  /** Profile selected by {@code AWS_PROFILE}, else {@code default}. */
  static String profileName(ConnectorContext context) {
    return context.env("AWS_PROFILE").orElse(DEFAULT_PROFILE);
  }

  Optional<String> property(String profile, String key) {
    Optional<String> v = property(credentials, profile, key);
    return v.isPresent() ? v : property(config, profile, key);
  }

  private static Optional<String> property(
      Optional<ProfileFile> file, String profile, String key) {
    return file.flatMap(f -> f.profile(profile))
        .flatMap((Profile p) -> p.property(key))
        .filter(v -> !v.isBlank());
  }

  private static Optional<ProfileFile> read(Path path, ProfileFile.Type type) {
    if (!Files.isRegularFile(path)) {
      return Optional.empty();
    }
    return Optional.of(ProfileFile.builder().type(type).content(path).build());
  }
}
