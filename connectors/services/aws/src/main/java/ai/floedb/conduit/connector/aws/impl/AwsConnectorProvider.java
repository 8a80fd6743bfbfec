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

import static ai.floedb.conduit.connector.aws.impl.AwsServiceConnector.ACCESS_KEY_ID;
import static ai.floedb.conduit.connector.aws.impl.AwsServiceConnector.AUTH_IAM_ROLE;
import static ai.floedb.conduit.connector.aws.impl.AwsServiceConnector.AUTH_SECRET_KEY;
import static ai.floedb.conduit.connector.aws.impl.AwsServiceConnector.AUTH_STS_TOKEN;
import static ai.floedb.conduit.connector.aws.impl.AwsServiceConnector.ENDPOINT_URL;
import static ai.floedb.conduit.connector.aws.impl.AwsServiceConnector.EXTERNAL_ID;
import static ai.floedb.conduit.connector.aws.impl.AwsServiceConnector.REGION;
import static ai.floedb.conduit.connector.aws.impl.AwsServiceConnector.ROLE_ARN;
import static ai.floedb.conduit.connector.aws.impl.AwsServiceConnector.SECRET_ACCESS_KEY;
import static ai.floedb.conduit.connector.aws.impl.AwsServiceConnector.SESSION_NAME;
import static ai.floedb.conduit.connector.aws.impl.AwsServiceConnector.SESSION_TOKEN;

import ai.floedb.conduit.connector.spi.AuthMethodSpec;
import ai.floedb.conduit.connector.spi.AuthenticationConfig;
import ai.floedb.conduit.connector.spi.ConfigurationException;
import ai.floedb.conduit.connector.spi.ConnectorContext;
import ai.floedb.conduit.connector.spi.ConnectorDescriptor;
import ai.floedb.conduit.connector.spi.ConnectorProvider;
import ai.floedb.conduit.connector.spi.ConnectorTypeSpec;
import ai.floedb.conduit.connector.spi.ServiceConnector;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.jboss.logging.Logger;

public final class AwsConnectorProvider implements ConnectorProvider {
  private static final Logger LOG = Logger.getLogger(AwsConnectorProvider.class);

  private final AwsClientFactory clients;

  public AwsConnectorProvider() {
    this(new SdkAwsClientFactory());
  }

  public AwsConnectorProvider(AwsClientFactory clients) {
    this.clients = clients;
  }

  @Override
  public ConnectorTypeSpec spec() {
    return AwsServiceConnector.SPEC;
  }

  @Override
  public ServiceConnector create(ConnectorDescriptor descriptor, ConnectorContext context) {
    return new AwsServiceConnector(descriptor, context, clients);
  }

  /**
   * Picks up credentials the way the AWS CLI does: {@code AWS_ACCESS_KEY_ID} and {@code
   * AWS_SECRET_ACCESS_KEY} first, then the profile named by {@code AWS_PROFILE} (or {@code
   * default}) in the shared credentials and config files. Without {@code authMethod} the method is
   * inferred: a {@code role_arn} in the profile selects {@code iam-role}, a session token {@code
   * sts-token}.
   *
   * @throws ConfigurationException if no credentials are found or they do not fit {@code
   *     authMethod}
   */
  @Override
  public ServiceConnector autoConfigure(
      String authMethod, String resourceType, String resourceId, ConnectorContext context) {
    AwsProfileSupport profiles = AwsProfileSupport.load(context);
    String profile = AwsProfileSupport.profileName(context);

    String accessKey;
    String secretKey;
    String sessionToken;
    Instant expiresAt = null;
    String source;
    Optional<String> envKey = context.env("AWS_ACCESS_KEY_ID");
    Optional<String> envSecret = context.env("AWS_SECRET_ACCESS_KEY");
    if (envKey.isPresent() && envSecret.isPresent()) {
      accessKey = envKey.get();
      secretKey = envSecret.get();
      sessionToken = context.env("AWS_SESSION_TOKEN").orElse(null);
      expiresAt = context.env("AWS_CREDENTIAL_EXPIRATION").map(this::parseExpiration).orElse(null);
      source = "environment variables";
    } else {
      String keyProfile = profile;
      if (profiles.property(profile, ACCESS_KEY_ID).isEmpty()) {
        keyProfile = profiles.property(profile, "source_profile").orElse(profile);
      }
      accessKey = profiles.property(keyProfile, ACCESS_KEY_ID).orElse(null);
      secretKey = profiles.property(keyProfile, SECRET_ACCESS_KEY).orElse(null);
      sessionToken = profiles.property(keyProfile, SESSION_TOKEN).orElse(null);
      source = "profile " + keyProfile;
    }
    if (accessKey == null || secretKey == null) {
      throw new ConfigurationException(
          "No AWS credentials found in the environment or in profile " + profile);
    }

    Optional<String> roleArn = profiles.property(profile, "role_arn");
    String method = authMethod;
    if (method == null) {
      method =
          roleArn.isPresent()
              ? AUTH_IAM_ROLE
              : sessionToken != null ? AUTH_STS_TOKEN : AUTH_SECRET_KEY;
    }
    AuthMethodSpec spec = spec().requireAuthMethod(method);

    Map<String, String> values = new LinkedHashMap<>();
    values.put(ACCESS_KEY_ID, accessKey);
    values.put(SECRET_ACCESS_KEY, secretKey);
    switch (method) {
      case AUTH_SECRET_KEY -> {
        if (sessionToken != null) {
          throw new ConfigurationException(
              "Found temporary AWS credentials in "
                  + source
                  + ", use the "
                  + AUTH_STS_TOKEN
                  + " auth method");
        }
        expiresAt = null;
      }
      case AUTH_STS_TOKEN -> {
        if (sessionToken == null) {
          throw new ConfigurationException("No AWS session token found in " + source);
        }
        values.put(SESSION_TOKEN, sessionToken);
      }
      case AUTH_IAM_ROLE -> {
        values.put(
            ROLE_ARN,
            roleArn.orElseThrow(
                () -> new ConfigurationException("No role_arn found in profile " + profile)));
        profiles.property(profile, EXTERNAL_ID).ifPresent(v -> values.put(EXTERNAL_ID, v));
        profiles.property(profile, "role_session_name").ifPresent(v -> values.put(SESSION_NAME, v));
        if (sessionToken != null) {
          values.put(SESSION_TOKEN, sessionToken);
        }
        // assumed credentials are refreshed on every handshake
        expiresAt = null;
      }
      default -> throw new ConfigurationException("Unsupported AWS auth method " + method);
    }

    context
        .env("AWS_REGION")
        .or(() -> context.env("AWS_DEFAULT_REGION"))
        .or(() -> profiles.property(profile, REGION))
        .ifPresent(v -> values.put(REGION, v));
    context
        .env("AWS_ENDPOINT_URL")
        .or(() -> profiles.property(profile, ENDPOINT_URL))
        .ifPresent(v -> values.put(ENDPOINT_URL, v));

    LOG.debugf("Found AWS credentials in %s", source);
    AuthenticationConfig config = AuthenticationConfig.of(spec.schema(), values);
    return create(
        new ConnectorDescriptor(
            AwsServiceConnector.TYPE, method, config, resourceType, resourceId, expiresAt),
        context);
  }

  private Instant parseExpiration(String raw) {
    try {
      return Instant.parse(raw);
    } catch (DateTimeParseException e) {
      throw new ConfigurationException("Invalid AWS_CREDENTIAL_EXPIRATION " + raw, e);
    }
  }
}
