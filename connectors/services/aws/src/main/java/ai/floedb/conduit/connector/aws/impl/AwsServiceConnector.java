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

import ai.floedb.conduit.connector.common.AbstractServiceConnector;
import ai.floedb.conduit.connector.spi.AuthMethodSpec;
import ai.floedb.conduit.connector.spi.AuthenticationConfig;
import ai.floedb.conduit.connector.spi.ConfigField;
import ai.floedb.conduit.connector.spi.ConfigSchema;
import ai.floedb.conduit.connector.spi.ConfigurationException;
import ai.floedb.conduit.connector.spi.ConnectorContext;
import ai.floedb.conduit.connector.spi.ConnectorDescriptor;
import ai.floedb.conduit.connector.spi.ConnectorTypeSpec;
import ai.floedb.conduit.connector.spi.LocalToolException;
import ai.floedb.conduit.connector.spi.LocalToolRunner;
import ai.floedb.conduit.connector.spi.ResourceId;
import ai.floedb.conduit.connector.spi.ResourceTypeSpec;
import ai.floedb.conduit.connector.spi.SecretValue;
import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.jboss.logging.Logger;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentials;
import software.amazon.awssdk.auth.credentials.AwsSessionCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.Bucket;
import software.amazon.awssdk.services.s3.model.HeadBucketRequest;
import software.amazon.awssdk.services.s3.model.ListBucketsRequest;
import software.amazon.awssdk.services.sts.StsClient;
import software.amazon.awssdk.services.sts.auth.StsAssumeRoleCredentialsProvider;
import software.amazon.awssdk.services.sts.model.AssumeRoleRequest;
import software.amazon.awssdk.services.sts.model.Credentials;
import software.amazon.awssdk.services.sts.model.GetCallerIdentityRequest;

/**
 * AWS connector. Reaches two resource types: {@code aws-generic}, whose client is an {@link
 * AwsSession}, and {@code s3-bucket}, whose client is an {@link S3Client} checked against one
 * bucket.
 */
public final class AwsServiceConnector extends AbstractServiceConnector {
  private static final Logger LOG = Logger.getLogger(AwsServiceConnector.class);

  public static final String TYPE = "aws";
  public static final String GENERIC_RESOURCE_TYPE = "aws-generic";
  public static final String S3_RESOURCE_TYPE = "s3-bucket";

  public static final String AUTH_SECRET_KEY = "secret-key";
  public static final String AUTH_STS_TOKEN = "sts-token";
  public static final String AUTH_IAM_ROLE = "iam-role";

  public static final String ACCESS_KEY_ID = "aws_access_key_id";
  public static final String SECRET_ACCESS_KEY = "aws_secret_access_key";
  public static final String SESSION_TOKEN = "aws_session_token";
  public static final String REGION = "region";
  public static final String ENDPOINT_URL = "endpoint_url";
  public static final String ROLE_ARN = "role_arn";
  public static final String EXTERNAL_ID = "external_id";
  public static final String SESSION_NAME = "session_name";

  static final String DEFAULT_SESSION_NAME = "conduit-assume-role";

  // position of the value in "aws configure set <key> <value>"
  private static final int VALUE_ARG = 4;

  private static final ConfigField ACCESS_KEY_FIELD =
      ConfigField.secret(ACCESS_KEY_ID, "AWS access key ID");
  private static final ConfigField SECRET_KEY_FIELD =
      ConfigField.secret(SECRET_ACCESS_KEY, "AWS secret access key");
  private static final ConfigField REGION_FIELD =
      ConfigField.optional(REGION, "AWS region, defaults to the configured default region");
  private static final ConfigField ENDPOINT_FIELD =
      ConfigField.optional(ENDPOINT_URL, "Custom endpoint, e.g. for S3 compatible stores");

  public static final ConnectorTypeSpec SPEC =
      new ConnectorTypeSpec(
          TYPE,
          "AWS Service Connector",
          "Connects to AWS with long-lived keys, temporary STS credentials or an assumed role.",
          List.of(
              new AuthMethodSpec(
                  AUTH_SECRET_KEY,
                  "AWS secret key",
                  "Long-lived access key ID and secret access key.",
                  ConfigSchema.of(
                      "aws-secret-key",
                      ACCESS_KEY_FIELD,
                      SECRET_KEY_FIELD,
                      REGION_FIELD,
                      ENDPOINT_FIELD)),
              new AuthMethodSpec(
                  AUTH_STS_TOKEN,
                  "AWS STS token",
                  "Temporary credentials issued by STS.",
                  ConfigSchema.of(
                      "aws-sts-token",
                      ACCESS_KEY_FIELD,
                      SECRET_KEY_FIELD,
                      ConfigField.secret(SESSION_TOKEN, "AWS session token"),
                      REGION_FIELD,
                      ENDPOINT_FIELD)),
              new AuthMethodSpec(
                  AUTH_IAM_ROLE,
                  "AWS IAM role",
                  "Access key pair used to assume an IAM role for every session.",
                  ConfigSchema.of(
                      "aws-iam-role",
                      ACCESS_KEY_FIELD,
                      SECRET_KEY_FIELD,
                      ConfigField.optionalSecret(SESSION_TOKEN, "Session token of the key pair"),
                      ConfigField.required(ROLE_ARN, "ARN of the role to assume"),
                      ConfigField.optional(EXTERNAL_ID, "External ID required by the role"),
                      ConfigField.optional(SESSION_NAME, "Role session name"),
                      REGION_FIELD,
                      ENDPOINT_FIELD))),
          List.of(
              new ResourceTypeSpec(
                  GENERIC_RESOURCE_TYPE,
                  "Generic AWS resource",
                  "An authenticated session for any AWS service in one region.",
                  false,
                  false,
                  Set.of(AUTH_SECRET_KEY, AUTH_STS_TOKEN, AUTH_IAM_ROLE)),
              new ResourceTypeSpec(
                  S3_RESOURCE_TYPE,
                  "AWS S3 bucket",
                  "An S3 bucket.",
                  true,
                  true,
                  Set.of(AUTH_SECRET_KEY, AUTH_STS_TOKEN, AUTH_IAM_ROLE))),
          true);

  private final AwsClientFactory clients;
  private final Object roleLock = new Object();
  private AssumedRole assumedRole;

  public AwsServiceConnector(ConnectorDescriptor descriptor, ConnectorContext context) {
    this(descriptor, context, new SdkAwsClientFactory());
  }

  public AwsServiceConnector(
      ConnectorDescriptor descriptor, ConnectorContext context, AwsClientFactory clients) {
    super(SPEC, List.of(AwsResourceIds.S3_RESOLVER), descriptor, context);
    this.clients = Objects.requireNonNull(clients, "clients");
  }

  @Override
  protected Object openClient(
      ResourceTypeSpec resourceType, ResourceId resource, AuthenticationConfig config) {
    AwsSession session =
        config.value(ROLE_ARN).isPresent() ? roleSession(config) : baseSession(config);
    if (resource == null) {
      callerIdentity(session);
      return session;
    }
    S3Client s3 = clients.s3(session);
    try {
      headBucket(s3, resource);
    } catch (RuntimeException e) {
      s3.close();
      throw e;
    }
    return s3;
  }

  @Override
  protected void checkAccess(
      ResourceTypeSpec resourceType, ResourceId resource, AuthenticationConfig config) {
    AwsSession session = session(config);
    if (resource == null) {
      callerIdentity(session);
      return;
    }
    try (S3Client s3 = clients.s3(session)) {
      headBucket(s3, resource);
    }
  }

  @Override
  protected List<String> discover(ResourceTypeSpec resourceType, AuthenticationConfig config) {
    try (S3Client s3 = clients.s3(session(config))) {
      return s3.listBuckets(ListBucketsRequest.builder().build()).buckets().stream()
          .map(Bucket::name)
          .toList();
    } catch (SdkException e) {
      throw AwsErrors.translate("Listing S3 buckets", e);
    }
  }

  @Override
  protected String implicitResourceId(ResourceTypeSpec resourceType, AuthenticationConfig config) {
    return region(config).id();
  }

  /** Writes the session credentials into a profile of the local {@code aws} CLI. */
  @Override
  protected void configureLocal(
      ResourceTypeSpec resourceType, ResourceId resource, AuthenticationConfig config) {
    AwsSession session = session(config);
    AwsCredentials creds = session.credentials().resolveCredentials();
    String profile = context().settings().awsLocalProfile();

    setProfileValue(profile, ACCESS_KEY_ID, creds.accessKeyId(), true);
    setProfileValue(profile, SECRET_ACCESS_KEY, creds.secretAccessKey(), true);
    if (creds instanceof AwsSessionCredentials sc) {
      setProfileValue(profile, SESSION_TOKEN, sc.sessionToken(), true);
    }
    setProfileValue(profile, "region", session.region().id(), false);
    if (session.endpointOverride().isPresent()) {
      setProfileValue(profile, ENDPOINT_URL, session.endpointOverride().get().toString(), false);
    }
    LOG.infof("Wrote AWS credentials to local CLI profile %s", profile);
  }

  /** Closes cached clients and the STS client that refreshes assumed role credentials. */
  @Override
  public void disconnect() {
    super.disconnect();
    synchronized (roleLock) {
      if (assumedRole != null) {
        assumedRole.close();
        assumedRole = null;
      }
    }
  }

  /**
   * Session for a single call. With a role the credentials are assumed once and are not refreshed,
   * so the session must not be cached.
   */
  AwsSession session(AuthenticationConfig config) {
    AwsSession session = baseSession(config);
    if (config.value(ROLE_ARN).isPresent()) {
      return assumeRole(session, config);
    }
    return session;
  }

  /**
   * Session whose role credentials are refreshed by STS before they expire. Shared by every client
   * opened with {@code config}; replaced once the credentials are rotated.
   */
  AwsSession roleSession(AuthenticationConfig config) {
    String fingerprint = config.fingerprint();
    synchronized (roleLock) {
      if (assumedRole != null && assumedRole.fingerprint().equals(fingerprint)) {
        return assumedRole.session();
      }
      if (assumedRole != null) {
        assumedRole.close();
        assumedRole = null;
      }
      AwsSession base = baseSession(config);
      AssumeRoleRequest req = roleRequest(config);
      StsClient sts = clients.sts(base);
      StsAssumeRoleCredentialsProvider provider =
          StsAssumeRoleCredentialsProvider.builder().stsClient(sts).refreshRequest(req).build();
      try {
        provider.resolveCredentials();
      } catch (RuntimeException e) {
        provider.close();
        sts.close();
        if (e instanceof SdkException sdk) {
          throw AwsErrors.translate("Assuming role " + req.roleArn(), sdk);
        }
        throw e;
      }
      LOG.debugf("Assumed role %s with refreshing credentials", req.roleArn());
      assumedRole =
          new AssumedRole(
              fingerprint,
              new AwsSession(base.region(), provider, base.endpointOverride()),
              provider,
              sts);
      return assumedRole.session();
    }
  }

  private AwsSession baseSession(AuthenticationConfig config) {
    Region region = region(config);
    Optional<URI> endpoint = config.value(ENDPOINT_URL).map(AwsServiceConnector::endpoint);
    String accessKey = config.requireSecret(ACCESS_KEY_ID).reveal();
    String secretKey = config.requireSecret(SECRET_ACCESS_KEY).reveal();
    AwsCredentials base =
        config
            .secret(SESSION_TOKEN)
            .map(SecretValue::reveal)
            .map(token -> AwsSessionCredentials.create(accessKey, secretKey, token))
            .map(AwsCredentials.class::cast)
            .orElseGet(() -> AwsBasicCredentials.create(accessKey, secretKey));
    return new AwsSession(region, StaticCredentialsProvider.create(base), endpoint);
  }

  private static AssumeRoleRequest roleRequest(AuthenticationConfig config) {
    return AssumeRoleRequest.builder()
        .roleArn(config.requireValue(ROLE_ARN))
        .roleSessionName(config.value(SESSION_NAME).orElse(DEFAULT_SESSION_NAME))
        .externalId(config.value(EXTERNAL_ID).orElse(null))
        .build();
  }

  private AwsSession assumeRole(AwsSession base, AuthenticationConfig config) {
    AssumeRoleRequest req = roleRequest(config);
    String roleArn = req.roleArn();
    Credentials creds;
    try (StsClient sts = clients.sts(base)) {
      creds = sts.assumeRole(req).credentials();
    } catch (SdkException e) {
      throw AwsErrors.translate("Assuming role " + roleArn, e);
    }
    LOG.debugf("Assumed role %s, credentials expire at %s", roleArn, creds.expiration());
    AwsSessionCredentials session =
        AwsSessionCredentials.create(
            creds.accessKeyId(), creds.secretAccessKey(), creds.sessionToken());
    return new AwsSession(
        base.region(), StaticCredentialsProvider.create(session), base.endpointOverride());
  }

  private void callerIdentity(AwsSession session) {
    try (StsClient sts = clients.sts(session)) {
      var identity = sts.getCallerIdentity(GetCallerIdentityRequest.builder().build());
      LOG.debugf("AWS credentials belong to %s", identity.arn());
    } catch (SdkException e) {
      throw AwsErrors.translate("Checking AWS caller identity", e);
    }
  }

  private static void headBucket(S3Client s3, ResourceId resource) {
    String bucket = resource.field(AwsResourceIds.BUCKET).orElseThrow();
    try {
      s3.headBucket(HeadBucketRequest.builder().bucket(bucket).build());
    } catch (SdkException e) {
      throw AwsErrors.translate("Accessing S3 bucket " + bucket, e);
    }
  }

  private Region region(AuthenticationConfig config) {
    return Region.of(config.value(REGION).orElse(context().settings().awsDefaultRegion()));
  }

  private void setProfileValue(String profile, String key, String value, boolean secret) {
    List<String> command = new ArrayList<>();
    command.add(context().settings().awsBinary());
    command.add("configure");
    command.add("set");
    command.add(key);
    command.add(value);
    command.add("--profile");
    command.add(profile);
    int[] masked = secret ? new int[] {VALUE_ARG} : new int[0];
    LocalToolRunner.Result result;
    try {
      result = context().toolRunner().run(command, null);
    } catch (LocalToolException e) {
      throw e.masking(masked);
    }
    if (!result.succeeded()) {
      throw new LocalToolException(command, result.exitCode(), result.stderr()).masking(masked);
    }
  }

  private record AssumedRole(
      String fingerprint,
      AwsSession session,
      StsAssumeRoleCredentialsProvider provider,
      StsClient sts) {
    void close() {
      provider.close();
      sts.close();
    }
  }

  private static URI endpoint(String raw) {
    try {
      return URI.create(raw);
    } catch (IllegalArgumentException e) {
      throw new ConfigurationException("Invalid " + ENDPOINT_URL + " " + raw, e);
    }
  }
}
