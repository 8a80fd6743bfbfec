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

import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;
import software.amazon.awssdk.http.urlconnection.UrlConnectionHttpClient;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3Configuration;
import software.amazon.awssdk.services.sts.StsClient;

public final class SdkAwsClientFactory implements AwsClientFactory {

  @Override
  public StsClient sts(AwsSession session) {
    var builder =
        StsClient.builder()
            .region(session.region())
            .httpClient(UrlConnectionHttpClient.create())
            .credentialsProvider(session.credentials())
            .overrideConfiguration(ClientOverrideConfiguration.builder().build());
    session.endpointOverride().ifPresent(builder::endpointOverride);
    return builder.build();
  }

  @Override
  public S3Client s3(AwsSession session) {
    // Custom endpoints (MinIO, LocalStack) generally only serve path style requests.
    var s3Cfg =
        S3Configuration.builder()
            .pathStyleAccessEnabled(session.endpointOverride().isPresent())
            .build();
    var builder =
        S3Client.builder()
            .region(session.region())
            .serviceConfiguration(s3Cfg)
            .httpClient(UrlConnectionHttpClient.create())
            .credentialsProvider(session.credentials())
            .overrideConfiguration(ClientOverrideConfiguration.builder().build());
    session.endpointOverride().ifPresent(builder::endpointOverride);
    return builder.build();
  }
}
