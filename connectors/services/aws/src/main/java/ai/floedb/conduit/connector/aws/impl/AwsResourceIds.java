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

import ai.floedb.conduit.connector.common.resolver.ShapeResourceIdResolver;
import ai.floedb.conduit.connector.common.resolver.ShapeResourceIdResolver.Parsed;
import java.util.Map;
import java.util.regex.Matcher;

/**
 * S3 bucket ids. {@code arn:aws[-partition]:s3:::<bucket>}, {@code s3://<bucket>[/<key>]} and a
 * bare {@code <bucket>} all canonicalize to {@code s3://<bucket>}.
 */
public final class AwsResourceIds {
  public static final String BUCKET = "bucket";

  private static final String BUCKET_NAME = "([a-z0-9][a-z0-9.-]{1,61}[a-z0-9])";

  public static final ShapeResourceIdResolver S3_RESOLVER =
      ShapeResourceIdResolver.builder(AwsServiceConnector.S3_RESOURCE_TYPE)
          .shape(
              "s3-arn", "^arn:aws(?:-[a-z-]+)?:s3:::" + BUCKET_NAME + "$", AwsResourceIds::bucket)
          .shape("s3-uri", "^s3://" + BUCKET_NAME + "(?:/.*)?$", AwsResourceIds::bucket)
          .shape("bucket-name", "^" + BUCKET_NAME + "$", AwsResourceIds::bucket)
          .hint(
              "Please provide a valid S3 bucket as arn:aws:s3:::<bucket-name>,"
                  + " s3://<bucket-name> or <bucket-name>")
          .build();

  private AwsResourceIds() {}

  private static Parsed bucket(Matcher m) {
    String bucket = m.group(1);
    return new Parsed("s3://" + bucket, Map.of(BUCKET, bucket));
  }
}
