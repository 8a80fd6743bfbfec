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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import ai.floedb.conduit.connector.spi.InvalidResourceIdException;
import java.util.List;
import org.junit.jupiter.api.Test;

class AwsResourceIdsTest {

  @Test
  void everyShapeCanonicalizesToS3Uri() {
    for (String raw :
        List.of(
            "arn:aws:s3:::my-bucket",
            "arn:aws-cn:s3:::my-bucket",
            "s3://my-bucket",
            "s3://my-bucket/some/prefix",
            "my-bucket")) {
      var id = AwsResourceIds.S3_RESOLVER.parse(raw);
      assertEquals("s3://my-bucket", id.canonical(), raw);
      assertEquals("my-bucket", id.field(AwsResourceIds.BUCKET).orElseThrow());
    }
  }

  @Test
  void canonicalizationIsIdempotent() {
    String once = AwsResourceIds.S3_RESOLVER.canonicalize("arn:aws:s3:::logs.example.com");
    assertEquals("s3://logs.example.com", once);
    assertEquals(once, AwsResourceIds.S3_RESOLVER.canonicalize(once));
  }

  @Test
  void rejectsInvalidBucketNames() {
    for (String raw :
        List.of("ab", "My-Bucket", "-bucket", "bucket-", "arn:aws:s3:::", "s3://", "gs://bucket")) {
      assertThrows(
          InvalidResourceIdException.class, () -> AwsResourceIds.S3_RESOLVER.parse(raw), raw);
    }
  }
}
