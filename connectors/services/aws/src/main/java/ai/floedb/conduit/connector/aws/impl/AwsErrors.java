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

import ai.floedb.conduit.connector.spi.AuthorizationException;
import ai.floedb.conduit.connector.spi.ConnectorException;
import ai.floedb.conduit.connector.spi.ProviderUnavailableException;
import software.amazon.awssdk.awscore.exception.AwsServiceException;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.core.exception.SdkException;

/** Maps SDK failures onto connector exceptions. */
final class AwsErrors {
  private AwsErrors() {}

  static ConnectorException translate(String action, SdkException e) {
    if (e instanceof SdkClientException) {
      return new ProviderUnavailableException(action + " failed: " + e.getMessage(), e);
    }
    if (e instanceof AwsServiceException ase) {
      if (ase.statusCode() >= 500 || ase.isThrottlingException()) {
        return new ProviderUnavailableException(
            action + " failed with HTTP " + ase.statusCode() + ": " + errorCode(ase), e);
      }
      return new AuthorizationException(
          action + " was rejected by AWS (" + errorCode(ase) + "): " + message(ase), e);
    }
    return new AuthorizationException(action + " failed: " + e.getMessage(), e);
  }

  private static String errorCode(AwsServiceException e) {
    var details = e.awsErrorDetails();
    if (details == null || details.errorCode() == null) {
      return "HTTP " + e.statusCode();
    }
    return details.errorCode();
  }

  private static String message(AwsServiceException e) {
    var details = e.awsErrorDetails();
    if (details == null || details.errorMessage() == null) {
      return String.valueOf(e.getMessage());
    }
    return details.errorMessage();
  }
}
