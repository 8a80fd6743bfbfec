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

package ai.floedb.conduit.connector.docker.impl;

import ai.floedb.conduit.connector.spi.AuthorizationException;
import ai.floedb.conduit.connector.spi.ProviderUnavailableException;
import ai.floedb.conduit.connector.spi.SecretValue;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Base64;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.jboss.logging.Logger;

/**
 * Registry client speaking the V2 API: pings {@code /v2/}, answers a Basic challenge with the
 * credentials, or trades them for a token at the realm of a Bearer challenge.
 */
final class HttpDockerRegistryClient implements DockerRegistryClient {
  private static final Logger LOG = Logger.getLogger(HttpDockerRegistryClient.class);
  private static final ObjectMapper M = new ObjectMapper();
  private static final Pattern CHALLENGE_PARAM = Pattern.compile("(\\w+)=\"([^\"]*)\"");

  static final String DOCKER_HUB_REGISTRY = "registry-1.docker.io";

  private final HttpClient http;
  private final Duration timeout;
  private final List<String> insecureRegistries;

  private volatile String registry;
  private volatile String authorization;

  HttpDockerRegistryClient(HttpClient http, Duration timeout, List<String> insecureRegistries) {
    this.http = http;
    this.timeout = timeout;
    this.insecureRegistries = List.copyOf(insecureRegistries);
  }

  @Override
  public void login(SecretValue username, SecretValue password, String registry) {
    String host = (registry == null || registry.isBlank()) ? DOCKER_HUB_REGISTRY : registry;
    String basic =
        "Basic "
            + Base64.getEncoder()
                .encodeToString(
                    (username.reveal() + ":" + password.reveal())
                        .getBytes(StandardCharsets.UTF_8));

    URI ping = URI.create(baseUri(host) + "/v2/");
    HttpResponse<String> challenge = send(HttpRequest.newBuilder(ping).GET(), host);
    int status = challenge.statusCode();
    if (status / 100 == 2) {
      // an open /v2/ says nothing about the credentials
      HttpResponse<String> checked =
          send(HttpRequest.newBuilder(ping).header("Authorization", basic).GET(), host);
      if (checked.statusCode() / 100 != 2) {
        throw failure(host, checked.statusCode(), checked.body());
      }
      LOG.debugf("Registry %s allows anonymous pings, credentials accepted", host);
      this.registry = host;
      this.authorization = basic;
      return;
    }
    if (status != 401) {
      throw failure(host, status, challenge.body());
    }

    String header = challenge.headers().firstValue("WWW-Authenticate").orElse("");
    if (header.regionMatches(true, 0, "Bearer", 0, 6)) {
      String token = fetchToken(host, header, username.reveal(), basic);
      this.authorization = "Bearer " + token;
    } else {
      HttpResponse<String> retry =
          send(HttpRequest.newBuilder(ping).header("Authorization", basic).GET(), host);
      if (retry.statusCode() / 100 != 2) {
        throw failure(host, retry.statusCode(), retry.body());
      }
      this.authorization = basic;
    }
    this.registry = host;
    LOG.debugf("Logged in to registry %s", host);
  }

  @Override
  public boolean isAuthenticated() {
    return authorization != null;
  }

  @Override
  public String registry() {
    return registry;
  }

  @Override
  public HttpRequest.Builder newRequest(String path) {
    String auth = authorization;
    String host = registry;
    if (auth == null || host == null) {
      throw new IllegalStateException("Docker registry client is not logged in");
    }
    String p = path.startsWith("/") ? path : "/" + path;
    return HttpRequest.newBuilder(URI.create(baseUri(host) + p))
        .timeout(timeout)
        .header("Authorization", auth);
  }

  @Override
  public void close() {
    authorization = null;
  }

  private String fetchToken(String host, String challenge, String username, String basic) {
    Map<String, String> params = new HashMap<>();
    Matcher m = CHALLENGE_PARAM.matcher(challenge);
    while (m.find()) {
      params.put(m.group(1).toLowerCase(Locale.ROOT), m.group(2));
    }
    String realm = params.get("realm");
    if (realm == null || realm.isBlank()) {
      throw new AuthorizationException(
          "Docker registry " + host + " sent a Bearer challenge without realm: " + challenge);
    }
    StringBuilder url = new StringBuilder(realm);
    url.append(realm.contains("?") ? '&' : '?').append("account=").append(enc(username));
    if (params.containsKey("service")) {
      url.append("&service=").append(enc(params.get("service")));
    }

    HttpRequest.Builder tokenRequest =
        HttpRequest.newBuilder(URI.create(url.toString())).header("Authorization", basic).GET();
    HttpResponse<String> resp = send(tokenRequest, host);
    if (resp.statusCode() / 100 != 2) {
      throw failure(host, resp.statusCode(), resp.body());
    }
    try {
      JsonNode root = M.readTree(resp.body());
      String token = root.path("token").asText(null);
      if (token == null || token.isBlank()) {
        token = root.path("access_token").asText(null);
      }
      if (token == null || token.isBlank()) {
        throw new AuthorizationException("No token in response of Docker registry " + host);
      }
      return token;
    } catch (IOException e) {
      throw new AuthorizationException("Failed to parse token response of registry " + host, e);
    }
  }

  private HttpResponse<String> send(HttpRequest.Builder request, String host) {
    try {
      return http.send(request.timeout(timeout).build(), HttpResponse.BodyHandlers.ofString());
    } catch (IOException e) {
      throw new ProviderUnavailableException(
          "Could not reach Docker registry " + host + ": " + e.getMessage(), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new ProviderUnavailableException("Interrupted while contacting " + host, e);
    }
  }

  private static RuntimeException failure(String host, int status, String body) {
    String diag = body == null ? "" : body.strip();
    if (status >= 500) {
      return new ProviderUnavailableException(
          "Docker registry " + host + " returned HTTP " + status + " " + diag);
    }
    return new AuthorizationException(
        "Failed to authenticate to Docker registry " + host + ": HTTP " + status + " " + diag);
  }

  String baseUri(String host) {
    String name = host.contains(":") ? host.substring(0, host.indexOf(':')) : host;
    boolean insecure = insecureRegistries.contains(host) || insecureRegistries.contains(name);
    return (insecure ? "http://" : "https://") + host;
  }

  private static String enc(String s) {
    return URLEncoder.encode(s, StandardCharsets.UTF_8);
  }
}
