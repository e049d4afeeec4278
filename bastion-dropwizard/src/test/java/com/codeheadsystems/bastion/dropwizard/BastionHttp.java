package com.codeheadsystems.bastion.dropwizard;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Small HTTP helper for the integration tests.
 */
class BastionHttp {

  private static final ObjectMapper MAPPER = new ObjectMapper();

  private final HttpClient httpClient = HttpClient.newHttpClient();
  private final String baseUrl;

  BastionHttp(int port) {
    this.baseUrl = String.format("http://localhost:%d", port);
  }

  /**
   * Fresh directory for one application's key pair.
   */
  static String tempKeysDirectory() {
    try {
      return Files.createTempDirectory("bastion-keys").toString();
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  static JsonNode json(HttpResponse<String> response) throws IOException {
    return MAPPER.readTree(response.body());
  }

  HttpResponse<String> form(String path, Map<String, String> fields) throws Exception {
    String body = fields.entrySet().stream()
        .map(e -> encode(e.getKey()) + "=" + encode(e.getValue()))
        .collect(Collectors.joining("&"));
    return send(HttpRequest.newBuilder()
        .uri(URI.create(baseUrl + path))
        .header("Content-Type", "application/x-www-form-urlencoded")
        .POST(HttpRequest.BodyPublishers.ofString(body))
        .build());
  }

  HttpResponse<String> postJson(String path, Object body) throws Exception {
    return send(HttpRequest.newBuilder()
        .uri(URI.create(baseUrl + path))
        .header("Content-Type", "application/json")
        .POST(HttpRequest.BodyPublishers.ofString(MAPPER.writeValueAsString(body)))
        .build());
  }

  HttpResponse<String> get(String path, String accessToken) throws Exception {
    HttpRequest.Builder builder = HttpRequest.newBuilder().uri(URI.create(baseUrl + path)).GET();
    if (accessToken != null) {
      builder.header("Authorization", "Bearer " + accessToken);
    }
    return send(builder.build());
  }

  HttpResponse<String> post(String path, String accessToken) throws Exception {
    return send(HttpRequest.newBuilder()
        .uri(URI.create(baseUrl + path))
        .header("Authorization", "Bearer " + accessToken)
        .POST(HttpRequest.BodyPublishers.noBody())
        .build());
  }

  HttpResponse<String> put(String path, String accessToken) throws Exception {
    return send(HttpRequest.newBuilder()
        .uri(URI.create(baseUrl + path))
        .header("Authorization", "Bearer " + accessToken)
        .PUT(HttpRequest.BodyPublishers.noBody())
        .build());
  }

  HttpResponse<String> delete(String path, String accessToken) throws Exception {
    return send(HttpRequest.newBuilder()
        .uri(URI.create(baseUrl + path))
        .header("Authorization", "Bearer " + accessToken)
        .DELETE()
        .build());
  }

  /**
   * Password grant; returns the token response body.
   */
  JsonNode login(String username, String password) throws Exception {
    HttpResponse<String> response = form("/api/v1/auth/token",
        Map.of("grant_type", "password", "username", username, "password", password));
    if (response.statusCode() != 200) {
      throw new IllegalStateException("Login failed: " + response.statusCode() + " " + response.body());
    }
    return json(response);
  }

  private HttpResponse<String> send(HttpRequest request) throws Exception {
    return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
  }

  private static String encode(String value) {
    return URLEncoder.encode(value, StandardCharsets.UTF_8);
  }
}
