package com.example.vaultkv2.core.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import java.net.URI;
import java.net.http.HttpRequest;
import java.net.http.HttpRequest.BodyPublishers;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Fully specified HTTP request against the KV engine.
 *
 * @param method HTTP method
 * @param uri absolute request URI
 * @param headers request headers, including the token header
 * @param body JSON body, null when the request has none
 */
public record VaultRequest(String method, URI uri, Map<String, String> headers, JsonNode body) {

  public VaultRequest {
    Objects.requireNonNull(method, "method");
    Objects.requireNonNull(uri, "uri");
    headers = Map.copyOf(headers);
  }

  public Optional<JsonNode> jsonBody() {
    return Optional.ofNullable(body);
  }

  /**
   * Converts to a JDK request.
   *
   * @param timeout request timeout, or null for none
   * @return the JDK request
   * @throws JsonProcessingException if the body cannot be serialized
   */
  HttpRequest toHttpRequest(final Duration timeout) throws JsonProcessingException {
    final var publisher =
        body == null
            ? BodyPublishers.noBody()
            : BodyPublishers.ofString(VaultJson.mapper().writeValueAsString(body));
    final var builder = HttpRequest.newBuilder(uri).method(method, publisher);
    headers.forEach(builder::header);
    if (timeout != null) builder.timeout(timeout);
    return builder.build();
  }

  @Override
  public String toString() {
    // never expose the token header
    return method + " " + uri;
  }
}
