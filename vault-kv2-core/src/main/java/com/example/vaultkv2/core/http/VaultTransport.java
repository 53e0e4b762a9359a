package com.example.vaultkv2.core.http;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.WARNING;

import com.example.vaultkv2.core.Result;
import com.example.vaultkv2.core.VaultError.TransportError;
import com.example.vaultkv2.core.connection.VaultConnection;
import java.io.IOException;
import java.net.http.HttpResponse.BodyHandlers;

/**
 * Performs exactly one HTTP round trip per request with the connection's {@link
 * java.net.http.HttpClient}. Failures are never retried.
 */
public final class VaultTransport {

  private static final System.Logger LOGGER = System.getLogger(VaultTransport.class.getName());

  private VaultTransport() {}

  /**
   * Sends the request and returns the raw response.
   *
   * @param connection connection owning the HTTP client
   * @param request the request
   * @return status and body, or a {@link TransportError}
   */
  public static Result<VaultResponse> send(
      final VaultConnection connection, final VaultRequest request) {
    try {
      final var response =
          connection.httpClient().send(request.toHttpRequest(null), BodyHandlers.ofString());
      LOGGER.log(DEBUG, "{0} -> {1}", request, response.statusCode());
      return Result.success(new VaultResponse(response.statusCode(), response.body()));
    } catch (final IOException e) {
      LOGGER.log(WARNING, "Request " + request + " failed", e);
      return Result.failure(new TransportError(request + " failed: " + e.getMessage(), e));
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
      return Result.failure(new TransportError(request + " interrupted", e));
    } catch (final IllegalArgumentException e) {
      // e.g. a token that is not a legal header value
      LOGGER.log(WARNING, "Request " + request + " rejected by the HTTP client", e);
      return Result.failure(new TransportError(request + " rejected: " + e.getMessage(), e));
    }
  }
}
