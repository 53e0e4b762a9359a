package com.example.vaultkv2.core;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.vaultkv2.core.connection.VaultConnection;
import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import org.mockito.ArgumentCaptor;
import org.testcontainers.DockerClientFactory;

/** Test-only utilities shared by unit and integration tests. */
public final class TestSupport {

  public static final String ADDRESS = "https://vault.test:8200";
  public static final String TOKEN = "s.test-token";

  private TestSupport() {}

  /** Simple Docker availability probe using Testcontainers. */
  public static boolean dockerAvailable() {
    try {
      DockerClientFactory.instance().client();
      return true;
    } catch (final Throwable t) {
      return false;
    }
  }

  /** Connection to {@link #ADDRESS} with engine {@code secret} backed by the given client. */
  public static VaultConnection connection(final HttpClient httpClient) {
    return new VaultConnection(
        ADDRESS, TOKEN.getBytes(StandardCharsets.UTF_8), "secret", httpClient);
  }

  /** Stubs every send of the mocked client with the given status and body. */
  @SuppressWarnings("unchecked")
  public static void respond(final HttpClient httpClient, final int status, final String body)
      throws IOException, InterruptedException {
    final HttpResponse<String> response = mock(HttpResponse.class);
    when(response.statusCode()).thenReturn(status);
    when(response.body()).thenReturn(body);
    doReturn(response).when(httpClient).send(any(HttpRequest.class), any());
  }

  public static void failWith(final HttpClient httpClient, final Exception exception)
      throws IOException, InterruptedException {
    doThrow(exception).when(httpClient).send(any(HttpRequest.class), any());
  }

  /** Returns the single request sent through the mocked client. */
  public static HttpRequest sentRequest(final HttpClient httpClient)
      throws IOException, InterruptedException {
    final var captor = ArgumentCaptor.forClass(HttpRequest.class);
    verify(httpClient).send(captor.capture(), any());
    return captor.getValue();
  }
}
