package com.example.vaultkv2.core.connection;

import com.example.vaultkv2.core.Result;
import com.example.vaultkv2.core.VaultError.ConfigurationError;
import java.net.Socket;
import java.net.http.HttpClient;
import java.security.GeneralSecurityException;
import java.security.cert.X509Certificate;
import java.time.Duration;
import javax.net.ssl.SSLContext;
import javax.net.ssl.SSLEngine;
import javax.net.ssl.TrustManager;
import javax.net.ssl.X509ExtendedTrustManager;

/**
 * Builds the {@link HttpClient} owned by a {@link VaultConnection}.
 *
 * <p>Each client gets its own {@link SSLContext}. Its client session cache keeps a single entry
 * for one second so that TLS sessions are not resumed across request contexts.
 */
final class TlsSettings {

  private static final int SESSION_CACHE_SIZE = 1;
  private static final int SESSION_TIMEOUT_SECONDS = 1;

  private TlsSettings() {}

  /**
   * Creates an HTTP client.
   *
   * @param disableCertValidation when true, accept any server certificate and host name
   * @param connectTimeout connect timeout of the client
   * @return the client, or a configuration error if TLS cannot be initialised
   */
  static Result<HttpClient> httpClient(
      final boolean disableCertValidation, final Duration connectTimeout) {
    try {
      final var sslContext = SSLContext.getInstance("TLS");
      sslContext.init(
          null, disableCertValidation ? new TrustManager[] {new TrustAll()} : null, null);
      sslContext.getClientSessionContext().setSessionCacheSize(SESSION_CACHE_SIZE);
      sslContext.getClientSessionContext().setSessionTimeout(SESSION_TIMEOUT_SECONDS);

      final var parameters = sslContext.getDefaultSSLParameters();
      parameters.setEndpointIdentificationAlgorithm(disableCertValidation ? null : "HTTPS");

      return Result.success(
          HttpClient.newBuilder()
              .sslContext(sslContext)
              .sslParameters(parameters)
              .connectTimeout(connectTimeout)
              .followRedirects(HttpClient.Redirect.NORMAL)
              .build());
    } catch (final GeneralSecurityException e) {
      return Result.failure(new ConfigurationError("Cannot initialise TLS: " + e.getMessage()));
    }
  }

  /** Trust manager that accepts every certificate chain without host name checks. */
  private static final class TrustAll extends X509ExtendedTrustManager {

    @Override
    public void checkClientTrusted(final X509Certificate[] chain, final String authType) {}

    @Override
    public void checkServerTrusted(final X509Certificate[] chain, final String authType) {}

    @Override
    public void checkClientTrusted(
        final X509Certificate[] chain, final String authType, final Socket socket) {}

    @Override
    public void checkServerTrusted(
        final X509Certificate[] chain, final String authType, final Socket socket) {}

    @Override
    public void checkClientTrusted(
        final X509Certificate[] chain, final String authType, final SSLEngine engine) {}

    @Override
    public void checkServerTrusted(
        final X509Certificate[] chain, final String authType, final SSLEngine engine) {}

    @Override
    public X509Certificate[] getAcceptedIssuers() {
      return new X509Certificate[0];
    }
  }
}
