package com.example.vaultkv2.core.http;

/**
 * Raw HTTP response.
 *
 * @param status HTTP status code
 * @param body response body text, empty when the service sent none
 */
public record VaultResponse(int status, String body) {

  public VaultResponse {
    body = body == null ? "" : body;
  }

  public boolean isSuccess() {
    return status >= 200 && status <= 299;
  }
}
