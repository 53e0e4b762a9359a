package com.example.vaultkv2.core;

import static org.junit.jupiter.api.Assertions.*;

import com.example.vaultkv2.core.VaultError.ConfigurationError;
import com.example.vaultkv2.core.VaultError.ServiceError;
import com.example.vaultkv2.core.VaultError.TransportError;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

public class ResultTest {

  private static final VaultError ERROR = new ConfigurationError("missing");

  @Test
  void successMapsAndFlatMaps() {
    final var result = Result.success(2).map(v -> v * 3).flatMap(v -> Result.success("v" + v));

    assertTrue(result.isSuccess());
    assertEquals("v6", result.orElseThrow());
    assertTrue(result.error().isEmpty());
  }

  @Test
  void failureShortCircuits() {
    final var calls = new ArrayList<Integer>();
    final Result<Integer> failure = Result.failure(ERROR);

    final var result =
        failure
            .map(
                v -> {
                  calls.add(v);
                  return v;
                })
            .flatMap(Result::success);

    assertTrue(result.isFailure());
    assertEquals(ERROR, result.error().orElseThrow());
    assertTrue(calls.isEmpty());
  }

  @Test
  void foldSelectsBranch() {
    assertEquals("ok:1", Result.success(1).fold(VaultError::message, v -> "ok:" + v));
    assertEquals("missing", Result.<Integer>failure(ERROR).fold(VaultError::message, v -> "ok"));
  }

  @Test
  void callbacksRunOnMatchingBranchOnly() {
    final var seen = new ArrayList<String>();

    Result.success("a").onSuccess(seen::add).onFailure(e -> seen.add("error"));
    Result.<String>failure(ERROR).onSuccess(seen::add).onFailure(e -> seen.add(e.message()));

    assertEquals(List.of("a", "missing"), seen);
  }

  @Test
  void orElseThrowKeepsTransportCause() {
    final var cause = new IOException("reset");
    final var thrown =
        assertThrows(
            VaultException.class,
            () -> Result.failure(new TransportError("GET x failed", cause)).orElseThrow());

    assertSame(cause, thrown.getCause());
    assertEquals("GET x failed", thrown.getMessage());
  }

  @Test
  void serviceErrorMessage() {
    assertEquals(
        "permission denied, invalid token",
        new ServiceError(403, List.of("permission denied", "invalid token"), "").message());
    assertEquals("HTTP 500", new ServiceError(500, List.of(), "").message());
    assertEquals("HTTP 500: oops", new ServiceError(500, List.of(), "oops").message());
  }

  @Test
  void failureRequiresError() {
    assertThrows(NullPointerException.class, () -> Result.failure(null));
  }
}
