package com.example.vaultkv2.core.http;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.function.Supplier;

/** Holder of the {@link ObjectMapper} used to encode request bodies and decode responses. */
public final class VaultJson {

  private static final ObjectMapper DEFAULT_MAPPER = new ObjectMapper();

  private static volatile Supplier<ObjectMapper> mapperSupplier = () -> DEFAULT_MAPPER;

  private VaultJson() {}

  /**
   * Sets the supplier of the {@link ObjectMapper} to use.
   *
   * @param supplier the supplier of the {@link ObjectMapper} to use
   */
  public static void setMapperSupplier(final Supplier<ObjectMapper> supplier) {
    mapperSupplier = supplier;
  }

  /** Restores the default mapper. */
  public static void resetMapper() {
    mapperSupplier = () -> DEFAULT_MAPPER;
  }

  static ObjectMapper mapper() {
    return mapperSupplier.get();
  }
}
