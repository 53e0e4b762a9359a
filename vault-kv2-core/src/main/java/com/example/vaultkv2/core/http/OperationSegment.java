package com.example.vaultkv2.core.http;

/** Path segment following the engine mount in a KV version 2 URL. */
public enum OperationSegment {
  /** Secret payload of a version. */
  DATA("data"),
  /** Version history, listings and per-secret settings. */
  METADATA("metadata"),
  DELETE("delete"),
  UNDELETE("undelete"),
  DESTROY("destroy"),
  /** Engine-wide settings; takes no secret path. */
  CONFIG("config");

  private final String segment;

  OperationSegment(final String segment) {
    this.segment = segment;
  }

  public String segment() {
    return segment;
  }
}
