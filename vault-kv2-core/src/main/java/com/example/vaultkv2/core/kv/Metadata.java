package com.example.vaultkv2.core.kv;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * History entry of one secret version.
 *
 * @param destroyed whether the version data was permanently removed
 * @param deletionTime ISO-8601 soft-deletion time, empty if the version is not deleted
 * @param createdTime ISO-8601 creation time
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Metadata(
    @JsonProperty("destroyed") boolean destroyed,
    @JsonProperty("deletion_time") String deletionTime,
    @JsonProperty("created_time") String createdTime) {

  public Metadata {
    deletionTime = deletionTime == null ? "" : deletionTime;
    createdTime = createdTime == null ? "" : createdTime;
  }

  public boolean isDeleted() {
    return !deletionTime.isEmpty();
  }
}
