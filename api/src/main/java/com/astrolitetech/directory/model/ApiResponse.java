package com.astrolitetech.directory.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/** Response bodies of the directory endpoints. */
public final class ApiResponse {

  private ApiResponse() {}

  @JsonInclude(JsonInclude.Include.NON_NULL)
  public record Error(String error, String details) {
    public static Error of(String message) {
      return new Error(message, null);
    }

    public static Error withDetails(String message, String details) {
      return new Error(message, details);
    }
  }

  public record Message(String message) {}

  /** {@code profile_image} is always rendered, null included. */
  public record Upsert(String message, @JsonProperty("profile_image") String profileImage) {
    public static Upsert from(UpsertResult result) {
      return new Upsert(result.outcome().getMessage(), result.profileImage());
    }
  }

  public record Health(String status) {}
}
