package com.astrolitetech.directory.model;

/** What an upsert did, and the photo reference now stored for the employee (may be null). */
public record UpsertResult(UpsertOutcome outcome, String profileImage) {

  public static UpsertResult created(String profileImage) {
    return new UpsertResult(UpsertOutcome.CREATED, profileImage);
  }

  public static UpsertResult updated(String profileImage) {
    return new UpsertResult(UpsertOutcome.UPDATED, profileImage);
  }
}
