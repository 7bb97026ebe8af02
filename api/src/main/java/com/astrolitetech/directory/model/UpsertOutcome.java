package com.astrolitetech.directory.model;

import org.springframework.http.HttpStatus;

public enum UpsertOutcome {
  CREATED(HttpStatus.CREATED, "Employee added successfully"),
  UPDATED(HttpStatus.OK, "Employee updated successfully");

  private final HttpStatus status;
  private final String message;

  UpsertOutcome(HttpStatus status, String message) {
    this.status = status;
    this.message = message;
  }

  public HttpStatus getStatus() {
    return status;
  }

  public String getMessage() {
    return message;
  }
}
