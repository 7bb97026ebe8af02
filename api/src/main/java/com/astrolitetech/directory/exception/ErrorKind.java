package com.astrolitetech.directory.exception;

import org.springframework.http.HttpStatus;

/** Every failure the directory reports to callers, with the status and message it surfaces as. */
public enum ErrorKind {
  MISSING_FIELD(HttpStatus.BAD_REQUEST, "All fields are required"),
  INVALID_ID_FORMAT(HttpStatus.BAD_REQUEST, "Invalid Employee ID format"),
  INVALID_EMAIL_FORMAT(HttpStatus.BAD_REQUEST, "Invalid email format"),
  INVALID_PHONE_FORMAT(HttpStatus.BAD_REQUEST, "Phone number must be 10 digits"),
  UNSUPPORTED_MEDIA_TYPE(HttpStatus.BAD_REQUEST, "Only JPEG or PNG images are allowed"),
  PAYLOAD_TOO_LARGE(HttpStatus.BAD_REQUEST, "File too large"),
  NOT_FOUND(HttpStatus.NOT_FOUND, "Employee not found"),
  STORE_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, "Server error"),
  SCHEMA_INIT_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, "Error initializing database");

  private final HttpStatus status;
  private final String message;

  ErrorKind(HttpStatus status, String message) {
    this.status = status;
    this.message = message;
  }

  public HttpStatus getStatus() {
    return status;
  }

  public String getMessage() {
    return message;
  }

  public boolean isClientError() {
    return status.is4xxClientError();
  }
}
