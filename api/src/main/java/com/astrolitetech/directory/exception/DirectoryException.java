package com.astrolitetech.directory.exception;

public class DirectoryException extends RuntimeException {

  private final ErrorKind kind;

  public DirectoryException(ErrorKind kind) {
    super(kind.getMessage());
    this.kind = kind;
  }

  public DirectoryException(ErrorKind kind, String message, Throwable cause) {
    super(message, cause);
    this.kind = kind;
  }

  public static DirectoryException of(ErrorKind kind) {
    return new DirectoryException(kind);
  }

  public static DirectoryException storeError(String message, Throwable cause) {
    return new DirectoryException(ErrorKind.STORE_ERROR, message, cause);
  }

  public static DirectoryException schemaInit(Throwable cause) {
    return new DirectoryException(
        ErrorKind.SCHEMA_INIT_ERROR, ErrorKind.SCHEMA_INIT_ERROR.getMessage(), cause);
  }

  public ErrorKind getKind() {
    return kind;
  }
}
