package com.jarvisbot.telegram.client;

/** The durable-storage write failed; the ingest event would be lost if this were ignored. */
public class StorageException extends RuntimeException {
  public StorageException(String message) {
    super(message);
  }

  public StorageException(String message, Throwable cause) {
    super(message, cause);
  }
}
