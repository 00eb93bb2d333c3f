package com.jarvisbot.telegram.client;

/** A contacts-service call failed (timeout, non-2xx, unreadable body). */
public class ContactsClientException extends RuntimeException {
  public ContactsClientException(String message) {
    super(message);
  }

  public ContactsClientException(String message, Throwable cause) {
    super(message, cause);
  }
}
