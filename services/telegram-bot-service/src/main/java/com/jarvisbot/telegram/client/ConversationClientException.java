package com.jarvisbot.telegram.client;

public class ConversationClientException extends RuntimeException {
  public ConversationClientException(String message) {
    super(message);
  }

  public ConversationClientException(String message, Throwable cause) {
    super(message, cause);
  }
}
