package com.jarvisbot.telegram.model;

/** Telegram message kinds that carry audio, with the fallback extension and MIME type of each. */
public enum AudioKind {
  VOICE("voice", "ogg", "audio/ogg"),
  AUDIO("audio", "mp3", "audio/mpeg");

  private final String prefix;
  private final String defaultExtension;
  private final String defaultMimeType;

  AudioKind(String prefix, String defaultExtension, String defaultMimeType) {
    this.prefix = prefix;
    this.defaultExtension = defaultExtension;
    this.defaultMimeType = defaultMimeType;
  }

  public String prefix() {
    return prefix;
  }

  public String defaultExtension() {
    return defaultExtension;
  }

  public String defaultMimeType() {
    return defaultMimeType;
  }
}
