package com.jarvisbot.telegram.domain.ingest;

import com.jarvisbot.telegram.model.AudioMessage;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import org.springframework.stereotype.Component;

/** {@code {kind}_{yyyyMMdd_HHmmss}_{username-or-id}.{ext}} */
@Component
public class FileNamePolicy {

  private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

  private final Clock clock;

  public FileNamePolicy(Clock clock) {
    this.clock = clock;
  }

  public String fileName(AudioMessage audio) {
    String timestamp = LocalDateTime.now(clock).format(TIMESTAMP);
    return audio.kind().prefix()
        + "_"
        + timestamp
        + "_"
        + audio.handle()
        + "."
        + extension(audio);
  }

  static String extension(AudioMessage audio) {
    String mime = audio.mimeType();
    if (mime != null) {
      int slash = mime.lastIndexOf('/');
      String subtype = slash < 0 ? "" : mime.substring(slash + 1);
      int params = subtype.indexOf(';');
      if (params >= 0) {
        subtype = subtype.substring(0, params);
      }
      subtype = subtype.trim().toLowerCase(Locale.ROOT);
      if (!subtype.isEmpty()) {
        return subtype;
      }
    }
    return audio.kind().defaultExtension();
  }
}
