package com.jarvisbot.telegram.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Google Drive fallback target.
 *
 * <p>{@code tokenJson} is an authorized-user credential document (client_id, client_secret,
 * refresh_token) as produced by the installed-app OAuth flow.
 */
@ConfigurationProperties(prefix = "drive")
public record DriveProperties(String folderId, String tokenJson, Duration timeout) {

  public boolean isConfigured() {
    return folderId != null
        && !folderId.isBlank()
        && tokenJson != null
        && !tokenJson.isBlank();
  }
}
