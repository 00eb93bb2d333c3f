package com.jarvisbot.telegram.client;

import com.google.auth.oauth2.AccessToken;
import com.google.auth.oauth2.UserCredentials;
import com.jarvisbot.telegram.config.DriveProperties;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import org.springframework.stereotype.Component;

/**
 * OAuth access tokens for Drive, from the authorized-user JSON in {@code drive.token-json}.
 *
 * <p>Credentials are parsed on first use and refreshed whenever the cached token has expired.
 */
@Component
public class GoogleAccessTokenProvider {

  private final DriveProperties properties;
  private UserCredentials credentials;

  public GoogleAccessTokenProvider(DriveProperties properties) {
    this.properties = properties;
  }

  public synchronized String accessToken() {
    if (properties.tokenJson() == null || properties.tokenJson().isBlank()) {
      throw new StorageException("drive.token-json is not configured");
    }
    try {
      if (credentials == null) {
        byte[] json = properties.tokenJson().getBytes(StandardCharsets.UTF_8);
        credentials = UserCredentials.fromStream(new ByteArrayInputStream(json));
      }
      credentials.refreshIfExpired();
      AccessToken token = credentials.getAccessToken();
      if (token == null) {
        throw new StorageException("Google credentials returned no access token");
      }
      return token.getTokenValue();
    } catch (IOException e) {
      throw new StorageException("Failed to obtain Google access token: " + e.getMessage(), e);
    }
  }
}
