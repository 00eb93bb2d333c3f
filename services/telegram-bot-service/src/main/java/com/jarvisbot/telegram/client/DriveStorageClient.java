package com.jarvisbot.telegram.client;

import com.jarvisbot.telegram.client.dto.DriveDtos.DriveFile;
import com.jarvisbot.telegram.client.dto.DriveDtos.RenameRequest;
import com.jarvisbot.telegram.config.DriveProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.InvalidMediaTypeException;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * Fallback target: stores the raw audio in a Drive folder watched by the out-of-band processor.
 *
 * <p>Two calls: a media upload (creates an unnamed file) followed by a metadata update that sets
 * the name and moves it into the configured folder.
 */
@Service
@Slf4j
public class DriveStorageClient {

  static final String UPLOAD_URL =
      "https://www.googleapis.com/upload/drive/v3/files?uploadType=media&fields=id,name";
  static final String FILES_URL = "https://www.googleapis.com/drive/v3/files/";

  private final RestClient rest;
  private final DriveProperties properties;
  private final GoogleAccessTokenProvider tokens;

  public DriveStorageClient(
      @Qualifier("driveRestClient") RestClient rest,
      DriveProperties properties,
      GoogleAccessTokenProvider tokens) {
    this.rest = rest;
    this.properties = properties;
    this.tokens = tokens;
  }

  public DriveFile upload(byte[] bytes, String filename, String mimeType) {
    if (!properties.isConfigured()) {
      throw new StorageException("Drive fallback is not configured (drive.folder-id/token-json)");
    }
    String bearer = "Bearer " + tokens.accessToken();

    try {
      DriveFile created =
          rest.post()
              .uri(UPLOAD_URL)
              .header("Authorization", bearer)
              .contentType(mediaType(mimeType))
              .body(bytes)
              .retrieve()
              .body(DriveFile.class);
      if (created == null || created.id() == null) {
        throw new StorageException("Drive upload returned no file id for " + filename);
      }

      DriveFile named =
          rest.patch()
              .uri(
                  FILES_URL + "{id}?addParents={folder}&fields=id,name",
                  created.id(),
                  properties.folderId())
              .header("Authorization", bearer)
              .contentType(MediaType.APPLICATION_JSON)
              .body(new RenameRequest(filename))
              .retrieve()
              .body(DriveFile.class);

      DriveFile result = named == null ? new DriveFile(created.id(), filename) : named;
      log.info("Uploaded to Drive: {} (id={})", result.name(), result.id());
      return result;
    } catch (RestClientException e) {
      throw new StorageException("Drive upload failed for " + filename + ": " + e.getMessage(), e);
    }
  }

  private static MediaType mediaType(String mimeType) {
    if (mimeType == null || mimeType.isBlank()) {
      return MediaType.APPLICATION_OCTET_STREAM;
    }
    try {
      return MediaType.parseMediaType(mimeType);
    } catch (InvalidMediaTypeException e) {
      return MediaType.APPLICATION_OCTET_STREAM;
    }
  }
}
