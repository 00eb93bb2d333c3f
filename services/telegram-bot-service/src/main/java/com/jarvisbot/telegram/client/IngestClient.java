package com.jarvisbot.telegram.client;

import com.jarvisbot.telegram.client.dto.IngestDtos.IngestResponse;
import com.jarvisbot.telegram.config.IngestProperties;
import com.jarvisbot.telegram.domain.ingest.FastPathResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

/**
 * Fast path: posts the raw audio to the analysis endpoint and waits for the structured result.
 *
 * <p>Never throws. Every transport or semantic problem comes back as a recoverable failure so the
 * caller can fall back to durable storage.
 */
@Service
@Slf4j
public class IngestClient {

  private final RestClient rest;
  private final IngestProperties properties;

  public IngestClient(@Qualifier("ingestRestClient") RestClient rest, IngestProperties properties) {
    this.rest = rest;
    this.properties = properties;
  }

  public boolean isConfigured() {
    return properties.isConfigured();
  }

  public FastPathResult process(byte[] bytes, String filename, String username) {
    if (!isConfigured()) {
      return FastPathResult.skipped();
    }

    MultiValueMap<String, Object> form = new LinkedMultiValueMap<>();
    form.add("file", namedResource(bytes, filename));
    form.add("filename", filename);
    form.add("username", username);

    try {
      ResponseEntity<IngestResponse> entity =
          rest.post()
              .uri(properties.processUrl())
              .contentType(MediaType.MULTIPART_FORM_DATA)
              .body(form)
              .retrieve()
              .toEntity(IngestResponse.class);

      if (!entity.getStatusCode().is2xxSuccessful()) {
        return FastPathResult.failure("HTTP " + entity.getStatusCode().value());
      }
      IngestResponse body = entity.getBody();
      if (body == null) {
        return FastPathResult.failure("empty response body");
      }
      if (!body.isSuccess()) {
        String reason = body.error() == null ? "status=" + body.status() : body.error();
        return FastPathResult.failure(reason);
      }
      return FastPathResult.success(body);
    } catch (RestClientResponseException e) {
      log.warn("Fast path rejected {}: HTTP {}", filename, e.getStatusCode().value());
      return FastPathResult.failure("HTTP " + e.getStatusCode().value());
    } catch (RestClientException e) {
      log.warn("Fast path call failed for {}: {}", filename, e.getMessage());
      return FastPathResult.failure(e.getMessage());
    }
  }

  private static ByteArrayResource namedResource(byte[] bytes, String filename) {
    return new ByteArrayResource(bytes) {
      @Override
      public String getFilename() {
        return filename;
      }
    };
  }
}
