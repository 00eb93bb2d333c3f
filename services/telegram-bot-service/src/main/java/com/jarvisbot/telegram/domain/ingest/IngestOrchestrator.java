package com.jarvisbot.telegram.domain.ingest;

import com.jarvisbot.telegram.client.DriveStorageClient;
import com.jarvisbot.telegram.client.IngestClient;
import com.jarvisbot.telegram.client.StorageException;
import com.jarvisbot.telegram.client.dto.DriveDtos.DriveFile;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Fast path first, Drive second.
 *
 * <p>The fast path is tried once. Any result other than success hands the bytes to Drive, where
 * the out-of-band processor picks them up. A storage failure is the only fatal outcome.
 */
@Service
@Slf4j
public class IngestOrchestrator {

  private final IngestClient fastPath;
  private final DriveStorageClient storage;
  private final ContactMatchExtractor extractor;

  public IngestOrchestrator(
      IngestClient fastPath, DriveStorageClient storage, ContactMatchExtractor extractor) {
    this.fastPath = fastPath;
    this.storage = storage;
    this.extractor = extractor;
  }

  public IngestOutcome ingest(byte[] bytes, String filename, String mimeType, String username) {
    FastPathResult result = fastPath.process(bytes, filename, username);
    switch (result.status()) {
      case SUCCESS -> {
        AnalysisResult analysis = extractor.extract(result.response());
        log.info(
            "Fast path processed {}: {} linked, {} unresolved",
            filename,
            analysis.linked().size(),
            analysis.unresolved().size());
        return IngestOutcome.processed(analysis);
      }
      case SKIPPED -> log.info("Fast path not configured; storing {} for later", filename);
      case RECOVERABLE_FAILURE -> log.warn(
          "Fast path failed for {} ({}); falling back to Drive", filename, result.failureReason());
    }

    try {
      DriveFile stored = storage.upload(bytes, filename, mimeType);
      return IngestOutcome.deferred(stored.name() == null ? filename : stored.name());
    } catch (StorageException e) {
      log.error("Could not store {}: {}", filename, e.getMessage(), e);
      return IngestOutcome.failed(e.getMessage());
    }
  }
}
