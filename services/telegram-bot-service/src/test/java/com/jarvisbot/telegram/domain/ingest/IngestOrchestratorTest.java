package com.jarvisbot.telegram.domain.ingest;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.jarvisbot.telegram.client.DriveStorageClient;
import com.jarvisbot.telegram.client.IngestClient;
import com.jarvisbot.telegram.client.StorageException;
import com.jarvisbot.telegram.client.dto.DriveDtos.DriveFile;
import com.jarvisbot.telegram.client.dto.IngestDtos.IngestResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class IngestOrchestratorTest {

  private static final byte[] BYTES = {1, 2, 3};

  private IngestClient fastPath;
  private DriveStorageClient storage;
  private IngestOrchestrator orchestrator;

  @BeforeEach
  void setUp() {
    fastPath = mock(IngestClient.class);
    storage = mock(DriveStorageClient.class);
    orchestrator = new IngestOrchestrator(fastPath, storage, new ContactMatchExtractor());
  }

  @Test
  void fastPathSuccess_isProcessed_withoutStorage() {
    when(fastPath.process(BYTES, "f.ogg", "alice"))
        .thenReturn(FastPathResult.success(new IngestResponse("success", "done", null, null)));

    IngestOutcome outcome = orchestrator.ingest(BYTES, "f.ogg", "audio/ogg", "alice");

    assertThat(outcome.status()).isEqualTo(IngestOutcome.Status.PROCESSED);
    assertThat(outcome.analysis().summary()).isEqualTo("done");
    verify(storage, never()).upload(any(), any(), any());
  }

  @Test
  void fastPathFailure_fallsBackToDrive() {
    when(fastPath.process(BYTES, "f.ogg", "alice")).thenReturn(FastPathResult.failure("HTTP 502"));
    when(storage.upload(BYTES, "f.ogg", "audio/ogg")).thenReturn(new DriveFile("d1", "f.ogg"));

    IngestOutcome outcome = orchestrator.ingest(BYTES, "f.ogg", "audio/ogg", "alice");

    assertThat(outcome.status()).isEqualTo(IngestOutcome.Status.DEFERRED);
    assertThat(outcome.storedFileName()).isEqualTo("f.ogg");
  }

  @Test
  void fastPathNotConfigured_goesStraightToDrive() {
    when(fastPath.process(BYTES, "f.ogg", "alice")).thenReturn(FastPathResult.skipped());
    when(storage.upload(BYTES, "f.ogg", "audio/ogg")).thenReturn(new DriveFile("d1", "f.ogg"));

    assertThat(orchestrator.ingest(BYTES, "f.ogg", "audio/ogg", "alice").status())
        .isEqualTo(IngestOutcome.Status.DEFERRED);
  }

  @Test
  void storageFailure_isFailedWithCause() {
    when(fastPath.process(BYTES, "f.ogg", "alice")).thenReturn(FastPathResult.failure("timeout"));
    when(storage.upload(BYTES, "f.ogg", "audio/ogg"))
        .thenThrow(new StorageException("Drive fallback is not configured"));

    IngestOutcome outcome = orchestrator.ingest(BYTES, "f.ogg", "audio/ogg", "alice");

    assertThat(outcome.status()).isEqualTo(IngestOutcome.Status.FAILED);
    assertThat(outcome.error()).contains("not configured");
  }
}
