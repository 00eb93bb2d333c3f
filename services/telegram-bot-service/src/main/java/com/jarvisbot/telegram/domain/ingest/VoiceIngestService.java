package com.jarvisbot.telegram.domain.ingest;

import com.jarvisbot.telegram.domain.FingerprintCache;
import com.jarvisbot.telegram.domain.dialog.DialogStep;
import com.jarvisbot.telegram.domain.dialog.PendingLinkQueue;
import com.jarvisbot.telegram.model.AudioMessage;
import com.jarvisbot.telegram.model.ChatResponse;
import com.jarvisbot.telegram.model.OutgoingMessage;
import com.jarvisbot.telegram.render.PromptRenderer;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Audio entry point: duplicate guard, ingest, then the first contact question if any.
 *
 * <p>Split in two so the transport can show a status line between acceptance and the (slow)
 * download and analysis.
 */
@Service
@Slf4j
public class VoiceIngestService {

  static final String DOWNLOAD_FAILED = "❌ Error: could not download the audio from Telegram.";

  private final FingerprintCache fingerprints;
  private final PendingLinkQueue queue;
  private final FileNamePolicy fileNames;
  private final IngestOrchestrator orchestrator;
  private final PromptRenderer renderer;

  public VoiceIngestService(
      FingerprintCache fingerprints,
      PendingLinkQueue queue,
      FileNamePolicy fileNames,
      IngestOrchestrator orchestrator,
      PromptRenderer renderer) {
    this.fingerprints = fingerprints;
    this.queue = queue;
    this.fileNames = fileNames;
    this.orchestrator = orchestrator;
    this.renderer = renderer;
  }

  /**
   * @return empty for a repeat delivery of a file seen within the dedup window; otherwise a ticket,
   *     after the user's open contact session has been discarded
   */
  public Optional<IngestTicket> accept(AudioMessage audio) {
    String fingerprint = audio.fileUniqueId() == null ? audio.fileId() : audio.fileUniqueId();
    if (fingerprints.seen(fingerprint)) {
      log.info(
          "Duplicate {} {} from user {} ignored",
          audio.kind().prefix(),
          fingerprint,
          audio.userId());
      return Optional.empty();
    }
    long generation = queue.beginIngest(audio.userId());
    return Optional.of(new IngestTicket(audio, fileNames.fileName(audio), generation));
  }

  public ChatResponse process(IngestTicket ticket, byte[] bytes) {
    AudioMessage audio = ticket.audio();
    if (bytes == null || bytes.length == 0) {
      return ChatResponse.ofText(DOWNLOAD_FAILED);
    }
    log.info(
        "Ingesting {} ({} bytes, {} s) from user {}",
        ticket.fileName(),
        bytes.length,
        audio.durationSeconds(),
        audio.userId());

    IngestOutcome outcome =
        orchestrator.ingest(bytes, ticket.fileName(), audio.effectiveMimeType(), audio.handle());
    return switch (outcome.status()) {
      case PROCESSED -> processed(ticket, outcome.analysis());
      case DEFERRED -> ChatResponse.ofText(
          "✅ Audio file uploaded!\n\n📁 File: "
              + outcome.storedFileName()
              + "\n\nProcessing will begin automatically.");
      case FAILED -> ChatResponse.ofText("❌ Error: " + outcome.error());
    };
  }

  private ChatResponse processed(IngestTicket ticket, AnalysisResult analysis) {
    String userId = ticket.audio().userId();
    ChatResponse response = ChatResponse.of(renderer.summary(userId, analysis));
    if (!analysis.hasUnresolved()) {
      return response;
    }
    Optional<DialogStep> first =
        queue.startSessionIfLatest(userId, ticket.generation(), analysis.unresolved());
    if (first.isEmpty()) {
      return response;
    }
    OutgoingMessage prompt = renderer.prompt(userId, first.get());
    return response.and(prompt);
  }
}
