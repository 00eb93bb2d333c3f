package com.jarvisbot.telegram.render;

import com.jarvisbot.telegram.domain.dialog.CallbackAction;
import com.jarvisbot.telegram.domain.dialog.CallbackActionRegistry;
import com.jarvisbot.telegram.domain.dialog.Candidate;
import com.jarvisbot.telegram.domain.dialog.DialogStep;
import com.jarvisbot.telegram.domain.dialog.PendingReference;
import com.jarvisbot.telegram.domain.ingest.AnalysisResult;
import com.jarvisbot.telegram.domain.ingest.LinkedReference;
import com.jarvisbot.telegram.model.ChatResponse;
import com.jarvisbot.telegram.model.InlineKeyboard;
import com.jarvisbot.telegram.model.OutgoingMessage;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;

/**
 * Text and button rendering for the contact dialog.
 *
 * <p>Every prompt is fully usable as plain text (numbered list, {@code 0 = Skip}, free-text
 * invitation); the inline keyboard is a shortcut on top. Buttons are minted through {@link
 * CallbackActionRegistry}, so rendering has the side effect of registering actions.
 */
@Component
public class PromptRenderer {

  public static final String SKIP_TOKEN = "0";
  public static final String COMPLETED = "🎉 All contacts are sorted. Thanks!";

  private static final int MAX_ALTERNATIVE_BUTTONS = 3;

  private final CallbackActionRegistry registry;

  public PromptRenderer(CallbackActionRegistry registry) {
    this.registry = registry;
  }

  public OutgoingMessage prompt(String userId, DialogStep step) {
    return OutgoingMessage.plain(promptText(step)).withKeyboard(promptKeyboard(userId, step));
  }

  public static String promptText(DialogStep step) {
    PendingReference ref = step.reference();
    StringBuilder sb = new StringBuilder();
    sb.append("❓ Who is \"").append(ref.searchedName()).append("\"?");
    if (step.total() > 1) {
      sb.append(" (").append(step.position()).append('/').append(step.total()).append(')');
    }
    sb.append("\n\n");

    List<Candidate> candidates = ref.candidates();
    if (candidates.isEmpty()) {
      sb.append("No matching contacts found.\n");
    }
    for (int i = 0; i < candidates.size(); i++) {
      sb.append(i + 1).append(" = ").append(candidates.get(i).label()).append('\n');
    }
    sb.append(SKIP_TOKEN).append(" = Skip\n\n");
    sb.append("Or type the correct full name.");
    return sb.toString();
  }

  /** Acknowledgement followed by the next prompt, or by the completion line. */
  public ChatResponse afterResolution(
      String userId, String acknowledgement, Optional<DialogStep> next) {
    ChatResponse response = ChatResponse.ofText(acknowledgement);
    if (next.isPresent()) {
      return response.and(prompt(userId, next.get()));
    }
    return response.and(OutgoingMessage.plain(COMPLETED));
  }

  public OutgoingMessage summary(String userId, AnalysisResult analysis) {
    StringBuilder sb = new StringBuilder("✅ Voice note processed!");
    if (analysis.summary() != null && !analysis.summary().isBlank()) {
      sb.append("\n\n").append(analysis.summary().trim());
    }
    sb.append("\n\n📝 Transcript: ").append(analysis.transcriptLength()).append(" characters");
    if (!analysis.linked().isEmpty()) {
      String names =
          analysis.linked().stream().map(LinkedReference::label).collect(Collectors.joining(", "));
      sb.append("\n👥 Linked: ").append(names);
    }
    int open = analysis.unresolved().size();
    if (open > 0) {
      sb.append("\n❓ ")
          .append(open)
          .append(open == 1 ? " contact needs" : " contacts need")
          .append(" your input.");
    }

    OutgoingMessage message = OutgoingMessage.plain(sb.toString());
    InlineKeyboard corrections = correctionKeyboard(userId, analysis.linked());
    return corrections == null ? message : message.withKeyboard(corrections);
  }

  private InlineKeyboard promptKeyboard(String userId, DialogStep step) {
    PendingReference ref = step.reference();
    List<List<InlineKeyboard.Button>> rows = new ArrayList<>();
    List<Candidate> candidates = ref.candidates();
    for (int i = 0; i < candidates.size(); i++) {
      Candidate c = candidates.get(i);
      String token = registry.register(CallbackAction.link(userId, step, c)).encode();
      rows.add(List.of(new InlineKeyboard.Button((i + 1) + ". " + c.label(), token)));
    }
    String create = registry.register(CallbackAction.create(userId, step)).encode();
    String skip = registry.register(CallbackAction.skip(userId, step)).encode();
    rows.add(
        List.of(
            new InlineKeyboard.Button("➕ New contact \"" + ref.searchedName() + "\"", create),
            new InlineKeyboard.Button("⏭ Skip", skip)));
    return new InlineKeyboard(rows);
  }

  private InlineKeyboard correctionKeyboard(String userId, List<LinkedReference> linked) {
    List<List<InlineKeyboard.Button>> rows = new ArrayList<>();
    for (LinkedReference ref : linked) {
      if (ref.meetingId() == null) {
        continue;
      }
      int shown = 0;
      for (Candidate alt : ref.alternatives()) {
        if (shown++ >= MAX_ALTERNATIVE_BUTTONS) {
          break;
        }
        String token =
            registry
                .register(CallbackAction.correct(userId, ref.meetingId(), ref.searchedName(), alt))
                .encode();
        String label = "🔁 " + ref.searchedName() + " → " + alt.label();
        rows.add(List.of(new InlineKeyboard.Button(label, token)));
      }
    }
    return rows.isEmpty() ? null : new InlineKeyboard(rows);
  }
}
