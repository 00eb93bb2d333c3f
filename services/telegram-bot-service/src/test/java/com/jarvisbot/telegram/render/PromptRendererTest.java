package com.jarvisbot.telegram.render;

import static org.assertj.core.api.Assertions.assertThat;

import com.jarvisbot.telegram.domain.dialog.ActionKind;
import com.jarvisbot.telegram.domain.dialog.ActionToken;
import com.jarvisbot.telegram.domain.dialog.CallbackAction;
import com.jarvisbot.telegram.domain.dialog.CallbackActionRegistry;
import com.jarvisbot.telegram.domain.dialog.Candidate;
import com.jarvisbot.telegram.domain.dialog.DialogStep;
import com.jarvisbot.telegram.domain.dialog.PendingReference;
import com.jarvisbot.telegram.domain.ingest.AnalysisResult;
import com.jarvisbot.telegram.domain.ingest.LinkedReference;
import com.jarvisbot.telegram.model.InlineKeyboard;
import com.jarvisbot.telegram.model.OutgoingMessage;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.Test;

class PromptRendererTest {

  private final CallbackActionRegistry registry =
      new CallbackActionRegistry(1000, Duration.ofHours(1));
  private final PromptRenderer renderer = new PromptRenderer(registry);

  private static DialogStep step(int position, int total, List<Candidate> candidates) {
    return new DialogStep(1, PendingReference.of("m1", "Jon", candidates), position, total);
  }

  @Test
  void singleReference_hasNoProgressMarker() {
    String text =
        PromptRenderer.promptText(step(1, 1, List.of(new Candidate("c1", "Jon Lee", null))));

    assertThat(text).startsWith("❓ Who is \"Jon\"?\n");
    assertThat(text).doesNotContain("(1/1)");
    assertThat(text).contains("1 = Jon Lee\n");
    assertThat(text).contains("0 = Skip");
    assertThat(text).contains("type the correct full name");
  }

  @Test
  void multipleReferences_showProgressAndCompany() {
    String text =
        PromptRenderer.promptText(
            step(
                2,
                3,
                List.of(new Candidate("c1", "Jon Lee", "Acme"), new Candidate("c2", "Jon Ray",
                    null))));

    assertThat(text).contains("(2/3)");
    assertThat(text).contains("1 = Jon Lee (Acme)\n2 = Jon Ray\n0 = Skip");
  }

  @Test
  void zeroCandidates_stillOffersSkipAndFreeText() {
    String text = PromptRenderer.promptText(step(1, 1, List.of()));

    assertThat(text).contains("No matching contacts found.");
    assertThat(text).contains("0 = Skip");
  }

  @Test
  void prompt_mintsLinkCreateAndSkipButtons() {
    OutgoingMessage msg =
        renderer.prompt("u1", step(1, 1, List.of(new Candidate("c1", "Jon Lee", null))));

    InlineKeyboard keyboard = msg.keyboard();
    assertThat(keyboard.rows()).hasSize(2);

    String link = keyboard.rows().get(0).get(0).callbackData();
    ActionToken token = ActionToken.parse(link).orElseThrow();
    assertThat(token.kind()).isEqualTo(ActionKind.LINK);
    CallbackAction action = registry.consume(token).orElseThrow();
    assertThat(action.contactId()).isEqualTo("c1");
    assertThat(action.meetingId()).isEqualTo("m1");
    assertThat(action.userId()).isEqualTo("u1");

    List<InlineKeyboard.Button> last = keyboard.rows().get(1);
    assertThat(ActionToken.parse(last.get(0).callbackData()).orElseThrow().kind())
        .isEqualTo(ActionKind.CREATE);
    assertThat(ActionToken.parse(last.get(1).callbackData()).orElseThrow().kind())
        .isEqualTo(ActionKind.SKIP);
  }

  @Test
  void summary_listsLinkedAndOffersCorrections() {
    AnalysisResult analysis =
        new AnalysisResult(
            "Met Ann about the launch.",
            1234,
            List.of(
                new LinkedReference(
                    "m1", "Ann", "Ann Smith", "Acme", List.of(new Candidate("c7", "Ann Jones",
                        null)))),
            List.of(PendingReference.of("m1", "Jon", List.of())));

    OutgoingMessage msg = renderer.summary("u1", analysis);

    assertThat(msg.text())
        .contains("Met Ann about the launch.")
        .contains("1234 characters")
        .contains("Linked: Ann Smith (Acme)")
        .contains("1 contact needs your input");
    String data = msg.keyboard().rows().get(0).get(0).callbackData();
    assertThat(ActionToken.parse(data).orElseThrow().kind()).isEqualTo(ActionKind.CORRECT);
  }

  @Test
  void summary_withoutAlternatives_hasNoKeyboard() {
    AnalysisResult analysis = new AnalysisResult(null, 10, List.of(), List.of());

    assertThat(renderer.summary("u1", analysis).keyboard()).isNull();
  }
}
