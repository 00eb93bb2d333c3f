package com.jarvisbot.telegram.domain.ingest;

import com.jarvisbot.telegram.client.dto.IngestDtos.ContactMatch;
import com.jarvisbot.telegram.client.dto.IngestDtos.Details;
import com.jarvisbot.telegram.client.dto.IngestDtos.IngestResponse;
import com.jarvisbot.telegram.client.dto.IngestDtos.LinkedContact;
import com.jarvisbot.telegram.client.dto.IngestDtos.Suggestion;
import com.jarvisbot.telegram.domain.dialog.Candidate;
import com.jarvisbot.telegram.domain.dialog.PendingReference;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Splits the analysis body into linked and unresolved mentions.
 *
 * <p>An unmatched entry without its own {@code meeting_id} takes the {@code meeting_ids} entry at
 * its position among unmatched entries, else the first one. Entries left without any meeting id
 * cannot be linked and are dropped.
 */
@Component
@Slf4j
public class ContactMatchExtractor {

  public AnalysisResult extract(IngestResponse response) {
    Details details = response.details();
    int transcriptLength =
        details == null || details.transcriptLength() == null ? 0 : details.transcriptLength();
    List<ContactMatch> matches =
        details == null || details.contactMatches() == null ? List.of() : details.contactMatches();
    List<String> meetingIds =
        details == null || details.meetingIds() == null ? List.of() : details.meetingIds();

    List<LinkedReference> linked = new ArrayList<>();
    List<PendingReference> unresolved = new ArrayList<>();
    int unmatchedIndex = 0;

    for (ContactMatch match : matches) {
      if (match == null) {
        continue;
      }
      if (match.matched()) {
        linked.add(toLinked(match, meetingIds));
        continue;
      }

      String meetingId = meetingIdFor(match, meetingIds, unmatchedIndex++);
      if (meetingId == null) {
        log.warn("Dropping unmatched mention '{}': no meeting id", match.searchedName());
        continue;
      }
      unresolved.add(PendingReference.of(meetingId, match.searchedName(), candidates(match)));
    }

    return new AnalysisResult(response.summary(), transcriptLength, linked, unresolved);
  }

  private static LinkedReference toLinked(ContactMatch match, List<String> meetingIds) {
    LinkedContact contact = match.linkedContact();
    String meetingId = present(match.meetingId()) ? match.meetingId() : first(meetingIds);
    return new LinkedReference(
        meetingId,
        match.searchedName(),
        contact == null ? null : contact.name(),
        contact == null ? null : contact.company(),
        candidates(match));
  }

  private static String meetingIdFor(ContactMatch match, List<String> meetingIds, int position) {
    if (present(match.meetingId())) {
      return match.meetingId();
    }
    if (position < meetingIds.size() && present(meetingIds.get(position))) {
      return meetingIds.get(position);
    }
    return first(meetingIds);
  }

  private static List<Candidate> candidates(ContactMatch match) {
    if (match.suggestions() == null) {
      return List.of();
    }
    List<Candidate> out = new ArrayList<>();
    for (Suggestion s : match.suggestions()) {
      if (s != null && present(s.id())) {
        out.add(new Candidate(s.id(), s.name(), s.company()));
      }
    }
    return out;
  }

  private static String first(List<String> meetingIds) {
    return meetingIds.isEmpty() || !present(meetingIds.get(0)) ? null : meetingIds.get(0);
  }

  private static boolean present(String s) {
    return s != null && !s.isBlank();
  }
}
