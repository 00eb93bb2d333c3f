package com.jarvisbot.telegram.domain.ingest;

import com.jarvisbot.telegram.domain.dialog.Candidate;
import java.util.List;

/** A mention the analysis already matched to a contact, with alternatives for correction. */
public record LinkedReference(
    String meetingId,
    String searchedName,
    String contactName,
    String company,
    List<Candidate> alternatives) {

  public LinkedReference {
    alternatives = alternatives == null ? List.of() : List.copyOf(alternatives);
  }

  public String label() {
    String name = contactName == null || contactName.isBlank() ? searchedName : contactName;
    if (company == null || company.isBlank()) {
      return name;
    }
    return name + " (" + company + ")";
  }
}
