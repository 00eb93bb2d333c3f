package com.jarvisbot.telegram.client.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/** Wire format of the fast-path analysis endpoint. */
public final class IngestDtos {
  private IngestDtos() {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record IngestResponse(String status, String summary, String error, Details details) {

    public boolean isSuccess() {
      return "success".equalsIgnoreCase(status);
    }
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Details(
      @JsonProperty("transcript_length") Integer transcriptLength,
      @JsonProperty("contact_matches") List<ContactMatch> contactMatches,
      @JsonProperty("meeting_ids") List<String> meetingIds) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record ContactMatch(
      boolean matched,
      @JsonProperty("meeting_id") String meetingId,
      @JsonProperty("searched_name") String searchedName,
      @JsonProperty("linked_contact") LinkedContact linkedContact,
      List<Suggestion> suggestions) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record LinkedContact(String id, String name, String company) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Suggestion(String id, String name, String company) {}
}
