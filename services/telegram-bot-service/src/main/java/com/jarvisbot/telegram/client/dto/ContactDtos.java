package com.jarvisbot.telegram.client.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/** Wire format of the contacts (intelligence) service. */
public final class ContactDtos {
  private ContactDtos() {}

  public record LinkRequest(
      @JsonProperty("meeting_id") String meetingId,
      @JsonProperty("contact_id") String contactId) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record LinkResponse(String status, String company) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record SearchResponse(List<ContactItem> contacts) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record ContactItem(String id, String name, String company) {}

  public record CreateRequest(
      @JsonProperty("first_name") String firstName,
      @JsonProperty("last_name") String lastName,
      @JsonProperty("meeting_id") String meetingId) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record CreateResponse(String id, String name) {}
}
