package com.jarvisbot.telegram.client;

import com.jarvisbot.telegram.client.dto.ContactDtos.ContactItem;
import com.jarvisbot.telegram.client.dto.ContactDtos.CreateRequest;
import com.jarvisbot.telegram.client.dto.ContactDtos.CreateResponse;
import com.jarvisbot.telegram.client.dto.ContactDtos.LinkRequest;
import com.jarvisbot.telegram.client.dto.ContactDtos.LinkResponse;
import com.jarvisbot.telegram.client.dto.ContactDtos.SearchResponse;
import com.jarvisbot.telegram.config.ContactsProperties;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/** Contacts collaborator: link a contact to a meeting, search contacts, create a contact. */
@Service
@Slf4j
public class ContactsClient {

  private final RestClient rest;
  private final ContactsProperties properties;

  public ContactsClient(
      @Qualifier("contactsRestClient") RestClient rest, ContactsProperties properties) {
    this.rest = rest;
    this.properties = properties;
  }

  public boolean isConfigured() {
    return properties.isConfigured();
  }

  public LinkResponse link(String meetingId, String contactId) {
    try {
      LinkResponse res =
          rest.post()
              .uri("/api/contacts/link")
              .body(new LinkRequest(meetingId, contactId))
              .retrieve()
              .body(LinkResponse.class);
      return res == null ? new LinkResponse("ok", null) : res;
    } catch (RestClientException e) {
      throw new ContactsClientException("link failed: " + e.getMessage(), e);
    }
  }

  public List<ContactItem> search(String query, int limit) {
    try {
      SearchResponse res =
          rest.get()
              .uri(
                  uriBuilder ->
                      uriBuilder
                          .path("/api/contacts/search")
                          .queryParam("q", query)
                          .queryParam("limit", limit)
                          .build())
              .retrieve()
              .body(SearchResponse.class);
      if (res == null || res.contacts() == null) {
        return List.of();
      }
      return res.contacts();
    } catch (RestClientException e) {
      throw new ContactsClientException("search failed: " + e.getMessage(), e);
    }
  }

  public List<ContactItem> search(String query) {
    return search(query, properties.searchLimit());
  }

  public CreateResponse create(String firstName, String lastName, String meetingId) {
    try {
      CreateResponse res =
          rest.post()
              .uri("/api/contacts")
              .body(new CreateRequest(firstName, lastName, meetingId))
              .retrieve()
              .body(CreateResponse.class);
      if (res == null) {
        throw new ContactsClientException("create returned an empty body");
      }
      log.info("Created contact {} for meeting {}", res.id(), meetingId);
      return res;
    } catch (RestClientException e) {
      throw new ContactsClientException("create failed: " + e.getMessage(), e);
    }
  }
}
