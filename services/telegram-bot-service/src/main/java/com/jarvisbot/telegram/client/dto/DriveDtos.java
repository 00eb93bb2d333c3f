package com.jarvisbot.telegram.client.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

public final class DriveDtos {
  private DriveDtos() {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record DriveFile(String id, String name) {}

  public record RenameRequest(String name) {}
}
