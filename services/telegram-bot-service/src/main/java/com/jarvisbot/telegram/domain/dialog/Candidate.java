package com.jarvisbot.telegram.domain.dialog;

/** A contact the user may pick for a reference. {@code company} is optional. */
public record Candidate(String id, String name, String company) {

  public String label() {
    if (company == null || company.isBlank()) {
      return name;
    }
    return name + " (" + company + ")";
  }
}
