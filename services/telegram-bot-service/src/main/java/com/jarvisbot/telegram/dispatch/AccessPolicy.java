package com.jarvisbot.telegram.dispatch;

import java.util.Arrays;
import java.util.Set;
import java.util.stream.Collectors;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/** Static allow-list of Telegram user ids. An empty list lets everyone in. */
@Component
public class AccessPolicy {

  private final Set<String> allowed;

  public AccessPolicy(@Value("${telegram.allowed-user-ids:}") String allowedUserIds) {
    this.allowed =
        allowedUserIds == null
            ? Set.of()
            : Arrays.stream(allowedUserIds.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toUnmodifiableSet());
  }

  public boolean isAllowed(String userId) {
    return allowed.isEmpty() || (userId != null && allowed.contains(userId));
  }
}
