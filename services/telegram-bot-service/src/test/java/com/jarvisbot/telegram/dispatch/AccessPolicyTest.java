package com.jarvisbot.telegram.dispatch;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class AccessPolicyTest {

  @Test
  void emptyList_allowsEveryone() {
    assertThat(new AccessPolicy("").isAllowed("1")).isTrue();
    assertThat(new AccessPolicy(null).isAllowed("1")).isTrue();
  }

  @Test
  void listedIdsOnly() {
    AccessPolicy policy = new AccessPolicy(" 11,22 ,");

    assertThat(policy.isAllowed("11")).isTrue();
    assertThat(policy.isAllowed("22")).isTrue();
    assertThat(policy.isAllowed("33")).isFalse();
    assertThat(policy.isAllowed(null)).isFalse();
  }
}
