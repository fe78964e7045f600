package com.codeheadsystems.swapdot.server.manager;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.swapdot.server.exception.PermissionException;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import org.junit.jupiter.api.Test;

class OwnershipHistoryTest {

  @Test
  void emptyHistory_acceptsAnything() {
    assertThat(OwnershipHistory.isAppendOnly(List.of(), List.of("Z", "Q"), "B")).isTrue();
  }

  @Test
  void unchangedHistory_isAccepted() {
    assertThat(OwnershipHistory.isAppendOnly(List.of("X", "Y"), List.of("X", "Y"), "B")).isTrue();
  }

  @Test
  void singleAppend_isAccepted() {
    assertThat(OwnershipHistory.isAppendOnly(List.of("X", "Y"), List.of("X", "Y", "A"), "B")).isTrue();
  }

  @Test
  void appendingTheNewOwner_isRejected() {
    assertThat(OwnershipHistory.isAppendOnly(List.of("X"), List.of("X", "B"), "B")).isFalse();
  }

  @Test
  void rewriteTruncateOrMultiAppend_isRejected() {
    assertThat(OwnershipHistory.isAppendOnly(List.of("X", "Y"), List.of("X", "Q", "A"), "B")).isFalse();
    assertThat(OwnershipHistory.isAppendOnly(List.of("X", "Y"), List.of("X"), "B")).isFalse();
    assertThat(OwnershipHistory.isAppendOnly(List.of("X", "Y"), List.of("X", "Y", "A", "C"), "B")).isFalse();
  }

  @Test
  void requireAppendOnly_throwsPermission() {
    assertThatThrownBy(() -> OwnershipHistory.requireAppendOnly(List.of("X"), List.of(), "B"))
        .isInstanceOf(PermissionException.class)
        .hasMessageContaining("Ownership history violation");
  }

  @Test
  void appendIfNotLast_skipsDuplicateTail() {
    assertThat(OwnershipHistory.appendIfNotLast(List.of("X", "A"), "A")).containsExactly("X", "A");
    assertThat(OwnershipHistory.appendIfNotLast(List.of("X"), "A")).containsExactly("X", "A");
    assertThat(OwnershipHistory.appendIfNotLast(List.of(), "A")).containsExactly("A");
  }

  @Test
  void randomMutations_neverPassUnlessPrefixPreserved() {
    Random random = new Random(42);
    for (int round = 0; round < 2_000; round++) {
      List<String> existing = randomHistory(random, 1 + random.nextInt(5));
      List<String> proposed = new ArrayList<>(existing);
      switch (random.nextInt(4)) {
        case 0 -> proposed.set(random.nextInt(proposed.size()), "mutated");
        case 1 -> proposed.remove(random.nextInt(proposed.size()));
        case 2 -> proposed.add(random.nextInt(proposed.size()), "inserted");
        default -> proposed.add("appended");
      }
      boolean prefixKept = proposed.size() >= existing.size()
          && proposed.subList(0, existing.size()).equals(existing)
          && proposed.size() - existing.size() <= 1;

      assertThat(OwnershipHistory.isAppendOnly(existing, proposed, "owner"))
          .as("existing=%s proposed=%s", existing, proposed)
          .isEqualTo(prefixKept);
    }
  }

  private static List<String> randomHistory(Random random, int size) {
    List<String> history = new ArrayList<>();
    for (int i = 0; i < size; i++) {
      history.add("user-" + random.nextInt(1000));
    }
    return history;
  }
}
