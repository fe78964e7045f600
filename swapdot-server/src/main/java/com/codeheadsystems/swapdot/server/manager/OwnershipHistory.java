package com.codeheadsystems.swapdot.server.manager;

import com.codeheadsystems.swapdot.server.exception.PermissionException;
import java.util.ArrayList;
import java.util.List;

/**
 * The append-only rule for a token's previous owners.
 */
public final class OwnershipHistory {

  private OwnershipHistory() {
  }

  /**
   * True iff {@code proposed} extends {@code existing} without rewriting it. An empty history
   * accepts anything. At most one entry may be appended and it must not be the new owner.
   *
   * @param existing current previous owners
   * @param proposed candidate previous owners
   * @param newOwner owner after the change
   * @return whether the proposal is allowed
   */
  public static boolean isAppendOnly(List<String> existing, List<String> proposed, String newOwner) {
    if (existing.isEmpty()) {
      return true;
    }
    if (proposed.size() < existing.size()) {
      return false;
    }
    for (int i = 0; i < existing.size(); i++) {
      if (!existing.get(i).equals(proposed.get(i))) {
        return false;
      }
    }
    int added = proposed.size() - existing.size();
    if (added == 0) {
      return true;
    }
    return added == 1 && !proposed.get(proposed.size() - 1).equals(newOwner);
  }

  /**
   * Validates a proposal, throwing before any write is made.
   *
   * @param existing current previous owners
   * @param proposed candidate previous owners
   * @param newOwner owner after the change
   * @throws PermissionException if the history would be rewritten
   */
  public static void requireAppendOnly(List<String> existing, List<String> proposed, String newOwner) {
    if (!isAppendOnly(existing, proposed, newOwner)) {
      throw new PermissionException("Ownership history violation: previous owners are append-only");
    }
  }

  /**
   * Appends {@code owner} unless it is already the last entry.
   *
   * @param history the history
   * @param owner   the owner to record
   * @return a new list
   */
  public static List<String> appendIfNotLast(List<String> history, String owner) {
    if (owner == null || (!history.isEmpty() && history.get(history.size() - 1).equals(owner))) {
      return List.copyOf(history);
    }
    List<String> out = new ArrayList<>(history);
    out.add(owner);
    return List.copyOf(out);
  }
}
