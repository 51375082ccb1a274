package io.lacuna.regular;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.TreeSet;

/**
 * An immutable state label.  Atomic states carry a plain label, composite states (produced by subset construction)
 * carry a sorted, duplicate-free list of their member states, so that two composites built in a different order are
 * equal and hash identically.
 */
public final class StateId implements Comparable<StateId> {

  private final String label;
  private final List<StateId> members;
  private final int hash;

  private StateId(String label, List<StateId> members) {
    this.label = label;
    this.members = members;
    this.hash = label != null ? label.hashCode() : 31 * members.hashCode() + 1;
  }

  /**
   * @return an atomic state with the given {@code label}
   */
  public static StateId of(String label) {
    if (label == null || label.isEmpty()) {
      throw new IllegalArgumentException("state label must be non-empty");
    }
    return new StateId(label, null);
  }

  /**
   * @return a composite state over {@code states}, which may be empty
   */
  public static StateId composite(Iterable<StateId> states) {
    TreeSet<StateId> sorted = new TreeSet<>();
    states.forEach(sorted::add);
    return new StateId(null, Collections.unmodifiableList(new ArrayList<>(sorted)));
  }

  public boolean isComposite() {
    return members != null;
  }

  /**
   * @return the underlying states of a composite state in canonical order, or a singleton list of this state if atomic
   */
  public List<StateId> members() {
    return members != null ? members : Collections.singletonList(this);
  }

  @Override
  public int compareTo(StateId o) {
    if (isComposite() != o.isComposite()) {
      return isComposite() ? 1 : -1;
    }

    if (!isComposite()) {
      return label.compareTo(o.label);
    }

    int n = Math.min(members.size(), o.members.size());
    for (int i = 0; i < n; i++) {
      int cmp = members.get(i).compareTo(o.members.get(i));
      if (cmp != 0) {
        return cmp;
      }
    }
    return Integer.compare(members.size(), o.members.size());
  }

  @Override
  public int hashCode() {
    return hash;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof StateId)) {
      return false;
    }

    StateId s = (StateId) obj;
    return hash == s.hash
            && (isComposite() ? members.equals(s.members) : label.equals(s.label));
  }

  @Override
  public String toString() {
    if (!isComposite()) {
      return label;
    }

    StringBuilder sb = new StringBuilder("{");
    if (members.size() > 0) {
      members.forEach(s -> sb.append(s).append(", "));
      sb.delete(sb.length() - 2, sb.length());
    }
    sb.append("}");
    return sb.toString();
  }
}
