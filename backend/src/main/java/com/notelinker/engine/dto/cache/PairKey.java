package com.notelinker.engine.dto.cache;

import lombok.EqualsAndHashCode;
import lombok.Getter;

/** Order-independent identity of a note pair: the smaller id always comes first. */
@Getter
@EqualsAndHashCode
public final class PairKey implements Comparable<PairKey> {

  private static final String SEPARATOR = ":";

  private final String first;
  private final String second;

  private PairKey(String first, String second) {
    this.first = first;
    this.second = second;
  }

  public static PairKey of(String a, String b) {
    if (a == null || b == null) {
      throw new IllegalArgumentException("Pair ids must not be null");
    }
    if (a.equals(b)) {
      throw new IllegalArgumentException("A note cannot be paired with itself: " + a);
    }
    return a.compareTo(b) < 0 ? new PairKey(a, b) : new PairKey(b, a);
  }

  /** Parses the form produced by {@link #toString()}. */
  public static PairKey parse(String value) {
    int split = value.indexOf(SEPARATOR);
    if (split <= 0 || split == value.length() - 1) {
      throw new IllegalArgumentException("Not a pair key: " + value);
    }
    return of(value.substring(0, split), value.substring(split + 1));
  }

  public boolean contains(String documentId) {
    return first.equals(documentId) || second.equals(documentId);
  }

  @Override
  public int compareTo(PairKey other) {
    int result = first.compareTo(other.first);
    return result != 0 ? result : second.compareTo(other.second);
  }

  @Override
  public String toString() {
    return first + SEPARATOR + second;
  }
}
