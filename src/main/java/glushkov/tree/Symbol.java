package glushkov.tree;

import glushkov.util.IntSet;
import java.util.Collections;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Occurrence of a literal symbol at a given position.
 */
public final class Symbol extends Node {

  /**
   * Characters with a meaning in pattern syntax.
   */
  public static final String RESERVED = "()|*";

  public final char value;
  public final int index;

  public Symbol(char value, int index) {
    if (index <= 0) {
      throw new IllegalArgumentException("symbol position must be positive, got " + index);
    } else if (RESERVED.indexOf(value) >= 0) {
      throw new IllegalArgumentException("'" + value + "' is reserved and cannot be a symbol");
    }
    this.value = value;
    this.index = index;
  }

  @Override
  boolean computeNullable() {
    return false;
  }

  @Override
  IntSet computeFirst() {
    return IntSet.of(index);
  }

  @Override
  IntSet computeLast() {
    return IntSet.of(index);
  }

  @Override
  Set<FollowPair> computeFollow() {
    return Collections.emptySet();
  }

  @Override
  SortedMap<Integer, Character> computePos() {
    final var pos = new TreeMap<Integer, Character>();
    pos.put(index, value);
    return pos;
  }

  @Override
  Node computeReverse() {
    return this;
  }

  @Override
  public String toPattern() {
    return String.valueOf(value);
  }

  @Override
  int precedence() {
    return 3;
  }

  @Override
  public int hashCode() {
    return 31 * Character.hashCode(value) + index;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    } else if (!(obj instanceof Symbol)) {
      return false;
    } else {
      final Symbol other = (Symbol) obj;
      return value == other.value && index == other.index;
    }
  }

  @Override
  public String toString() {
    return "Symbol('" + value + "', " + index + ")";
  }
}
