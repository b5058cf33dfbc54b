package glushkov.util;

import java.util.BitSet;
import java.util.Collection;
import java.util.function.IntPredicate;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Immutable set of small non-negative integers.
 *
 * <p>Positions in a pattern are dense ({@code 0} to the number of symbols), so
 * the set is backed by a bitset.
 */
public final class IntSet {

  public static final IntSet EMPTY = new IntSet(new BitSet());

  // Never mutated after construction
  private final BitSet bits;

  private IntSet(BitSet bits) {
    this.bits = bits;
  }

  public static IntSet of(int... elems) {
    final var bits = new BitSet();
    for (int elem : elems) {
      bits.set(checkElement(elem));
    }
    return new IntSet(bits);
  }

  public static IntSet of(Collection<Integer> elems) {
    final var bits = new BitSet();
    for (Integer elem : elems) {
      bits.set(checkElement(elem));
    }
    return new IntSet(bits);
  }

  public static IntSet fromStream(IntStream elems) {
    final var bits = new BitSet();
    elems.forEach(elem -> bits.set(checkElement(elem)));
    return new IntSet(bits);
  }

  /**
   * Set of all integers in {@code [from, to]}.
   *
   * @param from smallest element (inclusive)
   * @param to largest element (inclusive)
   * @return range as a set (empty if {@code to < from})
   */
  public static IntSet range(int from, int to) {
    final var bits = new BitSet();
    if (from <= to) {
      bits.set(checkElement(from), to + 1);
    }
    return new IntSet(bits);
  }

  private static int checkElement(int elem) {
    if (elem < 0) {
      throw new IllegalArgumentException("negative element " + elem);
    }
    return elem;
  }

  public boolean contains(int elem) {
    return elem >= 0 && bits.get(elem);
  }

  public boolean isEmpty() {
    return bits.isEmpty();
  }

  public int size() {
    return bits.cardinality();
  }

  /**
   * Largest element of the set.
   *
   * @return largest element, or {@code -1} if the set is empty
   */
  public int max() {
    return bits.length() - 1;
  }

  public IntStream stream() {
    return bits.stream();
  }

  public boolean anyMatch(IntPredicate predicate) {
    for (int i = bits.nextSetBit(0); i >= 0; i = bits.nextSetBit(i + 1)) {
      if (predicate.test(i)) {
        return true;
      }
    }
    return false;
  }

  public IntSet filter(IntPredicate predicate) {
    final var filtered = new BitSet();
    for (int i = bits.nextSetBit(0); i >= 0; i = bits.nextSetBit(i + 1)) {
      if (predicate.test(i)) {
        filtered.set(i);
      }
    }
    return new IntSet(filtered);
  }

  public IntSet union(IntSet other) {
    if (other.isEmpty()) {
      return this;
    } else if (isEmpty()) {
      return other;
    }
    final var union = (BitSet) bits.clone();
    union.or(other.bits);
    return new IntSet(union);
  }

  public IntSet with(int elem) {
    if (contains(elem)) {
      return this;
    }
    final var added = (BitSet) bits.clone();
    added.set(checkElement(elem));
    return new IntSet(added);
  }

  public boolean intersects(IntSet other) {
    return bits.intersects(other.bits);
  }

  @Override
  public int hashCode() {
    return bits.hashCode();
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    } else if (!(obj instanceof IntSet)) {
      return false;
    } else {
      return bits.equals(((IntSet) obj).bits);
    }
  }

  @Override
  public String toString() {
    return bits
      .stream()
      .mapToObj(Integer::toString)
      .collect(Collectors.joining(",", "{", "}"));
  }
}
