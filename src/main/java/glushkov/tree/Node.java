package glushkov.tree;

import glushkov.util.IntSet;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.SortedMap;
import java.util.stream.Collectors;

/**
 * Regular expression syntax tree, annotated with the attributes used by the
 * position-based automata constructions.
 *
 * <p>Nodes are immutable and compare by value. Symbol occurrences are
 * identified by their position index: position {@code 0} is reserved for the
 * synthetic "before any symbol" marker and never appears in {@link #pos()}.
 *
 * <p>Attributes are computed on first request and then cached on the node.
 * Every attribute is a pure function of the subtree, so two threads racing to
 * fill a cache compute the same (immutable) value.
 */
public abstract class Node {

  private Boolean nullable;
  private IntSet first;
  private IntSet last;
  private IntSet last0;
  private Set<FollowPair> follow;
  private SortedMap<Integer, Character> pos;
  private Node reverse;

  Node() { }

  abstract boolean computeNullable();

  abstract IntSet computeFirst();

  abstract IntSet computeLast();

  abstract Set<FollowPair> computeFollow();

  abstract SortedMap<Integer, Character> computePos();

  abstract Node computeReverse();

  /**
   * Can the subtree match the empty string?
   */
  public final boolean nullable() {
    Boolean cached = nullable;
    if (cached == null) {
      nullable = cached = computeNullable();
    }
    return cached;
  }

  /**
   * Positions that can begin a match.
   */
  public final IntSet first() {
    IntSet cached = first;
    if (cached == null) {
      first = cached = computeFirst();
    }
    return cached;
  }

  /**
   * Positions that can end a (non-empty) match.
   */
  public final IntSet last() {
    IntSet cached = last;
    if (cached == null) {
      last = cached = computeLast();
    }
    return cached;
  }

  /**
   * Same as {@link #last()}, but including the marker position {@code 0} if
   * the subtree is nullable.
   */
  public final IntSet last0() {
    IntSet cached = last0;
    if (cached == null) {
      last0 = cached = nullable() ? last().with(0) : last();
    }
    return cached;
  }

  /**
   * Pairs of positions {@code (i, j)} such that {@code j} may immediately
   * follow {@code i} in some matched word.
   *
   * @return unmodifiable set of follow pairs
   */
  public final Set<FollowPair> follow() {
    Set<FollowPair> cached = follow;
    if (cached == null) {
      follow = cached = Collections.unmodifiableSet(computeFollow());
    }
    return cached;
  }

  /**
   * Symbol at every position of the subtree.
   *
   * @return unmodifiable map from position to symbol, in position order
   */
  public final SortedMap<Integer, Character> pos() {
    SortedMap<Integer, Character> cached = pos;
    if (cached == null) {
      pos = cached = Collections.unmodifiableSortedMap(computePos());
    }
    return cached;
  }

  /**
   * Mirror image of the tree, whose attributes describe the reversed
   * language. Positions keep their indices.
   */
  public final Node reverse() {
    Node cached = reverse;
    if (cached == null) {
      reverse = cached = computeReverse();
    }
    return cached;
  }

  /**
   * Number of symbol occurrences in the subtree.
   */
  public final int size() {
    return pos().size();
  }

  /**
   * Distinct symbols used in the subtree, in ascending order.
   */
  public final List<Character> alphabet() {
    return pos()
      .values()
      .stream()
      .distinct()
      .sorted()
      .collect(Collectors.toUnmodifiableList());
  }

  /**
   * Render the tree back into pattern syntax (without position indices).
   *
   * <p>Parsing the output produces a tree for the same language, although
   * left-nested alternations and concatenations come back right-nested.
   */
  public abstract String toPattern();

  /**
   * Binding strength of the node in pattern syntax (higher binds tighter).
   */
  abstract int precedence();

  final String toPatternWithin(int enclosingPrecedence) {
    final String pattern = toPattern();
    return precedence() < enclosingPrecedence ? "(" + pattern + ")" : pattern;
  }
}
