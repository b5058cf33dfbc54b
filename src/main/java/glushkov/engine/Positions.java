package glushkov.engine;

import glushkov.tree.FollowPair;
import glushkov.tree.Node;
import glushkov.util.IntSet;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;

/**
 * Position attributes of a syntax tree, arranged for the automata
 * constructions.
 *
 * <p>The follow relation is indexed by its first component, with the marker
 * position {@code 0} followed by the first positions of the tree.
 */
public final class Positions {

  /**
   * Symbol at each (real) position.
   */
  public final SortedMap<Integer, Character> pos;

  /**
   * Positions that can start a match.
   */
  public final IntSet first;

  /**
   * Positions that can end a match, plus {@code 0} if the tree is nullable.
   */
  public final IntSet last0;

  /**
   * Distinct symbols, in ascending order.
   */
  public final List<Character> alphabet;

  // `follows[i]` is the set of positions that can follow `i`
  private final IntSet[] follows;

  // Symbol at each position (index 0 is unused)
  private final char[] symbols;

  private final Map<IntSet, IntSet> followSets = new HashMap<>();

  public Positions(Node node) {
    this.pos = node.pos();
    this.first = node.first();
    this.last0 = node.last0();
    this.alphabet = node.alphabet();

    final int size = pos.isEmpty() ? 0 : pos.lastKey();
    this.symbols = new char[size + 1];
    for (Map.Entry<Integer, Character> entry : pos.entrySet()) {
      symbols[entry.getKey()] = entry.getValue();
    }

    final List<List<Integer>> followLists = new ArrayList<>();
    for (int i = 0; i <= size; i++) {
      followLists.add(new ArrayList<>());
    }
    for (FollowPair pair : node.follow()) {
      followLists.get(pair.from()).add(pair.to());
    }
    this.follows = new IntSet[size + 1];
    follows[0] = first;
    for (int i = 1; i <= size; i++) {
      follows[i] = IntSet.of(followLists.get(i));
    }
  }

  /**
   * Largest position.
   */
  public int size() {
    return symbols.length - 1;
  }

  /**
   * Real positions: {@code 1} to {@link #size()} for a parsed pattern, but
   * possibly fewer for a subtree.
   */
  public IntSet positions() {
    return IntSet.of(pos.keySet());
  }

  public char symbolAt(int position) {
    return symbols[position];
  }

  public boolean isLast0(int position) {
    return last0.contains(position);
  }

  /**
   * Positions that can follow a position.
   *
   * @param position real position, or {@code 0} for the start
   * @return following positions
   */
  public IntSet followOf(int position) {
    return follows[position];
  }

  /**
   * Positions that can follow any of the positions in a set.
   *
   * @param positions set of positions (possibly including {@code 0})
   * @return union of the following positions
   */
  public IntSet followSet(IntSet positions) {
    IntSet union = followSets.get(positions);
    if (union == null) {
      union = positions
        .stream()
        .mapToObj(position -> follows[position])
        .reduce(IntSet.EMPTY, IntSet::union);
      followSets.put(positions, union);
    }
    return union;
  }

  /**
   * Restrict a set of positions to those carrying a symbol.
   *
   * @param positions real positions
   * @param symbol symbol to keep
   * @return positions whose symbol is {@code symbol}
   */
  public IntSet select(IntSet positions, char symbol) {
    return positions.filter(i -> i > 0 && symbols[i] == symbol);
  }
}
