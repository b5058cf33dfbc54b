package glushkov.engine;

import glushkov.graph.Dfa;
import glushkov.graph.Nfa;
import glushkov.tree.Node;
import glushkov.util.IntSet;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Position (Glushkov) automaton.
 *
 * <p>States are the positions of the pattern, plus the start marker {@code 0}.
 * Reading a symbol from a position leads to every following position carrying
 * that symbol. A position is accepting if it can end a match (and the start
 * marker is accepting if the pattern is nullable).
 *
 * <p>The counted states are the real positions {@code 1..N}; the start
 * marker is left out.
 */
public final class PositionAutomaton extends Nfa<Integer> {

  public final Positions positions;

  public PositionAutomaton(Node node) {
    this(new Positions(node));
  }

  private PositionAutomaton(Positions positions) {
    super(
      positions.alphabet,
      () -> Set.of(0),
      positions::isLast0,
      (Integer state, Character symbol) -> boxed(positions.select(positions.followOf(state), symbol)),
      Optional.of(boxed(positions.positions()))
    );
    this.positions = positions;
  }

  static Set<Integer> boxed(IntSet set) {
    return set.stream().boxed().collect(Collectors.toUnmodifiableSet());
  }

  /**
   * Minimal DFA for the language of a pattern, via Brzozowski's double
   * reversal of position automata.
   *
   * @param node syntax tree of the pattern
   * @return minimal deterministic automaton
   */
  public static Dfa<Set<Set<Integer>>> minimize(Node node) {
    return Dfa.minimal(new PositionAutomaton(node.reverse()).determinise());
  }
}
