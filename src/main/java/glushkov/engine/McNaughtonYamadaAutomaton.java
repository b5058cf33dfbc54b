package glushkov.engine;

import glushkov.graph.Dfa;
import glushkov.tree.Node;
import glushkov.util.IntSet;
import java.util.Set;

/**
 * McNaughton-Yamada automaton.
 *
 * <p>Deterministic from the outset: a state is the set of positions reached
 * so far (starting with just the marker {@code 0}). A transition first takes
 * everything that can follow the current positions and then keeps the
 * positions carrying the symbol read.
 */
public final class McNaughtonYamadaAutomaton extends Dfa<IntSet> {

  public final Positions positions;

  public McNaughtonYamadaAutomaton(Node node) {
    this(new Positions(node));
  }

  private McNaughtonYamadaAutomaton(Positions positions) {
    super(
      positions.alphabet,
      () -> IntSet.of(0),
      (IntSet state) -> state.intersects(positions.last0),
      (IntSet state, Character symbol) -> positions.select(positions.followSet(state), symbol),
      IntSet::isEmpty
    );
    this.positions = positions;
  }

  /**
   * Minimal DFA for the language of a pattern, via Brzozowski's double
   * reversal of McNaughton-Yamada automata.
   *
   * @param node syntax tree of the pattern
   * @return minimal deterministic automaton
   */
  public static Dfa<Set<IntSet>> minimize(Node node) {
    return Dfa.minimal(new McNaughtonYamadaAutomaton(node.reverse()));
  }
}
