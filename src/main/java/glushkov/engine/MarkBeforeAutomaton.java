package glushkov.engine;

import glushkov.graph.Dfa;
import glushkov.tree.Node;
import glushkov.util.IntSet;
import java.util.Set;

/**
 * Mark-before automaton.
 *
 * <p>Deterministic from the outset, with {@link FollowState} states. Reading a
 * symbol selects the positions of the current follow set carrying it. The
 * finality of the next state is decided on those selected positions, before
 * they are closed under the follow relation. McNaughton-Yamada does these two
 * steps in the opposite order.
 */
public final class MarkBeforeAutomaton extends Dfa<FollowState> {

  public final Positions positions;

  public MarkBeforeAutomaton(Node node) {
    this(new Positions(node));
  }

  private MarkBeforeAutomaton(Positions positions) {
    super(
      positions.alphabet,
      () -> new FollowState(positions.first, positions.isLast0(0)),
      FollowState::accepting,
      (FollowState state, Character symbol) -> {
        final IntSet selected = positions.select(state.follow(), symbol);
        return new FollowState(positions.followSet(selected), selected.intersects(positions.last0));
      },
      (FollowState state) -> state.follow().isEmpty()
    );
    this.positions = positions;
  }

  /**
   * Minimal DFA for the language of a pattern, via Brzozowski's double
   * reversal of mark-before automata.
   *
   * @param node syntax tree of the pattern
   * @return minimal deterministic automaton
   */
  public static Dfa<Set<FollowState>> minimize(Node node) {
    return Dfa.minimal(new MarkBeforeAutomaton(node.reverse()));
  }
}
