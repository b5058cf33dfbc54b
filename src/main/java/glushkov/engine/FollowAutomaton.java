package glushkov.engine;

import glushkov.graph.Dfa;
import glushkov.graph.Nfa;
import glushkov.tree.Node;
import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Follow automaton.
 *
 * <p>This is the position automaton with each position {@code i} (including
 * the start marker) replaced by the pair of its follow set and its finality.
 * Positions sharing the same pair become a single state.
 */
public final class FollowAutomaton extends Nfa<FollowState> {

  public final Positions positions;

  public FollowAutomaton(Node node) {
    this(new Positions(node));
  }

  private FollowAutomaton(Positions positions) {
    this(positions, followStates(positions));
  }

  private FollowAutomaton(Positions positions, FollowState[] states) {
    super(
      positions.alphabet,
      () -> Set.of(states[0]),
      FollowState::accepting,
      (FollowState state, Character symbol) -> positions
        .select(state.follow(), symbol)
        .stream()
        .mapToObj(j -> states[j])
        .collect(Collectors.toUnmodifiableSet()),
      Optional.of(Arrays.stream(states).filter(Objects::nonNull).collect(Collectors.toUnmodifiableSet()))
    );
    this.positions = positions;
  }

  // Follow state of the start marker and of every real position, indexed by
  // position (gaps in the numbering stay `null`)
  private static FollowState[] followStates(Positions positions) {
    final var states = new FollowState[positions.size() + 1];
    states[0] = new FollowState(positions.followOf(0), positions.isLast0(0));
    positions.positions().stream().forEach(i -> {
      states[i] = new FollowState(positions.followOf(i), positions.isLast0(i));
    });
    return states;
  }

  /**
   * Minimal DFA for the language of a pattern, via Brzozowski's double
   * reversal of follow automata.
   *
   * @param node syntax tree of the pattern
   * @return minimal deterministic automaton
   */
  public static Dfa<Set<Set<FollowState>>> minimize(Node node) {
    return Dfa.minimal(new FollowAutomaton(node.reverse()).determinise());
  }
}
