package glushkov;

import glushkov.engine.FollowAutomaton;
import glushkov.engine.MarkBeforeAutomaton;
import glushkov.engine.McNaughtonYamadaAutomaton;
import glushkov.engine.PositionAutomaton;
import glushkov.graph.Automaton;
import glushkov.graph.Dfa;
import glushkov.tree.Node;

/**
 * Automaton constructions available for a parsed pattern.
 */
public enum Engine {

  /**
   * Position (Glushkov) NFA.
   */
  POSITION("position"),

  /**
   * Subset construction applied to the position NFA.
   */
  DETERMINISTIC_POSITION("deterministic position"),

  /**
   * McNaughton-Yamada DFA.
   */
  MCNAUGHTON_YAMADA("McNaughton-Yamada"),

  /**
   * Follow NFA (positions merged by follow set and finality).
   */
  FOLLOW("follow"),

  /**
   * Subset construction applied to the follow NFA.
   */
  DETERMINISTIC_FOLLOW("deterministic follow"),

  /**
   * Mark-before DFA.
   */
  MARK_BEFORE("mark-before");

  private final String displayName;

  Engine(String displayName) {
    this.displayName = displayName;
  }

  public String displayName() {
    return displayName;
  }

  /**
   * Does this engine build a deterministic automaton?
   */
  public boolean isDeterministic() {
    return this != POSITION && this != FOLLOW;
  }

  /**
   * Build this engine's automaton for a pattern.
   *
   * @param node syntax tree of the pattern
   * @return automaton accepting the language of the pattern
   */
  public Automaton automaton(Node node) {
    switch (this) {
      case POSITION:
        return new PositionAutomaton(node);
      case DETERMINISTIC_POSITION:
        return new PositionAutomaton(node).determinise();
      case MCNAUGHTON_YAMADA:
        return new McNaughtonYamadaAutomaton(node);
      case FOLLOW:
        return new FollowAutomaton(node);
      case DETERMINISTIC_FOLLOW:
        return new FollowAutomaton(node).determinise();
      case MARK_BEFORE:
        return new MarkBeforeAutomaton(node);
      default:
        throw new IllegalStateException("unknown engine " + this);
    }
  }

  /**
   * Build the minimal DFA for a pattern, by double reversal of this engine's
   * automaton.
   *
   * <p>The deterministic variants of the position and follow automata reverse
   * through the same subset construction as their non-deterministic bases.
   *
   * @param node syntax tree of the pattern
   * @return minimal deterministic automaton
   */
  public Dfa<?> minimize(Node node) {
    switch (this) {
      case POSITION:
      case DETERMINISTIC_POSITION:
        return PositionAutomaton.minimize(node);
      case MCNAUGHTON_YAMADA:
        return McNaughtonYamadaAutomaton.minimize(node);
      case FOLLOW:
      case DETERMINISTIC_FOLLOW:
        return FollowAutomaton.minimize(node);
      case MARK_BEFORE:
        return MarkBeforeAutomaton.minimize(node);
      default:
        throw new IllegalStateException("unknown engine " + this);
    }
  }
}
