package glushkov.graph;

import java.util.List;

/**
 * Finite automaton, as seen by code that only wants to run it or size it up.
 */
public interface Automaton {

  /**
   * Input symbols the automaton has transitions for.
   *
   * @return distinct symbols, in ascending order
   */
  List<Character> alphabet();

  /**
   * Run the automaton over a whole word.
   *
   * @param word input to consume
   * @return whether the automaton ends up in an accepting state
   */
  boolean accepts(CharSequence word);

  /**
   * Number of states in the automaton (see the implementations for which
   * states are counted).
   */
  int countStates();
}
