package glushkov.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.BiFunction;
import java.util.function.Predicate;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import java.util.stream.Stream;

/**
 * Deterministic finite automaton whose states are explored lazily.
 *
 * <p>Every state has exactly one successor per symbol. Missing transitions go
 * to a dead state, recognized by a predicate (for instance, the empty set in a
 * subset construction). Dead states are never counted as part of the
 * automaton, unless they happen to be accepting.
 *
 * <p>The functions describing the automaton must be pure, and states must
 * have value-based {@code equals} and {@code hashCode}. Transitions are
 * memoized for the lifetime of the automaton.
 *
 * @param <Q> states in the automaton
 */
public class Dfa<Q> implements Automaton, DotGraph<Integer, Character> {

  private final List<Character> alphabet;
  private final Set<Character> symbols;
  private final Supplier<Q> initialSupplier;
  private final Predicate<Q> accepting;
  private final BiFunction<Q, Character, Q> transitionFunction;
  private final Predicate<Q> dead;

  // Caches (only ever added to)
  private Q initialState = null;
  private Set<Q> allStates = null;
  private final Map<TransitionKey<Q>, Q> transitions = new HashMap<>();
  private List<Q> vertexStates = null;

  /**
   * @param alphabet input symbols
   * @param initial supplier of the initial state
   * @param accepting which states are accepting
   * @param transition successor of a state on a symbol
   * @param dead which states have no way of reaching acceptance
   */
  protected Dfa(
    List<Character> alphabet,
    Supplier<Q> initial,
    Predicate<Q> accepting,
    BiFunction<Q, Character, Q> transition,
    Predicate<Q> dead
  ) {
    this.alphabet = List.copyOf(alphabet);
    this.symbols = Set.copyOf(alphabet);
    this.initialSupplier = Objects.requireNonNull(initial, "initial");
    this.accepting = Objects.requireNonNull(accepting, "accepting");
    this.transitionFunction = Objects.requireNonNull(transition, "transition");
    this.dead = Objects.requireNonNull(dead, "dead");
  }

  public static <Q> Dfa<Q> of(
    List<Character> alphabet,
    Supplier<Q> initial,
    Predicate<Q> accepting,
    BiFunction<Q, Character, Q> transition,
    Predicate<Q> dead
  ) {
    return new Dfa<>(alphabet, initial, accepting, transition, dead);
  }

  /**
   * Second half of Brzozowski's minimization.
   *
   * <p>Given a DFA for the reverse of some language, reversing it again and
   * determinising yields the minimal DFA of the language itself (up to the
   * naming of states, and without a dead state).
   *
   * @param reversedLanguage DFA accepting the reverse of the target language
   * @return minimal DFA accepting the target language
   */
  public static <Q> Dfa<Set<Q>> minimal(Dfa<Q> reversedLanguage) {
    return reversedLanguage.reverse().determinise();
  }

  @Override
  public List<Character> alphabet() {
    return alphabet;
  }

  public Q initial() {
    if (initialState == null) {
      initialState = Objects.requireNonNull(initialSupplier.get(), "initial state");
    }
    return initialState;
  }

  public boolean isAccepting(Q state) {
    return accepting.test(state);
  }

  public boolean isDead(Q state) {
    return dead.test(state);
  }

  /**
   * Look up the successor of a state on a symbol.
   *
   * <p>Only symbols in the alphabet are memoized: the cache stays bounded by
   * the number of states times the size of the alphabet, whatever the inputs.
   *
   * @param state starting state
   * @param symbol input symbol
   * @return target state (possibly dead)
   */
  public Q transition(Q state, char symbol) {
    if (!symbols.contains(symbol)) {
      return Objects.requireNonNull(transitionFunction.apply(state, symbol), "transition target");
    }
    final var key = new TransitionKey<>(state, symbol);
    Q target = transitions.get(key);
    if (target == null) {
      target = Objects.requireNonNull(transitionFunction.apply(state, symbol), "transition target");
      transitions.put(key, target);
    }
    return target;
  }

  @Override
  public boolean accepts(CharSequence word) {
    return accepts(word, false);
  }

  /**
   * Run the automaton over a whole word.
   *
   * @param word input to consume
   * @param printDebugInfo print to STDERR a trace of what is happening
   * @return whether the automaton ends up in an accepting state
   */
  public boolean accepts(CharSequence word, boolean printDebugInfo) {
    Q currentState = initial();

    if (printDebugInfo) {
      System.err.println("[DFA] starting run at " + currentState + " on: " + word);
    }

    for (int i = 0; i < word.length(); i++) {
      final char symbol = word.charAt(i);
      if (isDead(currentState)) {
        if (printDebugInfo) {
          System.err.println("[DFA] ending run at " + currentState + "; no transition for " + symbol);
        }
        return false;
      }
      currentState = transition(currentState, symbol);
      if (printDebugInfo) {
        System.err.println("[DFA] entering " + currentState);
      }
    }

    final boolean accepted = isAccepting(currentState);
    if (printDebugInfo) {
      System.err.println("[DFA] exiting run (" + (accepted ? "successful" : "unsuccessful") + ")");
    }
    return accepted;
  }

  /**
   * All states reachable from the initial state.
   *
   * <p>States are discovered in breadth-first rounds. Dead states are left out
   * unless they are accepting.
   *
   * @return unmodifiable set of states, in order of discovery
   */
  public Set<Q> allStates() {
    if (allStates == null) {
      final Set<Q> states = new LinkedHashSet<>();
      states.add(initial());
      Set<Q> frontier = Set.of(initial());

      while (!frontier.isEmpty()) {
        final Set<Q> discovered = new LinkedHashSet<>();
        for (Q state : frontier) {
          for (char symbol : alphabet) {
            final Q next = transition(state, symbol);
            if (!states.contains(next) && (!isDead(next) || isAccepting(next))) {
              discovered.add(next);
            }
          }
        }
        states.addAll(discovered);
        frontier = discovered;
      }

      allStates = Collections.unmodifiableSet(states);
    }
    return allStates;
  }

  @Override
  public int countStates() {
    return allStates().size();
  }

  /**
   * Automaton for the reversed language.
   *
   * <p>This explores the whole DFA up front. The initial states of the output
   * are the accepting states of this DFA, the only accepting state is the
   * initial state of this DFA, and transitions are the pre-images of the
   * transitions of this DFA.
   *
   * @return non-deterministic automaton accepting the reversed words
   */
  public Nfa<Q> reverse() {
    final Set<Q> states = allStates();
    final Q start = initial();
    final Set<Q> acceptingStates = states
      .stream()
      .filter(this::isAccepting)
      .collect(Collectors.toUnmodifiableSet());

    return Nfa.of(
      alphabet,
      () -> acceptingStates,
      start::equals,
      (Q to, Character symbol) -> states
        .stream()
        .filter(from -> to.equals(transition(from, symbol)))
        .collect(Collectors.toUnmodifiableSet()),
      states
    );
  }

  private List<Q> vertexStates() {
    if (vertexStates == null) {
      vertexStates = List.copyOf(allStates());
    }
    return vertexStates;
  }

  @Override
  public Stream<DotGraph.Vertex<Integer>> vertices() {
    final List<Q> states = vertexStates();
    return IntStream
      .range(0, states.size())
      .mapToObj((int id) -> new DotGraph.Vertex<Integer>(id, isAccepting(states.get(id))));
  }

  @Override
  public Stream<DotGraph.Edge<Integer, Character>> edges() {
    final List<Q> states = vertexStates();
    final Map<Q, Integer> ids = new HashMap<>();
    for (Q state : states) {
      ids.put(state, ids.size());
    }

    final List<DotGraph.Edge<Integer, Character>> edges = new ArrayList<>();
    edges.add(new DotGraph.Edge<>(null, ids.get(initial()), null));
    for (Q from : states) {
      for (char symbol : alphabet) {
        final Integer to = ids.get(transition(from, symbol));
        if (to != null) {
          edges.add(new DotGraph.Edge<>(ids.get(from), to, symbol));
        }
      }
    }
    return edges.stream();
  }

  @Override
  public String renderVertexLabel(DotGraph.Vertex<Integer> vertex) {
    return DotGraph.escapeHtml(vertexStates().get(vertex.id()).toString());
  }
}
