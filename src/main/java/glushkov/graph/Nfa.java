package glushkov.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.BiFunction;
import java.util.function.Predicate;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import java.util.stream.Stream;

/**
 * Non-deterministic finite automaton whose states are explored lazily.
 *
 * <p>The automaton is described by functions rather than by an explicit
 * transition table: states are only ever computed when they are reached. The
 * functions must be pure. Results of the transition function are memoized for
 * the lifetime of the automaton.
 *
 * <p>States must have value-based {@code equals} and {@code hashCode}.
 *
 * @param <Q> states in the automaton
 */
public class Nfa<Q> implements Automaton, DotGraph<Integer, Character> {

  private final List<Character> alphabet;
  private final Set<Character> symbols;
  private final Supplier<Set<Q>> initialSupplier;
  private final Predicate<Q> accepting;
  private final BiFunction<Q, Character, Set<Q>> transitionFunction;

  /**
   * If present, the full set of states (used instead of exploring).
   */
  private final Optional<Set<Q>> knownStates;

  // Caches (only ever added to)
  private Set<Q> initialStates = null;
  private Set<Q> allStates = null;
  private final Map<TransitionKey<Q>, Set<Q>> transitions = new HashMap<>();
  private List<Q> vertexStates = null;

  /**
   * @param alphabet input symbols
   * @param initial supplier of the set of initial states
   * @param accepting which states are accepting
   * @param transition states reachable from a state on a symbol
   * @param knownStates full set of states, if it is already known
   */
  protected Nfa(
    List<Character> alphabet,
    Supplier<Set<Q>> initial,
    Predicate<Q> accepting,
    BiFunction<Q, Character, Set<Q>> transition,
    Optional<Set<Q>> knownStates
  ) {
    this.alphabet = List.copyOf(alphabet);
    this.symbols = Set.copyOf(alphabet);
    this.initialSupplier = Objects.requireNonNull(initial, "initial");
    this.accepting = Objects.requireNonNull(accepting, "accepting");
    this.transitionFunction = Objects.requireNonNull(transition, "transition");
    this.knownStates = knownStates.map(Collections::unmodifiableSet);
  }

  public static <Q> Nfa<Q> of(
    List<Character> alphabet,
    Supplier<Set<Q>> initial,
    Predicate<Q> accepting,
    BiFunction<Q, Character, Set<Q>> transition
  ) {
    return new Nfa<>(alphabet, initial, accepting, transition, Optional.empty());
  }

  public static <Q> Nfa<Q> of(
    List<Character> alphabet,
    Supplier<Set<Q>> initial,
    Predicate<Q> accepting,
    BiFunction<Q, Character, Set<Q>> transition,
    Set<Q> knownStates
  ) {
    return new Nfa<>(alphabet, initial, accepting, transition, Optional.of(knownStates));
  }

  @Override
  public List<Character> alphabet() {
    return alphabet;
  }

  /**
   * Initial states.
   *
   * @return unmodifiable set of starting states
   */
  public Set<Q> initial() {
    if (initialStates == null) {
      initialStates = Set.copyOf(initialSupplier.get());
    }
    return initialStates;
  }

  public boolean isAccepting(Q state) {
    return accepting.test(state);
  }

  /**
   * Look up the states reachable from a state on a symbol.
   *
   * <p>A symbol outside the alphabet leads nowhere, and is not memoized.
   *
   * @param state starting state
   * @param symbol input symbol
   * @return unmodifiable (possibly empty) set of target states
   */
  public Set<Q> transition(Q state, char symbol) {
    if (!symbols.contains(symbol)) {
      return Set.of();
    }
    final var key = new TransitionKey<>(state, symbol);
    Set<Q> targets = transitions.get(key);
    if (targets == null) {
      targets = Set.copyOf(transitionFunction.apply(state, symbol));
      transitions.put(key, targets);
    }
    return targets;
  }

  @Override
  public boolean accepts(CharSequence word) {
    Set<Q> frontier = initial();
    for (int i = 0; i < word.length(); i++) {
      if (frontier.isEmpty()) {
        return false;
      }
      final char symbol = word.charAt(i);
      final Set<Q> next = new HashSet<>();
      for (Q state : frontier) {
        next.addAll(transition(state, symbol));
      }
      frontier = next;
    }
    return frontier.stream().anyMatch(accepting);
  }

  /**
   * All states of the automaton.
   *
   * <p>If the states were supplied up front, they are returned as is.
   * Otherwise, states are discovered breadth-first from the initial states.
   *
   * @return unmodifiable set of states
   */
  public Set<Q> allStates() {
    if (allStates == null) {
      allStates = knownStates.orElseGet(this::exploreStates);
    }
    return allStates;
  }

  private Set<Q> exploreStates() {
    final Set<Q> states = new HashSet<>(initial());
    Set<Q> frontier = initial();

    while (!frontier.isEmpty()) {
      final Set<Q> discovered = new HashSet<>();
      for (Q state : frontier) {
        for (char symbol : alphabet) {
          for (Q next : transition(state, symbol)) {
            if (!states.contains(next)) {
              discovered.add(next);
            }
          }
        }
      }
      states.addAll(discovered);
      frontier = discovered;
    }

    return Collections.unmodifiableSet(states);
  }

  @Override
  public int countStates() {
    return allStates().size();
  }

  /**
   * Subset construction.
   *
   * <p>States of the output are (unmodifiable) sets of states of this
   * automaton, and the empty set is the dead state. Nothing is computed until
   * the output is run or explored.
   *
   * @return deterministic automaton for the same language
   */
  public Dfa<Set<Q>> determinise() {
    return Dfa.of(
      alphabet,
      this::initial,
      (Set<Q> states) -> states.stream().anyMatch(accepting),
      (Set<Q> states, Character symbol) -> {
        final Set<Q> targets = new HashSet<>();
        for (Q state : states) {
          targets.addAll(transition(state, symbol));
        }
        return Set.copyOf(targets);
      },
      Set::isEmpty
    );
  }

  // Vertex numbering for rendering: initial states first
  private List<Q> vertexStates() {
    if (vertexStates == null) {
      vertexStates = Stream.concat(initial().stream(), allStates().stream())
        .distinct()
        .collect(Collectors.toUnmodifiableList());
    }
    return vertexStates;
  }

  private Map<Q, Integer> vertexIds() {
    final var ids = new HashMap<Q, Integer>();
    for (Q state : vertexStates()) {
      ids.put(state, ids.size());
    }
    return ids;
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
    final Map<Q, Integer> ids = vertexIds();
    final List<DotGraph.Edge<Integer, Character>> edges = new ArrayList<>();
    for (Q state : initial()) {
      edges.add(new DotGraph.Edge<>(null, ids.get(state), null));
    }
    for (Q from : vertexStates()) {
      for (char symbol : alphabet) {
        for (Q to : transition(from, symbol)) {
          if (ids.containsKey(to)) {
            edges.add(new DotGraph.Edge<>(ids.get(from), ids.get(to), symbol));
          }
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
