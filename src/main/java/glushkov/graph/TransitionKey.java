package glushkov.graph;

/**
 * Key for memoized transitions.
 *
 * @param state state the transition starts from
 * @param symbol input symbol consumed
 */
record TransitionKey<Q>(Q state, char symbol) { }
