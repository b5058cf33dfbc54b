package glushkov;

import glushkov.codegen.CompiledDfa;
import glushkov.codegen.CompiledMatcher;
import glushkov.graph.Automaton;
import glushkov.graph.Dfa;
import glushkov.parser.RegexParser;
import glushkov.tree.Node;
import java.util.List;

/**
 * Entry points for building automata from patterns.
 *
 * <p>Patterns are made of single-character symbols combined with
 * concatenation, alternation ({@code |}), Kleene star ({@code *}) and
 * parentheses. Matching is always against the whole word.
 */
public final class RegexAutomata {

  private RegexAutomata() { }

  /**
   * Parse a pattern into a syntax tree.
   *
   * @param pattern non-empty pattern
   * @return syntax tree, with positions numbered from 1
   * @throws glushkov.parser.RegexSyntaxException if the pattern is malformed
   */
  public static Node parse(String pattern) {
    return RegexParser.parse(pattern);
  }

  /**
   * Check whether a word is in the language of a pattern, using the position
   * automaton.
   *
   * @param pattern pattern (the empty pattern only matches the empty word)
   * @param word word to check
   * @return whether the pattern matches the whole word
   */
  public static boolean match(String pattern, CharSequence word) {
    return match(pattern, word, Engine.POSITION);
  }

  /**
   * Check whether a word is in the language of a pattern.
   *
   * @param pattern pattern (the empty pattern only matches the empty word)
   * @param word word to check
   * @param engine construction used to build the automaton
   * @return whether the pattern matches the whole word
   */
  public static boolean match(String pattern, CharSequence word, Engine engine) {
    if (pattern.isEmpty()) {
      return word.length() == 0;
    }
    return automaton(pattern, engine).accepts(word);
  }

  public static Automaton automaton(String pattern, Engine engine) {
    return engine.automaton(parse(pattern));
  }

  public static Dfa<?> minimize(String pattern, Engine engine) {
    return engine.minimize(parse(pattern));
  }

  public static CompiledMatcher compile(String pattern) {
    return compile(pattern, Engine.MCNAUGHTON_YAMADA, false);
  }

  /**
   * Compile a pattern into a matcher backed by its minimal DFA.
   *
   * @param pattern pattern (the empty pattern only matches the empty word)
   * @param engine construction whose double reversal gives the minimal DFA
   * @param printDebugInfo print debug info and generate code which prints debug info to STDERR
   * @return compiled matcher
   */
  public static CompiledMatcher compile(String pattern, Engine engine, boolean printDebugInfo) {
    final Dfa<?> dfa = pattern.isEmpty() ? emptyWordDfa() : minimize(pattern, engine);
    return CompiledDfa.compile(pattern, dfa, printDebugInfo);
  }

  // One accepting state, and nothing else
  private static Dfa<Boolean> emptyWordDfa() {
    return Dfa.of(
      List.of(),
      () -> Boolean.TRUE,
      (Boolean state) -> state,
      (Boolean state, Character symbol) -> Boolean.FALSE,
      (Boolean state) -> !state
    );
  }
}
