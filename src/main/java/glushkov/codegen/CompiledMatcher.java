package glushkov.codegen;

/**
 * Whole-input matcher for a pattern, backed by a DFA compiled to bytecode.
 */
public interface CompiledMatcher {

  /**
   * Pattern from which the matcher was compiled.
   */
  String pattern();

  /**
   * Number of DFA states laid out in the generated code.
   */
  int stateCount();

  /**
   * Check whether the whole input matches the pattern.
   *
   * @param input input string
   * @return whether the input is in the language of the pattern
   */
  boolean matches(CharSequence input);
}
