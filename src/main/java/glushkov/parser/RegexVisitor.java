package glushkov.parser;

/**
 * Bottom-up traversal of the regular expression pattern AST.
 *
 * @param <R> output from traversing the regex pattern AST
 */
public interface RegexVisitor<R> {

  /**
   * Matches a single literal symbol.
   *
   * @param symbol literal character
   * @param position unique (positive) index of this occurrence in the pattern
   */
  R visitSymbol(char symbol, int position);

  /**
   * Matches a concatenation of two patterns.
   *
   * @param lhs first pattern to match
   * @param rhs second pattern to match
   */
  R visitConcatenation(R lhs, R rhs);

  /**
   * Matches a union of two patterns.
   *
   * @param lhs first pattern to try matching
   * @param rhs second pattern to try matching
   */
  R visitAlternation(R lhs, R rhs);

  /**
   * Matches a pattern zero or more times.
   *
   * @param lhs pattern to match
   */
  R visitKleene(R lhs);
}
