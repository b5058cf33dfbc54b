package glushkov.parser;

/**
 * Categories of pattern syntax errors.
 */
public enum SyntaxErrorKind {

  /**
   * A reserved character, or the end of the pattern, where a symbol or group
   * was required.
   */
  UNEXPECTED_TOKEN,

  /**
   * The pattern ended while a group was still open.
   */
  UNMATCHED_OPEN_PAREN,

  /**
   * A closing parenthesis with no group open.
   */
  UNMATCHED_CLOSE_PAREN,

  /**
   * Nothing to parse at all.
   */
  EMPTY_INPUT
}
