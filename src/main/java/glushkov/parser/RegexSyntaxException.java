package glushkov.parser;

import java.util.regex.PatternSyntaxException;

/**
 * Syntax error in a pattern, along with what went wrong and where.
 */
public class RegexSyntaxException extends PatternSyntaxException {

  @java.io.Serial
  private static final long serialVersionUID = -2715830934816624310L;

  /**
   * Placeholder for the token found when the pattern ended early.
   */
  public static final String END_OF_INPUT = "empty string";

  /**
   * Category of the error.
   */
  public final SyntaxErrorKind kind;

  /**
   * Description of what the parser was expecting.
   */
  public final String expected;

  /**
   * Token found instead (or {@link #END_OF_INPUT}).
   */
  public final String found;

  public RegexSyntaxException(
    SyntaxErrorKind kind,
    String expected,
    String found,
    String regex,
    int index
  ) {
    super("Expected " + expected + ", found " + found, regex, index);
    this.kind = kind;
    this.expected = expected;
    this.found = found;
  }
}
