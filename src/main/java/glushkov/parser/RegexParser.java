package glushkov.parser;

import glushkov.tree.Node;
import java.util.ArrayList;
import java.util.List;

/**
 * Parser for a small subset of regular expressions.
 *
 * <p>This is a fairly standard recursive descent parser for the grammar
 *
 * <pre>
 *   alt    ::= concat | concat "|" alt
 *   concat ::= star   | star concat
 *   star   ::= atom   | atom "*"
 *   atom   ::= symbol | "(" alt ")"
 * </pre>
 *
 * where a symbol is any character other than {@code ( ) | *}. There is no
 * escaping. Both binary operators associate to the right. The results are made
 * available through a visitor instead of as an explicit AST type (see
 * {@link TreeBuilder} for building an explicit tree).
 *
 * <p>Each symbol consumed gets the next position index, starting at {@code 1}.
 * A parser instance only ever scans its input once: {@link #parse()} caches
 * its outcome, success or failure.
 */
public final class RegexParser<A> {

  // Used when "visiting" the AST bottom up
  private final RegexVisitor<A> visitor;

  // Bookkeeping around position in source
  private final String input;
  private final int length;
  private int position = 0;
  private int openGroups = 0;
  private int nextSymbolIndex = 1;

  // Outcome of the one and only scan
  private A parsed = null;
  private RegexSyntaxException failure = null;

  public RegexParser(RegexVisitor<A> visitor, String input) {
    this.visitor = visitor;
    this.input = input;
    this.length = input.length();
  }

  /**
   * Parse a pattern into a syntax tree.
   *
   * @param pattern regular expression pattern
   * @return root of the tree
   * @throws RegexSyntaxException if the pattern is not valid
   */
  public static Node parse(String pattern) throws RegexSyntaxException {
    return new RegexParser<>(new TreeBuilder(), pattern).parse();
  }

  /**
   * Parse the input, or return the result of the previous call.
   *
   * @return parsed regular expression
   * @throws RegexSyntaxException if the input is not a valid pattern
   */
  public A parse() throws RegexSyntaxException {
    if (failure != null) {
      throw failure;
    } else if (parsed == null) {
      try {
        parsed = parseInput();
      } catch (RegexSyntaxException error) {
        failure = error;
        throw error;
      }
    }
    return parsed;
  }

  private A parseInput() throws RegexSyntaxException {
    if (length == 0) {
      throw error(SyntaxErrorKind.EMPTY_INPUT, "pattern");
    }
    final A result = parseAlternation();
    if (position < length) {
      throw error(SyntaxErrorKind.UNMATCHED_CLOSE_PAREN, "end of the pattern");
    }
    return result;
  }

  private RegexSyntaxException error(SyntaxErrorKind kind, String expected) {
    final String found = position < length
      ? "'" + input.charAt(position) + "'"
      : RegexSyntaxException.END_OF_INPUT;
    return new RegexSyntaxException(kind, expected, found, input, position);
  }

  /**
   * Peek at the next character.
   *
   * @return next character, or {@code -1} at the end of the input
   */
  private int peek() {
    return position < length ? input.charAt(position) : -1;
  }

  /**
   * Parse an alternation.
   */
  private A parseAlternation() throws RegexSyntaxException {
    final List<A> alternatives = new ArrayList<>();
    while (true) {
      alternatives.add(parseConcatenation());
      if (peek() == ')' && openGroups == 0) {
        throw error(SyntaxErrorKind.UNMATCHED_CLOSE_PAREN, "'|' or end of the pattern");
      } else if (peek() != '|') {
        break;
      }
      position++;
    }

    // Fold from the right: `a|b|c` is `a|(b|c)`
    A union = alternatives.get(alternatives.size() - 1);
    for (int i = alternatives.size() - 2; i >= 0; i--) {
      union = visitor.visitAlternation(alternatives.get(i), union);
    }
    return union;
  }

  /**
   * Parse a concatenation.
   */
  private A parseConcatenation() throws RegexSyntaxException {
    final List<A> parts = new ArrayList<>();
    do {
      parts.add(parseStar());
    } while (peek() != -1 && peek() != '|' && peek() != ')');

    // Fold from the right: `abc` is `a(bc)`
    A concat = parts.get(parts.size() - 1);
    for (int i = parts.size() - 2; i >= 0; i--) {
      concat = visitor.visitConcatenation(parts.get(i), concat);
    }
    return concat;
  }

  /**
   * Parse an atom and at most one trailing Kleene star.
   */
  private A parseStar() throws RegexSyntaxException {
    final A atom = parseAtom();
    if (peek() == '*') {
      position++;
      return visitor.visitKleene(atom);
    }
    return atom;
  }

  /**
   * Parse a symbol or a parenthesized group.
   */
  private A parseAtom() throws RegexSyntaxException {
    switch (peek()) {
      case -1:
      case '|':
      case '*':
        throw error(SyntaxErrorKind.UNEXPECTED_TOKEN, "symbol");

      case ')':
        throw error(
          openGroups == 0 ? SyntaxErrorKind.UNMATCHED_CLOSE_PAREN : SyntaxErrorKind.UNEXPECTED_TOKEN,
          "symbol"
        );

      case '(':
        position++;
        openGroups++;
        final A group = parseAlternation();
        if (peek() == -1) {
          throw error(SyntaxErrorKind.UNMATCHED_OPEN_PAREN, "')'");
        } else if (peek() != ')') {
          throw error(SyntaxErrorKind.UNEXPECTED_TOKEN, "')'");
        }
        position++;
        openGroups--;
        return group;

      default:
        final char symbol = input.charAt(position++);
        return visitor.visitSymbol(symbol, nextSymbolIndex++);
    }
  }
}
