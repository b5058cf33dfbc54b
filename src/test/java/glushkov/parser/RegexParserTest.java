package glushkov.parser;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.sameInstance;
import static org.junit.Assert.assertThrows;

import glushkov.tree.Node;
import java.util.regex.PatternSyntaxException;
import org.junit.Test;

/**
 * Tests for {@link RegexParser} beyond the shape of the output.
 */
public class RegexParserTest {

  /**
   * Renders the visited pattern in prefix notation, counting visits.
   */
  private static final class CountingVisitor implements RegexVisitor<String> {
    int visits = 0;

    @Override
    public String visitSymbol(char symbol, int position) {
      visits++;
      return symbol + "" + position;
    }

    @Override
    public String visitConcatenation(String lhs, String rhs) {
      visits++;
      return "." + lhs + rhs;
    }

    @Override
    public String visitAlternation(String lhs, String rhs) {
      visits++;
      return "|" + lhs + rhs;
    }

    @Override
    public String visitKleene(String lhs) {
      visits++;
      return "*" + lhs;
    }
  }

  @Test
  public void parseIsCached() {
    final var parser = new RegexParser<>(new TreeBuilder(), "a*b|c(aa)*d|a|z");
    final Node first = parser.parse();
    assertThat(parser.parse(), is(sameInstance(first)));
  }

  @Test
  public void cachedParseDoesNotRevisit() {
    final var visitor = new CountingVisitor();
    final var parser = new RegexParser<>(visitor, "(a|b)*c");
    assertThat(parser.parse(), is(".*|a1b2c3"));
    final int visits = visitor.visits;
    assertThat(parser.parse(), is(".*|a1b2c3"));
    assertThat(visitor.visits, is(visits));
  }

  @Test
  public void failureIsCached() {
    final var parser = new RegexParser<>(new TreeBuilder(), "a**");
    final RegexSyntaxException first = assertThrows(RegexSyntaxException.class, parser::parse);
    final RegexSyntaxException second = assertThrows(RegexSyntaxException.class, parser::parse);
    assertThat(second, is(sameInstance(first)));
  }

  @Test
  public void operatorsAssociateToTheRight() {
    final var parser = new RegexParser<>(new CountingVisitor(), "abc|d|e");
    assertThat(parser.parse(), is("|.a1.b2c3|d4e5"));
  }

  @Test
  public void errorsArePatternSyntaxExceptions() {
    final PatternSyntaxException error = assertThrows(
      PatternSyntaxException.class,
      () -> RegexParser.parse("ab)")
    );
    assertThat(error.getDescription(), is("Expected '|' or end of the pattern, found ')'"));
    assertThat(error.getMessage(), containsString("ab)"));
  }

  @Test
  public void errorAtEndOfInputMentionsIt() {
    final RegexSyntaxException error = assertThrows(
      RegexSyntaxException.class,
      () -> RegexParser.parse("(ab|c")
    );
    assertThat(error.expected, is("')'"));
    assertThat(error.getDescription(), is("Expected ')', found empty string"));
  }
}
