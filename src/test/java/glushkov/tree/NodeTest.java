package glushkov.tree;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.sameInstance;
import static org.junit.Assert.assertThrows;

import glushkov.RandomRegex;
import glushkov.parser.RegexParser;
import glushkov.util.IntSet;
import org.junit.Test;

/**
 * Tests for {@link Node} construction, equality and rendering.
 */
public class NodeTest {

  private static final Node A_STAR_B = new Concat(new Star(new Symbol('a', 1)), new Symbol('b', 2));

  @Test
  public void structuralEquality() {
    final Node other = new Concat(new Star(new Symbol('a', 1)), new Symbol('b', 2));
    assertThat(other, is(A_STAR_B));
    assertThat(other.hashCode(), is(A_STAR_B.hashCode()));
    assertThat(new Symbol('a', 2), is(not(new Symbol('a', 1))));
    assertThat(new Alt(new Symbol('a', 1), new Symbol('b', 2)), is(not(new Concat(new Symbol('a', 1), new Symbol('b', 2)))));
  }

  @Test
  public void attributesAreCached() {
    final Node node = new Star(new Alt(new Symbol('a', 1), new Symbol('b', 2)));
    assertThat(node.follow(), is(sameInstance(node.follow())));
    assertThat(node.pos(), is(sameInstance(node.pos())));
    assertThat(node.reverse(), is(sameInstance(node.reverse())));
  }

  @Test
  public void attributesAreUnmodifiable() {
    assertThrows(UnsupportedOperationException.class, () -> A_STAR_B.follow().clear());
    assertThrows(UnsupportedOperationException.class, () -> A_STAR_B.pos().put(3, 'c'));
  }

  @Test
  public void last0OfNonNullable() {
    assertThat(A_STAR_B.last0(), is(IntSet.of(2)));
    assertThat(A_STAR_B.last(), is(IntSet.of(2)));
  }

  @Test
  public void symbolValidation() {
    assertThrows(IllegalArgumentException.class, () -> new Symbol('a', 0));
    assertThrows(IllegalArgumentException.class, () -> new Symbol('a', -1));
    for (char reserved : Symbol.RESERVED.toCharArray()) {
      assertThrows(IllegalArgumentException.class, () -> new Symbol(reserved, 1));
    }
  }

  @Test
  public void sizeAndAlphabet() {
    final Node node = RegexParser.parse("b(ca|b)*a");
    assertThat(node.size(), is(5));
    assertThat(node.alphabet(), contains('a', 'b', 'c'));
  }

  @Test
  public void toPatternParenthesizesOnlyWhereNeeded() {
    assertThat(A_STAR_B.toPattern(), is("a*b"));
    assertThat(RegexParser.parse("(a|b)c").toPattern(), is("(a|b)c"));
    assertThat(RegexParser.parse("(ab)*").toPattern(), is("(ab)*"));
    assertThat(RegexParser.parse("((a))|b|c").toPattern(), is("a|b|c"));
    assertThat(new Star(new Star(new Symbol('a', 1))).toPattern(), is("(a*)*"));
  }

  @Test
  public void toStringShowsStructure() {
    assertThat(A_STAR_B.toString(), is("Concat(Star(Symbol('a', 1)), Symbol('b', 2))"));
  }

  @Test
  public void toPatternParsesBackToSamePattern() {
    final var random = new RandomRegex(7, 3, 0.2, 0.2, 0.3);
    for (int i = 0; i < 200; i++) {
      final String pattern = random.pattern(1 + i % 12);
      final Node node = RegexParser.parse(pattern);
      final Node reparsed = RegexParser.parse(node.toPattern());
      assertThat(pattern, reparsed.toPattern(), is(node.toPattern()));
      assertThat(pattern, reparsed.pos(), is(node.pos()));
    }
  }

  @Test
  public void reverseIsAnInvolution() {
    final var random = new RandomRegex(11, 4, 0.2, 0.2, 0.1);
    for (int i = 0; i < 200; i++) {
      final Node node = RegexParser.parse(random.pattern(1 + i % 15));
      assertThat(node.reverse().reverse(), is(node));
    }
  }

  @Test
  public void positionsAreComplete() {
    final var random = new RandomRegex(13, 5, 0.15, 0.15, 0.05);
    for (int length = 1; length <= 30; length++) {
      final Node node = RegexParser.parse(random.pattern(length));
      assertThat(IntSet.of(node.pos().keySet()), is(IntSet.range(1, length)));
    }
  }

  @Test
  public void followReferencesKnownPositions() {
    final var random = new RandomRegex(17, 3, 0.3, 0.2, 0.1);
    for (int i = 0; i < 100; i++) {
      final Node node = RegexParser.parse(random.pattern(1 + i % 20));
      for (FollowPair pair : node.follow()) {
        assertThat(node.pos().containsKey(pair.from()), is(true));
        assertThat(node.pos().containsKey(pair.to()), is(true));
      }
    }
  }
}
