package glushkov.engine;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.sameInstance;

import glushkov.parser.RegexParser;
import glushkov.util.IntSet;
import org.junit.Test;

/**
 * Tests for {@link Positions}.
 */
public class PositionsTest {

  private final Positions positions = new Positions(RegexParser.parse("(a|b)*abb"));

  @Test
  public void basics() {
    assertThat(positions.size(), is(5));
    assertThat(positions.positions(), is(IntSet.of(1, 2, 3, 4, 5)));
    assertThat(positions.alphabet, contains('a', 'b'));
    assertThat(positions.first, is(IntSet.of(1, 2, 3)));
    assertThat(positions.last0, is(IntSet.of(5)));
    assertThat(positions.symbolAt(3), is('a'));
    assertThat(positions.symbolAt(4), is('b'));
    assertThat(positions.isLast0(5), is(true));
    assertThat(positions.isLast0(0), is(false));
  }

  @Test
  public void followOf() {
    assertThat(positions.followOf(0), is(IntSet.of(1, 2, 3)));
    assertThat(positions.followOf(1), is(IntSet.of(1, 2, 3)));
    assertThat(positions.followOf(3), is(IntSet.of(4)));
    assertThat(positions.followOf(5), is(IntSet.EMPTY));
  }

  @Test
  public void followSet() {
    assertThat(positions.followSet(IntSet.of(2, 4)), is(IntSet.of(1, 2, 3, 5)));
    assertThat(positions.followSet(IntSet.of(0)), is(IntSet.of(1, 2, 3)));
    assertThat(positions.followSet(IntSet.EMPTY), is(IntSet.EMPTY));
    assertThat(positions.followSet(IntSet.of(2, 4)), is(sameInstance(positions.followSet(IntSet.of(4, 2)))));
  }

  @Test
  public void select() {
    assertThat(positions.select(IntSet.of(1, 2, 3), 'a'), is(IntSet.of(1, 3)));
    assertThat(positions.select(IntSet.of(1, 2, 3), 'c'), is(IntSet.EMPTY));
    assertThat(positions.select(IntSet.of(0, 2), 'b'), is(IntSet.of(2)));
  }

  @Test
  public void nullablePatternHasMarkerInLast0() {
    final var nullable = new Positions(RegexParser.parse("a*"));
    assertThat(nullable.isLast0(0), is(true));
    assertThat(nullable.isLast0(1), is(true));
  }
}
