package glushkov;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.is;

import glushkov.graph.Automaton;
import glushkov.graph.Dfa;
import glushkov.graph.Nfa;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;

/**
 * Tests for each {@link Engine} on hand-picked patterns.
 */
@RunWith(Parameterized.class)
public class EngineTest {

  private final Engine engine;

  public EngineTest(Engine engine) {
    this.engine = engine;
  }

  @Parameterized.Parameters(name = "{0}")
  public static Collection<Object[]> data() {
    final List<Object[]> data = new ArrayList<>();
    for (Engine engine : Engine.values()) {
      data.add(new Object[] { engine });
    }
    return data;
  }

  private boolean match(String pattern, String word) {
    return RegexAutomata.match(pattern, word, engine);
  }

  @Test
  public void starThenSymbol() {
    assertThat(match("a*b", "aaab"), is(true));
    assertThat(match("a*b", "b"), is(true));
    assertThat(match("a*b", "ba"), is(false));
  }

  @Test
  public void suffixAfterLoop() {
    assertThat(match("(a|b)*abb", "ababb"), is(true));
    assertThat(match("(a|b)*abb", "abb"), is(true));
    assertThat(match("(a|b)*abb", "ab"), is(false));
  }

  @Test
  public void emptyPattern() {
    assertThat(match("", ""), is(true));
    assertThat(match("", "a"), is(false));
  }

  @Test
  public void alternationOfLoopAndSymbol() {
    assertThat(match("a(ba)*b|a", "a"), is(true));
    assertThat(match("a(ba)*b|a", "abab"), is(true));
    assertThat(match("a(ba)*b|a", "abb"), is(false));
  }

  @Test
  public void nestedStars() {
    assertThat(match("(a*)*b", "b"), is(true));
    assertThat(match("(a*)*b", "aaaaaaaab"), is(true));
    assertThat(match("(a*)*b", "aaaaaaaaaaac"), is(false));
    assertThat(match("(a*b*)*", ""), is(true));
    assertThat(match("(a*b*)*", "babba"), is(true));
  }

  @Test
  public void symbolsOutsideAlphabet() {
    assertThat(match("ab", "ac"), is(false));
    assertThat(match("a*", "aaz"), is(false));
  }

  @Test
  public void automatonShape() {
    final Automaton automaton = RegexAutomata.automaton("(a|b)*abb", engine);
    assertThat(automaton, instanceOf(engine.isDeterministic() ? Dfa.class : Nfa.class));
    assertThat(automaton.alphabet(), is(List.of('a', 'b')));
  }

  @Test
  public void minimalStateCounts() {
    // Deliberately 3, not 2: start, after `a` and accepting are all live, and only the dead state is left out
    assertThat(RegexAutomata.minimize("ab", engine).countStates(), is(3));
    assertThat(RegexAutomata.minimize("(a|b)*abb", engine).countStates(), is(4));
    assertThat(RegexAutomata.minimize("a(ba)*b|a", engine).countStates(), is(4));
    assertThat(RegexAutomata.minimize("(a|b)*", engine).countStates(), is(1));
  }

  @Test
  public void displayName() {
    assertThat(engine.displayName().isEmpty(), is(false));
  }
}
