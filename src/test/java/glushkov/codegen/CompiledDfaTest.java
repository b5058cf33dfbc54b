package glushkov.codegen;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.not;

import glushkov.engine.MarkBeforeAutomaton;
import glushkov.engine.McNaughtonYamadaAutomaton;
import glushkov.graph.Dfa;
import glushkov.parser.RegexParser;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.junit.Test;

/**
 * Tests for {@link CompiledDfa}.
 */
public class CompiledDfaTest {

  private static CompiledMatcher compileMinimal(String pattern) {
    return CompiledDfa.compile(pattern, McNaughtonYamadaAutomaton.minimize(RegexParser.parse(pattern)), false);
  }

  private static void assertAgrees(String pattern, List<String> words) {
    final CompiledMatcher compiled = compileMinimal(pattern);
    final var interpreted = new McNaughtonYamadaAutomaton(RegexParser.parse(pattern));
    for (String word : words) {
      assertThat(pattern + " / " + word, compiled.matches(word), is(interpreted.accepts(word)));
    }
  }

  @Test
  public void matches() {
    final CompiledMatcher matcher = compileMinimal("a(ba)*b|a");
    assertThat(matcher.matches("a"), is(true));
    assertThat(matcher.matches("abab"), is(true));
    assertThat(matcher.matches("abb"), is(false));
    assertThat(matcher.matches(""), is(false));
    assertThat(matcher.matches(new StringBuilder("ab")), is(true));
  }

  @Test
  public void nonMinimalDfa() {
    final Dfa<?> dfa = new MarkBeforeAutomaton(RegexParser.parse("(a|b)*abb"));
    final CompiledMatcher matcher = CompiledDfa.compile("(a|b)*abb", dfa, false);
    assertThat(matcher.stateCount(), is(4));
    assertThat(matcher.matches("aababb"), is(true));
    assertThat(matcher.matches("aababba"), is(false));
  }

  @Test
  public void acceptingStateWithoutTransitions() {
    final Dfa<?> dfa = new MarkBeforeAutomaton(RegexParser.parse("ab"));
    final CompiledMatcher matcher = CompiledDfa.compile("ab", dfa, false);
    assertThat(matcher.stateCount(), is(3));
    assertThat(matcher.matches("ab"), is(true));
    assertThat(matcher.matches("abb"), is(false));
  }

  @Test
  public void denseAndSparseSymbols() {
    // Dense symbols go through `tableswitch`, sparse ones through `lookupswitch`
    assertAgrees("(a|b|c|d)*d", List.of("", "d", "abcd", "dddc", "e"));
    assertAgrees("(a|m|z)*m", List.of("", "m", "azm", "zza", "b"));
  }

  @Test
  public void unusualSymbols() {
    // Symbols needing each width of integer constant
    assertAgrees("\u0000b", List.of("\u0000b", "b", "\u0000"));
    assertAgrees("x\u0400*", List.of("x", "x\u0400\u0400", "\u0400"));
    assertAgrees("\uffffa", List.of("\uffffa", "a", "\ufffea"));
  }

  @Test
  public void distinctClassesPerCompilation() {
    final CompiledMatcher first = compileMinimal("a");
    final CompiledMatcher second = compileMinimal("b");
    assertThat(first.getClass(), is(not(second.getClass())));
    assertThat(first.matches("a"), is(true));
    assertThat(second.matches("a"), is(false));
  }

  @Test
  public void debugTrace() {
    final var buffer = new ByteArrayOutputStream();
    final PrintStream originalErr = System.err;
    final CompiledMatcher matcher;
    try {
      System.setErr(new PrintStream(buffer, true, StandardCharsets.UTF_8));
      matcher = CompiledDfa.compile("ab", McNaughtonYamadaAutomaton.minimize(RegexParser.parse("ab")), true);
      assertThat(matcher.matches("ab"), is(true));
    } finally {
      System.setErr(originalErr);
    }

    final String output = buffer.toString(StandardCharsets.UTF_8);
    assertThat(output, containsString("[DFA compilation] "));
    assertThat(output, containsString(
      String.join(
        System.lineSeparator(),
        "[DFA] starting run on: ab",
        "[DFA] entering 0",
        "[DFA] entering 1",
        "[DFA] entering 2",
        "[DFA] exiting run (successful)"
      )
    ));
  }
}
