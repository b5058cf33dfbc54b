package glushkov.tree;

import glushkov.util.IntSet;
import java.util.HashSet;
import java.util.Objects;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Zero or more repetitions of the child.
 */
public final class Star extends Node {

  public final Node child;

  public Star(Node child) {
    this.child = Objects.requireNonNull(child, "child");
  }

  @Override
  boolean computeNullable() {
    return true;
  }

  @Override
  IntSet computeFirst() {
    return child.first();
  }

  @Override
  IntSet computeLast() {
    return child.last();
  }

  @Override
  Set<FollowPair> computeFollow() {
    // Looping back: any last position can be followed by any first position
    final var follow = new HashSet<>(child.follow());
    child.last().stream().forEach(i ->
      child.first().stream().forEach(j -> follow.add(new FollowPair(i, j)))
    );
    return follow;
  }

  @Override
  SortedMap<Integer, Character> computePos() {
    return new TreeMap<>(child.pos());
  }

  @Override
  Node computeReverse() {
    return new Star(child.reverse());
  }

  @Override
  public String toPattern() {
    // `a**` is not valid syntax, so nested stars also get parenthesized
    return child.toPatternWithin(precedence() + 1) + "*";
  }

  @Override
  int precedence() {
    return 2;
  }

  @Override
  public int hashCode() {
    return 17 * child.hashCode() + 1;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    } else if (!(obj instanceof Star)) {
      return false;
    } else {
      return child.equals(((Star) obj).child);
    }
  }

  @Override
  public String toString() {
    return "Star(" + child + ")";
  }
}
