package glushkov.tree;

import glushkov.util.IntSet;
import java.util.HashSet;
import java.util.Objects;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Match of either the left or the right subtree.
 */
public final class Alt extends Node {

  public final Node left;
  public final Node right;

  public Alt(Node left, Node right) {
    this.left = Objects.requireNonNull(left, "left");
    this.right = Objects.requireNonNull(right, "right");
  }

  @Override
  boolean computeNullable() {
    return left.nullable() || right.nullable();
  }

  @Override
  IntSet computeFirst() {
    return left.first().union(right.first());
  }

  @Override
  IntSet computeLast() {
    return left.last().union(right.last());
  }

  @Override
  Set<FollowPair> computeFollow() {
    final var follow = new HashSet<>(left.follow());
    follow.addAll(right.follow());
    return follow;
  }

  @Override
  SortedMap<Integer, Character> computePos() {
    final var pos = new TreeMap<>(left.pos());
    pos.putAll(right.pos());
    return pos;
  }

  @Override
  Node computeReverse() {
    return new Alt(right.reverse(), left.reverse());
  }

  @Override
  public String toPattern() {
    return left.toPatternWithin(precedence()) + "|" + right.toPatternWithin(precedence());
  }

  @Override
  int precedence() {
    return 0;
  }

  @Override
  public int hashCode() {
    return 31 * (31 * left.hashCode() + right.hashCode()) + 3;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    } else if (!(obj instanceof Alt)) {
      return false;
    } else {
      final Alt other = (Alt) obj;
      return left.equals(other.left) && right.equals(other.right);
    }
  }

  @Override
  public String toString() {
    return "Alt(" + left + ", " + right + ")";
  }
}
