package glushkov.tree;

import glushkov.util.IntSet;
import java.util.HashSet;
import java.util.Objects;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Match of the left subtree followed by a match of the right subtree.
 */
public final class Concat extends Node {

  public final Node left;
  public final Node right;

  public Concat(Node left, Node right) {
    this.left = Objects.requireNonNull(left, "left");
    this.right = Objects.requireNonNull(right, "right");
  }

  @Override
  boolean computeNullable() {
    return left.nullable() && right.nullable();
  }

  @Override
  IntSet computeFirst() {
    return left.nullable() ? left.first().union(right.first()) : left.first();
  }

  @Override
  IntSet computeLast() {
    return right.nullable() ? left.last().union(right.last()) : right.last();
  }

  @Override
  Set<FollowPair> computeFollow() {
    final var follow = new HashSet<>(left.follow());
    follow.addAll(right.follow());
    left.last().stream().forEach(i ->
      right.first().stream().forEach(j -> follow.add(new FollowPair(i, j)))
    );
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
    return new Concat(right.reverse(), left.reverse());
  }

  @Override
  public String toPattern() {
    return left.toPatternWithin(precedence()) + right.toPatternWithin(precedence());
  }

  @Override
  int precedence() {
    return 1;
  }

  @Override
  public int hashCode() {
    return 31 * (31 * left.hashCode() + right.hashCode()) + 2;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    } else if (!(obj instanceof Concat)) {
      return false;
    } else {
      final Concat other = (Concat) obj;
      return left.equals(other.left) && right.equals(other.right);
    }
  }

  @Override
  public String toString() {
    return "Concat(" + left + ", " + right + ")";
  }
}
