package glushkov.tree;

/**
 * Position {@code to} may immediately follow position {@code from}.
 *
 * @param from earlier position (possibly the marker {@code 0} in derived relations)
 * @param to later position
 */
public record FollowPair(int from, int to) {

  @Override
  public String toString() {
    return "(" + from + "," + to + ")";
  }
}
