package glushkov.engine;

import glushkov.util.IntSet;

/**
 * State shared by the follow and mark-before automata: the positions that
 * may come next, and whether the word read so far is accepted.
 *
 * <p>Positions with the same follow set and finality are indistinguishable,
 * and collapse into one state since records compare by value.
 *
 * @param follow positions that may be read next
 * @param accepting whether this state is accepting
 */
public record FollowState(IntSet follow, boolean accepting) {

  @Override
  public String toString() {
    return follow + (accepting ? "!" : "");
  }
}
