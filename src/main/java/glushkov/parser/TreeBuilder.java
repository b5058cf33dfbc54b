package glushkov.parser;

import glushkov.tree.Alt;
import glushkov.tree.Concat;
import glushkov.tree.Node;
import glushkov.tree.Star;
import glushkov.tree.Symbol;

/**
 * Visitor which builds an explicit syntax tree.
 */
public final class TreeBuilder implements RegexVisitor<Node> {

  @Override
  public Node visitSymbol(char symbol, int position) {
    return new Symbol(symbol, position);
  }

  @Override
  public Node visitConcatenation(Node lhs, Node rhs) {
    return new Concat(lhs, rhs);
  }

  @Override
  public Node visitAlternation(Node lhs, Node rhs) {
    return new Alt(lhs, rhs);
  }

  @Override
  public Node visitKleene(Node lhs) {
    return new Star(lhs);
  }
}
