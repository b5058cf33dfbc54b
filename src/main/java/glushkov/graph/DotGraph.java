package glushkov.graph;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Graph which can be rendered in Graphviz's Dot language.
 *
 * @param <V> vertex identifiers
 * @param <E> edge labels
 */
public interface DotGraph<V, E> {

  /**
   * Vertex in the dot graph.
   *
   * @param id unique identifier for the vertex
   * @param accepting is this an accepting state?
   */
  record Vertex<V>(V id, boolean accepting) { }

  /**
   * Edge in the dot graph.
   *
   * @param from vertex where the edge starts (`null` for an entry arrow)
   * @param to vertex where the edge ends
   * @param label label on the edge (`null` for no label)
   */
  record Edge<V, E>(V from, V to, E label) { }

  Stream<Vertex<V>> vertices();

  Stream<Edge<V, E>> edges();

  /**
   * Render an edge label.
   *
   * @param edge edge associated with the label
   * @return HTML label string (empty for no label)
   */
  default String renderEdgeLabel(Edge<V, E> edge) {
    return edge.label() == null ? "" : escapeHtml(edge.label().toString());
  }

  /**
   * Render a vertex label.
   *
   * @param vertex vertex associated with the label
   * @return HTML label string
   */
  default String renderVertexLabel(Vertex<V> vertex) {
    return escapeHtml(String.valueOf(vertex.id()));
  }

  /**
   * Render a full Dot graph.
   *
   * <p>Parallel edges are drawn as one arrow carrying all of their labels, and
   * each entry arrow starts from its own invisible point. Compile the output
   * using {@code dot -Tsvg fsm.dot > fsm.svg}.
   *
   * @param name title given to the graph
   * @return source code for the graph
   */
  default String dotGraph(String name) {
    final var builder = new StringBuilder();
    builder.append("digraph ").append(quote(name)).append(" {\n");
    builder.append("  rankdir = LR;\n");
    builder.append("  node [shape = circle];\n");

    vertices().forEach(vertex -> {
      builder.append("  ").append(quote(String.valueOf(vertex.id()))).append(" [");
      if (vertex.accepting()) {
        builder.append("shape = doublecircle, ");
      }
      builder.append("label = <").append(renderVertexLabel(vertex)).append(">];\n");
    });

    // Arrows keyed by their (quoted) endpoints, in order of first appearance
    final Map<List<String>, List<String>> arrows = new LinkedHashMap<>();
    final List<String> entryPoints = new ArrayList<>();
    edges().forEach(edge -> {
      final String from;
      if (edge.from() == null) {
        from = quote("_start" + (entryPoints.size() + 1));
        entryPoints.add(from);
      } else {
        from = quote(edge.from().toString());
      }
      final String to = quote(edge.to().toString());
      final String label = renderEdgeLabel(edge);
      final List<String> labels = arrows.computeIfAbsent(List.of(from, to), k -> new ArrayList<>());
      if (!label.isEmpty()) {
        labels.add(label);
      }
    });

    arrows.forEach((endpoints, labels) -> {
      builder.append("  ").append(endpoints.get(0)).append(" -> ").append(endpoints.get(1));
      if (!labels.isEmpty()) {
        builder.append(" [label = <").append(String.join(", ", labels)).append(">]");
      }
      builder.append(";\n");
    });

    for (String entryPoint : entryPoints) {
      builder.append("  ").append(entryPoint).append(" [shape = point];\n");
    }

    builder.append("}\n");
    return builder.toString();
  }

  /**
   * Turn a string into a Dot ID: any double-quoted string, with quotes inside
   * escaped.
   */
  private static String quote(String str) {
    return "\"" + str.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
  }

  /**
   * Escape text so that it can be placed inside an HTML label.
   *
   * @param str raw text
   * @return text with HTML special characters replaced by entities
   */
  static String escapeHtml(String str) {
    return str
      .replace("&", "&amp;")
      .replace("<", "&lt;")
      .replace(">", "&gt;")
      .replace("\"", "&quot;");
  }
}
