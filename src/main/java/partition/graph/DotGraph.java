package partition.graph;

import java.util.stream.Stream;

/**
 * Group graph which can be dumped in the DOT language, for inspecting the
 * state of a partitioning with Graphviz.
 *
 * <p>Every group becomes a box. Groups which are settled (frozen, or part of
 * a repeated block) get a double border. Dependencies between groups are
 * unlabelled arrows from producer to consumer.
 *
 * @param <V> group identifier
 */
public interface DotGraph<V> {

  /**
   * Box in the rendered graph.
   *
   * @param id group identifier, unique in the graph
   * @param settled whether the group is frozen or belongs to a repeated block
   */
  record Vertex<V>(V id, boolean settled) { }

  /**
   * Arrow from a producer group to one of its consumers.
   */
  record Edge<V>(V producer, V consumer) { }

  public Stream<Vertex<V>> vertices();

  public Stream<Edge<V>> edges();

  /**
   * HTML label of a box, which defaults to the group identifier.
   */
  default String renderVertexLabel(Vertex<V> vertex) {
    return vertex.id().toString();
  }

  /**
   * Render the groups top to bottom, producers above their consumers.
   *
   * @param name title given to the graph
   * @return DOT source
   */
  default String dotGraph(String name) {
    final var builder = new StringBuilder();
    builder.append("digraph ").append(quote(name)).append(" {\n");
    builder.append("  rankdir = TB;\n");

    vertices().forEachOrdered(vertex -> builder
      .append("  ").append(quote(vertex.id().toString()))
      .append(" [shape = box, peripheries = ").append(vertex.settled() ? 2 : 1)
      .append(", label = <").append(renderVertexLabel(vertex)).append(">];\n"));

    edges().forEachOrdered(edge -> builder
      .append("  ").append(quote(edge.producer().toString()))
      .append(" -> ").append(quote(edge.consumer().toString())).append(";\n"));

    builder.append("}");
    return builder.toString();
  }

  /**
   * Double-quoted DOT identifier, with inner quotes escaped.
   */
  private static String quote(String str) {
    return "\"" + str.replace("\"", "\\\"") + "\"";
  }
}
