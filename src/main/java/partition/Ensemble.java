package partition;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;
import partition.graph.DotGraph;

/**
 * Result of partitioning a model.
 *
 * <p>Every operation of the model belongs to exactly one group. Groups sharing
 * a repeated block id are structurally identical and can share a compiled
 * function; the layer correspondence between them is in {@link #repeated()}.
 *
 * @param groups final groups, in topological order
 * @param repeated kept repeated blocks, by id
 * @param ports ports used by every direct connection between two layers
 * @param dependencies dependencies between groups, as pairs of group ids
 */
public record Ensemble(
  List<PartitionGroup> groups,
  Map<String, RepeatedBlock> repeated,
  List<PortLink> ports,
  List<GroupEdge> dependencies
) implements DotGraph<Integer> {

  /**
   * Dependency between two groups.
   *
   * @param producer id of the producing group
   * @param consumer id of the consuming group
   */
  public record GroupEdge(int producer, int consumer) { }

  public Ensemble {
    groups = List.copyOf(groups);
    repeated = Collections.unmodifiableMap(new LinkedHashMap<>(repeated));
    ports = List.copyOf(ports);
    dependencies = List.copyOf(dependencies);
  }

  /**
   * Find the group containing a layer.
   *
   * @param layerName name of an operation of the model
   */
  public Optional<PartitionGroup> groupOf(String layerName) {
    return groups
      .stream()
      .filter(group -> group.allLayers().contains(layerName))
      .findFirst();
  }

  /**
   * Groups which are instances of a given repeated block.
   */
  public List<PartitionGroup> instancesOf(String repeatedId) {
    return groups
      .stream()
      .filter(group -> group.repeatedId().filter(repeatedId::equals).isPresent())
      .toList();
  }

  /**
   * Render the final group graph into DOT source.
   */
  public String dotGraph() {
    return dotGraph("partitioning");
  }

  @Override
  public Stream<DotGraph.Vertex<Integer>> vertices() {
    return groups
      .stream()
      .map(group -> new DotGraph.Vertex<Integer>(group.id(), group.repeatedId().isPresent()));
  }

  @Override
  public Stream<DotGraph.Edge<Integer>> edges() {
    return dependencies
      .stream()
      .map(edge -> new DotGraph.Edge<Integer>(edge.producer(), edge.consumer()));
  }

  @Override
  public String renderVertexLabel(DotGraph.Vertex<Integer> vertex) {
    final var group = groups
      .stream()
      .filter(candidate -> candidate.id() == vertex.id())
      .findFirst()
      .orElseThrow();
    final var label = new StringBuilder(String.join("<br/>", group.allLayers()));
    group.repeatedId().ifPresent(id -> label.append("<br/><i>").append(id).append("</i>"));
    return label.toString();
  }
}
