package partition.online;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.SortedSet;
import java.util.Stack;
import java.util.TreeSet;
import partition.PartitionGroup;
import partition.graph.Graph;
import partition.graph.Graph.NodeHandle;
import partition.model.Layer;

/**
 * Contraction unit of the online partitioner.
 *
 * <p>A group starts out wrapping a single layer and grows by absorbing
 * adjacent groups. The surviving group keeps its id and its graph handle; the
 * absorbed group is removed from the graph and its handle becomes dead.
 *
 * <p>Every fusion first checks that the pair can be contracted without
 * creating a cycle, and fails with a {@link PartitioningException} otherwise.
 * Frozen groups never take part in fusion.
 */
public final class Group {

  private static final int NO_REPEATED = -1;

  private final int id;

  private final NodeHandle handle;

  private final Graph<Group> graph;

  private final Snapshot snapshot;

  private final Layer initialLayer;

  /**
   * Layers inside the group, in the order they were absorbed.
   */
  private final LinkedHashSet<Layer> content = new LinkedHashSet<>();

  /**
   * For every layer in {@link #content}, the ids of the repeated tags
   * assigned to the groups it was part of.
   */
  private final Map<Layer, List<Integer>> reptrack = new HashMap<>();

  private final TreeSet<String> avoidedTargets = new TreeSet<>();

  private String specialTag = "";

  private boolean frozen = false;

  private boolean noFold = false;

  private int repeated = NO_REPEATED;

  Group(Layer initialLayer, int id, NodeHandle handle, Graph<Group> graph, Snapshot snapshot) {
    this.initialLayer = initialLayer;
    this.id = id;
    this.handle = handle;
    this.graph = graph;
    this.snapshot = snapshot;
    content.add(initialLayer);
    reptrack.put(initialLayer, new ArrayList<>());
  }

  /**
   * Creation order of the group, used as the final tie-breaker everywhere
   * groups get sorted.
   */
  public int getId() {
    return id;
  }

  public NodeHandle getHandle() {
    return handle;
  }

  /**
   * Layer the group was created from.
   */
  public Layer getInitialLayer() {
    return initialLayer;
  }

  public Set<Layer> getContent() {
    return Collections.unmodifiableSet(content);
  }

  /**
   * Number of layers in the group.
   */
  public int size() {
    return content.size();
  }

  /**
   * Whether the group is still part of the graph (and has not been absorbed).
   */
  public boolean isLive() {
    return graph.contains(handle);
  }

  /**
   * Producer groups, deduplicated, in the order the edges were added.
   */
  public List<NodeHandle> srcNodes() {
    return graph.srcNodes(liveHandle());
  }

  /**
   * Consumer groups, deduplicated, in the order the edges were added.
   */
  public List<NodeHandle> dstNodes() {
    return graph.dstNodes(liveHandle());
  }

  /**
   * Check whether contracting this group with another one would create a
   * cycle.
   *
   * <p>This is the case exactly when there is a path of length two or more
   * between the groups in either direction: after contraction, that path
   * would start and end at the same group.
   *
   * @param other live group
   * @return whether the two groups cannot be fused
   */
  public boolean hasCycle(Group other) {
    liveHandle();
    other.liveHandle();
    return reachesIndirectly(handle, other.handle) || reachesIndirectly(other.handle, handle);
  }

  private boolean reachesIndirectly(NodeHandle from, NodeHandle to) {
    final var seen = new HashSet<NodeHandle>();
    final var toVisit = new Stack<NodeHandle>();

    // Seed the DFS with everything but the direct edge
    for (NodeHandle dst : graph.dstNodes(from)) {
      if (!dst.equals(to) && seen.add(dst)) {
        toVisit.push(dst);
      }
    }

    while (!toVisit.isEmpty()) {
      final var next = toVisit.pop();
      for (NodeHandle dst : graph.dstNodes(next)) {
        if (dst.equals(to)) {
          return true;
        }
        if (seen.add(dst)) {
          toVisit.push(dst);
        }
      }
    }
    return false;
  }

  /**
   * Absorb one of the producers of this group.
   *
   * @param producer live, non-frozen group with an edge into this group
   */
  public void fuse(Group producer) {
    if (!graph.linked(producer.liveHandle(), liveHandle())) {
      throw new PartitioningException("tried to fuse group " + producer.id + " which is not a producer of group " + id);
    }
    absorb(producer);
  }

  /**
   * Absorb one of the consumers of this group.
   *
   * @param consumer live, non-frozen group with an edge from this group
   */
  public void fuseWith(Group consumer) {
    if (!graph.linked(liveHandle(), consumer.liveHandle())) {
      throw new PartitioningException("tried to fuse group " + consumer.id + " which is not a consumer of group " + id);
    }
    absorb(consumer);
  }

  /**
   * Contract two producers of this group together, reducing its fan-in.
   *
   * <p>The first producer survives and absorbs the second one. This group is
   * left untouched.
   *
   * @param first surviving producer
   * @param second absorbed producer
   */
  public void fuseInputs(Group first, Group second) {
    final var self = liveHandle();
    if (!graph.linked(first.liveHandle(), self) || !graph.linked(second.liveHandle(), self)) {
      throw new PartitioningException("tried to fuse groups " + first.id + " and " + second.id
        + " which are not both producers of group " + id);
    }
    first.absorb(second);
  }

  private void absorb(Group other) {
    if (other == this) {
      throw new PartitioningException("tried to fuse group " + id + " with itself");
    }
    if (frozen || other.frozen) {
      throw new PartitioningException("tried to fuse frozen groups " + id + " and " + other.id);
    }
    if (hasCycle(other)) {
      throw new PartitioningException("fusing groups " + id + " and " + other.id + " would create a cycle");
    }

    final var nodeToGroup = snapshot.getNodeToGroupMap();
    for (Layer layer : other.content) {
      content.add(layer);
      reptrack.put(layer, other.reptrack.get(layer));
      nodeToGroup.put(layer, this);
    }
    avoidedTargets.addAll(other.avoidedTargets);
    if (specialTag.isEmpty()) {
      specialTag = other.specialTag;
    }
    noFold = noFold || other.noFold;

    relinkGraph(other);
  }

  /**
   * Move the edges of the other group onto this one and drop the other group
   * from the graph.
   */
  private void relinkGraph(Group other) {
    final var producers = graph.srcNodes(other.handle);
    final var consumers = graph.dstNodes(other.handle);

    // Also removes all of its edges
    graph.remove(other.handle);

    for (NodeHandle producer : producers) {
      if (!producer.equals(handle) && !graph.linked(producer, handle)) {
        graph.link(producer, handle);
      }
    }
    for (NodeHandle consumer : consumers) {
      if (!consumer.equals(handle) && !graph.linked(handle, consumer)) {
        graph.link(handle, consumer);
      }
    }
  }

  /**
   * Describe how the layers of a producer group feed the layers of this one.
   *
   * <p>The result is only meant to be compared with other interconnects.
   *
   * @param producer group whose outputs are read by this group
   * @return sorted interconnects, one per distinct edge
   */
  public SortedSet<MetaInterconnect> metaInterconnect(Group producer) {
    final var interconnects = new TreeSet<MetaInterconnect>();
    for (Layer layer : content) {
      final var inputs = layer.inputs();
      for (int port = 0; port < inputs.size(); port++) {
        final var input = inputs.get(port);
        final var source = input.source();
        if (producer.content.contains(source)) {
          interconnects.add(new MetaInterconnect(
            source.metaDesc(),
            producer.getReptrack(source),
            input.outputPort(),
            layer.metaDesc(),
            getReptrack(layer),
            port
          ));
        }
      }
    }
    return interconnects;
  }

  /**
   * Layers reading at least one tensor from outside the group, in model order.
   */
  public List<Layer> inputLayers() {
    final var inputs = new ArrayList<Layer>();
    for (Layer layer : content) {
      for (Layer.Input input : layer.inputs()) {
        if (!content.contains(input.source())) {
          inputs.add(layer);
          break;
        }
      }
    }
    inputs.sort(Comparator.comparingInt(layer -> layer.index));
    return inputs;
  }

  /**
   * Layers with at least one reader outside the group, in model order.
   */
  public List<Layer> outputLayers() {
    final var outputs = new ArrayList<Layer>();
    for (Layer layer : content) {
      boolean external = false;
      for (int port = 0; port < layer.outputs.size() && !external; port++) {
        for (Layer.Consumer consumer : layer.consumers(port)) {
          if (!content.contains(consumer.target())) {
            external = true;
            break;
          }
        }
      }
      if (external) {
        outputs.add(layer);
      }
    }
    outputs.sort(Comparator.comparingInt(layer -> layer.index));
    return outputs;
  }

  /**
   * Keep the group off a device.
   */
  public void avoid(String device) {
    checkNotFrozen("avoid " + device);
    avoidedTargets.add(device);
  }

  public SortedSet<String> avoidedTargets() {
    return Collections.unmodifiableSortedSet(avoidedTargets);
  }

  /**
   * Attach an isolation tag to the group.
   */
  public void isolate(String tag) {
    checkNotFrozen("isolate " + tag);
    specialTag = tag;
  }

  /**
   * Isolation tag, or the empty string.
   */
  public String specialTag() {
    return specialTag;
  }

  public boolean isolated() {
    return !specialTag.isEmpty();
  }

  /**
   * Permanently exclude the group from further fusion.
   */
  public void freeze() {
    frozen = true;
  }

  public boolean isFrozen() {
    return frozen;
  }

  /**
   * Prevent the group from being folded into a shared function.
   */
  public void noFold() {
    noFold = true;
  }

  public boolean isNoFold() {
    return noFold;
  }

  /**
   * Associate the group with a repeated tag, or clear the association.
   *
   * <p>Assigning a tag also records it in the reptrack of every layer in the
   * group.
   *
   * @param rep repeated tag, or {@code null}
   */
  public void setRepeated(Repeated rep) {
    checkNotFrozen("change repeated tag");
    if (rep == null) {
      repeated = NO_REPEATED;
      return;
    }
    repeated = rep.id;
    for (Layer layer : content) {
      reptrack.get(layer).add(rep.id);
    }
  }

  public Optional<Repeated> repeated() {
    return repeated == NO_REPEATED ? Optional.empty() : Optional.of(snapshot.repeatedTag(repeated));
  }

  /**
   * Repeated tags the layer was part of, oldest first.
   *
   * @param layer layer inside the group
   */
  public List<Integer> getReptrack(Layer layer) {
    final var track = reptrack.get(layer);
    if (track == null) {
      throw new IllegalArgumentException("layer " + layer + " is not in group " + id);
    }
    return Collections.unmodifiableList(track);
  }

  /**
   * Describe the group for consumers of the partitioning result.
   */
  public PartitionGroup toPartitionGroup() {
    liveHandle();
    final var allLayers = new ArrayList<>(content);
    allLayers.sort(Comparator.comparingInt(layer -> layer.index));
    return new PartitionGroup(
      id,
      layerNames(inputLayers()),
      layerNames(outputLayers()),
      layerNames(allLayers),
      repeated().map(Repeated::repeatedId),
      avoidedTargets,
      specialTag
    );
  }

  private static List<String> layerNames(List<Layer> layers) {
    return layers.stream().map(layer -> layer.name).toList();
  }

  private NodeHandle liveHandle() {
    if (!graph.contains(handle)) {
      throw new PartitioningException("used group " + id + " after it was fused into another group");
    }
    return handle;
  }

  private void checkNotFrozen(String action) {
    if (frozen) {
      throw new PartitioningException("tried to " + action + " on frozen group " + id);
    }
  }

  @Override
  public String toString() {
    return "Group[" + id + ", size=" + content.size() + (frozen ? ", frozen]" : "]");
  }
}
