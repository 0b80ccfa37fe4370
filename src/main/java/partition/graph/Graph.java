package partition.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.PriorityQueue;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Directed graph whose nodes live in an arena of slots.
 *
 * <p>Nodes are addressed by {@link NodeHandle}, which pairs the slot index with
 * the generation of the slot at the time the node was created. Removing a node
 * bumps the generation of its slot, so every handle that was captured before
 * the removal fails the liveness check from then on. Slots are never reused.
 *
 * <p>Each node carries one opaque metadata payload of type {@code M}.
 *
 * <p>The graph does not check for cycles when linking nodes: callers are
 * expected to have verified that the new edge keeps the graph acyclic.
 *
 * @param <M> metadata attached to each node
 */
public final class Graph<M> {

  /**
   * Handle to a node in the graph.
   *
   * @param slot index of the arena slot
   * @param generation generation of the slot when the handle was issued
   */
  public record NodeHandle(int slot, int generation) implements Comparable<NodeHandle> {

    @Override
    public int compareTo(NodeHandle other) {
      final int slotCmp = Integer.compare(slot, other.slot);
      return slotCmp != 0 ? slotCmp : Integer.compare(generation, other.generation);
    }

    @Override
    public String toString() {
      return "n" + slot;
    }
  }

  private static final class Slot<M> {
    int generation = 0;
    boolean alive = true;
    M meta = null;
    final LinkedHashSet<Integer> in = new LinkedHashSet<>();
    final LinkedHashSet<Integer> out = new LinkedHashSet<>();
  }

  private final ArrayList<Slot<M>> slots = new ArrayList<>();

  private int liveCount = 0;

  /**
   * Cached topological order, cleared on every structural change.
   */
  private List<NodeHandle> sortedCache = null;

  /**
   * Create a fresh node with no metadata and no edges.
   *
   * @return handle to the new node
   */
  public NodeHandle create() {
    final var slot = new Slot<M>();
    slots.add(slot);
    liveCount++;
    sortedCache = null;
    return new NodeHandle(slots.size() - 1, slot.generation);
  }

  /**
   * Remove a node along with all of its edges.
   *
   * <p>The handle (and every copy of it) becomes permanently dead.
   *
   * @param handle live node to remove
   */
  public void remove(NodeHandle handle) {
    final var slot = live(handle);
    for (int src : slot.in) {
      slots.get(src).out.remove(handle.slot());
    }
    for (int dst : slot.out) {
      slots.get(dst).in.remove(handle.slot());
    }
    slot.in.clear();
    slot.out.clear();
    slot.meta = null;
    slot.alive = false;
    slot.generation++;
    liveCount--;
    sortedCache = null;
  }

  /**
   * Check whether the handle still refers to a node in the graph.
   *
   * <p>This is the only liveness authority: a handle is dead as soon as its
   * node was removed.
   */
  public boolean contains(NodeHandle handle) {
    if (handle == null || handle.slot() < 0 || handle.slot() >= slots.size()) {
      return false;
    }
    final var slot = slots.get(handle.slot());
    return slot.alive && slot.generation == handle.generation();
  }

  /**
   * Add an edge from one node to another.
   *
   * @param from source of the edge
   * @param to target of the edge
   */
  public void link(NodeHandle from, NodeHandle to) {
    final var fromSlot = live(from);
    final var toSlot = live(to);
    if (from.slot() == to.slot()) {
      throw new IllegalArgumentException("cannot link " + from + " to itself");
    }
    if (!fromSlot.out.add(to.slot())) {
      throw new IllegalArgumentException(from + " is already linked to " + to);
    }
    toSlot.in.add(from.slot());
    sortedCache = null;
  }

  /**
   * Remove the edge from one node to another, if there is one.
   *
   * @return whether an edge was removed
   */
  public boolean unlink(NodeHandle from, NodeHandle to) {
    final var fromSlot = live(from);
    final var toSlot = live(to);
    final boolean removed = fromSlot.out.remove(to.slot());
    toSlot.in.remove(from.slot());
    if (removed) {
      sortedCache = null;
    }
    return removed;
  }

  /**
   * Check whether there is an edge going from one node to another.
   */
  public boolean linked(NodeHandle from, NodeHandle to) {
    final var fromSlot = live(from);
    live(to);
    return fromSlot.out.contains(to.slot());
  }

  /**
   * Nodes with an edge into the given node, in the order the edges were added.
   */
  public List<NodeHandle> srcNodes(NodeHandle handle) {
    return handles(live(handle).in);
  }

  /**
   * Nodes with an edge out of the given node, in the order the edges were added.
   */
  public List<NodeHandle> dstNodes(NodeHandle handle) {
    return handles(live(handle).out);
  }

  /**
   * Metadata attached to a node.
   *
   * @param handle live node
   * @return metadata, or {@code null} if none was set
   */
  public M meta(NodeHandle handle) {
    return live(handle).meta;
  }

  public void setMeta(NodeHandle handle, M meta) {
    live(handle).meta = meta;
  }

  /**
   * Number of live nodes.
   */
  public int size() {
    return liveCount;
  }

  /**
   * All live nodes, in creation order.
   */
  public List<NodeHandle> nodes() {
    return IntStream
      .range(0, slots.size())
      .filter(i -> slots.get(i).alive)
      .mapToObj(i -> new NodeHandle(i, slots.get(i).generation))
      .collect(Collectors.toUnmodifiableList());
  }

  /**
   * Live nodes in topological order.
   *
   * <p>The order is deterministic: among the nodes that are ready to be
   * emitted, the one created first always goes first. The result is cached
   * until the next change to the graph.
   *
   * @return unmodifiable topologically sorted list of handles
   * @throws IllegalStateException if the graph contains a cycle
   */
  public List<NodeHandle> sorted() {
    if (sortedCache != null) {
      return sortedCache;
    }

    final var inDegree = new int[slots.size()];
    final var ready = new PriorityQueue<Integer>();
    for (int i = 0; i < slots.size(); i++) {
      final var slot = slots.get(i);
      if (slot.alive) {
        inDegree[i] = slot.in.size();
        if (inDegree[i] == 0) {
          ready.add(i);
        }
      }
    }

    final var order = new ArrayList<NodeHandle>(liveCount);
    while (!ready.isEmpty()) {
      final int next = ready.poll();
      final var slot = slots.get(next);
      order.add(new NodeHandle(next, slot.generation));
      for (int dst : slot.out) {
        if (--inDegree[dst] == 0) {
          ready.add(dst);
        }
      }
    }

    if (order.size() != liveCount) {
      throw new IllegalStateException(
        "graph is not acyclic: only " + order.size() + " of " + liveCount + " nodes could be sorted"
      );
    }

    sortedCache = Collections.unmodifiableList(order);
    return sortedCache;
  }

  private Slot<M> live(NodeHandle handle) {
    if (!contains(handle)) {
      throw new IllegalStateException("dead or foreign node handle " + handle);
    }
    return slots.get(handle.slot());
  }

  private List<NodeHandle> handles(LinkedHashSet<Integer> indices) {
    return indices
      .stream()
      .map(i -> new NodeHandle(i, slots.get(i).generation))
      .collect(Collectors.toUnmodifiableList());
  }
}
