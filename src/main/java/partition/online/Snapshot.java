package partition.online;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.SortedSet;
import java.util.Stack;
import java.util.TreeSet;
import java.util.stream.Stream;
import org.jboss.logging.Logger;
import partition.graph.DotGraph;
import partition.graph.Graph;
import partition.graph.Graph.NodeHandle;
import partition.model.Layer;
import partition.model.MetaDesc;
import partition.model.Model;
import partition.patterns.KnownPattern;

/**
 * State of the online partitioning of one model.
 *
 * <p>The snapshot owns the group graph and runs the contraction passes over
 * it. Every pass walks the groups in topological order; since fusing removes
 * groups from the graph, handles captured before a fusion are checked for
 * liveness before being used.
 *
 * <p>Passes are deterministic: whenever groups get sorted, their ids (which
 * follow the topological order of the model) are the final tie-breaker, and
 * all intermediate collections preserve insertion order.
 */
public final class Snapshot implements DotGraph<Integer> {

  private static final Logger LOG = Logger.getLogger(Snapshot.class);

  /**
   * Direct connection between two layers.
   *
   * @param producer layer producing a tensor
   * @param consumer layer reading the tensor
   */
  public record Link(Layer producer, Layer consumer) { }

  /**
   * Ports on either side of a {@link Link}.
   *
   * @param outputPort output index on the producer
   * @param inputPort input index on the consumer
   */
  public record Ports(int outputPort, int inputPort) { }

  /**
   * Direct neighbours of a layer, including layers which are not operations.
   */
  private record ProducersConsumers(Set<Layer> producers, Set<Layer> consumers) { }

  /**
   * Key under which single-layer groups are considered identical.
   */
  private record UniqueKey(MetaDesc metaDesc, SortedSet<String> avoidedTargets, String specialTag) { }

  /**
   * Producer/consumer pair considered for a repeated merge.
   */
  private record Candidate(Group producer, Group consumer) { }

  /**
   * Apex of a repeated triangle along with the base groups it feeds.
   */
  private record Triangle(Group apex, List<Group> base) { }

  private static final Comparator<Group> BY_ID_DESCENDING = Comparator.comparingInt(Group::getId).reversed();

  private final Model model;

  private final PassContext ctx;

  private final Graph<Group> graph = new Graph<>();

  private final Map<Layer, Group> nodeToGroup = new HashMap<>();

  private final Map<Layer, ProducersConsumers> nodeToProdCons = new HashMap<>();

  private final Map<Link, Ports> portsMap = new LinkedHashMap<>();

  /**
   * For every kept repeated block, the names of the layers matched across its
   * instances (one set per archetype).
   */
  private final Map<String, List<SortedSet<String>>> layerMatches = new LinkedHashMap<>();

  private final ArrayList<Repeated> repeatedTags = new ArrayList<>();

  private boolean built = false;

  public Snapshot(Model model, PassContext ctx) {
    this.model = model;
    this.ctx = ctx;
  }

  /**
   * Whether the layer takes part in partitioning.
   *
   * <p>Parameters, constants, and results are not operations. Neither is a
   * conversion whose only input is a constant, since it gets folded into the
   * weights.
   */
  static boolean isOp(Layer layer) {
    if (layer.type != Layer.Type.OP) {
      return false;
    }
    if (layer.kind.equals("Convert")) {
      if (layer.inputs().size() != 1) {
        return false;
      }
      return layer.inputs().get(0).source().type != Layer.Type.CONSTANT;
    }
    return true;
  }

  /**
   * Build the graph and run the passes of the configured pipeline.
   */
  public void run() {
    LOG.infof("Online partitioning: running %s pipeline with %s", ctx.pipeline, ctx);
    buildGraph();
    switch (ctx.pipeline) {
      case INIT:
        break;
      case JUST:
        earlyAvoids();
        repeat(this::collectLHF);
        fuseRemnantsExtended();
        break;
      case REP:
        earlyAvoids();
        earlyRegroup();
        repeatedBlocks();
        repeat(this::collectLHF);
        fuseRemnantsExtended();
        break;
      default:
        throw new IllegalArgumentException("unsupported pipeline " + ctx.pipeline);
    }
    LOG.infof("Online partitioning: finished with %d groups", graphSize());
  }

  /**
   * Create one group per operation and mirror the edges of the model.
   */
  public void buildGraph() {
    if (built) {
      throw new IllegalStateException("the group graph was already built");
    }
    built = true;
    LOG.info("Online partitioning: parsing model to initial groups...");

    int gid = 0;
    for (Layer layer : model.layers()) {
      if (!isOp(layer)) {
        continue;
      }
      nodeToProdCons.put(layer, new ProducersConsumers(new LinkedHashSet<>(), new LinkedHashSet<>()));

      final var nh = graph.create();
      final var group = new Group(layer, gid++, nh, graph, this);
      graph.setMeta(nh, group);
      nodeToGroup.put(layer, group);
    }

    for (NodeHandle nh : graph.sorted()) {
      final var layer = group(nh).getInitialLayer();
      final var prodCons = nodeToProdCons.get(layer);

      for (int i = 0; i < layer.outputs.size(); i++) {
        for (Layer.Consumer consumer : layer.consumers(i)) {
          final var child = consumer.target();
          prodCons.consumers().add(child);
          portsMap.putIfAbsent(new Link(layer, child), new Ports(i, consumer.inputPort()));

          if (isOp(child)) {
            final var childHandle = nodeToGroup.get(child).getHandle();
            if (!graph.linked(nh, childHandle)) {
              graph.link(nh, childHandle);
            }
          }
        }
      }

      final var inputs = layer.inputs();
      for (int i = 0; i < inputs.size(); i++) {
        final var parent = inputs.get(i).source();
        prodCons.producers().add(parent);
        portsMap.putIfAbsent(new Link(parent, layer), new Ports(inputs.get(i).outputPort(), i));

        if (isOp(parent)) {
          final var parentHandle = nodeToGroup.get(parent).getHandle();
          if (!graph.linked(parentHandle, nh)) {
            graph.link(parentHandle, nh);
          }
        }
      }
    }

    LOG.debugf("Initial number of groups: %d", graphSize());
  }

  /**
   * Fuse the "low hanging fruit": a group with a single producer which itself
   * has this group as its single consumer.
   */
  public void collectLHF() {
    LOG.info("Online partitioning: executing collectLHF pass...");

    for (NodeHandle nh : graph.sorted()) {
      // skip if removed by fuse
      if (!graph.contains(nh)) {
        continue;
      }
      final var group = group(nh);
      final var producers = group.srcNodes();
      if (producers.size() != 1) {
        continue;
      }
      final var prod = producers.get(0);
      if (!graph.contains(prod) || graph.dstNodes(prod).size() != 1) {
        continue;
      }
      final var prodGroup = group(prod);
      if (group.isFrozen() || prodGroup.isFrozen()) {
        continue;
      }
      // stop merging groups if the graph is already small enough
      if (graphSize() <= ctx.minGraphSize) {
        break;
      }
      group.fuse(prodGroup);
    }

    LOG.debugf("Number of groups after collectLHF: %d", graphSize());
  }

  /**
   * Repeatedly fuse groups with their consumers, then repeatedly fuse sibling
   * inputs.
   */
  public void fuseRemnantsExtended() {
    LOG.info("Online partitioning: executing fuseRemnantsExtended pass...");
    repeat(this::fuseRemnants);
    repeat(this::fuseInputs);
  }

  /**
   * Fuse every group with the first consumer it can be fused with, trying
   * consumers in the configured order.
   */
  public void fuseRemnants() {
    LOG.info("Online partitioning: executing fuseRemnants pass...");
    final Comparator<Group> order = ctx.remnantOrder.thenComparingInt(Group::getId);

    for (NodeHandle nh : graph.sorted()) {
      // skip if removed by fuseWith
      if (!graph.contains(nh)) {
        continue;
      }
      final var group = group(nh);
      if (group.isFrozen()) {
        continue;
      }
      final var consumers = liveGroups(group.dstNodes());
      if (consumers.isEmpty()) {
        continue;
      }
      consumers.sort(order);
      for (Group consumer : consumers) {
        if (!consumer.isFrozen() && !group.hasCycle(consumer)) {
          group.fuseWith(consumer);
          break;
        }
      }
      // stop merging groups if the graph is already small enough
      if (graphSize() <= ctx.minGraphSize) {
        break;
      }
    }

    LOG.debugf("Number of groups after fuseRemnants: %d", graphSize());
  }

  /**
   * For every group, fuse the first pair of its producers which can be fused
   * together.
   */
  public void fuseInputs() {
    LOG.info("Online partitioning: executing fuseInputs pass...");

    for (NodeHandle nh : graph.sorted()) {
      // skip if removed by fuseInputs
      if (!graph.contains(nh)) {
        continue;
      }
      final var group = group(nh);
      final var producers = liveGroups(group.srcNodes());

      Group first = null;
      Group second = null;
      for (int i = 0; i < producers.size() && second == null; i++) {
        final var candidate = producers.get(i);
        if (candidate.isFrozen()) {
          continue;
        }
        // Double loop here since we need to consider every pair of inputs
        for (int j = i + 1; j < producers.size(); j++) {
          final var other = producers.get(j);
          if (!other.isFrozen() && !candidate.hasCycle(other) && !other.hasCycle(candidate)) {
            first = candidate;
            second = other;
            break;
          }
        }
      }
      if (second != null) {
        group.fuseInputs(first, second);
      }

      // stop merging groups if the graph is already small enough
      if (graphSize() <= ctx.minGraphSize) {
        break;
      }
    }

    LOG.debugf("Number of groups after fuseInputs: %d", graphSize());
  }

  /**
   * Mark groups which should be kept off some device.
   */
  public void earlyAvoids() {
    LOG.info("Online partitioning: executing earlyAvoids pass...");

    for (PassContext.Avoid avoid : ctx.avoids) {
      switch (avoid.type()) {
        case OP:
          // Only called at the very beginning, so match the initial layer
          for (NodeHandle nh : graph.sorted()) {
            final var group = group(nh);
            if (group.getInitialLayer().kind.equals(avoid.pattern())) {
              group.avoid(avoid.device());
            }
          }
          break;
        case PATTERN:
          final var pattern = KnownPattern.byName(avoid.pattern()).filter(p -> p.avoidable);
          if (pattern.isEmpty()) {
            LOG.warnf(
              "Avoid pattern %s is skipped: only RMSNorm is supported as an avoid pattern (not to be confused with operations)",
              avoid.pattern()
            );
            break;
          }
          for (List<Layer> match : pattern.get().match(model)) {
            for (Layer layer : match) {
              groupOf(layer).ifPresent(group -> group.avoid(avoid.device()));
            }
          }
          break;
        default:
          throw new IllegalArgumentException("unsupported avoid type " + avoid.type());
      }
    }
  }

  /**
   * Tag groups which should end up isolated from the rest.
   */
  public void earlyRegroup() {
    LOG.info("Online partitioning: executing earlyRegroup pass...");

    for (PassContext.Isolate isolate : ctx.isolates) {
      switch (isolate.type()) {
        case OP:
          for (NodeHandle nh : graph.sorted()) {
            final var group = group(nh);
            if (group.getInitialLayer().kind.equals(isolate.pattern())) {
              group.isolate(isolate.tag());
            }
          }
          break;
        case PATTERN:
          final var pattern = KnownPattern.byName(isolate.pattern());
          if (pattern.isEmpty()) {
            LOG.warnf(
              "Isolate pattern %s is skipped: only %s are supported as patterns",
              isolate.pattern(),
              String.join(", ", KnownPattern.names())
            );
            break;
          }
          for (List<Layer> match : pattern.get().match(model)) {
            for (Layer layer : match) {
              groupOf(layer).ifPresent(group -> group.isolate(isolate.tag()));
            }
          }
          break;
        default:
          throw new IllegalArgumentException("unsupported isolate type " + isolate.type());
      }
    }
  }

  /**
   * Identify, grow, and validate repeated blocks.
   */
  public void repeatedBlocks() {
    LOG.info("Online partitioning: executing repeatedBlocks pass group...");

    identifyUniques();
    repeat(this::mergeUniques);
    mergeTriangles();
    cleanUpUniques();

    LOG.infof("Number of groups after repeatedBlocks: %d", graphSize());
  }

  /**
   * Tag single-layer groups which are indistinguishable from each other.
   */
  public void identifyUniques() {
    LOG.info("Online partitioning: executing identifyUniques pass...");

    final var uniques = new LinkedHashMap<UniqueKey, List<Group>>();
    for (NodeHandle nh : graph.sorted()) {
      final var group = group(nh);
      if (group.size() != 1) {
        continue;
      }
      final var key = new UniqueKey(
        group.getInitialLayer().metaDesc(),
        new TreeSet<>(group.avoidedTargets()),
        group.specialTag()
      );
      uniques.computeIfAbsent(key, k -> new ArrayList<>()).add(group);
    }

    for (List<Group> groups : uniques.values()) {
      if (groups.size() > 1) {
        final var rep = newRepeated();
        for (Group group : groups) {
          group.setRepeated(rep);
        }
      }
    }

    LOG.debugf("Number of repeated tags after identifyUniques: %d", repeatedTags.size());
  }

  /**
   * Try to grow every repeated tag which is still open for merging.
   */
  public void mergeUniques() {
    LOG.info("Online partitioning: executing mergeUniques pass...");

    final var mergedThisTime = new HashSet<Repeated>();
    for (NodeHandle nh : graph.sorted()) {
      if (!graph.contains(nh)) {
        continue;
      }
      final var rep = group(nh).repeated();
      if (rep.isEmpty() || !rep.get().openForMerge() || mergedThisTime.contains(rep.get())) {
        continue;
      }
      final var repeatingGroups = members(rep.get());
      tryGrowRepeatingGroups(repeatingGroups).ifPresent(mergedThisTime::add);
    }

    LOG.debugf("Number of groups after mergeUniques: %d", graphSize());
  }

  /**
   * Try to merge every instance of a repeated block with one of its
   * producers, such that the results are again identical.
   *
   * <p>Candidate (producer, consumer) pairs are bucketed by how they are
   * wired together. The biggest bucket wins, and among buckets of the same
   * size the one closest to the tail of the model.
   *
   * @param repeatingGroups live groups sharing the same repeated tag
   * @return the fresh tag of the merged groups, if a merge happened
   */
  Optional<Repeated> tryGrowRepeatingGroups(List<Group> repeatingGroups) {
    final var first = repeatingGroups.get(0);
    final var thisRepTag = first.repeated().orElseThrow();
    final var thisAvoided = first.avoidedTargets();
    final var thisSpecial = first.specialTag();

    final var mics = new LinkedHashMap<List<MetaInterconnect>, List<Candidate>>();

    // Prioritize groups from the tail of the model
    final var sortedGroups = new ArrayList<>(repeatingGroups);
    sortedGroups.sort(BY_ID_DESCENDING);

    for (Group group : sortedGroups) {
      for (NodeHandle prodNh : group.srcNodes()) {
        if (!graph.contains(prodNh)) {
          continue;
        }
        final var prodGroup = group(prodNh);
        final var prodRep = prodGroup.repeated();
        if (prodRep.isPresent()
          && prodRep.get() != thisRepTag
          && !prodGroup.isFrozen()
          && prodGroup.avoidedTargets().equals(thisAvoided)
          && prodGroup.specialTag().equals(thisSpecial)
          && !prodGroup.hasCycle(group)) {
          final var key = List.copyOf(group.metaInterconnect(prodGroup));
          mics.computeIfAbsent(key, k -> new ArrayList<>()).add(new Candidate(prodGroup, group));
        }
      }
    }

    // Bigger buckets first, then the ones closest to the tail of the model
    final var micsVec = new ArrayList<>(mics.values());
    micsVec.sort(
      Comparator
        .<List<Candidate>>comparingInt(List::size)
        .reversed()
        .thenComparing(candidates -> candidates.get(0).producer(), BY_ID_DESCENDING)
    );

    for (List<Candidate> candidates : micsVec) {
      final var prods = candidates.stream().map(Candidate::producer).toList();
      final var conss = candidates.stream().map(Candidate::consumer).toList();
      final var newRep = tryMergeRepeating(prods, conss);
      if (newRep.isPresent()) {
        return newRep;
      }
    }

    // No merges happened at all, so stop trying to grow this tag
    thisRepTag.exclude();
    return Optional.empty();
  }

  /**
   * Fuse every consumer with its matching producer.
   *
   * @param prods producers, one per consumer
   * @param conss consumers which absorb the producers
   * @return the fresh tag of the merged groups, if the pairs could be merged
   */
  Optional<Repeated> tryMergeRepeating(List<Group> prods, List<Group> conss) {
    if (prods.size() != conss.size()) {
      throw new PartitioningException(
        "tried to merge repeated groups with different sizes of producers and consumers ("
          + prods.size() + " vs " + conss.size() + ")"
      );
    }
    if (conss.size() == 1) {
      return Optional.empty();
    }

    // Repeated producers mean this is really a producer/consumer triangle,
    // which is left for mergeTriangles:
    //
    //  A1     A2
    // .  .   .  .
    // B1 B2  B3 B4
    final Set<Group> prodsSet = Collections.newSetFromMap(new IdentityHashMap<>());
    prodsSet.addAll(prods);
    if (prodsSet.size() != conss.size()) {
      return Optional.empty();
    }

    for (Group cons : conss) {
      if (prodsSet.contains(cons)) {
        throw new PartitioningException("tried to merge repeated groups which overlap (group " + cons.getId() + ")");
      }
    }

    // Each pair is acyclic on its own, but fusing one pair can route a path
    // through another one, like in
    //
    //  P1    P2
    //  |  \/  |
    //  |  /\  |
    //  C1    C2
    final var pairs = new ArrayList<List<Group>>();
    for (int i = 0; i < conss.size(); i++) {
      pairs.add(List.of(conss.get(i), prods.get(i)));
    }
    if (!staysAcyclic(pairs)) {
      LOG.debugf("Skipping a merge of %d repeated groups which would create a cycle", conss.size());
      return Optional.empty();
    }

    final var newRep = newRepeated();
    for (int i = 0; i < conss.size(); i++) {
      conss.get(i).fuse(prods.get(i));
      // producer is consumed, no need to tag it
      conss.get(i).setRepeated(newRep);
    }
    return Optional.of(newRep);
  }

  /**
   * Handle repeated groups acting as the single producer of several other
   * repeated groups at once, like in
   *
   * <pre>
   *       A1             A2            A3
   *    .  .  .        .  .  .       .  .  .
   *    :  :  :        :  :  :       :  :  :
   *    B1 B2 B3       B4 B5 B6      B7 B8 B9
   * </pre>
   *
   * <p>Unlike {@link #mergeUniques()}, this runs once and ignores whether tags
   * are still open for merging.
   */
  public void mergeTriangles() {
    LOG.info("Online partitioning: executing mergeTriangles pass...");

    final var mergedThisTime = new HashSet<Repeated>();
    for (NodeHandle nh : graph.sorted()) {
      if (!graph.contains(nh)) {
        continue;
      }
      final var group = group(nh);
      final var rep = group.repeated();
      if (rep.isEmpty() || group.isFrozen() || mergedThisTime.contains(rep.get())) {
        continue;
      }
      final var repeatingGroups = new ArrayList<Group>();
      for (Group other : members(rep.get())) {
        if (!other.isFrozen()) {
          repeatingGroups.add(other);
        }
      }
      tryMergeTriangles(repeatingGroups).ifPresent(mergedThisTime::add);
    }

    LOG.debugf("Number of groups after mergeTriangles: %d", graphSize());
  }

  Optional<Repeated> tryMergeTriangles(List<Group> repeatingGroups) {
    if (repeatingGroups.size() < 2) {
      return Optional.empty();
    }
    final var first = repeatingGroups.get(0);
    final var thisRepTag = first.repeated().orElseThrow();
    final var thisAvoided = first.avoidedTargets();
    final var thisSpecial = first.specialTag();

    final var mics = new LinkedHashMap<List<MetaInterconnect>, LinkedHashMap<Group, LinkedHashSet<Group>>>();

    final var sortedGroups = new ArrayList<>(repeatingGroups);
    sortedGroups.sort(BY_ID_DESCENDING);

    for (Group group : sortedGroups) {
      for (NodeHandle consNh : group.dstNodes()) {
        if (!graph.contains(consNh)) {
          continue;
        }
        final var consGroup = group(consNh);
        final var consRep = consGroup.repeated();
        if (consRep.isPresent()
          && consRep.get() != thisRepTag
          && !consGroup.isFrozen()
          && consGroup.avoidedTargets().equals(thisAvoided)
          && consGroup.specialTag().equals(thisSpecial)
          && !group.hasCycle(consGroup)) {
          final var key = List.copyOf(consGroup.metaInterconnect(group));
          mics
            .computeIfAbsent(key, k -> new LinkedHashMap<>())
            .computeIfAbsent(group, k -> new LinkedHashSet<>())
            .add(consGroup);
        }
      }
    }

    final var micsVec = new ArrayList<List<Triangle>>();
    for (var triangles : mics.values()) {
      final var apexes = new ArrayList<Triangle>();
      for (var apexAndBase : triangles.entrySet()) {
        apexes.add(new Triangle(apexAndBase.getKey(), new ArrayList<>(apexAndBase.getValue())));
      }
      apexes.sort(Comparator.comparing(Triangle::apex, BY_ID_DESCENDING));
      micsVec.add(apexes);
    }
    micsVec.sort(
      Comparator
        .<List<Triangle>>comparingInt(List::size)
        .reversed()
        .thenComparing(triangles -> triangles.get(0).apex(), BY_ID_DESCENDING)
    );

    for (List<Triangle> triangles : micsVec) {
      final var prods = triangles.stream().map(Triangle::apex).toList();
      final var conss = triangles.stream().map(Triangle::base).toList();
      final var newRep = tryMergeTriangles(prods, conss);
      if (newRep.isPresent()) {
        return newRep;
      }
    }

    // This set of passes ignores excluded tags, so don't exclude anything here
    return Optional.empty();
  }

  Optional<Repeated> tryMergeTriangles(List<Group> prods, List<List<Group>> conss) {
    if (prods.size() != conss.size()) {
      throw new PartitioningException(
        "tried to merge repeated triangles with different sizes of producers and consumers ("
          + prods.size() + " vs " + conss.size() + ")"
      );
    }
    if (prods.size() < 2) {
      return Optional.empty();
    }

    // Every base must have the same size and every base group must sit on a
    // simple path (one producer, one consumer)
    final int baseSize = conss.get(0).size();
    for (List<Group> base : conss) {
      if (base.size() != baseSize) {
        return Optional.empty();
      }
      for (Group group : base) {
        if (group.dstNodes().size() != 1 || group.srcNodes().size() > 1) {
          return Optional.empty();
        }
      }
    }

    // The bases all look the same from their apex, so tell their members
    // apart by how they feed their own consumers
    final var mic2 = new LinkedHashMap<List<MetaInterconnect>, List<Group>>();
    for (List<Group> base : conss) {
      for (Group group : base) {
        final var groupCons = group(group.dstNodes().get(0));
        final var key = List.copyOf(groupCons.metaInterconnect(group));
        mic2.computeIfAbsent(key, k -> new ArrayList<>()).add(group);
      }
    }

    if (mic2.size() != baseSize) {
      throw new PartitioningException(
        "encountered an incorrect number of second order interconnects during mergeTriangles pass: got "
          + mic2.size() + ", expected " + baseSize
      );
    }

    final var triangles = new ArrayList<List<Group>>();
    for (int i = 0; i < prods.size(); i++) {
      final var triangle = new ArrayList<Group>();
      triangle.add(prods.get(i));
      triangle.addAll(conss.get(i));
      triangles.add(triangle);
    }
    if (!staysAcyclic(triangles)) {
      LOG.debugf("Skipping a merge of %d repeated triangles which would create a cycle", prods.size());
      return Optional.empty();
    }

    final var consProdCache = new IdentityHashMap<Group, Group>();
    for (int i = 0; i < prods.size(); i++) {
      for (Group cons : conss.get(i)) {
        consProdCache.put(cons, prods.get(i));
      }
    }

    // Fuse the bases step by step into the apexes
    Repeated newRep = null;
    for (List<Group> sameCons : mic2.values()) {
      newRep = newRepeated();
      for (Group cons : sameCons) {
        final var prod = consProdCache.get(cons);
        prod.fuseWith(cons);
        // consumer is consumed, no need to tag it
        prod.setRepeated(newRep);
      }
    }
    return Optional.ofNullable(newRep);
  }

  /**
   * Check whether contracting every class of groups into a single group keeps
   * the graph free of cycles.
   *
   * <p>Fusing the members of the classes one pair at a time only goes through
   * coarser and coarser versions of the same contraction, so if the final
   * graph is acyclic, so is every intermediate one.
   *
   * @param classes disjoint lists of live groups
   * @return whether all the classes can be contracted together
   */
  private boolean staysAcyclic(List<List<Group>> classes) {
    final var representative = new HashMap<NodeHandle, NodeHandle>();
    for (List<Group> members : classes) {
      final var head = members.get(0).getHandle();
      for (Group member : members) {
        if (representative.putIfAbsent(member.getHandle(), head) != null) {
          return false;
        }
      }
    }

    // Edges of the contracted graph, without the ones inside a class
    final var contracted = new LinkedHashMap<NodeHandle, Set<NodeHandle>>();
    for (NodeHandle nh : graph.nodes()) {
      final var from = representative.getOrDefault(nh, nh);
      final var dsts = contracted.computeIfAbsent(from, k -> new LinkedHashSet<>());
      for (NodeHandle dst : graph.dstNodes(nh)) {
        final var to = representative.getOrDefault(dst, dst);
        if (!to.equals(from)) {
          dsts.add(to);
        }
      }
    }

    final var inDegree = new HashMap<NodeHandle, Integer>();
    for (Set<NodeHandle> dsts : contracted.values()) {
      for (NodeHandle to : dsts) {
        inDegree.merge(to, 1, Integer::sum);
      }
    }
    final var ready = new Stack<NodeHandle>();
    for (NodeHandle node : contracted.keySet()) {
      if (!inDegree.containsKey(node)) {
        ready.push(node);
      }
    }

    // Kahn's algorithm only drains every node when there is no cycle
    int drained = 0;
    while (!ready.isEmpty()) {
      final var node = ready.pop();
      drained++;
      for (NodeHandle to : contracted.get(node)) {
        if (inDegree.merge(to, -1, Integer::sum) == 0) {
          ready.push(to);
        }
      }
    }
    return drained == contracted.size();
  }

  /**
   * Decide which repeated tags to keep, freeze their groups, and record the
   * layer correspondence across instances.
   */
  public void cleanUpUniques() {
    LOG.info("Online partitioning: executing cleanUpUniques pass...");

    for (var entry : repeating().entrySet()) {
      final var gset = entry.getValue();
      if (gset.size() < 2) {
        // Nothing left to share this tag with
        gset.get(0).setRepeated(null);
        continue;
      }
      if (cleanUpUniquesImpl(gset)) {
        completeRepeating(entry.getKey(), gset);
      }
    }

    afterUniques();

    LOG.debugf("Number of groups after cleanUpUniques: %d", graphSize());
  }

  private boolean cleanUpUniquesImpl(List<Group> gset) {
    final int blockLayerSize = gset.get(0).size();

    for (Group group : gset) {
      if (!group.avoidedTargets().isEmpty() || group.isNoFold()) {
        LOG.debugf(
          "Keeping a repeated block of %d groups with %d layers - has avoids or is not folded",
          gset.size(),
          blockLayerSize
        );
        gset.forEach(Group::freeze);
        return true;
      }
    }

    if (gset.size() >= ctx.keepBlocks && blockLayerSize >= ctx.keepBlockSize) {
      LOG.debugf("Keeping a repeated block of %d groups with %d layers", gset.size(), blockLayerSize);
      gset.forEach(Group::freeze);
      return true;
    }

    for (Group group : gset) {
      group.setRepeated(null);
    }
    LOG.debugf("Repeated block of %d groups with %d layers is dropped", gset.size(), blockLayerSize);
    return false;
  }

  /**
   * Match the layers of every instance of a kept repeated block.
   *
   * <p>Every archetype must show up exactly once in every instance.
   */
  private void completeRepeating(Repeated reptag, List<Group> gset) {
    final var matches = new LinkedHashMap<Repeated.Archetype, List<Layer>>();
    for (Group group : gset) {
      for (Layer layer : group.getContent()) {
        final var archetype = new Repeated.Archetype(layer.metaDesc(), group.getReptrack(layer));
        matches.computeIfAbsent(archetype, k -> new ArrayList<>()).add(layer);
      }
    }

    for (var match : matches.entrySet()) {
      if (match.getValue().size() != gset.size()) {
        throw new PartitioningException(
          "couldn't match properly during repeated blocks pass (node archetype " + match.getKey().metaDesc()
            + "). Got " + match.getValue().size() + ", expected " + gset.size()
        );
      }
    }
    for (Group group : gset) {
      if (matches.size() != group.size()) {
        throw new PartitioningException(
          "couldn't match properly during repeated blocks pass (count of archetypes). Got "
            + matches.size() + ", expected " + group.size()
        );
      }
    }

    final var layerNames = new ArrayList<SortedSet<String>>();
    for (List<Layer> layers : matches.values()) {
      final var names = new TreeSet<String>();
      for (Layer layer : layers) {
        names.add(layer.name);
      }
      layerNames.add(Collections.unmodifiableSortedSet(names));
    }
    layerMatches.put(reptag.repeatedId(), Collections.unmodifiableList(layerNames));
  }

  /**
   * Apply the configured no-fold overrides.
   */
  public void afterUniques() {
    LOG.info("Online partitioning: executing afterUniques pass...");

    for (NodeHandle nh : graph.sorted()) {
      final var group = group(nh);
      if (group.isolated() && ctx.nofolds.contains(group.specialTag())) {
        group.noFold();
      }
    }
  }

  /**
   * Run a pass until it stops changing the number of groups, or the graph is
   * small enough.
   *
   * @param pass pass to run
   */
  public void repeat(Runnable pass) {
    int prevGraphSize = 0;
    int currGraphSize = graphSize();

    while (graphSize() > ctx.minGraphSize && currGraphSize != prevGraphSize) {
      prevGraphSize = graphSize();
      pass.run();
      currGraphSize = graphSize();
    }

    LOG.debugf("Number of groups after repeated pass: %d", graphSize());
  }

  /**
   * Live groups which currently carry a repeated tag, grouped by tag.
   *
   * <p>Tags are ordered by the first of their groups in topological order.
   */
  public Map<Repeated, List<Group>> repeating() {
    final var repeating = new LinkedHashMap<Repeated, List<Group>>();
    for (NodeHandle nh : graph.sorted()) {
      final var group = group(nh);
      group.repeated().ifPresent(rep -> repeating.computeIfAbsent(rep, k -> new ArrayList<>()).add(group));
    }
    return repeating;
  }

  private List<Group> members(Repeated rep) {
    final var members = new ArrayList<Group>();
    for (NodeHandle nh : graph.sorted()) {
      final var group = group(nh);
      if (group.repeated().filter(other -> other == rep).isPresent()) {
        members.add(group);
      }
    }
    return members;
  }

  private List<Group> liveGroups(List<NodeHandle> handles) {
    final var groups = new ArrayList<Group>(handles.size());
    for (NodeHandle nh : handles) {
      if (graph.contains(nh)) {
        groups.add(group(nh));
      }
    }
    return groups;
  }

  /**
   * Group behind a handle.
   *
   * @param nh live handle
   * @throws PartitioningException if the group was fused away
   */
  public Group group(NodeHandle nh) {
    if (!graph.contains(nh)) {
      throw new PartitioningException("dereferenced the dead group handle " + nh);
    }
    return graph.meta(nh);
  }

  /**
   * Group currently containing a layer, if the layer is an operation.
   */
  public Optional<Group> groupOf(Layer layer) {
    return Optional.ofNullable(nodeToGroup.get(layer));
  }

  /**
   * Live groups in topological order.
   */
  public List<Group> groups() {
    return graph.sorted().stream().map(this::group).toList();
  }

  Repeated newRepeated() {
    final var rep = new Repeated(repeatedTags.size());
    repeatedTags.add(rep);
    return rep;
  }

  Repeated repeatedTag(int id) {
    return repeatedTags.get(id);
  }

  /**
   * Mapping from layers to the groups containing them, updated by fusion.
   */
  Map<Layer, Group> getNodeToGroupMap() {
    return nodeToGroup;
  }

  public Set<Layer> getNodeProducers(Layer layer) {
    return Collections.unmodifiableSet(nodeToProdCons.get(layer).producers());
  }

  public Set<Layer> getNodeConsumers(Layer layer) {
    return Collections.unmodifiableSet(nodeToProdCons.get(layer).consumers());
  }

  public Graph<Group> getGraph() {
    return graph;
  }

  public Model getModel() {
    return model;
  }

  public PassContext getContext() {
    return ctx;
  }

  public int graphSize() {
    return graph.size();
  }

  /**
   * Ports used by every direct connection between two layers; when two
   * layers are connected several times, the first connection is recorded.
   */
  public Map<Link, Ports> getPortsMap() {
    return Collections.unmodifiableMap(portsMap);
  }

  /**
   * Layer names matched across the instances of every kept repeated block.
   */
  public Map<String, List<SortedSet<String>>> getMatches() {
    return Collections.unmodifiableMap(layerMatches);
  }

  @Override
  public Stream<DotGraph.Vertex<Integer>> vertices() {
    return groups()
      .stream()
      .map(group -> new DotGraph.Vertex<Integer>(group.getId(), group.isFrozen()));
  }

  @Override
  public Stream<DotGraph.Edge<Integer>> edges() {
    return graph
      .sorted()
      .stream()
      .flatMap(nh -> graph
        .dstNodes(nh)
        .stream()
        .map(dst -> new DotGraph.Edge<Integer>(group(nh).getId(), group(dst).getId()))
      );
  }

  @Override
  public String renderVertexLabel(DotGraph.Vertex<Integer> vertex) {
    final var group = groups()
      .stream()
      .filter(candidate -> candidate.getId() == vertex.id())
      .findFirst()
      .orElseThrow();
    final var label = new StringBuilder("g" + group.getId() + " (" + group.size() + ")");
    group.repeated().ifPresent(rep -> label.append("<br/>").append(rep.repeatedId()));
    if (!group.avoidedTargets().isEmpty()) {
      label.append("<br/>avoid ").append(String.join(",", group.avoidedTargets()));
    }
    if (group.isolated()) {
      label.append("<br/>tag ").append(group.specialTag());
    }
    return label.toString();
  }
}
