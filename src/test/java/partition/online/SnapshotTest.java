package partition.online;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import partition.model.Layer;
import partition.model.ModelText;

class SnapshotTest {

  private static final String CHAIN = "x=Parameter; a=Relu(x); b=Sigmoid(a); c=Tanh(b); d=Exp(c); r=Result(d)";

  private static final String DIAMOND = "x=Parameter; a=Relu(x); b=Sin(a); c=Cos(a); d=Add(b,c); r=Result(d)";

  /** Diamond whose two branches are structurally identical. */
  private static final String SAME_DIAMOND = "x=Parameter; a=Relu(x); b=Sin(a); c=Sin(a); d=Add(b,c); r=Result(d)";

  /** Each consumer reads both producers, on swapped ports. */
  private static final String CROSSED = "x=Parameter; p1=Relu(x); p2=Relu(x); c1=Add(p1,p2); c2=Add(p2,p1)";

  private static final String TWO_CHAINS =
    "x=Parameter; a1=Relu(x); b1=Sigmoid(a1); c1=Tanh(b1); a2=Relu(x); b2=Sigmoid(a2); c2=Tanh(b2); "
      + "r1=Result(c1); r2=Result(c2)";

  /** Each apex feeds two identical consumers, which then feed different avoided layers. */
  private static final String TRIANGLES =
    "x=Parameter; A1=Relu(x); B1a=Sin(A1); B1b=Sin(A1); E1=Tanh(B1a); F1=Cos(B1b); "
      + "A2=Relu(x); B2a=Sin(A2); B2b=Sin(A2); E2=Tanh(B2a); F2=Cos(B2b); "
      + "r1=Result(E1); r2=Result(F1); r3=Result(E2); r4=Result(F2)";

  private static Snapshot built(String model, PassContext ctx) {
    final var snapshot = new Snapshot(ModelText.parse(model), ctx);
    snapshot.buildGraph();
    return snapshot;
  }

  private static Snapshot built(String model) {
    return built(model, PassContext.builder().minGraphSize(1).build());
  }

  private static Layer layer(Snapshot snapshot, String name) {
    return snapshot.getModel().layer(name).orElseThrow();
  }

  private static Group group(Snapshot snapshot, String name) {
    return snapshot.groupOf(layer(snapshot, name)).orElseThrow();
  }

  private static List<List<String>> contents(Snapshot snapshot) {
    return snapshot
      .groups()
      .stream()
      .map(group -> group.toPartitionGroup().allLayers())
      .toList();
  }

  private static PassContext.Builder keepEverything() {
    return PassContext.builder().minGraphSize(1).keepBlocks(2).keepBlockSize(1);
  }

  @Test
  void buildGraphCreatesOneGroupPerOperation() {
    final var snapshot = built("x=Parameter; w=Constant; wc=Convert(w); a=MatMul(x,wc); b=Add(a,a); c=Convert(b); r=Result(c)");

    assertThat(contents(snapshot)).containsExactly(List.of("a"), List.of("b"), List.of("c"));
    assertThat(snapshot.groupOf(layer(snapshot, "wc"))).isEmpty();
    assertThat(snapshot.getNodeProducers(layer(snapshot, "a")))
      .containsExactly(layer(snapshot, "x"), layer(snapshot, "wc"));
    assertThat(snapshot.getNodeConsumers(layer(snapshot, "c"))).containsExactly(layer(snapshot, "r"));
    assertThat(group(snapshot, "a").dstNodes()).containsExactly(group(snapshot, "b").getHandle());
    assertThatThrownBy(snapshot::buildGraph).isInstanceOf(IllegalStateException.class);
  }

  @Test
  void portsMapKeepsTheFirstConnection() {
    final var snapshot = built("x=Parameter; a=Relu(x); b=Add(a,a); r=Result(b)");
    final var ports = snapshot.getPortsMap();

    assertThat(ports.get(new Snapshot.Link(layer(snapshot, "a"), layer(snapshot, "b"))))
      .isEqualTo(new Snapshot.Ports(0, 0));
    assertThat(ports.get(new Snapshot.Link(layer(snapshot, "x"), layer(snapshot, "a"))))
      .isEqualTo(new Snapshot.Ports(0, 0));
    assertThat(ports.get(new Snapshot.Link(layer(snapshot, "b"), layer(snapshot, "r"))))
      .isEqualTo(new Snapshot.Ports(0, 0));
    assertThat(ports).hasSize(3);
  }

  @Test
  void collectLHFCollapsesChains() {
    final var snapshot = built(CHAIN);

    snapshot.repeat(snapshot::collectLHF);

    assertThat(contents(snapshot)).containsExactly(List.of("a", "b", "c", "d"));
  }

  @Test
  void collectLHFStopsAtTheFloor() {
    final var snapshot = built(CHAIN, PassContext.builder().minGraphSize(2).build());

    snapshot.collectLHF();

    assertThat(contents(snapshot)).containsExactly(List.of("a", "b", "c"), List.of("d"));
  }

  @Test
  void collectLHFSkipsFanOut() {
    final var snapshot = built(DIAMOND);

    snapshot.collectLHF();

    assertThat(snapshot.graphSize()).isEqualTo(4);
  }

  @ParameterizedTest
  @ValueSource(strings = {DIAMOND, SAME_DIAMOND})
  void fuseInputsMergesSiblingProducers(String diamond) {
    final var snapshot = built(diamond);

    snapshot.repeat(snapshot::fuseInputs);

    assertThat(contents(snapshot)).containsExactly(List.of("a"), List.of("b", "c"), List.of("d"));
  }

  @Test
  void fuseRemnantsPrefersSmallerConsumers() {
    final var snapshot = built("x=Parameter; a=Relu(x); b=Sin(a); c=Cos(b); d=Exp(a); e=Add(c,d)");
    final var b = group(snapshot, "b");
    final var c = group(snapshot, "c");
    c.fuse(b);

    snapshot.fuseRemnants();

    assertThat(group(snapshot, "d")).isSameAs(group(snapshot, "a"));
  }

  @Test
  void fuseRemnantsOrderIsPluggable() {
    final var largestFirst = PassContext
      .builder()
      .minGraphSize(1)
      .remnantOrder(PassContext.SMALLEST_FIRST.reversed())
      .build();
    final var snapshot = built("x=Parameter; a=Relu(x); b=Sin(a); c=Cos(b); d=Exp(a); e=Add(c,d)", largestFirst);
    group(snapshot, "c").fuse(group(snapshot, "b"));

    snapshot.fuseRemnants();

    assertThat(group(snapshot, "b")).isSameAs(group(snapshot, "a"));
  }

  @Test
  void frozenGroupsAreLeftAlone() {
    final var snapshot = built(CHAIN);
    group(snapshot, "b").freeze();

    snapshot.repeat(snapshot::collectLHF);
    snapshot.fuseRemnantsExtended();

    assertThat(contents(snapshot)).containsExactly(List.of("a"), List.of("b"), List.of("c", "d"));
  }

  @Test
  void identifyUniquesTagsIdenticalLayers() {
    final var snapshot = built(TWO_CHAINS);

    snapshot.identifyUniques();

    final var repeating = snapshot.repeating();
    assertThat(repeating).hasSize(3);
    assertThat(repeating.values())
      .extracting(groups -> groups.stream().map(group -> group.getInitialLayer().name).toList())
      .containsExactly(List.of("a1", "a2"), List.of("b1", "b2"), List.of("c1", "c2"));
  }

  @Test
  void identifyUniquesSeparatesAvoidedLayers() {
    final var snapshot = built(TWO_CHAINS);
    group(snapshot, "a1").avoid("NPU");
    group(snapshot, "b2").isolate("special");

    snapshot.identifyUniques();

    assertThat(group(snapshot, "a1").repeated()).isEmpty();
    assertThat(group(snapshot, "a2").repeated()).isEmpty();
    assertThat(group(snapshot, "b1").repeated()).isEmpty();
    assertThat(group(snapshot, "c1").repeated()).isPresent();
  }

  @Test
  void mergeUniquesGrowsIdenticalChains() {
    final var snapshot = built(TWO_CHAINS);
    snapshot.identifyUniques();

    snapshot.repeat(snapshot::mergeUniques);

    assertThat(contents(snapshot)).containsExactly(List.of("a1", "b1", "c1"), List.of("a2", "b2", "c2"));
    final var rep = group(snapshot, "c1").repeated().orElseThrow();
    assertThat(group(snapshot, "c2").repeated()).containsSame(rep);
    // nothing is left to grow into
    assertThat(rep.openForMerge()).isFalse();
  }

  @Test
  void tagsWithoutProducersAreExcluded() {
    final var snapshot = built("x=Parameter; a=Relu(x); b=Relu(x); r1=Result(a); r2=Result(b)");
    snapshot.identifyUniques();
    final var rep = group(snapshot, "a").repeated().orElseThrow();

    snapshot.mergeUniques();

    assertThat(rep.openForMerge()).isFalse();
    assertThat(snapshot.graphSize()).isEqualTo(2);
  }

  @Test
  void tryMergeRepeatingChecksCardinality() {
    final var snapshot = built(TWO_CHAINS);
    final var a1 = group(snapshot, "a1");
    final var b1 = group(snapshot, "b1");
    final var c1 = group(snapshot, "c1");
    final var a2 = group(snapshot, "a2");

    assertThatThrownBy(() -> snapshot.tryMergeRepeating(List.of(a1, a2), List.of(b1)))
      .isInstanceOf(PartitioningException.class)
      .hasMessageContaining("different sizes");
    assertThat(snapshot.tryMergeRepeating(List.of(a1), List.of(b1))).isEmpty();
    assertThat(snapshot.tryMergeRepeating(List.of(a1, a1), List.of(b1, group(snapshot, "b2")))).isEmpty();
    assertThatThrownBy(() -> snapshot.tryMergeRepeating(List.of(a1, b1), List.of(b1, c1)))
      .isInstanceOf(PartitioningException.class)
      .hasMessageContaining("overlap");
    assertThat(snapshot.graphSize()).isEqualTo(6);
  }

  @Test
  void tryMergeRepeatingRejectsPairsClosingACycle() {
    final var snapshot = built(CROSSED, keepEverything().build());
    final var p1 = group(snapshot, "p1");
    final var p2 = group(snapshot, "p2");
    final var c1 = group(snapshot, "c1");
    final var c2 = group(snapshot, "c2");

    // Every pair is fine on its own
    assertThat(c1.hasCycle(p1)).isFalse();
    assertThat(c2.hasCycle(p2)).isFalse();

    assertThat(snapshot.tryMergeRepeating(List.of(p1, p2), List.of(c1, c2))).isEmpty();
    assertThat(snapshot.tryMergeRepeating(List.of(p2, p1), List.of(c1, c2))).isEmpty();
    assertThat(snapshot.graphSize()).isEqualTo(4);
    assertThat(snapshot.repeating()).isEmpty();
  }

  @Test
  void repeatedBlocksSurviveCrossedProducers() {
    final var snapshot = built(CROSSED, keepEverything().build());

    snapshot.repeatedBlocks();

    assertThat(contents(snapshot)).containsExactly(List.of("p1"), List.of("p2"), List.of("c1"), List.of("c2"));
    assertThat(snapshot.getMatches().values())
      .extracting(matches -> String.join(",", matches.get(0)))
      .containsExactlyInAnyOrder("p1,p2", "c1,c2");
    assertThat(snapshot.groups()).allMatch(Group::isFrozen);
  }

  @Test
  void mergeTrianglesFusesSharedProducers() {
    final var ctx = keepEverything()
      .avoid(PassContext.MatchType.OP, "Tanh", "NPU")
      .avoid(PassContext.MatchType.OP, "Cos", "NPU")
      .build();
    final var snapshot = built(TRIANGLES, ctx);
    snapshot.earlyAvoids();
    snapshot.identifyUniques();
    snapshot.repeat(snapshot::mergeUniques);

    // consumers sharing a producer are out of reach of mergeUniques
    assertThat(snapshot.graphSize()).isEqualTo(10);
    final var apexTag = group(snapshot, "A1").repeated().orElseThrow();
    assertThat(apexTag.openForMerge()).isFalse();

    snapshot.mergeTriangles();

    assertThat(contents(snapshot)).containsExactly(
      List.of("A1", "B1a", "B1b"),
      List.of("E1"),
      List.of("F1"),
      List.of("A2", "B2a", "B2b"),
      List.of("E2"),
      List.of("F2")
    );
    final var merged = group(snapshot, "A1").repeated().orElseThrow();
    assertThat(group(snapshot, "A2").repeated()).containsSame(merged);
    assertThat(merged).isNotSameAs(apexTag);

    snapshot.cleanUpUniques();

    assertThat(snapshot.getMatches().get(merged.repeatedId()))
      .extracting(names -> String.join(",", names))
      .containsExactly("A1,A2", "B1a,B2a", "B1b,B2b");
    assertThat(snapshot.groups()).allMatch(Group::isFrozen);
  }

  @Test
  void cleanUpUniquesKeepsLargeEnoughBlocks() {
    final var snapshot = built(TWO_CHAINS, keepEverything().build());
    snapshot.repeatedBlocks();

    final var kept = group(snapshot, "c1").repeated().orElseThrow();
    assertThat(group(snapshot, "c1").isFrozen()).isTrue();
    assertThat(group(snapshot, "c2").isFrozen()).isTrue();
    assertThat(snapshot.getMatches()).containsOnlyKeys(kept.repeatedId());
    assertThat(snapshot.getMatches().get(kept.repeatedId()))
      .extracting(names -> String.join(",", names))
      .containsExactly("c1,c2", "b1,b2", "a1,a2");
  }

  @Test
  void cleanUpUniquesDropsSmallBlocks() {
    final var snapshot = built(TWO_CHAINS, PassContext.builder().minGraphSize(1).keepBlocks(3).keepBlockSize(1).build());
    snapshot.repeatedBlocks();

    assertThat(snapshot.repeating()).isEmpty();
    assertThat(snapshot.getMatches()).isEmpty();
    assertThat(snapshot.groups()).noneMatch(Group::isFrozen);
    assertThat(snapshot.graphSize()).isEqualTo(2);
  }

  @Test
  void avoidedBlocksAreAlwaysKept() {
    final var ctx = PassContext.builder().minGraphSize(1).avoid(PassContext.MatchType.OP, "Relu", "NPU").build();
    final var snapshot = built("x=Parameter; a=Relu(x); b=Relu(x); r1=Result(a); r2=Result(b)", ctx);
    snapshot.earlyAvoids();
    snapshot.repeatedBlocks();

    assertThat(group(snapshot, "a").isFrozen()).isTrue();
    assertThat(group(snapshot, "a").repeated()).isPresent();
    assertThat(snapshot.getMatches()).hasSize(1);
  }

  @Test
  void noFoldBlocksAreAlwaysKept() {
    final var snapshot = built("x=Parameter; a=Relu(x); b=Relu(x); r1=Result(a); r2=Result(b)");
    group(snapshot, "b").noFold();
    snapshot.repeatedBlocks();

    assertThat(group(snapshot, "a").isFrozen()).isTrue();
    assertThat(group(snapshot, "b").isFrozen()).isTrue();
  }

  @Test
  void singleInstanceTagsAreCleared() {
    final var snapshot = built(CHAIN, keepEverything().build());
    final var rep = snapshot.newRepeated();
    group(snapshot, "b").setRepeated(rep);

    snapshot.cleanUpUniques();

    assertThat(group(snapshot, "b").repeated()).isEmpty();
    assertThat(group(snapshot, "b").isFrozen()).isFalse();
  }

  @Test
  void mismatchedInstancesAreFatal() {
    final var snapshot = built(
      "x=Parameter; a1=Relu(x); b1=Sin(a1); a2=Relu(x); b2=Cos(a2)",
      keepEverything().build()
    );
    final var b1 = group(snapshot, "b1");
    final var b2 = group(snapshot, "b2");
    b1.fuse(group(snapshot, "a1"));
    b2.fuse(group(snapshot, "a2"));
    final var rep = snapshot.newRepeated();
    b1.setRepeated(rep);
    b2.setRepeated(rep);

    assertThatThrownBy(snapshot::cleanUpUniques)
      .isInstanceOf(PartitioningException.class)
      .hasMessageContaining("couldn't match properly");
  }

  @Test
  void avoidPatternsOtherThanRmsNormAreSkipped() {
    final var ctx = PassContext
      .builder()
      .avoid(PassContext.MatchType.PATTERN, "SwishMultXMM", "NPU")
      .avoid(PassContext.MatchType.PATTERN, "Unknown", "NPU")
      .avoid(PassContext.MatchType.OP, "Sin", "GPU")
      .build();
    final var snapshot = built("x=Parameter; s=Swish(x); m=Multiply(s,x); w=Parameter; mm=MatMul(m,w); y=Sin(mm)", ctx);

    snapshot.earlyAvoids();

    assertThat(group(snapshot, "s").avoidedTargets()).isEmpty();
    assertThat(group(snapshot, "mm").avoidedTargets()).isEmpty();
    assertThat(group(snapshot, "y").avoidedTargets()).containsExactly("GPU");
  }

  @Test
  void rmsNormCanBeAvoided() {
    final var ctx = PassContext.builder().avoid(PassContext.MatchType.PATTERN, "RMSNorm", "NPU").build();
    final var snapshot = built(
      "x=Parameter; two=Constant; pw=Power(x,two); rm=ReduceMean(pw); eps=Constant; ad=Add(rm,eps); "
        + "sq=Sqrt(ad); dv=Divide(x,sq); gamma=Constant; mu=Multiply(dv,gamma); out=Relu(mu)",
      ctx
    );

    snapshot.earlyAvoids();

    for (String name : List.of("pw", "rm", "ad", "sq", "dv", "mu")) {
      assertThat(group(snapshot, name).avoidedTargets()).as(name).containsExactly("NPU");
    }
    assertThat(group(snapshot, "out").avoidedTargets()).isEmpty();
  }

  @Test
  void earlyRegroupIsolatesLayers() {
    final var ctx = PassContext
      .builder()
      .isolate(PassContext.MatchType.OP, "Sin", "trig")
      .isolate(PassContext.MatchType.PATTERN, "SwishMultXMM", "ffn")
      .isolate(PassContext.MatchType.PATTERN, "Unknown", "none")
      .build();
    final var snapshot = built("x=Parameter; s=Swish(x); m=Multiply(s,x); w=Parameter; mm=MatMul(m,w); y=Sin(mm)", ctx);

    snapshot.earlyRegroup();

    assertThat(group(snapshot, "y").specialTag()).isEqualTo("trig");
    assertThat(group(snapshot, "s").specialTag()).isEqualTo("ffn");
    assertThat(group(snapshot, "m").specialTag()).isEqualTo("ffn");
    assertThat(group(snapshot, "mm").specialTag()).isEqualTo("ffn");
  }

  @Test
  void afterUniquesAppliesNoFoldByTag() {
    final var ctx = PassContext.builder().isolate(PassContext.MatchType.OP, "Sin", "trig").nofold("trig").build();
    final var snapshot = built(DIAMOND, ctx);
    snapshot.earlyRegroup();

    snapshot.afterUniques();

    assertThat(group(snapshot, "b").isNoFold()).isTrue();
    assertThat(group(snapshot, "c").isNoFold()).isFalse();
  }

  @Test
  void initPipelineOnlyBuildsTheGraph() {
    final var snapshot = new Snapshot(ModelText.parse(CHAIN), PassContext.builder().pipeline(PassContext.Pipeline.INIT).build());

    snapshot.run();

    assertThat(snapshot.graphSize()).isEqualTo(4);
  }

  @Test
  void dotGraphHighlightsFrozenGroups() {
    final var snapshot = built(CHAIN);
    group(snapshot, "a").freeze();

    final var dot = snapshot.dotGraph("snapshot");

    assertThat(dot).contains("\"0\" [shape = box, peripheries = 2, label = <g0 (1)>];");
    assertThat(dot).contains("\"1\" [shape = box, peripheries = 1, label = <g1 (1)>];");
    assertThat(dot).contains("\"0\" -> \"1\"");
  }
}
