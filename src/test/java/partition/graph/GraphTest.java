package partition.graph;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class GraphTest {

  @Test
  void createdNodesAreLiveAndCounted() {
    final var graph = new Graph<String>();
    final var a = graph.create();
    final var b = graph.create();

    assertThat(graph.size()).isEqualTo(2);
    assertThat(graph.contains(a)).isTrue();
    assertThat(graph.contains(b)).isTrue();
    assertThat(graph.nodes()).containsExactly(a, b);
    assertThat(graph.meta(a)).isNull();
  }

  @Test
  void removedHandlesStayDead() {
    final var graph = new Graph<String>();
    final var a = graph.create();
    final var b = graph.create();
    graph.link(a, b);
    final var copy = new Graph.NodeHandle(a.slot(), a.generation());

    graph.remove(a);

    assertThat(graph.contains(a)).isFalse();
    assertThat(graph.contains(copy)).isFalse();
    assertThat(graph.size()).isEqualTo(1);
    assertThat(graph.srcNodes(b)).isEmpty();
    assertThatThrownBy(() -> graph.meta(a))
      .isInstanceOf(IllegalStateException.class)
      .hasMessageContaining("dead");
    assertThatThrownBy(() -> graph.remove(a)).isInstanceOf(IllegalStateException.class);
    assertThatThrownBy(() -> graph.link(a, b)).isInstanceOf(IllegalStateException.class);
  }

  @Test
  void handlesFromAnotherGraphAreNotContained() {
    final var graph = new Graph<String>();
    final var other = new Graph<String>();
    other.create();
    final var foreign = other.create();

    assertThat(graph.contains(foreign)).isFalse();
    assertThat(graph.contains(null)).isFalse();
  }

  @Test
  void neighboursKeepInsertionOrder() {
    final var graph = new Graph<String>();
    final var a = graph.create();
    final var b = graph.create();
    final var c = graph.create();
    final var d = graph.create();
    graph.link(a, d);
    graph.link(c, d);
    graph.link(b, d);
    graph.link(a, c);
    graph.link(a, b);

    assertThat(graph.srcNodes(d)).containsExactly(a, c, b);
    assertThat(graph.dstNodes(a)).containsExactly(d, c, b);
    assertThat(graph.linked(a, d)).isTrue();
    assertThat(graph.linked(d, a)).isFalse();
  }

  @Test
  void rejectsSelfAndDuplicateLinks() {
    final var graph = new Graph<String>();
    final var a = graph.create();
    final var b = graph.create();
    graph.link(a, b);

    assertThatThrownBy(() -> graph.link(a, a)).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> graph.link(a, b)).isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void unlinkReportsWhetherAnEdgeWasRemoved() {
    final var graph = new Graph<String>();
    final var a = graph.create();
    final var b = graph.create();
    graph.link(a, b);

    assertThat(graph.unlink(a, b)).isTrue();
    assertThat(graph.unlink(a, b)).isFalse();
    assertThat(graph.linked(a, b)).isFalse();
    assertThat(graph.srcNodes(b)).isEmpty();
  }

  @Test
  void sortedPrefersEarlierCreatedNodes() {
    final var graph = new Graph<String>();
    final var a = graph.create();
    final var b = graph.create();
    final var c = graph.create();
    final var d = graph.create();
    graph.link(c, a);
    graph.link(d, b);

    assertThat(graph.sorted()).containsExactly(c, a, d, b);
  }

  @Test
  void sortedIsRefreshedAfterChanges() {
    final var graph = new Graph<String>();
    final var a = graph.create();
    final var b = graph.create();
    final var before = graph.sorted();
    assertThat(graph.sorted()).isSameAs(before);

    graph.link(b, a);

    assertThat(graph.sorted()).containsExactly(b, a);
    assertThat(before).containsExactly(a, b);
  }

  @Test
  void sortedRejectsCycles() {
    final var graph = new Graph<String>();
    final var a = graph.create();
    final var b = graph.create();
    final var c = graph.create();
    graph.link(a, b);
    graph.link(b, c);
    graph.link(c, a);

    assertThatThrownBy(graph::sorted)
      .isInstanceOf(IllegalStateException.class)
      .hasMessageContaining("not acyclic");
  }

  @Test
  void metadataIsAttachedPerNode() {
    final var graph = new Graph<String>();
    final var a = graph.create();
    final var b = graph.create();
    graph.setMeta(a, "first");
    graph.setMeta(b, "second");

    assertThat(graph.meta(a)).isEqualTo("first");
    assertThat(graph.meta(b)).isEqualTo("second");
  }
}
