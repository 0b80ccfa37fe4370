package partition.online;

import java.util.Comparator;
import java.util.List;
import partition.model.MetaDesc;

/**
 * Description of one edge between two adjacent groups, stripped of the
 * identity of the layers involved.
 *
 * <p>Two pairs of groups connected by equal sets of interconnects are wired
 * the same way, which makes them candidates for being merged into instances
 * of the same repeated block.
 *
 * @param producerMeta descriptor of the layer producing the tensor
 * @param producerReptrack repeated tags the producing layer was part of
 * @param outputPort output index on the producing layer
 * @param consumerMeta descriptor of the layer reading the tensor
 * @param consumerReptrack repeated tags the reading layer was part of
 * @param inputPort input index on the reading layer
 */
public record MetaInterconnect(
  MetaDesc producerMeta,
  List<Integer> producerReptrack,
  int outputPort,
  MetaDesc consumerMeta,
  List<Integer> consumerReptrack,
  int inputPort
) implements Comparable<MetaInterconnect> {

  private static final Comparator<MetaInterconnect> ORDER = Comparator
    .comparing(MetaInterconnect::producerMeta)
    .thenComparing(MetaInterconnect::producerReptrack, MetaDesc::compareLists)
    .thenComparingInt(MetaInterconnect::outputPort)
    .thenComparing(MetaInterconnect::consumerMeta)
    .thenComparing(MetaInterconnect::consumerReptrack, MetaDesc::compareLists)
    .thenComparingInt(MetaInterconnect::inputPort);

  public MetaInterconnect {
    producerReptrack = List.copyOf(producerReptrack);
    consumerReptrack = List.copyOf(consumerReptrack);
  }

  @Override
  public int compareTo(MetaInterconnect other) {
    return ORDER.compare(this, other);
  }
}
