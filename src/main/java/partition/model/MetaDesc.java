package partition.model;

import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Structural descriptor of a layer.
 *
 * <p>Two layers with equal descriptors are interchangeable as far as the
 * partitioner is concerned: they have the same kind, consume tensors of the
 * same shapes, produce tensors of the same shapes, and carry the same
 * attributes. The names of the layers are not part of the descriptor.
 *
 * @param kind operation kind, eg. {@code MatMul}
 * @param inputs descriptors of the consumed tensors, in input port order
 * @param outputs descriptors of the produced tensors, in output port order
 * @param attributes operation attributes
 */
public record MetaDesc(
  String kind,
  List<String> inputs,
  List<String> outputs,
  SortedMap<String, String> attributes
) implements Comparable<MetaDesc> {

  public MetaDesc {
    inputs = List.copyOf(inputs);
    outputs = List.copyOf(outputs);
    attributes = Collections.unmodifiableSortedMap(new TreeMap<>(attributes));
  }

  @Override
  public int compareTo(MetaDesc other) {
    int cmp = kind.compareTo(other.kind);
    if (cmp == 0) {
      cmp = compareLists(inputs, other.inputs);
    }
    if (cmp == 0) {
      cmp = compareLists(outputs, other.outputs);
    }
    if (cmp == 0) {
      cmp = compareAttributes(attributes, other.attributes);
    }
    return cmp;
  }

  /**
   * Lexicographic comparison of two sorted attribute maps, entry by entry,
   * key before value.
   */
  private static int compareAttributes(SortedMap<String, String> left, SortedMap<String, String> right) {
    final Iterator<Map.Entry<String, String>> l = left.entrySet().iterator();
    final Iterator<Map.Entry<String, String>> r = right.entrySet().iterator();
    while (l.hasNext() && r.hasNext()) {
      final var leftEntry = l.next();
      final var rightEntry = r.next();
      int cmp = leftEntry.getKey().compareTo(rightEntry.getKey());
      if (cmp == 0) {
        cmp = leftEntry.getValue().compareTo(rightEntry.getValue());
      }
      if (cmp != 0) {
        return cmp;
      }
    }
    return Boolean.compare(l.hasNext(), r.hasNext());
  }

  /**
   * Lexicographic comparison of two lists.
   */
  public static <T extends Comparable<? super T>> int compareLists(List<T> left, List<T> right) {
    final Iterator<T> l = left.iterator();
    final Iterator<T> r = right.iterator();
    while (l.hasNext() && r.hasNext()) {
      final int cmp = l.next().compareTo(r.next());
      if (cmp != 0) {
        return cmp;
      }
    }
    return Boolean.compare(l.hasNext(), r.hasNext());
  }

  @Override
  public String toString() {
    final var builder = new StringBuilder(kind);
    builder.append(" {").append(String.join(", ", inputs)).append("} -> {");
    builder.append(String.join(", ", outputs)).append("}");
    if (!attributes.isEmpty()) {
      builder.append(" ").append(attributes);
    }
    return builder.toString();
  }
}
