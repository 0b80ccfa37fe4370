package partition;

import java.util.List;
import java.util.SortedSet;

/**
 * Correspondence between the layers of the instances of a repeated block.
 *
 * <p>Each entry of {@code matches} holds the names of the layers playing the
 * same role in every instance, so it has exactly one name per instance.
 *
 * @param id repeated block id, as found in {@link PartitionGroup#repeatedId()}
 * @param matches matched layer names, one set per archetype
 */
public record RepeatedBlock(String id, List<SortedSet<String>> matches) {

  public RepeatedBlock {
    matches = List.copyOf(matches);
  }
}
