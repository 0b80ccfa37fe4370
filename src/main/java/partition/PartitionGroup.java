package partition;

import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * One group of the final partitioning.
 *
 * @param id creation id of the group
 * @param inputLayers names of the layers reading tensors from outside the group
 * @param outputLayers names of the layers with readers outside the group
 * @param allLayers names of every layer in the group, in model order
 * @param repeatedId id of the repeated block the group is an instance of
 * @param avoidedTargets devices the group must not run on
 * @param tag isolation tag, or the empty string
 */
public record PartitionGroup(
  int id,
  List<String> inputLayers,
  List<String> outputLayers,
  List<String> allLayers,
  Optional<String> repeatedId,
  SortedSet<String> avoidedTargets,
  String tag
) {

  public PartitionGroup {
    inputLayers = List.copyOf(inputLayers);
    outputLayers = List.copyOf(outputLayers);
    allLayers = List.copyOf(allLayers);
    avoidedTargets = Collections.unmodifiableSortedSet(new TreeSet<>(avoidedTargets));
  }

  /**
   * Number of layers in the group.
   */
  public int size() {
    return allLayers.size();
  }
}
