package partition.online;

import java.util.List;
import partition.model.MetaDesc;

/**
 * Shared identity of groups which are believed to be structurally identical.
 *
 * <p>Tags are owned by a {@link Snapshot}, which hands them out with
 * increasing ids. Groups refer to tags by id.
 */
public final class Repeated {

  /**
   * Canonical role of a layer inside a repeated block.
   *
   * <p>Corresponding layers across the instances of a block share the same
   * archetype, which is how they get matched up.
   *
   * @param metaDesc structural descriptor of the layer
   * @param reptrack ids of the repeated tags the layer was part of, oldest first
   */
  public record Archetype(MetaDesc metaDesc, List<Integer> reptrack) {

    public Archetype {
      reptrack = List.copyOf(reptrack);
    }
  }

  /**
   * Unique (within a snapshot) identifier of the tag.
   */
  public final int id;

  private boolean excluded = false;

  Repeated(int id) {
    this.id = id;
  }

  /**
   * Whether the tag may still be grown by merging with neighbours.
   */
  public boolean openForMerge() {
    return !excluded;
  }

  /**
   * Permanently stop trying to grow groups with this tag.
   */
  public void exclude() {
    excluded = true;
  }

  /**
   * Name under which the repeated block is reported.
   */
  public String repeatedId() {
    return "repeated_" + id;
  }

  @Override
  public String toString() {
    return "Repeated[" + id + (excluded ? ", excluded]" : "]");
  }
}
