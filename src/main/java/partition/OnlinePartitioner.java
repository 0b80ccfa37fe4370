package partition;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import org.jboss.logging.Logger;
import partition.model.Model;
import partition.online.Group;
import partition.online.PassContext;
import partition.online.Snapshot;

/**
 * Entry point of the online partitioning.
 */
public final class OnlinePartitioner {

  private static final Logger LOG = Logger.getLogger(OnlinePartitioner.class);

  private OnlinePartitioner() { }

  /**
   * Partition a model using the settings from the application configuration.
   *
   * @param model model to partition
   * @return partitioning of the model
   * @throws partition.online.PartitioningException if partitioning failed
   */
  public static Ensemble partition(Model model) {
    return partition(model, PassContext.load());
  }

  /**
   * Partition a model.
   *
   * <p>Partitioning is deterministic: partitioning the same model with the
   * same settings always produces the same groups and repeated block ids.
   *
   * @param model model to partition
   * @param ctx pass settings
   * @return partitioning of the model
   * @throws partition.online.PartitioningException if partitioning failed
   */
  public static Ensemble partition(Model model, PassContext ctx) {
    LOG.infof("Online partitioning: partitioning a model of %d layers", model.size());

    final var snapshot = new Snapshot(model, ctx);
    snapshot.run();
    return ensemble(snapshot);
  }

  /**
   * Collect the outputs of a snapshot whose passes have run.
   */
  static Ensemble ensemble(Snapshot snapshot) {
    final var graph = snapshot.getGraph();
    final var groups = snapshot.groups();

    final var partitionGroups = new ArrayList<PartitionGroup>(groups.size());
    final var edges = new ArrayList<Ensemble.GroupEdge>();
    for (Group group : groups) {
      partitionGroups.add(group.toPartitionGroup());
      for (var consumer : group.dstNodes()) {
        edges.add(new Ensemble.GroupEdge(group.getId(), graph.meta(consumer).getId()));
      }
    }

    final var repeated = new LinkedHashMap<String, RepeatedBlock>();
    for (var match : snapshot.getMatches().entrySet()) {
      repeated.put(match.getKey(), new RepeatedBlock(match.getKey(), match.getValue()));
    }

    final var ports = new ArrayList<PortLink>();
    for (var entry : snapshot.getPortsMap().entrySet()) {
      final var link = entry.getKey();
      final var linkPorts = entry.getValue();
      ports.add(new PortLink(
        link.producer().name,
        link.consumer().name,
        linkPorts.outputPort(),
        linkPorts.inputPort()
      ));
    }

    LOG.infof(
      "Online partitioning: got %d groups, %d of them in %d repeated blocks",
      partitionGroups.size(),
      partitionGroups.stream().filter(group -> group.repeatedId().isPresent()).count(),
      repeated.size()
    );
    return new Ensemble(partitionGroups, repeated, ports, edges);
  }
}
