package partition.online;

/**
 * Online partitioning ran into a violated invariant and cannot continue.
 *
 * <p>These errors are not recoverable: the passes are deterministic, so
 * running the partitioner again on the same input reproduces the failure.
 */
public class PartitioningException extends IllegalStateException {

  @java.io.Serial
  private static final long serialVersionUID = 4187733092065237712L;

  public PartitioningException(String message) {
    super("Online partitioning " + message);
  }
}
