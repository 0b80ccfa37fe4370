package partition.online;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import org.eclipse.microprofile.config.Config;
import org.eclipse.microprofile.config.ConfigProvider;
import org.jboss.logging.Logger;

/**
 * Settings driving the online partitioning passes.
 *
 * <p>Instances are immutable. Build them with {@link #builder()} or read them
 * from MicroProfile configuration with {@link #fromConfig(Config)}.
 */
public final class PassContext {

  private static final Logger LOG = Logger.getLogger(PassContext.class);

  public static final String PIPELINE = "npuw.online.pipeline";
  public static final String MIN_SIZE = "npuw.online.min-size";
  public static final String KEEP_BLOCKS = "npuw.online.keep-blocks";
  public static final String KEEP_BLOCK_SIZE = "npuw.online.keep-block-size";
  public static final String AVOID = "npuw.online.avoid";
  public static final String ISOLATE = "npuw.online.isolate";
  public static final String NOFOLD = "npuw.online.nofold";

  public static final int DEFAULT_MIN_GRAPH_SIZE = 10;
  public static final int DEFAULT_KEEP_BLOCKS = 10;
  public static final int DEFAULT_KEEP_BLOCK_SIZE = 10;

  /**
   * Which passes run after the initial graph is built.
   */
  public enum Pipeline {
    /** Only build the initial one-group-per-layer graph. */
    INIT,
    /** Contract the graph without looking for repeated blocks. */
    JUST,
    /** Detect repeated blocks first, then contract the rest. */
    REP
  }

  /**
   * How a label is attached to layers.
   */
  public enum MatchType {
    /** Every layer of the given kind. */
    OP,
    /** Every layer matched by the named structural pattern. */
    PATTERN
  }

  /**
   * Request to keep some layers off a device.
   *
   * @param type whether {@code pattern} is a layer kind or a pattern name
   * @param pattern layer kind or pattern name
   * @param device device to avoid
   */
  public record Avoid(MatchType type, String pattern, String device) { }

  /**
   * Request to tag some layers so they end up in their own groups.
   *
   * @param type whether {@code pattern} is a layer kind or a pattern name
   * @param pattern layer kind or pattern name
   * @param tag isolation tag
   */
  public record Isolate(MatchType type, String pattern, String tag) { }

  /**
   * Order in which {@code fuseRemnants} tries the consumers of a group: the
   * smallest consumer goes first. This does not account for the amount of
   * computation in the consumer.
   */
  public static final Comparator<Group> SMALLEST_FIRST = Comparator.comparingInt(Group::size);

  public final Pipeline pipeline;

  /**
   * Contraction passes stop as soon as the number of groups drops to this
   * size.
   */
  public final int minGraphSize;

  /**
   * Minimum number of instances for a repeated block to be kept.
   */
  public final int keepBlocks;

  /**
   * Minimum number of layers in an instance for a repeated block to be kept.
   */
  public final int keepBlockSize;

  public final List<Avoid> avoids;

  public final List<Isolate> isolates;

  /**
   * Isolation tags whose groups must never be folded into repeated functions.
   */
  public final List<String> nofolds;

  /**
   * Consumer ordering used by {@code fuseRemnants}; group ids break ties.
   */
  public final Comparator<Group> remnantOrder;

  private PassContext(Builder builder) {
    this.pipeline = builder.pipeline;
    this.minGraphSize = builder.minGraphSize;
    this.keepBlocks = builder.keepBlocks;
    this.keepBlockSize = builder.keepBlockSize;
    this.avoids = List.copyOf(builder.avoids);
    this.isolates = List.copyOf(builder.isolates);
    this.nofolds = List.copyOf(builder.nofolds);
    this.remnantOrder = builder.remnantOrder;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Default settings.
   */
  public static PassContext defaults() {
    return builder().build();
  }

  /**
   * Read the settings from the configuration of the current application.
   */
  public static PassContext load() {
    return fromConfig(ConfigProvider.getConfig());
  }

  /**
   * Read the settings from a configuration.
   *
   * <p>Malformed avoid, isolate, and nofold entries are logged and skipped.
   *
   * @param config source of the {@code npuw.online.*} properties
   * @return pass context
   */
  public static PassContext fromConfig(Config config) {
    final var builder = builder();
    config
      .getOptionalValue(PIPELINE, String.class)
      .ifPresent(name -> builder.pipeline(parsePipeline(name)));
    config.getOptionalValue(MIN_SIZE, Integer.class).ifPresent(builder::minGraphSize);
    config.getOptionalValue(KEEP_BLOCKS, Integer.class).ifPresent(builder::keepBlocks);
    config.getOptionalValue(KEEP_BLOCK_SIZE, Integer.class).ifPresent(builder::keepBlockSize);
    config.getOptionalValue(AVOID, String.class).ifPresent(value -> builder.avoids(parseAvoids(value)));
    config.getOptionalValue(ISOLATE, String.class).ifPresent(value -> builder.isolates(parseIsolates(value)));
    config.getOptionalValue(NOFOLD, String.class).ifPresent(value -> builder.nofolds(parseNofolds(value)));
    return builder.build();
  }

  static Pipeline parsePipeline(String name) {
    try {
      return Pipeline.valueOf(name.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("unknown online partitioning pipeline '" + name + "'", e);
    }
  }

  /**
   * Parse avoid entries like {@code Op:Sin/NPU,P:RMSNorm/NPU}.
   */
  public static List<Avoid> parseAvoids(String value) {
    final var avoids = new ArrayList<Avoid>();
    for (String entry : value.split(",")) {
      parseEntry(AVOID, entry).ifPresent(parsed -> avoids.add(new Avoid(parsed.type(), parsed.pattern(), parsed.label())));
    }
    return avoids;
  }

  /**
   * Parse isolate entries like {@code P:RMSNorm/compute,Op:Softmax/attn}.
   */
  public static List<Isolate> parseIsolates(String value) {
    final var isolates = new ArrayList<Isolate>();
    for (String entry : value.split(",")) {
      parseEntry(ISOLATE, entry).ifPresent(parsed -> isolates.add(new Isolate(parsed.type(), parsed.pattern(), parsed.label())));
    }
    return isolates;
  }

  /**
   * Parse a comma separated list of tags.
   */
  public static List<String> parseNofolds(String value) {
    final var tags = new ArrayList<String>();
    for (String entry : value.split(",")) {
      final var tag = entry.trim();
      if (!tag.isEmpty()) {
        tags.add(tag);
      }
    }
    return tags;
  }

  private record Entry(MatchType type, String pattern, String label) { }

  private static Optional<Entry> parseEntry(String property, String rawEntry) {
    final var entry = rawEntry.trim();
    if (entry.isEmpty()) {
      return Optional.empty();
    }

    final int colon = entry.indexOf(':');
    final int slash = entry.lastIndexOf('/');
    if (colon < 0 || slash < colon + 2 || slash == entry.length() - 1) {
      LOG.warnf("Malformed %s entry '%s' is skipped: expected <Op|P>:<pattern>/<label>", property, entry);
      return Optional.empty();
    }

    final MatchType type;
    switch (entry.substring(0, colon)) {
      case "Op":
        type = MatchType.OP;
        break;
      case "P":
        type = MatchType.PATTERN;
        break;
      default:
        LOG.warnf("Unknown match type in %s entry '%s' is skipped: expected Op or P", property, entry);
        return Optional.empty();
    }
    return Optional.of(new Entry(type, entry.substring(colon + 1, slash), entry.substring(slash + 1)));
  }

  @Override
  public String toString() {
    return String.format(
      "PassContext[pipeline=%s, minGraphSize=%d, keepBlocks=%d, keepBlockSize=%d, avoids=%s, isolates=%s, nofolds=%s]",
      pipeline, minGraphSize, keepBlocks, keepBlockSize, avoids, isolates, nofolds
    );
  }

  public static class Builder {

    private Pipeline pipeline = Pipeline.REP;
    private int minGraphSize = DEFAULT_MIN_GRAPH_SIZE;
    private int keepBlocks = DEFAULT_KEEP_BLOCKS;
    private int keepBlockSize = DEFAULT_KEEP_BLOCK_SIZE;
    private final List<Avoid> avoids = new ArrayList<>();
    private final List<Isolate> isolates = new ArrayList<>();
    private final List<String> nofolds = new ArrayList<>();
    private Comparator<Group> remnantOrder = SMALLEST_FIRST;

    public Builder pipeline(Pipeline pipeline) {
      this.pipeline = pipeline;
      return this;
    }

    public Builder minGraphSize(int minGraphSize) {
      if (minGraphSize < 1) {
        throw new IllegalArgumentException("minimum graph size must be positive, got " + minGraphSize);
      }
      this.minGraphSize = minGraphSize;
      return this;
    }

    public Builder keepBlocks(int keepBlocks) {
      this.keepBlocks = keepBlocks;
      return this;
    }

    public Builder keepBlockSize(int keepBlockSize) {
      this.keepBlockSize = keepBlockSize;
      return this;
    }

    public Builder avoid(MatchType type, String pattern, String device) {
      avoids.add(new Avoid(type, pattern, device));
      return this;
    }

    public Builder avoids(List<Avoid> avoids) {
      this.avoids.addAll(avoids);
      return this;
    }

    public Builder isolate(MatchType type, String pattern, String tag) {
      isolates.add(new Isolate(type, pattern, tag));
      return this;
    }

    public Builder isolates(List<Isolate> isolates) {
      this.isolates.addAll(isolates);
      return this;
    }

    public Builder nofold(String tag) {
      nofolds.add(tag);
      return this;
    }

    public Builder nofolds(List<String> nofolds) {
      this.nofolds.addAll(nofolds);
      return this;
    }

    public Builder remnantOrder(Comparator<Group> remnantOrder) {
      this.remnantOrder = remnantOrder;
      return this;
    }

    public PassContext build() {
      return new PassContext(this);
    }
  }
}
