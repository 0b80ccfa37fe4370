package partition.patterns;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import partition.model.Layer;
import partition.model.Model;

/**
 * Closed set of patterns which can be used to label layers.
 *
 * <p>Each pattern is a chain of layer kinds, from the first operation to the
 * root. Matching starts at every layer whose kind is the root kind and walks
 * backwards through the inputs: at each step, the first input produced by a
 * layer of the expected kind is followed.
 */
public enum KnownPattern implements Recognizer {

  /**
   * Root mean square normalization: {@code x / sqrt(mean(x^2) + eps)}.
   */
  RMS_NORM("RMSNorm", true, "Power", "ReduceMean", "Add", "Sqrt", "Divide", "Multiply"),

  /**
   * Swish activation gating a matrix multiplication.
   */
  SWISH_MULT_XMM("SwishMultXMM", false, "Swish", "Multiply", "MatMul"),

  /**
   * Matrix multiplication with channel-wise dequantized weights.
   */
  DEQUANT_MATMUL_CW("DequantMatMulCW", false, "Convert", "Multiply", "MatMul"),

  /**
   * Matrix multiplication with group-quantized weights.
   */
  DEQUANT_MATMUL_GQ("DequantMatMulGQ", false, "Convert", "Multiply", "Reshape", "MatMul"),

  /**
   * Shape computations feeding a concatenation.
   */
  ADDITIONAL_COMPUTE("AdditionalCompute", false, "ShapeOf", "Gather", "Concat");

  private final String patternName;

  /**
   * Whether the pattern can be used in avoid entries (every pattern can be
   * used in isolate entries).
   */
  public final boolean avoidable;

  private final List<String> chain;

  KnownPattern(String patternName, boolean avoidable, String... chain) {
    this.patternName = patternName;
    this.avoidable = avoidable;
    this.chain = List.of(chain);
  }

  @Override
  public String patternName() {
    return patternName;
  }

  /**
   * Look up a pattern by its configuration name.
   */
  public static Optional<KnownPattern> byName(String name) {
    return Arrays
      .stream(values())
      .filter(pattern -> pattern.patternName.equals(name))
      .findFirst();
  }

  /**
   * Names of all of the patterns, for error messages.
   */
  public static List<String> names() {
    return Arrays.stream(values()).map(KnownPattern::patternName).toList();
  }

  @Override
  public List<List<Layer>> match(Model model) {
    final var matches = new ArrayList<List<Layer>>();
    final String rootKind = chain.get(chain.size() - 1);
    for (Layer root : model.layers()) {
      if (root.type == Layer.Type.OP && root.kind.equals(rootKind)) {
        matchFrom(root).ifPresent(matches::add);
      }
    }
    return matches;
  }

  private Optional<List<Layer>> matchFrom(Layer root) {
    final var matched = new ArrayList<Layer>();
    matched.add(root);

    Layer current = root;
    for (int step = chain.size() - 2; step >= 0; step--) {
      final String expected = chain.get(step);
      Layer next = null;
      for (Layer.Input input : current.inputs()) {
        final var source = input.source();
        if (source.kind.equals(expected) && !matched.contains(source)) {
          next = source;
          break;
        }
      }
      if (next == null) {
        return Optional.empty();
      }
      matched.add(next);
      current = next;
    }

    matched.sort(Comparator.comparingInt(layer -> layer.index));
    return Optional.of(matched);
  }
}
