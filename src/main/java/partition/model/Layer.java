package partition.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.SortedMap;

/**
 * One operation (or graph input, constant, or graph output) of a model.
 *
 * <p>Layers are created through {@link Model.Builder} and never change their
 * connectivity after the model is built. Layer identity is reference
 * identity: two distinct layers are never equal, even with the same name.
 */
public final class Layer {

  public enum Type {
    /** Model input. */
    PARAMETER,
    /** Constant tensor, eg. weights. */
    CONSTANT,
    /** Model output. */
    RESULT,
    /** Actual computation. */
    OP
  }

  /**
   * Tensor consumed by a layer.
   *
   * @param source layer producing the tensor
   * @param outputPort index of the output of {@code source}
   */
  public record Input(Layer source, int outputPort) { }

  /**
   * Reader of a tensor produced by a layer.
   *
   * @param target layer consuming the tensor
   * @param inputPort index of the input of {@code target}
   */
  public record Consumer(Layer target, int inputPort) { }

  /**
   * Unique (within the model) human-readable name.
   */
  public final String name;

  public final Type type;

  /**
   * Operation kind (eg. {@code MatMul}, {@code Parameter}).
   */
  public final String kind;

  /**
   * Position of the layer inside {@link Model#layers()}.
   */
  public final int index;

  /**
   * Descriptors of the produced tensors, one per output port.
   */
  public final List<String> outputs;

  public final SortedMap<String, String> attributes;

  private final List<Input> inputs;

  private final List<List<Consumer>> consumers;

  private final MetaDesc metaDesc;

  Layer(
    String name,
    Type type,
    String kind,
    int index,
    List<String> outputs,
    SortedMap<String, String> attributes,
    List<Input> inputs
  ) {
    this.name = name;
    this.type = type;
    this.kind = kind;
    this.index = index;
    this.outputs = List.copyOf(outputs);
    this.attributes = Collections.unmodifiableSortedMap(attributes);
    this.inputs = List.copyOf(inputs);
    this.consumers = new ArrayList<>();
    for (int i = 0; i < outputs.size(); i++) {
      consumers.add(new ArrayList<>());
    }

    final var inputTensors = this.inputs
      .stream()
      .map(input -> input.source().outputs.get(input.outputPort()))
      .toList();
    this.metaDesc = new MetaDesc(kind, inputTensors, this.outputs, this.attributes);
  }

  /**
   * Inputs of the layer, in input port order.
   */
  public List<Input> inputs() {
    return inputs;
  }

  /**
   * Readers of one output of the layer, in the order they were added.
   *
   * @param outputPort index of the output
   */
  public List<Consumer> consumers(int outputPort) {
    return Collections.unmodifiableList(consumers.get(outputPort));
  }

  void addConsumer(int outputPort, Consumer consumer) {
    consumers.get(outputPort).add(consumer);
  }

  /**
   * Reference to one of the outputs of this layer.
   */
  public Input output(int outputPort) {
    if (outputPort < 0 || outputPort >= outputs.size()) {
      throw new IllegalArgumentException(name + " has no output " + outputPort);
    }
    return new Input(this, outputPort);
  }

  /**
   * Structural descriptor used for equivalence of layers.
   */
  public MetaDesc metaDesc() {
    return metaDesc;
  }

  @Override
  public String toString() {
    return name;
  }
}
