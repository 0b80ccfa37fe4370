package partition.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * In-memory dataflow graph handed to the partitioner.
 *
 * <p>Layers are kept in a valid topological order: every layer appears after
 * all of the layers it reads from. This is guaranteed by construction, since
 * the builder only accepts inputs from layers it has already created.
 */
public final class Model {

  /**
   * All layers, in topological order.
   */
  private final List<Layer> layers;

  private final Map<String, Layer> byName;

  private Model(List<Layer> layers, Map<String, Layer> byName) {
    this.layers = layers;
    this.byName = byName;
  }

  /**
   * All layers (operations, parameters, constants, and results) in
   * topological order.
   */
  public List<Layer> layers() {
    return layers;
  }

  /**
   * Look up a layer by its name.
   */
  public Optional<Layer> layer(String name) {
    return Optional.ofNullable(byName.get(name));
  }

  public int size() {
    return layers.size();
  }

  public static Builder builder() {
    return new Builder();
  }

  public static class Builder {

    private boolean used = false;
    private final ArrayList<Layer> layers = new ArrayList<>();
    private final LinkedHashMap<String, Layer> byName = new LinkedHashMap<>();

    public Layer parameter(String name, String tensor) {
      return add(name, Layer.Type.PARAMETER, "Parameter", Map.of(), List.of(tensor), List.of());
    }

    public Layer constant(String name, String tensor) {
      return add(name, Layer.Type.CONSTANT, "Constant", Map.of(), List.of(tensor), List.of());
    }

    public Layer result(String name, Layer input) {
      return add(name, Layer.Type.RESULT, "Result", Map.of(), List.of(), List.of(input.output(0)));
    }

    /**
     * Add a single-output operation reading the first output of each input.
     *
     * @param name unique layer name
     * @param kind operation kind
     * @param tensor descriptor of the produced tensor
     * @param inputs layers read by the operation, in input port order
     */
    public Layer op(String name, String kind, String tensor, Layer... inputs) {
      final var ports = Arrays
        .stream(inputs)
        .map(input -> input.output(0))
        .toList();
      return add(name, Layer.Type.OP, kind, Map.of(), List.of(tensor), ports);
    }

    /**
     * Add an arbitrary operation.
     *
     * @param name unique layer name
     * @param kind operation kind
     * @param attributes operation attributes (part of the structural descriptor)
     * @param outputs descriptors of the produced tensors
     * @param inputs tensors read by the operation, in input port order
     */
    public Layer op(
      String name,
      String kind,
      Map<String, String> attributes,
      List<String> outputs,
      List<Layer.Input> inputs
    ) {
      return add(name, Layer.Type.OP, kind, attributes, outputs, inputs);
    }

    private Layer add(
      String name,
      Layer.Type type,
      String kind,
      Map<String, String> attributes,
      List<String> outputs,
      List<Layer.Input> inputs
    ) {
      if (used) {
        throw new IllegalStateException("model builder was already used");
      }
      if (byName.containsKey(name)) {
        throw new IllegalArgumentException("duplicate layer name " + name);
      }
      for (Layer.Input input : inputs) {
        final Layer source = input.source();
        if (source.index >= layers.size() || layers.get(source.index) != source) {
          throw new IllegalArgumentException("input " + source.name + " of " + name + " is not part of this model");
        }
        if (source.type == Layer.Type.RESULT) {
          throw new IllegalArgumentException("result " + source.name + " cannot be read by " + name);
        }
        source.output(input.outputPort());
      }

      final var layer = new Layer(name, type, kind, layers.size(), outputs, new TreeMap<>(attributes), inputs);
      for (int port = 0; port < inputs.size(); port++) {
        final var input = inputs.get(port);
        input.source().addConsumer(input.outputPort(), new Layer.Consumer(layer, port));
      }
      layers.add(layer);
      byName.put(name, layer);
      return layer;
    }

    /**
     * Finalize the construction of the model.
     */
    public Model build() {
      if (used) {
        throw new IllegalStateException("build may only be called once on a model builder");
      } else {
        used = true;
      }
      return new Model(Collections.unmodifiableList(layers), Collections.unmodifiableMap(byName));
    }
  }
}
