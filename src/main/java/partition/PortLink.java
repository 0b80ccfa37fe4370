package partition;

/**
 * Direct connection between two layers of the model.
 *
 * @param producer name of the producing layer
 * @param consumer name of the consuming layer
 * @param outputPort output index on the producer
 * @param inputPort input index on the consumer
 */
public record PortLink(String producer, String consumer, int outputPort, int inputPort) { }
