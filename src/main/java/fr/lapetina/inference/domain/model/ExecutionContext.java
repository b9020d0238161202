package fr.lapetina.inference.domain.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Placeholder bindings for one function run: inputs are bound before the run,
 * outputs are bound by the function.
 *
 * Ownership moves with the context: the caller hands it to the device, and
 * gets it back through the run's completion callback. It is never used by two
 * threads at once, so it carries no synchronization.
 */
public final class ExecutionContext {

    private final Map<String, Tensor> placeholders = new LinkedHashMap<>();

    public ExecutionContext bind(String placeholder, Tensor tensor) {
        placeholders.put(placeholder, tensor);
        return this;
    }

    public Optional<Tensor> get(String placeholder) {
        return Optional.ofNullable(placeholders.get(placeholder));
    }

    public boolean contains(String placeholder) {
        return placeholders.containsKey(placeholder);
    }

    public Map<String, Tensor> getPlaceholders() {
        return Collections.unmodifiableMap(placeholders);
    }

    @Override
    public String toString() {
        return "ExecutionContext{placeholders=" + placeholders.keySet() + "}";
    }
}
