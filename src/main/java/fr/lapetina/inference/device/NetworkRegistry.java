package fr.lapetina.inference.device;

import fr.lapetina.inference.domain.model.DeviceErrorType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Functions currently loaded on one device.
 *
 * Not thread-safe. Owned by the device's queue thread and never touched from
 * anywhere else.
 */
final class NetworkRegistry {

    private static final Logger log = LoggerFactory.getLogger(NetworkRegistry.class);

    private final int capacity;
    private final Map<String, CompiledFunction> loaded = new HashMap<>();
    private final Set<String> evicted = new HashSet<>();

    NetworkRegistry(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Network capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
    }

    /**
     * Loads every function or none of them.
     */
    void addAll(Map<String, CompiledFunction> functions) throws DeviceException {
        if (functions.isEmpty()) {
            throw new DeviceException(DeviceErrorType.UNSUPPORTED, "No functions to load");
        }
        for (String name : functions.keySet()) {
            if (loaded.containsKey(name)) {
                throw new DeviceException(DeviceErrorType.NETWORK_EXISTS,
                        "Function already loaded: " + name);
            }
        }
        if (loaded.size() + functions.size() > capacity) {
            throw new DeviceException(DeviceErrorType.OUT_OF_MEMORY,
                    "Cannot load " + functions.size() + " function(s): "
                            + loaded.size() + " of " + capacity + " slots in use");
        }

        loaded.putAll(functions);
        evicted.removeAll(functions.keySet());
        log.debug("Functions registered: names={}, loaded={}", functions.keySet(), loaded.size());
    }

    void remove(String name) throws DeviceException {
        if (loaded.remove(name) == null) {
            throw new DeviceException(
                    evicted.contains(name) ? DeviceErrorType.NETWORK_EVICTED : DeviceErrorType.UNKNOWN_FUNCTION,
                    "Function not loaded: " + name);
        }
        evicted.add(name);
    }

    /**
     * Looks up a loaded function, telling apart names never loaded from names
     * that have been evicted.
     */
    CompiledFunction require(String name) throws DeviceException {
        CompiledFunction function = loaded.get(name);
        if (function != null) {
            return function;
        }
        if (evicted.contains(name)) {
            throw new DeviceException(DeviceErrorType.NETWORK_EVICTED, "Function was evicted: " + name);
        }
        throw new DeviceException(DeviceErrorType.UNKNOWN_FUNCTION, "Unknown function: " + name);
    }

    Optional<CompiledFunction> get(String name) {
        return Optional.ofNullable(loaded.get(name));
    }

    boolean contains(String name) {
        return loaded.containsKey(name);
    }

    Set<String> getLoadedNames() {
        return Set.copyOf(loaded.keySet());
    }

    int size() {
        return loaded.size();
    }

    int getCapacity() {
        return capacity;
    }
}
