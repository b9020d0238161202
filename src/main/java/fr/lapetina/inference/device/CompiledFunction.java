package fr.lapetina.inference.device;

import fr.lapetina.inference.domain.model.ExecutionContext;
import fr.lapetina.inference.domain.model.TensorType;

import java.util.Map;

/**
 * A compiled function ready to be loaded onto a device.
 *
 * Implementations need not be thread-safe: a device only ever calls
 * {@link #execute} from its own queue thread.
 */
public interface CompiledFunction {

    /**
     * Declared input placeholders and their types.
     */
    Map<String, TensorType> getInputTypes();

    /**
     * Runs the function, reading inputs from the context and binding outputs
     * into it.
     *
     * @throws DeviceException if the run fails
     */
    void execute(ExecutionContext context) throws DeviceException;
}
