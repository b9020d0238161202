package fr.lapetina.inference.device;

import fr.lapetina.inference.domain.model.ExecutionContext;
import fr.lapetina.inference.domain.model.Module;
import fr.lapetina.inference.domain.model.RunIdentifier;

import java.util.Map;

/**
 * Asynchronous, non-blocking access to a stateful compute device.
 *
 * Every operation returns immediately; its work runs later on the device's own
 * queue, in submission order, and reports back through a callback. Callbacks
 * never run on the calling thread.
 *
 * Operations submitted after {@link #stop(boolean)} throw
 * {@link fr.lapetina.inference.executor.exception.RejectedTaskException}.
 */
public interface DeviceManager extends AutoCloseable {

    String getName();

    /**
     * Loads all functions of a module, all or nothing.
     *
     * @param module    the module the functions come from
     * @param functions function name to compiled function
     * @param onReady   called once loading succeeded or failed
     */
    void addNetwork(Module module, Map<String, CompiledFunction> functions, ReadyCallback onReady);

    /**
     * Unloads a function. Unknown names are logged, never fatal. No callback.
     */
    void evictNetwork(String functionName);

    /**
     * Runs a loaded function.
     *
     * @param functionName function to run
     * @param context      inputs; ownership passes to the device until the
     *                     callback hands it back
     * @param onDone       called once with outputs or the failure reason
     * @return the identifier the result will carry
     */
    RunIdentifier runFunction(String functionName, ExecutionContext context, ResultCallback onDone);

    /**
     * Stops the device queue. After a blocking stop returns, no callback fires.
     */
    void stop(boolean block);

    /**
     * Stops the device queue without draining it. Queued operations never run
     * and never call back; the operation in progress is interrupted.
     * Returns at once.
     */
    void halt();

    @Override
    default void close() {
        stop(true);
    }
}
