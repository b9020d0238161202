package fr.lapetina.inference.device;

import fr.lapetina.inference.domain.model.RunResult;

/**
 * Completion of a runFunction call. Invoked exactly once, on the device thread.
 */
@FunctionalInterface
public interface ResultCallback {
    void onResult(RunResult result);
}
