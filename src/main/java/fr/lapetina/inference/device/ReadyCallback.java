package fr.lapetina.inference.device;

import fr.lapetina.inference.domain.model.NetworkResult;

/**
 * Completion of an addNetwork call. Invoked exactly once, on the device thread.
 */
@FunctionalInterface
public interface ReadyCallback {
    void onReady(NetworkResult result);
}
