package fr.lapetina.inference.domain.model;

/**
 * Error taxonomy for device operations.
 * Reported through completion callbacks, never thrown across the device queue.
 */
public enum DeviceErrorType {
    /** A function with the same name is already loaded on the device */
    NETWORK_EXISTS,

    /** The device cannot load what it was given (empty function map, etc.) */
    UNSUPPORTED,

    /** Loading would exceed the device's network capacity */
    OUT_OF_MEMORY,

    /** No function with this name was ever loaded */
    UNKNOWN_FUNCTION,

    /** The function was loaded and has since been evicted */
    NETWORK_EVICTED,

    /** An input tensor is missing or does not have the declared type */
    SHAPE_MISMATCH,

    /** The compiled function failed while running */
    EXECUTION_FAILED,

    /** Unexpected failure inside the device */
    INTERNAL_ERROR
}
