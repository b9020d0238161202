package fr.lapetina.inference.domain.model;

import java.util.Objects;
import java.util.Set;

/**
 * Outcome of an addNetwork call.
 */
public record NetworkResult(
        String moduleName,
        Set<String> functionNames,
        DeviceErrorType errorType,
        String errorMessage
) {
    public NetworkResult {
        Objects.requireNonNull(moduleName, "Module name is required");
        functionNames = functionNames != null ? Set.copyOf(functionNames) : Set.of();
    }

    public boolean isSuccess() {
        return errorType == null;
    }

    public boolean isError() {
        return errorType != null;
    }

    public static NetworkResult success(String moduleName, Set<String> functionNames) {
        return new NetworkResult(moduleName, functionNames, null, null);
    }

    public static NetworkResult error(
            String moduleName,
            Set<String> functionNames,
            DeviceErrorType errorType,
            String errorMessage
    ) {
        Objects.requireNonNull(errorType, "Error type is required");
        return new NetworkResult(moduleName, functionNames, errorType, errorMessage);
    }
}
