package fr.lapetina.inference.domain.model;

import java.time.Duration;
import java.util.Objects;

/**
 * Outcome of a runFunction call, delivered exactly once through its callback.
 * On success the context carries the bound outputs.
 */
public record RunResult(
        RunIdentifier runId,
        String functionName,
        ExecutionContext context,
        DeviceErrorType errorType,
        String errorMessage,
        Duration executionTime
) {
    public RunResult {
        Objects.requireNonNull(runId, "Run ID is required");
        Objects.requireNonNull(functionName, "Function name is required");
        if (executionTime == null) {
            executionTime = Duration.ZERO;
        }
    }

    public boolean isSuccess() {
        return errorType == null;
    }

    public boolean isError() {
        return errorType != null;
    }

    public static RunResult success(
            RunIdentifier runId,
            String functionName,
            ExecutionContext context,
            Duration executionTime
    ) {
        return new RunResult(runId, functionName, context, null, null, executionTime);
    }

    public static RunResult error(
            RunIdentifier runId,
            String functionName,
            ExecutionContext context,
            DeviceErrorType errorType,
            String errorMessage
    ) {
        Objects.requireNonNull(errorType, "Error type is required");
        return new RunResult(runId, functionName, context, errorType, errorMessage, Duration.ZERO);
    }
}
