package fr.lapetina.inference.device;

import fr.lapetina.inference.domain.model.DeviceErrorType;

/**
 * Raised by backend operations running on a device queue. The queue-backed
 * facade turns it into an error result for the operation's callback.
 */
public class DeviceException extends Exception {

    private final DeviceErrorType errorType;

    public DeviceException(DeviceErrorType errorType, String message) {
        super(message);
        this.errorType = errorType;
    }

    public DeviceException(DeviceErrorType errorType, String message, Throwable cause) {
        super(message, cause);
        this.errorType = errorType;
    }

    public DeviceErrorType getErrorType() {
        return errorType;
    }
}
