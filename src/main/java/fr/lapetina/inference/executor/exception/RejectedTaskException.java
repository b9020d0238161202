package fr.lapetina.inference.executor.exception;

/**
 * Exception thrown when a task cannot be accepted by a serial executor.
 *
 * This occurs when:
 * - The executor has started shutting down
 * - The ring buffer has no free slot left
 *
 * A rejected task never runs.
 */
public final class RejectedTaskException extends RuntimeException {

    private final RejectionReason reason;

    public RejectedTaskException(RejectionReason reason) {
        super("Task rejected: " + reason.getMessage());
        this.reason = reason;
    }

    public RejectedTaskException(RejectionReason reason, String details) {
        super("Task rejected: " + reason.getMessage() + " - " + details);
        this.reason = reason;
    }

    public RejectionReason getReason() {
        return reason;
    }

    public enum RejectionReason {
        SHUTDOWN("Executor is shutting down"),
        QUEUE_FULL("Task queue is full");

        private final String message;

        RejectionReason(String message) {
            this.message = message;
        }

        public String getMessage() {
            return message;
        }
    }
}
