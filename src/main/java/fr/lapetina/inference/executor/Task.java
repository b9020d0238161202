package fr.lapetina.inference.executor;

/**
 * One-shot unit of deferred work submitted to a {@link SerialExecutor}.
 *
 * A task captures everything it needs when it is created. The executor runs it
 * at most once and drops its reference right after.
 */
@FunctionalInterface
public interface Task {

    /**
     * Runs the task on the executor's worker thread.
     *
     * @throws Exception any failure; it is logged by the executor and never
     *                   propagated to the submitter
     */
    void execute() throws Exception;
}
