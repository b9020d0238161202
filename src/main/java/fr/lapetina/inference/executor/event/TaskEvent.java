package fr.lapetina.inference.executor.event;

import fr.lapetina.inference.executor.Task;

import java.time.Instant;

/**
 * Ring buffer slot carrying one submitted task.
 *
 * Slots are pre-allocated and reused. The handler clears the slot as soon as
 * the task has run, which is what makes a task run at most once.
 *
 * IMPORTANT: This class is intentionally mutable. It must never be accessed
 * outside the executor's publish and handler code.
 */
public final class TaskEvent {

    private Task task;
    private long submissionId;
    private Instant enqueuedAt;

    /**
     * Clears the slot for reuse.
     */
    public void clear() {
        this.task = null;
        this.submissionId = -1;
        this.enqueuedAt = null;
    }

    /**
     * Fills the slot with a freshly submitted task.
     */
    public void initialize(Task task, long submissionId) {
        clear();
        this.task = task;
        this.submissionId = submissionId;
        this.enqueuedAt = Instant.now();
    }

    public Task getTask() {
        return task;
    }

    public long getSubmissionId() {
        return submissionId;
    }

    public Instant getEnqueuedAt() {
        return enqueuedAt;
    }

    public boolean isEmpty() {
        return task == null;
    }

    @Override
    public String toString() {
        return "TaskEvent{" +
                "submissionId=" + submissionId +
                ", empty=" + isEmpty() +
                '}';
    }
}
