package fr.lapetina.inference.executor.event;

import com.lmax.disruptor.EventFactory;

/**
 * Pre-allocates the {@link TaskEvent} slots of a serial executor's ring buffer.
 */
public final class TaskEventFactory implements EventFactory<TaskEvent> {

    @Override
    public TaskEvent newInstance() {
        return new TaskEvent();
    }
}
