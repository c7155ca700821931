package fr.lapetina.neuraforge.domain.event;

import com.lmax.disruptor.EventFactory;

/**
 * Pre-allocates the ring buffer's {@link SchedulerEvent} instances.
 */
public final class SchedulerEventFactory implements EventFactory<SchedulerEvent> {

    @Override
    public SchedulerEvent newInstance() {
        return new SchedulerEvent();
    }
}
