package fr.lapetina.neuraforge.domain.model;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Pending-request count of one model name, shared by every handle of that name.
 *
 * During a swap the draining version and the new Ready version admit against the same
 * counter, so the name never holds more than its admission limit.
 */
public final class AdmissionCounter {

    private final String model;
    private final AtomicInteger pending = new AtomicInteger(0);

    public AdmissionCounter(String model) {
        this.model = model;
    }

    public String getModel() {
        return model;
    }

    /**
     * Takes one unit if the count is below {@code limit}.
     */
    public boolean tryAcquire(int limit) {
        while (true) {
            int current = pending.get();
            if (current >= limit) {
                return false;
            }
            if (pending.compareAndSet(current, current + 1)) {
                return true;
            }
        }
    }

    public void release() {
        if (pending.getAndDecrement() <= 0) {
            pending.incrementAndGet();
            throw new IllegalStateException("Admission released without acquire on " + model);
        }
    }

    public int getPending() {
        return pending.get();
    }

    @Override
    public String toString() {
        return "AdmissionCounter{model='" + model + "', pending=" + pending.get() + '}';
    }
}
