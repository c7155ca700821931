package fr.lapetina.neuraforge.domain.queue;

import fr.lapetina.neuraforge.domain.batch.Batch;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Global first-in first-out ready queue.
 *
 * Batches run in seal order regardless of model.
 */
public final class FifoBatchQueue implements BatchQueue {

    private final LinkedBlockingQueue<Batch> queue = new LinkedBlockingQueue<>();

    @Override
    public String getName() {
        return "fifo";
    }

    @Override
    public void offer(Batch batch) {
        queue.add(batch);
    }

    @Override
    public Batch poll(long timeout, TimeUnit unit) throws InterruptedException {
        return queue.poll(timeout, unit);
    }

    @Override
    public int size() {
        return queue.size();
    }

    @Override
    public List<Batch> drain() {
        List<Batch> drained = new ArrayList<>();
        queue.drainTo(drained);
        return drained;
    }
}
