package com.genenet.rbn.disruptor;

import com.genenet.rbn.api.Trajectory;
import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.EventHandler;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import com.lmax.disruptor.util.DaemonThreadFactory;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Hands sampled trajectories from the simulating thread to a single consumer
 * thread through an LMAX Disruptor ring buffer.
 *
 * <h3>Workflow</h3>
 * <ol>
 * <li>The producer (simulation thread) samples a trajectory and calls
 * {@link #publish(TrajectoryBatch, int, Trajectory, boolean)}.</li>
 * <li>The consumer thread passes it to the {@link TrajectorySink} (scoring,
 * reporting) and adds it to its batch.</li>
 * <li>On the batch's last event the sink's
 * {@link TrajectorySink#onBatchEnd(TrajectoryBatch)} runs (export) and the
 * batch's completion future is completed, exceptionally if the sink threw.</li>
 * </ol>
 *
 * Simulation of the next trajectory overlaps with scoring of the previous one.
 * Both only read the network and the attractor sets.
 */
public final class TrajectoryPublisher implements AutoCloseable {
    private static final Logger log = LogManager.getLogger(TrajectoryPublisher.class);

    private final Disruptor<TrajectoryEvent> disruptor;
    private final RingBuffer<TrajectoryEvent> ringBuffer;

    public TrajectoryPublisher(TrajectorySink sink, int bufferSize) {
        this.disruptor = new Disruptor<>(
                TrajectoryEvent::new,
                bufferSize,
                DaemonThreadFactory.INSTANCE,
                ProducerType.SINGLE,
                new BlockingWaitStrategy());
        disruptor.handleEventsWith(new Consumer(sink));
        this.ringBuffer = disruptor.start();
    }

    /**
     * Publishes one trajectory. Blocks while the ring buffer is full.
     */
    public void publish(TrajectoryBatch batch, int index, Trajectory trajectory, boolean batchEnd) {
        long sequence = ringBuffer.next();
        try {
            ringBuffer.get(sequence).set(batch, index, trajectory, batchEnd);
        } finally {
            ringBuffer.publish(sequence);
        }
    }

    /** Waits for all published events to be consumed, then stops the consumer. */
    @Override
    public void close() {
        disruptor.shutdown();
    }

    static final class Consumer implements EventHandler<TrajectoryEvent> {
        private final TrajectorySink sink;

        Consumer(TrajectorySink sink) {
            this.sink = sink;
        }

        @Override
        public void onEvent(TrajectoryEvent event, long sequence, boolean endOfBatch) {
            TrajectoryBatch batch = event.batch();
            try {
                if (!batch.completion().isDone()) {
                    sink.onTrajectory(batch, event.index(), event.trajectory());
                    batch.add(event.trajectory());
                    if (event.isBatchEnd()) {
                        sink.onBatchEnd(batch);
                        batch.completion().complete(batch);
                    }
                }
            } catch (Exception e) {
                log.error("Trajectory consumer failed on batch [{}] at trajectory {}", batch, event.index(), e);
                batch.completion().completeExceptionally(e);
            } finally {
                event.clear();
            }
        }
    }
}
