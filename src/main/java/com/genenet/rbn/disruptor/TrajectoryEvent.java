package com.genenet.rbn.disruptor;

import com.genenet.rbn.api.Trajectory;

/**
 * A mutable data holder for one sampled trajectory, used within the LMAX
 * Disruptor RingBuffer.
 *
 * <p>
 * <b>Flyweight Pattern:</b> Instances are pre-allocated during RingBuffer
 * construction and reused for every published trajectory.
 */
public final class TrajectoryEvent {
    private TrajectoryBatch batch;
    private int index = -1;
    private Trajectory trajectory;
    private boolean batchEnd;

    /**
     * @param batch      the sweep point the trajectory belongs to.
     * @param index      trajectory number within the batch, from 0.
     * @param trajectory the sampled trajectory.
     * @param batchEnd   true for the batch's last trajectory.
     */
    public void set(TrajectoryBatch batch, int index, Trajectory trajectory, boolean batchEnd) {
        this.batch = batch;
        this.index = index;
        this.trajectory = trajectory;
        this.batchEnd = batchEnd;
    }

    public TrajectoryBatch batch() {
        return batch;
    }

    public int index() {
        return index;
    }

    public Trajectory trajectory() {
        return trajectory;
    }

    public boolean isBatchEnd() {
        return batchEnd;
    }

    public void clear() {
        batch = null;
        index = -1;
        trajectory = null;
        batchEnd = false;
    }
}
