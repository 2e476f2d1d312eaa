package com.genenet.rbn.disruptor;

import com.genenet.rbn.api.Trajectory;

/**
 * Consumer-side callbacks of the {@link TrajectoryPublisher}. Always invoked
 * on the single consumer thread, in publication order.
 */
public interface TrajectorySink {

    /** Called for every trajectory, before it is added to its batch. */
    void onTrajectory(TrajectoryBatch batch, int index, Trajectory trajectory) throws Exception;

    /** Called after the batch's last trajectory has been added. */
    void onBatchEnd(TrajectoryBatch batch) throws Exception;
}
