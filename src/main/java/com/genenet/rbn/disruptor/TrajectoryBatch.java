package com.genenet.rbn.disruptor;

import com.genenet.rbn.api.Trajectory;
import com.genenet.rbn.api.UpdateScheme;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import lombok.Getter;

/**
 * One point of an experiment sweep: the trajectories sampled for a network
 * with a fixed length, stride and count. Batches for a network loaded from a
 * rule file also carry the model name.
 *
 * Trajectories are appended by the consumer thread only; {@link #completion()}
 * completes after the consumer has seen the batch's last event, which
 * publishes the collected trajectories to the waiting producer.
 */
public final class TrajectoryBatch {
    /** Model name, or {@code null} for a generated network. */
    @Getter
    private final String model;
    @Getter
    private final int nodes;
    @Getter
    private final int steps;
    @Getter
    private final int stride;
    @Getter
    private final int count;

    private final Map<UpdateScheme, List<Trajectory>> trajectories = new EnumMap<>(UpdateScheme.class);
    private final CompletableFuture<TrajectoryBatch> completion = new CompletableFuture<>();

    public TrajectoryBatch(int nodes, int steps, int stride, int count) {
        this(null, nodes, steps, stride, count);
    }

    private TrajectoryBatch(String model, int nodes, int steps, int stride, int count) {
        this.model = model;
        this.nodes = nodes;
        this.steps = steps;
        this.stride = stride;
        this.count = count;
    }

    /**
     * Batch of unsampled trajectories of a loaded model.
     *
     * @param updates updates per trajectory; each holds {@code updates + 1}
     *                states.
     */
    public static TrajectoryBatch forModel(String model, int nodes, int updates, int count) {
        return new TrajectoryBatch(model, nodes, updates + 1, 1, count);
    }

    void add(Trajectory trajectory) {
        trajectories.computeIfAbsent(trajectory.scheme(), s -> new ArrayList<>(count)).add(trajectory);
    }

    public List<Trajectory> trajectories(UpdateScheme scheme) {
        return Collections.unmodifiableList(trajectories.getOrDefault(scheme, List.of()));
    }

    public CompletableFuture<TrajectoryBatch> completion() {
        return completion;
    }

    @Override
    public String toString() {
        String prefix = model == null ? "" : "model=" + model + ", ";
        return prefix + "nodes=" + nodes + ", steps=" + steps + ", sample=" + stride + ", ntraj=" + count;
    }
}
