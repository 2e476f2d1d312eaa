package com.genenet.rbn.io;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.genenet.rbn.api.ConfigurationException;
import com.genenet.rbn.api.UpdateScheme;
import com.genenet.rbn.engine.ParentPolicy;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import lombok.Data;

/**
 * Parameters of an experiment sweep, loaded from JSON.
 *
 * <p>
 * For every node count one network is generated. Three one-parameter sweeps
 * follow, each holding the other two parameters at their baseline: the
 * trajectory length ({@code steps}), the sampling stride
 * ({@code sampleEvery}) and the number of trajectories
 * ({@code trajectoryCounts}). Baselines are the second entry of
 * {@code steps} and {@code trajectoryCounts} and the first entry of
 * {@code sampleEvery} (or the only entry of a one-element list).
 *
 * <p>
 * {@code steps} counts sampled states per trajectory: a value {@code s} with
 * stride {@code k} simulates {@code (s - 1) * k} updates.
 *
 * <p>
 * Each of {@code modelFiles} is a {@code .bnet} rule file. After the sweep,
 * every model is analysed and {@code modelTrajectoryCount} trajectories of
 * {@code modelUpdates} updates are exported per scheme. With model files
 * given, {@code nodes} may be empty.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class ExperimentConfig {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private List<Integer> nodes = new ArrayList<>(List.of(5, 8, 16));
    private int maxParents = 3;
    private ParentPolicy parentPolicy = ParentPolicy.EXCLUDE_SELF;
    private List<Integer> steps = new ArrayList<>(List.of(10, 20, 30));
    private List<Integer> sampleEvery = new ArrayList<>(List.of(1, 2, 3));
    private List<Integer> trajectoryCounts = new ArrayList<>(List.of(16, 32, 64));
    private List<UpdateScheme> schemes = new ArrayList<>(List.of(UpdateScheme.SYNCHRONOUS, UpdateScheme.ASYNCHRONOUS));

    /** Random seed; {@code null} draws a fresh one. */
    private Long seed;

    private String outputDir = "BN_data";
    private String reportFile = "report.txt";

    private long maxSyncStates = 1L << 22;
    /** Wall-clock bound of one synchronous search; {@code null} for none. */
    private Long syncTimeoutMillis;

    /** External solver command; empty uses the in-process solver. */
    private List<String> solverCommand = new ArrayList<>();
    private long solverTimeoutMillis = 60_000;
    private long maxSolverStates = 1L << 20;

    private List<String> modelFiles = new ArrayList<>();
    private int modelUpdates = 50;
    private int modelTrajectoryCount = 10;

    public static ExperimentConfig load(Path path) throws IOException {
        return MAPPER.readValue(path.toFile(), ExperimentConfig.class).validate();
    }

    public static ExperimentConfig load(InputStream in) throws IOException {
        return MAPPER.readValue(in, ExperimentConfig.class).validate();
    }

    public static ExperimentConfig parse(String json) throws IOException {
        return MAPPER.readValue(json, ExperimentConfig.class).validate();
    }

    public int baselineSteps() {
        return steps.get(Math.min(1, steps.size() - 1));
    }

    public int baselineStride() {
        return sampleEvery.get(0);
    }

    public int baselineTrajectoryCount() {
        return trajectoryCounts.get(Math.min(1, trajectoryCounts.size() - 1));
    }

    /**
     * Checks every parameter.
     *
     * @return this config.
     * @throws ConfigurationException on the first invalid parameter.
     */
    public ExperimentConfig validate() {
        if (modelFiles == null)
            throw new ConfigurationException("modelFiles must not be null");
        requireNoNulls("modelFiles", modelFiles);
        if (modelFiles.isEmpty())
            requireNonEmpty("nodes", nodes);
        else if (nodes == null)
            throw new ConfigurationException("nodes must not be null");
        requireNoNulls("nodes", nodes);
        requireNonEmpty("steps", steps);
        requireNonEmpty("sampleEvery", sampleEvery);
        requireNonEmpty("trajectoryCounts", trajectoryCounts);
        requireNonEmpty("schemes", schemes);
        if (parentPolicy == null)
            throw new ConfigurationException("parentPolicy must be set");
        if (maxParents < 1)
            throw new ConfigurationException("maxParents must be >= 1, got " + maxParents);
        for (int n : nodes)
            parentPolicy.maxParents(n, maxParents);
        for (int s : steps) {
            if (s < 1)
                throw new ConfigurationException("Trajectory length must be >= 1 sampled state, got " + s);
        }
        for (int k : sampleEvery) {
            if (k < 1)
                throw new ConfigurationException("Sampling stride must be >= 1, got " + k);
        }
        for (int c : trajectoryCounts) {
            if (c < 1)
                throw new ConfigurationException("Trajectory count must be >= 1, got " + c);
        }
        if (maxSyncStates < 1 || maxSolverStates < 1)
            throw new ConfigurationException("State bounds must be >= 1");
        if (syncTimeoutMillis != null && syncTimeoutMillis < 1)
            throw new ConfigurationException("syncTimeoutMillis must be >= 1, got " + syncTimeoutMillis);
        if (solverTimeoutMillis < 1)
            throw new ConfigurationException("solverTimeoutMillis must be >= 1, got " + solverTimeoutMillis);
        if (modelUpdates < 0)
            throw new ConfigurationException("modelUpdates must be >= 0, got " + modelUpdates);
        if (modelTrajectoryCount < 1)
            throw new ConfigurationException("modelTrajectoryCount must be >= 1, got " + modelTrajectoryCount);
        return this;
    }

    private static void requireNonEmpty(String name, List<?> values) {
        if (values == null || values.isEmpty())
            throw new ConfigurationException(name + " must list at least one value");
        requireNoNulls(name, values);
    }

    private static void requireNoNulls(String name, List<?> values) {
        for (Object v : values) {
            if (v == null)
                throw new ConfigurationException(name + " must not contain null");
        }
    }
}
