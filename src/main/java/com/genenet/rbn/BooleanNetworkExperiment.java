package com.genenet.rbn;

import com.genenet.rbn.api.AnalysisException;
import com.genenet.rbn.api.AnalysisResult;
import com.genenet.rbn.api.Attractor;
import com.genenet.rbn.api.Network;
import com.genenet.rbn.api.Proportions;
import com.genenet.rbn.api.SimulationListener;
import com.genenet.rbn.api.Trajectory;
import com.genenet.rbn.api.TrapSpaceSolver;
import com.genenet.rbn.api.UpdateScheme;
import com.genenet.rbn.engine.AsyncAttractorFinder;
import com.genenet.rbn.engine.DynamicsEngine;
import com.genenet.rbn.engine.NetworkBuilder;
import com.genenet.rbn.engine.ProportionAnalyzer;
import com.genenet.rbn.engine.SyncAttractorFinder;
import com.genenet.rbn.io.BnetFormat;
import com.genenet.rbn.io.ExperimentConfig;
import com.genenet.rbn.solver.ExhaustiveTrapSpaceSolver;
import com.genenet.rbn.solver.ProcessTrapSpaceSolver;
import com.genenet.rbn.util.CompositeSimulationListener;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;

/**
 * A network together with its attractor analysis and a dynamics engine.
 * <p>
 * This class handles:
 * <ul>
 * <li>computing the attractors of every requested update scheme exactly once,
 * on construction;</li>
 * <li>recording a failed analysis as unavailable rather than as zero
 * attractors;</li>
 * <li>sampling trajectories with the shared {@link DynamicsEngine};</li>
 * <li>scoring trajectories against the precomputed attractor sets.</li>
 * </ul>
 * The attractor sets are read-only after construction. Sampling is not
 * thread-safe; scoring is.
 */
public class BooleanNetworkExperiment {
    private static final Logger log = LogManager.getLogger(BooleanNetworkExperiment.class);

    private final Network network;
    private final DynamicsEngine engine;
    private final CompositeSimulationListener compositeListener = new CompositeSimulationListener();
    private final Map<UpdateScheme, AnalysisResult> analyses = new EnumMap<>(UpdateScheme.class);
    private final Map<UpdateScheme, ProportionAnalyzer> analyzers = new EnumMap<>(UpdateScheme.class);

    /**
     * @param network    the network, read-only from here on.
     * @param random     random source for trajectory sampling.
     * @param schemes    update schemes to analyse.
     * @param syncFinder synchronous attractor finder.
     * @param asyncFinder asynchronous attractor finder.
     */
    public BooleanNetworkExperiment(Network network, Random random, Collection<UpdateScheme> schemes,
            SyncAttractorFinder syncFinder, AsyncAttractorFinder asyncFinder) {
        this.network = network;
        this.engine = new DynamicsEngine(random);
        this.engine.setListener(compositeListener);

        for (UpdateScheme scheme : schemes) {
            AnalysisResult result = analyse(scheme, syncFinder, asyncFinder);
            analyses.put(scheme, result);
            if (result.isAvailable())
                analyzers.put(scheme, new ProportionAnalyzer(result.attractors()));
        }
    }

    /**
     * Generates a random network of {@code n} nodes as configured and
     * analyses it.
     */
    public static BooleanNetworkExperiment create(ExperimentConfig config, int n, Random random) {
        Network network = new NetworkBuilder(random)
                .policy(config.getParentPolicy())
                .build(n, config.getMaxParents());
        return new BooleanNetworkExperiment(network, random, config.getSchemes(),
                syncFinder(config), new AsyncAttractorFinder(solver(config)));
    }

    /**
     * Loads a network from a {@code .bnet} rule file and analyses it with the
     * configured finders.
     *
     * @throws IOException              if the file cannot be read.
     * @throws IllegalArgumentException if the file is not valid {@code .bnet}.
     */
    public static BooleanNetworkExperiment load(ExperimentConfig config, Path modelFile, Random random)
            throws IOException {
        Network network = BnetFormat.load(modelFile);
        return new BooleanNetworkExperiment(network, random, config.getSchemes(),
                syncFinder(config), new AsyncAttractorFinder(solver(config)));
    }

    static SyncAttractorFinder syncFinder(ExperimentConfig config) {
        Duration timeout = config.getSyncTimeoutMillis() == null ? null
                : Duration.ofMillis(config.getSyncTimeoutMillis());
        return new SyncAttractorFinder(config.getMaxSyncStates(), timeout);
    }

    static TrapSpaceSolver solver(ExperimentConfig config) {
        if (config.getSolverCommand() == null || config.getSolverCommand().isEmpty())
            return new ExhaustiveTrapSpaceSolver(config.getMaxSolverStates());
        return new ProcessTrapSpaceSolver(config.getSolverCommand(),
                Duration.ofMillis(config.getSolverTimeoutMillis()));
    }

    private AnalysisResult analyse(UpdateScheme scheme, SyncAttractorFinder syncFinder,
            AsyncAttractorFinder asyncFinder) {
        try {
            List<Attractor> attractors = switch (scheme) {
                case SYNCHRONOUS -> syncFinder.find(network);
                case ASYNCHRONOUS -> asyncFinder.find(network);
            };
            log.info("{} attractors: {}", scheme.label(), attractors.size());
            return AnalysisResult.found(scheme, attractors);
        } catch (AnalysisException e) {
            log.warn("{} attractor analysis unavailable for {}: {}", scheme.label(), network, e.getMessage());
            return AnalysisResult.unavailable(scheme, e);
        }
    }

    /**
     * Registers a listener to monitor simulation. Adds to the composite
     * listener rather than replacing existing ones.
     */
    public void addListener(SimulationListener listener) {
        compositeListener.add(listener);
    }

    public Network network() {
        return network;
    }

    public DynamicsEngine engine() {
        return engine;
    }

    /** The analysis outcome for {@code scheme}; never null for an analysed scheme. */
    public AnalysisResult analysis(UpdateScheme scheme) {
        AnalysisResult result = analyses.get(scheme);
        if (result == null)
            throw new IllegalArgumentException("Scheme " + scheme + " was not analysed");
        return result;
    }

    /** Samples one trajectory of {@code samples} states, {@code stride} updates apart. */
    public Trajectory sample(UpdateScheme scheme, int samples, int stride) {
        return engine.simulateSampled(network, samples, stride, scheme);
    }

    /**
     * Scores a trajectory against the attractors of its own scheme.
     *
     * @return the proportions, or empty when that scheme's analysis is
     *         unavailable.
     */
    public Optional<Proportions> score(Trajectory trajectory) {
        ProportionAnalyzer analyzer = analyzers.get(trajectory.scheme());
        return analyzer == null ? Optional.empty() : Optional.of(analyzer.analyze(trajectory));
    }
}
