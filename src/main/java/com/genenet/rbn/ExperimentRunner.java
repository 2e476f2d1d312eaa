package com.genenet.rbn;

import com.genenet.rbn.api.Proportions;
import com.genenet.rbn.api.Trajectory;
import com.genenet.rbn.api.UpdateScheme;
import com.genenet.rbn.disruptor.TrajectoryBatch;
import com.genenet.rbn.disruptor.TrajectoryPublisher;
import com.genenet.rbn.disruptor.TrajectorySink;
import com.genenet.rbn.io.BnfExporter;
import com.genenet.rbn.io.ExperimentConfig;
import com.genenet.rbn.util.NetworkExplain;
import lombok.extern.log4j.Log4j2;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.CompletionException;

/**
 * Runs an experiment sweep: generates one network per node count, analyses
 * its attractors once, then samples, scores and exports trajectories for
 * every sweep point. Configured {@code .bnet} models are then loaded and
 * exported the same way, one batch per model.
 *
 * <p>
 * Simulation runs on the calling thread; scoring, reporting and export run on
 * the consumer thread of a {@link TrajectoryPublisher}. The caller waits for
 * each sweep point to finish before starting the next, so report lines never
 * interleave.
 */
@Log4j2
public final class ExperimentRunner implements TrajectorySink {
    private static final String DEFAULT_CONFIG = "/experiment.json";

    private final ExperimentConfig config;
    private final Random random;
    private final Path outputDir;
    private final Writer report;

    // Set by the producer before a batch is published; read by the consumer.
    private volatile BooleanNetworkExperiment current;

    private final StringBuilder pendingLine = new StringBuilder(128);
    private int pendingSchemes;

    public ExperimentRunner(ExperimentConfig config, Path outputDir, Writer report) {
        this.config = config.validate();
        this.random = config.getSeed() == null ? new Random() : new Random(config.getSeed());
        this.outputDir = outputDir;
        this.report = report;
    }

    public static void main(String[] args) throws Exception {
        ExperimentConfig config = args.length > 0 ? ExperimentConfig.load(Path.of(args[0])) : defaultConfig();
        Path outputDir = Path.of(config.getOutputDir());
        Files.createDirectories(outputDir);

        try (Writer report = Files.newBufferedWriter(Path.of(config.getReportFile()), StandardCharsets.UTF_8)) {
            new ExperimentRunner(config, outputDir, report).run();
        }
        log.info("Experiment finished. Report written to {}", config.getReportFile());
    }

    static ExperimentConfig defaultConfig() throws IOException {
        try (InputStream in = ExperimentRunner.class.getResourceAsStream(DEFAULT_CONFIG)) {
            if (in == null)
                throw new IOException("Missing classpath resource " + DEFAULT_CONFIG);
            return ExperimentConfig.load(in);
        }
    }

    /**
     * Runs every sweep of every node count.
     *
     * @throws IOException if the report or an export file cannot be written.
     */
    public void run() throws IOException {
        try (TrajectoryPublisher publisher = new TrajectoryPublisher(this, 1024)) {
            for (int n : config.getNodes())
                runNetwork(n, publisher);
            for (String file : config.getModelFiles())
                runModel(Path.of(file), publisher);
        }
    }

    private void runModel(Path file, TrajectoryPublisher publisher) throws IOException {
        String model = modelName(file);
        log.info("Loading model {} from {}", model, file);
        BooleanNetworkExperiment experiment = BooleanNetworkExperiment.load(config, file, random);
        current = experiment;

        int n = experiment.network().size();
        report("BOOLEAN NETWORK (model = " + model + ", nodes = " + n + ")\n");
        report(new NetworkExplain(experiment.network()).describe().stripTrailing());
        runBatch(TrajectoryBatch.forModel(model, n, config.getModelUpdates(), config.getModelTrajectoryCount()),
                experiment, publisher);
        report("\n======================\n");
    }

    /**
     * Name a model's data files are written under: the file name without its
     * extension, or the directory name for the {@code <model>/model.bnet}
     * layout.
     */
    static String modelName(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        if (dot > 0)
            name = name.substring(0, dot);
        Path parent = file.toAbsolutePath().getParent();
        if (name.equals("model") && parent != null && parent.getFileName() != null)
            return parent.getFileName().toString();
        return name;
    }

    private void runNetwork(int n, TrajectoryPublisher publisher) throws IOException {
        log.info("Generating network with {} nodes", n);
        BooleanNetworkExperiment experiment = BooleanNetworkExperiment.create(config, n, random);
        current = experiment;

        report("BOOLEAN NETWORK (nodes = " + n + ")\n");
        report(new NetworkExplain(experiment.network()).describe().stripTrailing());

        int steps = config.baselineSteps();
        int stride = config.baselineStride();
        int count = config.baselineTrajectoryCount();

        // Vary one parameter at a time.
        for (int s : config.getSteps())
            runBatch(new TrajectoryBatch(n, s, stride, count), experiment, publisher);
        for (int k : config.getSampleEvery())
            runBatch(new TrajectoryBatch(n, steps, k, count), experiment, publisher);
        for (int c : config.getTrajectoryCounts())
            runBatch(new TrajectoryBatch(n, steps, stride, c), experiment, publisher);

        report("\n======================\n");
    }

    private void runBatch(TrajectoryBatch batch, BooleanNetworkExperiment experiment, TrajectoryPublisher publisher)
            throws IOException {
        report("\n[Attractors | " + batch + "]");
        for (UpdateScheme scheme : config.getSchemes()) {
            report(String.format("  %-5s attractors : %s", scheme.label(),
                    experiment.analysis(scheme).describe()));
        }

        List<UpdateScheme> schemes = config.getSchemes();
        for (int i = 0; i < batch.getCount(); i++) {
            for (int j = 0; j < schemes.size(); j++) {
                Trajectory t = experiment.sample(schemes.get(j), batch.getSteps(), batch.getStride());
                boolean last = i == batch.getCount() - 1 && j == schemes.size() - 1;
                publisher.publish(batch, i, t, last);
            }
        }

        try {
            batch.completion().join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof IOException io)
                throw io;
            if (e.getCause() instanceof UncheckedIOException uio)
                throw uio.getCause();
            throw e;
        }
    }

    @Override
    public void onTrajectory(TrajectoryBatch batch, int index, Trajectory trajectory) throws IOException {
        if (pendingSchemes == 0) {
            pendingLine.setLength(0);
            pendingLine.append(String.format("  traj %02d", index + 1));
        }

        Optional<Proportions> p = current.score(trajectory);
        pendingLine.append(" | ").append(trajectory.scheme().label()).append('=')
                .append(p.map(v -> "(" + v + ")").orElse("unavailable"));

        if (++pendingSchemes == config.getSchemes().size()) {
            pendingSchemes = 0;
            report(pendingLine.toString());
        }
    }

    @Override
    public void onBatchEnd(TrajectoryBatch batch) throws IOException {
        List<String> names = current.network().nodeNames();
        for (UpdateScheme scheme : config.getSchemes()) {
            String fileName = batch.getModel() != null
                    ? BnfExporter.modelFileName(batch.getModel(), scheme.label())
                    : BnfExporter.fileName(batch.getNodes(), batch.getSteps(), batch.getStride(), batch.getCount(),
                            scheme.label());
            Path file = outputDir.resolve(fileName);
            BnfExporter.write(file, batch.trajectories(scheme), names);
            log.info("saved: {}", file);
        }
    }

    private void report(String line) throws IOException {
        log.info(line);
        report.write(line);
        report.write('\n');
        report.flush();
    }
}
