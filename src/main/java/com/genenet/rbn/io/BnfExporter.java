package com.genenet.rbn.io;

import com.genenet.rbn.api.State;
import com.genenet.rbn.api.Trajectory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Writes trajectories as BNFinder2 expression data: a gene by time matrix,
 * tab separated.
 *
 * <p>
 * Each trajectory becomes one block: a header row {@code Gene S0 S1 ...}, one
 * row per node holding its name and its value at every sampled time, and a
 * blank separator line.
 */
public final class BnfExporter {
    private BnfExporter() {
        // Utility class
    }

    public static void write(Path path, List<Trajectory> trajectories, List<String> nodeNames) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null)
            Files.createDirectories(parent);
        try (BufferedWriter w = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            write(w, trajectories, nodeNames);
        }
    }

    public static void write(Writer w, List<Trajectory> trajectories, List<String> nodeNames) throws IOException {
        for (Trajectory trajectory : trajectories) {
            if (trajectory.nodeCount() != nodeNames.size())
                throw new IllegalArgumentException("Trajectory has " + trajectory.nodeCount()
                        + " nodes but " + nodeNames.size() + " names were given");
            w.write("Gene");
            for (int t = 0; t < trajectory.length(); t++)
                w.write("\tS" + t);
            w.write('\n');

            for (int g = 0; g < nodeNames.size(); g++) {
                w.write(nodeNames.get(g));
                for (State state : trajectory.states()) {
                    w.write('\t');
                    w.write(state.get(g) ? '1' : '0');
                }
                w.write('\n');
            }
            w.write('\n');
        }
    }

    /** Data file name used by the experiment sweep. */
    public static String fileName(int nodes, int steps, int stride, int count, String schemeLabel) {
        return "nodes" + nodes + "_steps" + steps + "_sample" + stride + "_ntraj" + count + "_" + schemeLabel + ".data";
    }

    /** Data file name used for a loaded model. */
    public static String modelFileName(String model, String schemeLabel) {
        return model + "_" + schemeLabel + ".data";
    }
}
