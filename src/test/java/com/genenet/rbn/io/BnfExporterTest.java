package com.genenet.rbn.io;

import com.genenet.rbn.api.State;
import com.genenet.rbn.api.Trajectory;
import com.genenet.rbn.api.UpdateScheme;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.Assert.*;

public class BnfExporterTest {

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private final Trajectory first = new Trajectory(UpdateScheme.SYNCHRONOUS,
            List.of(State.ofBits(0, 1), State.ofBits(1, 1), State.ofBits(1, 0)));
    private final Trajectory second = new Trajectory(UpdateScheme.SYNCHRONOUS,
            List.of(State.ofBits(1, 1)));

    @Test
    public void testLayout() throws Exception {
        StringWriter out = new StringWriter();
        BnfExporter.write(out, List.of(first, second), List.of("X0", "X1"));

        String expected = "Gene\tS0\tS1\tS2\n"
                + "X0\t0\t1\t1\n"
                + "X1\t1\t1\t0\n"
                + "\n"
                + "Gene\tS0\n"
                + "X0\t1\n"
                + "X1\t1\n"
                + "\n";
        assertEquals(expected, out.toString());
    }

    @Test
    public void testNoTrajectories() throws Exception {
        StringWriter out = new StringWriter();
        BnfExporter.write(out, List.of(), List.of("X0"));
        assertEquals("", out.toString());
    }

    @Test
    public void testWritesFileAndCreatesDirectories() throws Exception {
        Path file = folder.getRoot().toPath().resolve("BN_data").resolve(BnfExporter.fileName(2, 3, 1, 1, "sync"));
        BnfExporter.write(file, List.of(first), List.of("X0", "X1"));

        assertEquals("nodes2_steps3_sample1_ntraj1_sync.data", file.getFileName().toString());
        List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        assertEquals(4, lines.size());
        assertEquals("X1\t1\t1\t0", lines.get(2));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNameCountMismatch() throws Exception {
        BnfExporter.write(new StringWriter(), List.of(first), List.of("X0"));
    }
}
