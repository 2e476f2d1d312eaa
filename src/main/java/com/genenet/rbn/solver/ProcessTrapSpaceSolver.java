package com.genenet.rbn.solver;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.genenet.rbn.api.ResourceExceededException;
import com.genenet.rbn.api.SolverFailureException;
import com.genenet.rbn.api.TrapSpaceSolver;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Runs an external trap-space solver as a child process.
 *
 * <p>
 * The rule set is written to a temporary {@code .bnet} file. Every
 * {@value #RULE_FILE_PLACEHOLDER} argument of the command is replaced by that
 * file's path; without a placeholder the path is appended as the last
 * argument. The process must print a JSON array of partial assignments on
 * standard output, e.g. {@code [{"v0": 1, "v2": 0}, {"v1": 1}]}, and exit with
 * status 0. A typical command is a short PyBoolNet wrapper script:
 *
 * <pre>
 * python3 min_trap_spaces.py {bnet}
 * </pre>
 */
public final class ProcessTrapSpaceSolver implements TrapSpaceSolver {
    private static final Logger log = LogManager.getLogger(ProcessTrapSpaceSolver.class);

    public static final String RULE_FILE_PLACEHOLDER = "{bnet}";

    private static final TypeReference<List<Map<String, Object>>> RESULT_TYPE = new TypeReference<>() {
    };

    private final List<String> command;
    private final Duration timeout;
    private final ObjectMapper mapper = new ObjectMapper();

    public ProcessTrapSpaceSolver(List<String> command, Duration timeout) {
        if (command.isEmpty())
            throw new IllegalArgumentException("Solver command must not be empty");
        this.command = List.copyOf(command);
        this.timeout = timeout;
    }

    @Override
    public List<Map<String, Integer>> computeMinimalTrapSpaces(String bnetRules) {
        Path rules = null;
        Path stdout = null;
        Path stderr = null;
        try {
            rules = Files.createTempFile("rbn-rules-", ".bnet");
            stdout = Files.createTempFile("rbn-solver-", ".out");
            stderr = Files.createTempFile("rbn-solver-", ".err");
            Files.writeString(rules, bnetRules, StandardCharsets.UTF_8);

            List<String> cmd = resolveCommand(rules);
            log.debug("Running trap-space solver: {}", cmd);
            Process process = new ProcessBuilder(cmd)
                    .redirectOutput(stdout.toFile())
                    .redirectError(stderr.toFile())
                    .start();

            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                throw new ResourceExceededException("Trap-space solver did not finish within " + timeout);
            }
            if (process.exitValue() != 0) {
                throw new SolverFailureException("Trap-space solver exited with status " + process.exitValue()
                        + ": " + head(Files.readString(stderr, StandardCharsets.UTF_8)));
            }
            return parseResult(Files.readString(stdout, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new SolverFailureException("Trap-space solver could not be run: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SolverFailureException("Interrupted while waiting for trap-space solver", e);
        } finally {
            deleteQuietly(rules);
            deleteQuietly(stdout);
            deleteQuietly(stderr);
        }
    }

    List<String> resolveCommand(Path rules) {
        List<String> cmd = new ArrayList<>(command.size() + 1);
        boolean placed = false;
        for (String arg : command) {
            if (arg.contains(RULE_FILE_PLACEHOLDER)) {
                cmd.add(arg.replace(RULE_FILE_PLACEHOLDER, rules.toString()));
                placed = true;
            } else {
                cmd.add(arg);
            }
        }
        if (!placed)
            cmd.add(rules.toString());
        return cmd;
    }

    /**
     * Parses the solver's JSON output. Values may be numbers or the strings
     * {@code "0"}/{@code "1"}.
     */
    List<Map<String, Integer>> parseResult(String json) {
        List<Map<String, Object>> raw;
        try {
            raw = mapper.readValue(json, RESULT_TYPE);
        } catch (JsonProcessingException e) {
            throw new SolverFailureException("Malformed solver output: " + head(json), e);
        }
        if (raw == null)
            throw new SolverFailureException("Solver printed no result");

        List<Map<String, Integer>> result = new ArrayList<>(raw.size());
        for (Map<String, Object> space : raw) {
            if (space == null)
                throw new SolverFailureException("Solver printed a null trap space");
            Map<String, Integer> assignment = new LinkedHashMap<>();
            for (Map.Entry<String, Object> e : space.entrySet())
                assignment.put(e.getKey(), toBit(e.getKey(), e.getValue()));
            result.add(assignment);
        }
        return result;
    }

    private static Integer toBit(String node, Object value) {
        String s = String.valueOf(value);
        if (s.equals("0") || s.equals("1"))
            return Integer.valueOf(s);
        throw new SolverFailureException("Solver printed value " + value + " for node " + node);
    }

    private static String head(String text) {
        String t = text.strip();
        return t.length() > 200 ? t.substring(0, 200) + "..." : t;
    }

    private static void deleteQuietly(Path path) {
        if (path == null)
            return;
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            log.warn("Could not delete temporary file {}", path, e);
        }
    }
}
