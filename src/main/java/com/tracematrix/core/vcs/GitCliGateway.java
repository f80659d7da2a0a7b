package com.tracematrix.core.vcs;

import com.tracematrix.core.config.TraceabilityConfig;
import com.tracematrix.core.model.CommitRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

/**
 * {@link VersionControlGateway} backed by the {@code git} command line.
 *
 * <p>Shells out via {@link ProcessBuilder}. Every invocation is bounded by the configured
 * timeout; failures are logged and reported as an empty result so a shallow clone or a
 * directory without history degrades the matrix instead of aborting it.
 */
public class GitCliGateway implements VersionControlGateway {

    private static final Logger log = LoggerFactory.getLogger(GitCliGateway.class);

    /** Separates commits in {@code git log} output. */
    static final char RECORD_SEPARATOR = '\u001e';
    /** Separates hash from subject within a commit header. */
    static final char UNIT_SEPARATOR = '\u001f';

    private final Path workDir;
    private final String executable;
    private final Duration timeout;
    private final boolean enabled;

    public GitCliGateway(TraceabilityConfig config) {
        this.workDir = config.projectRoot();
        this.executable = config.gitExecutable();
        this.timeout = config.gitTimeout();
        this.enabled = config.gitEnabled();
    }

    @Override
    public List<String> listBranches() {
        return runGitOutput("branch", "-a", "--no-color")
                .map(GitCliGateway::parseBranchList)
                .orElse(List.of());
    }

    @Override
    public List<CommitRecord> findCommitsReferencing(String requirementId) {
        return runGitOutput("log", "--fixed-strings", "--grep=" + requirementId, "--name-only",
                "--pretty=format:%x1e%H%x1f%s")
                .map(GitCliGateway::parseLog)
                .orElse(List.of());
    }

    /**
     * Parses {@code git branch -a} output: one branch per line, the current one prefixed by
     * {@code *}. Symbolic refs such as {@code remotes/origin/HEAD -> origin/main} are dropped.
     */
    static List<String> parseBranchList(String output) {
        var branches = new ArrayList<String>();
        for (String line : output.split("\\R")) {
            String name = line.trim();
            if (name.startsWith("*") || name.startsWith("+")) {
                name = name.substring(1).trim();
            }
            if (name.isEmpty() || name.contains(" -> ") || name.startsWith("(")) {
                continue;
            }
            branches.add(name);
        }
        return branches;
    }

    /**
     * Parses {@code git log --name-only --pretty=format:%x1e%H%x1f%s}: each record starts
     * with a header line {@code hash<US>subject}, followed by the touched paths.
     */
    static List<CommitRecord> parseLog(String output) {
        var commits = new ArrayList<CommitRecord>();
        for (String chunk : output.split(String.valueOf(RECORD_SEPARATOR))) {
            if (chunk.isBlank()) {
                continue;
            }
            String[] lines = chunk.split("\\R");
            String header = lines[0];
            int split = header.indexOf(UNIT_SEPARATOR);
            String hash = split >= 0 ? header.substring(0, split).trim() : header.trim();
            String subject = split >= 0 ? header.substring(split + 1).trim() : "";
            var files = new ArrayList<String>();
            for (int i = 1; i < lines.length; i++) {
                String file = lines[i].trim();
                if (!file.isEmpty()) {
                    files.add(file);
                }
            }
            commits.add(new CommitRecord(hash, subject, files));
        }
        return commits;
    }

    /**
     * Runs a git command and captures stdout.
     *
     * @param args git arguments
     * @return stdout, or empty when git is disabled, missing, exits non-zero or times out
     */
    Optional<String> runGitOutput(String... args) {
        if (!enabled) {
            return Optional.empty();
        }
        var command = buildCommand(args);
        log.debug("Running (capture): {}", String.join(" ", command));

        Process process;
        try {
            process = new ProcessBuilder(command)
                    .directory(workDir.toFile())
                    .redirectError(ProcessBuilder.Redirect.DISCARD)
                    .start();
        } catch (IOException e) {
            log.warn("Could not start {}: {}", executable, e.getMessage());
            return Optional.empty();
        }

        CompletableFuture<String> stdout = CompletableFuture.supplyAsync(() -> readAll(process.getInputStream()));
        try {
            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                log.warn("Git command timed out after {}s: {}", timeout.toSeconds(), String.join(" ", command));
                return Optional.empty();
            }
            String output = stdout.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            int exitCode = process.exitValue();
            if (exitCode != 0) {
                log.warn("Git command exited with code {}: {}", exitCode, String.join(" ", command));
                return Optional.empty();
            }
            return Optional.of(output);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            log.warn("Interrupted while waiting for git: {}", String.join(" ", command));
            return Optional.empty();
        } catch (ExecutionException | TimeoutException e) {
            process.destroyForcibly();
            log.warn("Failed reading git output for {}: {}", String.join(" ", command), e.getMessage());
            return Optional.empty();
        }
    }

    private static String readAll(InputStream in) {
        try (var reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
            return reader.lines().collect(Collectors.joining("\n"));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private List<String> buildCommand(String... args) {
        var command = new ArrayList<String>();
        command.add(executable);
        command.addAll(List.of(args));
        return command;
    }
}
