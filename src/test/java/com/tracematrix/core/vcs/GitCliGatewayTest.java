package com.tracematrix.core.vcs;

import com.tracematrix.core.config.TraceabilityConfig;
import com.tracematrix.core.config.TraceabilityProperties;
import com.tracematrix.core.model.CommitRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class GitCliGatewayTest {

    @TempDir
    Path root;

    /**
     * Intercepts git invocations so no real repository is needed.
     */
    static class TestableGitCliGateway extends GitCliGateway {
        final List<String> commands = new ArrayList<>();
        final Map<String, String> outputs = new HashMap<>();

        TestableGitCliGateway(TraceabilityConfig config) {
            super(config);
        }

        @Override
        Optional<String> runGitOutput(String... args) {
            String cmd = String.join(" ", args);
            commands.add(cmd);
            return Optional.ofNullable(outputs.get(args[0]));
        }
    }

    @Nested
    @DisplayName("Branches")
    class Branches {

        @Test
        @DisplayName("lists local and remote branches, dropping the current marker and symbolic refs")
        void listsBranches() {
            var gateway = new TestableGitCliGateway(TraceabilityConfig.forProject(root));
            gateway.outputs.put("branch", """
                    * main
                      feature/req-001-login
                    + worktree/req-002
                      remotes/origin/HEAD -> origin/main
                      remotes/origin/feature/req-001-login
                    """);

            assertEquals(List.of("main", "feature/req-001-login", "worktree/req-002",
                    "remotes/origin/feature/req-001-login"), gateway.listBranches());
            assertEquals("branch -a --no-color", gateway.commands.get(0));
        }

        @Test
        @DisplayName("detached HEAD entries are dropped")
        void detachedHead() {
            assertEquals(List.of("main"),
                    GitCliGateway.parseBranchList("* (HEAD detached at 1a2b3c)\n  main\n"));
        }

        @Test
        @DisplayName("git failure yields no branches")
        void failure() {
            var gateway = new TestableGitCliGateway(TraceabilityConfig.forProject(root));
            assertTrue(gateway.listBranches().isEmpty());
        }
    }

    @Nested
    @DisplayName("Commits")
    class Commits {

        @Test
        @DisplayName("parses hash, subject and touched files per commit")
        void parsesLog() {
            String log = "\u001eabc123\u001fREQ-001: add login\nsrc/auth/Login.java\ntests/login.test.js\n\n"
                    + "\u001edef456\u001fREQ-001 follow-up\nsrc/auth/Session.java\n";

            List<CommitRecord> commits = GitCliGateway.parseLog(log);

            assertEquals(2, commits.size());
            assertEquals(new CommitRecord("abc123", "REQ-001: add login",
                    List.of("src/auth/Login.java", "tests/login.test.js")), commits.get(0));
            assertEquals(List.of("src/auth/Session.java"), commits.get(1).files());
        }

        @Test
        @DisplayName("greps commit messages for the literal requirement id")
        void grepsForId() {
            var gateway = new TestableGitCliGateway(TraceabilityConfig.forProject(root));
            gateway.outputs.put("log", "\u001eabc\u001fREQ-001\nsrc/A.java\n");

            assertEquals(1, gateway.findCommitsReferencing("REQ-001").size());
            assertTrue(gateway.commands.get(0).contains("--fixed-strings --grep=REQ-001 --name-only"));
        }

        @Test
        @DisplayName("empty log yields no commits")
        void emptyLog() {
            assertTrue(GitCliGateway.parseLog("").isEmpty());
        }
    }

    @Test
    @DisplayName("disabled git never starts a process")
    void disabled() {
        var properties = new TraceabilityProperties();
        properties.setProjectRoot(root.toString());
        properties.getGit().setEnabled(false);
        var gateway = new GitCliGateway(properties.toConfig());

        assertTrue(gateway.runGitOutput("status").isEmpty());
        assertTrue(gateway.listBranches().isEmpty());
    }

    @Test
    @DisplayName("missing git executable yields empty output instead of failing")
    void missingExecutable() {
        var properties = new TraceabilityProperties();
        properties.setProjectRoot(root.toString());
        properties.getGit().setExecutable("git-does-not-exist-" + System.nanoTime());
        var gateway = new GitCliGateway(properties.toConfig());

        assertTrue(gateway.findCommitsReferencing("REQ-001").isEmpty());
    }
}
