package com.tracematrix.core.scanner;

import com.tracematrix.core.config.TraceabilityConfig;
import com.tracematrix.core.model.TestRecord;
import com.tracematrix.core.reference.ReferenceExtractor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;

/**
 * Finds test files in the configured test directories and records the requirement IDs
 * each one mentions. Files without references are left out.
 */
@Service
public class TestScanner {

    private static final Logger log = LoggerFactory.getLogger(TestScanner.class);

    private final TraceabilityConfig config;

    public TestScanner(TraceabilityConfig config) {
        this.config = config;
    }

    public SortedMap<String, TestRecord> scan() {
        var tests = new TreeMap<String, TestRecord>();
        List<Path> dirs = config.testDirs().stream().filter(Files::isDirectory).toList();
        if (dirs.isEmpty()) {
            log.warn("No test directory found (looked for {})", config.testDirs());
            return tests;
        }

        var files = new ArrayList<Path>();
        for (Path dir : dirs) {
            try {
                files.addAll(ArtifactFiles.find(dir, config.testFilePatterns()));
            } catch (IOException e) {
                log.warn("Could not scan tests in {}: {}", dir, e.getMessage());
            }
        }

        for (Path file : files) {
            String relative = config.relativize(file);
            if (tests.containsKey(relative)) {
                continue;
            }
            try {
                SortedSet<String> refs = ReferenceExtractor.extractReferences(ArtifactFiles.readText(file));
                if (!refs.isEmpty()) {
                    tests.put(relative, new TestRecord(relative, List.copyOf(refs), ArtifactFiles.lastModified(file)));
                }
            } catch (IOException e) {
                log.warn("Skipping unreadable test file {}: {}", relative, e.getMessage());
            }
        }
        log.info("Scanned {} test file(s), {} referencing requirements", files.size(), tests.size());
        return tests;
    }
}
