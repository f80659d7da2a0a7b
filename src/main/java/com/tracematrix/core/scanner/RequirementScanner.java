package com.tracematrix.core.scanner;

import com.tracematrix.core.config.TraceabilityConfig;
import com.tracematrix.core.frontmatter.Frontmatter;
import com.tracematrix.core.frontmatter.FrontmatterParser;
import com.tracematrix.core.model.Requirement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Reads requirement files ({@code req-*.md}) and parses their frontmatter into
 * {@link Requirement} records keyed by ID.
 * <p>
 * A file without a usable {@code id} is skipped. When two files declare the same ID the
 * first one in path order wins.
 */
@Service
public class RequirementScanner {

    private static final Logger log = LoggerFactory.getLogger(RequirementScanner.class);

    private final TraceabilityConfig config;
    private final FrontmatterParser parser;

    public RequirementScanner(TraceabilityConfig config, FrontmatterParser parser) {
        this.config = config;
        this.parser = parser;
    }

    public SortedMap<String, Requirement> scan() {
        var requirements = new TreeMap<String, Requirement>();
        Path dir = config.requirementsDir();
        if (!Files.isDirectory(dir)) {
            log.warn("Requirements directory not found: {}", dir);
            return requirements;
        }

        List<Path> files;
        try {
            files = ArtifactFiles.find(dir, List.of(config.requirementFilePattern()));
        } catch (IOException e) {
            log.warn("Could not scan requirements in {}: {}", dir, e.getMessage());
            return requirements;
        }

        for (Path file : files) {
            try {
                readRequirement(file).ifPresent(req -> {
                    Requirement previous = requirements.putIfAbsent(req.id(), req);
                    if (previous != null) {
                        log.warn("Duplicate requirement {} in {} (already defined in {})",
                                req.id(), req.filePath(), previous.filePath());
                    }
                });
            } catch (IOException e) {
                log.warn("Skipping unreadable requirement file {}: {}", file, e.getMessage());
            }
        }
        log.info("Scanned {} requirement(s) from {} file(s)", requirements.size(), files.size());
        return requirements;
    }

    private Optional<Requirement> readRequirement(Path file) throws IOException {
        Frontmatter fm = parser.parse(ArtifactFiles.readText(file));
        String relative = config.relativize(file);
        if (!fm.isPresent()) {
            log.debug("No frontmatter in {}, skipping", relative);
            return Optional.empty();
        }
        if (fm.kind() == Frontmatter.Kind.LENIENT) {
            log.debug("Frontmatter in {} is not valid YAML ({}), read leniently", relative, fm.problem());
        }
        String id = fm.string("id", null);
        if (id == null) {
            log.warn("Requirement file {} has no id field, skipping", relative);
            return Optional.empty();
        }
        return Optional.of(new Requirement(
                id,
                fm.string("title", "Untitled"),
                fm.string("epic", null),
                fm.string("status", null),
                fm.string("priority", null),
                fm.stringList("complianceStandards", "compliance_standards"),
                fm.stringList("dependencies"),
                relative,
                ArtifactFiles.lastModified(file)
        ));
    }
}
