package com.tracematrix.core.scanner;

import com.tracematrix.core.config.TraceabilityConfig;
import com.tracematrix.core.frontmatter.Frontmatter;
import com.tracematrix.core.frontmatter.FrontmatterParser;
import com.tracematrix.core.model.FeatureRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.stream.Stream;

/**
 * Reads feature descriptors laid out as {@code <features>/<domain>/<feature>/README.md}.
 * Only allow-listed domains are visited and reserved sub-directory names are skipped.
 */
@Service
public class FeatureScanner {

    private static final Logger log = LoggerFactory.getLogger(FeatureScanner.class);

    private static final String README = "README.md";

    private final TraceabilityConfig config;
    private final FrontmatterParser parser;

    public FeatureScanner(TraceabilityConfig config, FrontmatterParser parser) {
        this.config = config;
        this.parser = parser;
    }

    public SortedMap<String, FeatureRecord> scan() {
        var features = new TreeMap<String, FeatureRecord>();
        Path root = config.featuresDir();
        if (!Files.isDirectory(root)) {
            log.warn("Features directory not found: {}", root);
            return features;
        }

        for (Path domainDir : sortedSubdirectories(root)) {
            String domain = domainDir.getFileName().toString();
            if (!config.featureDomains().contains(domain)) {
                log.debug("Skipping unknown feature domain {}", domain);
                continue;
            }
            for (Path featureDir : sortedSubdirectories(domainDir)) {
                String name = featureDir.getFileName().toString();
                if (config.featureSkipDirs().contains(name)) {
                    continue;
                }
                Path readme = featureDir.resolve(README);
                if (!Files.isRegularFile(readme)) {
                    continue;
                }
                FeatureRecord feature = readFeature(domain, featureDir, readme);
                FeatureRecord previous = features.putIfAbsent(name, feature);
                if (previous != null) {
                    log.warn("Feature {} exists in both {} and {}, keeping {}",
                            name, previous.domain(), domain, previous.domain());
                }
            }
        }
        log.info("Scanned {} feature(s)", features.size());
        return features;
    }

    private FeatureRecord readFeature(String domain, Path featureDir, Path readme) {
        String name = featureDir.getFileName().toString();
        Frontmatter fm;
        try {
            fm = parser.parse(ArtifactFiles.readText(readme));
        } catch (IOException e) {
            log.warn("Could not read {}: {}", readme, e.getMessage());
            fm = Frontmatter.absent();
        }
        return new FeatureRecord(
                name,
                domain,
                config.relativize(featureDir),
                fm.string("title", name),
                fm.firstString("unknown", "phase", "status"),
                fm.stringList("requirements"),
                fm.string("epic", ""),
                fm.string("priority", "medium"),
                fm.flag("tests_pending", false)
        );
    }

    private static List<Path> sortedSubdirectories(Path dir) {
        try (Stream<Path> children = Files.list(dir)) {
            return children.filter(Files::isDirectory).sorted().toList();
        } catch (IOException e) {
            log.warn("Could not list feature directory {}: {}", dir, e.toString());
        } catch (UncheckedIOException e) {
            log.warn("Could not list feature directory {}: {}", dir, e.getCause().toString());
        }
        return List.of();
    }
}
