package com.tracematrix.core.scanner;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tracematrix.core.config.TraceabilityConfig;
import com.tracematrix.core.model.ComplianceFrameworkCoverage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Loads per-framework clause coverage from the compliance mapping file:
 * <pre>
 * { "framework_coverage": { "ISO-13485": { "total_clauses": 40, "covered_clauses": 31,
 *                                          "coverage_percentage": 78, "clauses": ["4.2.3"] } } }
 * </pre>
 * The figures are authoritative input; nothing here recomputes them.
 */
@Service
public class ComplianceScanner {

    private static final Logger log = LoggerFactory.getLogger(ComplianceScanner.class);

    private final TraceabilityConfig config;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public ComplianceScanner(TraceabilityConfig config) {
        this.config = config;
    }

    public SortedMap<String, ComplianceFrameworkCoverage> scan() {
        var frameworks = new TreeMap<String, ComplianceFrameworkCoverage>();
        Path mappingFile = config.complianceMappingFile();
        if (!Files.isRegularFile(mappingFile)) {
            log.warn("Compliance mapping not found: {}", mappingFile);
            return frameworks;
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(mappingFile.toFile());
        } catch (IOException e) {
            log.warn("Could not read compliance mapping {}: {}", mappingFile, e.getMessage());
            return frameworks;
        }

        JsonNode coverage = root == null ? null : root.get("framework_coverage");
        if (coverage == null || !coverage.isObject()) {
            log.warn("Compliance mapping {} has no framework_coverage object", mappingFile);
            return frameworks;
        }

        Iterator<Map.Entry<String, JsonNode>> fields = coverage.fields();
        while (fields.hasNext()) {
            var entry = fields.next();
            JsonNode data = entry.getValue();
            if (!data.isObject()) {
                log.warn("Ignoring framework {}: expected an object", entry.getKey());
                continue;
            }
            frameworks.put(entry.getKey(), new ComplianceFrameworkCoverage(
                    entry.getKey(),
                    data.path("total_clauses").asInt(0),
                    data.path("covered_clauses").asInt(0),
                    data.path("coverage_percentage").asInt(0),
                    clauses(data.path("clauses"))
            ));
        }
        log.info("Loaded coverage for {} compliance framework(s)", frameworks.size());
        return frameworks;
    }

    private static List<String> clauses(JsonNode node) {
        var clauses = new ArrayList<String>();
        if (node.isArray()) {
            node.forEach(c -> clauses.add(c.asText()));
        }
        return clauses;
    }
}
