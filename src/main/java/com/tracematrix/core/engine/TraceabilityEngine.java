package com.tracematrix.core.engine;

import com.tracematrix.core.audit.AuditSigner;
import com.tracematrix.core.config.TraceabilityConfig;
import com.tracematrix.core.coverage.CoverageCalculator;
import com.tracematrix.core.export.AuditExportWriter;
import com.tracematrix.core.link.LinkBuilder;
import com.tracematrix.core.logging.MdcContext;
import com.tracematrix.core.metrics.TraceabilityMetrics;
import com.tracematrix.core.model.CoverageScore;
import com.tracematrix.core.model.CoverageSummary;
import com.tracematrix.core.model.Matrix;
import com.tracematrix.core.model.MatrixMetadata;
import com.tracematrix.core.model.Requirement;
import com.tracematrix.core.model.RequirementValidation;
import com.tracematrix.core.model.ScanResult;
import com.tracematrix.core.model.TraceabilityLink;
import com.tracematrix.core.persistence.MatrixStore;
import com.tracematrix.core.scanner.ComplianceScanner;
import com.tracematrix.core.scanner.FeatureScanner;
import com.tracematrix.core.scanner.GitBranchScanner;
import com.tracematrix.core.scanner.RequirementScanner;
import com.tracematrix.core.scanner.TestScanner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;
import java.util.function.Supplier;

/**
 * Runs the traceability pipeline: scan every artifact kind, build links, compute coverage,
 * sign, persist. Each phase hands an immutable value to the next, and linking starts only
 * after every scanner has returned.
 */
@Service
public class TraceabilityEngine {

    private static final Logger log = LoggerFactory.getLogger(TraceabilityEngine.class);

    static final String GENERATED_BY = "tracematrix";
    static final String GENERATOR_VERSION = "0.1.0";

    private final TraceabilityConfig config;
    private final RequirementScanner requirementScanner;
    private final TestScanner testScanner;
    private final GitBranchScanner gitBranchScanner;
    private final ComplianceScanner complianceScanner;
    private final FeatureScanner featureScanner;
    private final LinkBuilder linkBuilder;
    private final CoverageCalculator coverageCalculator;
    private final AuditSigner auditSigner;
    private final MatrixStore matrixStore;
    private final AuditExportWriter exportWriter;
    private final TraceabilityMetrics metrics;
    private final Clock clock;

    public TraceabilityEngine(TraceabilityConfig config,
                              RequirementScanner requirementScanner,
                              TestScanner testScanner,
                              GitBranchScanner gitBranchScanner,
                              ComplianceScanner complianceScanner,
                              FeatureScanner featureScanner,
                              LinkBuilder linkBuilder,
                              CoverageCalculator coverageCalculator,
                              AuditSigner auditSigner,
                              MatrixStore matrixStore,
                              AuditExportWriter exportWriter,
                              TraceabilityMetrics metrics,
                              Clock clock) {
        this.config = config;
        this.requirementScanner = requirementScanner;
        this.testScanner = testScanner;
        this.gitBranchScanner = gitBranchScanner;
        this.complianceScanner = complianceScanner;
        this.featureScanner = featureScanner;
        this.linkBuilder = linkBuilder;
        this.coverageCalculator = coverageCalculator;
        this.auditSigner = auditSigner;
        this.matrixStore = matrixStore;
        this.exportWriter = exportWriter;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Builds a fresh matrix from the project and persists it.
     *
     * @return the signed matrix
     * @throws com.tracematrix.core.persistence.MatrixStoreException if the matrix file cannot be written
     */
    public Matrix generate() {
        long start = System.currentTimeMillis();
        log.info("Generating traceability matrix for {}", config.projectRoot());
        try {
            MdcContext.setPhase("scan");
            ScanResult scan = scanAll();

            MdcContext.setPhase("link");
            SortedMap<String, TraceabilityLink> links = linkBuilder.build(scan);

            MdcContext.setPhase("coverage");
            CoverageSummary coverage = coverageCalculator.summarize(scan, links);
            metrics.recordRequirementCoverage(coverage.requirements().percentage());

            MdcContext.setPhase("sign");
            var metadata = new MatrixMetadata(Instant.now(clock).toString(), GENERATED_BY, GENERATOR_VERSION);
            Matrix matrix = auditSigner.sign(Matrix.unsigned(metadata, scan, links, coverage));

            MdcContext.setPhase("persist");
            matrixStore.save(matrix);

            long elapsed = System.currentTimeMillis() - start;
            metrics.recordGeneration(elapsed);
            log.info("Traceability matrix generated in {}ms: {} requirements, {} tests, signature {}",
                    elapsed, matrix.requirements().size(), matrix.tests().size(), matrix.auditTrail().signature());
            return matrix;
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * Runs every scanner to completion. Scanners degrade to empty results on their own,
     * so this never fails part-way.
     */
    ScanResult scanAll() {
        return new ScanResult(
                timedScan("requirements", requirementScanner::scan),
                timedScan("tests", testScanner::scan),
                timedScan("branches", gitBranchScanner::scan),
                timedScan("compliance", complianceScanner::scan),
                timedScan("features", featureScanner::scan)
        );
    }

    private <K, V> SortedMap<K, V> timedScan(String artifact, Supplier<SortedMap<K, V>> scanner) {
        long start = System.currentTimeMillis();
        SortedMap<K, V> result = scanner.get();
        metrics.recordScan(artifact, System.currentTimeMillis() - start, result.size());
        return result;
    }

    /**
     * Returns the persisted matrix, generating one first when none exists or it cannot be read.
     */
    public Matrix loadOrGenerate() {
        Optional<Matrix> stored = matrixStore.load();
        if (stored.isPresent()) {
            log.debug("Using persisted matrix {}", matrixStore.location());
            return stored.get();
        }
        log.info("No usable matrix at {}, generating", matrixStore.location());
        return generate();
    }

    /**
     * Scores one requirement against the persisted (or freshly generated) matrix.
     *
     * @param requirementId ID as written, or in any case
     * @return the validation, or empty when the requirement is unknown
     */
    public Optional<RequirementValidation> validate(String requirementId) {
        Matrix matrix = loadOrGenerate();
        Optional<RequirementValidation> result = validate(matrix, requirementId);
        result.ifPresent(v -> metrics.recordValidation(v.passed()));
        return result;
    }

    public Optional<RequirementValidation> validate(Matrix matrix, String requirementId) {
        Requirement requirement = lookup(matrix.requirements(), requirementId);
        if (requirement == null) {
            log.info("Requirement {} not found in matrix", requirementId);
            return Optional.empty();
        }
        TraceabilityLink link = matrix.linkFor(requirement.id());
        CoverageScore score = coverageCalculator.score(link);
        log.info("{} coverage {}% ({})", requirement.id(), score.percentage(), score.passed() ? "pass" : "fail");
        return Optional.of(new RequirementValidation(requirement, link, score));
    }

    private static Requirement lookup(Map<String, Requirement> requirements, String requirementId) {
        if (requirementId == null) {
            return null;
        }
        Requirement exact = requirements.get(requirementId.trim());
        if (exact != null) {
            return exact;
        }
        return requirements.get(requirementId.trim().toUpperCase(Locale.ROOT));
    }

    /**
     * Writes the HTML, CSV, JSON and compliance Markdown reports.
     *
     * @param outputDir target directory, or {@code null} for the configured default
     * @return the directory written to
     * @throws com.tracematrix.core.export.ExportException if a report cannot be written
     */
    public Path auditExport(Path outputDir) {
        Path target = outputDir != null ? outputDir.toAbsolutePath() : config.exportDir();
        Matrix matrix = loadOrGenerate();
        List<Path> files = exportWriter.write(matrix, target);
        log.info("Audit export of {} file(s) written to {}", files.size(), target);
        return target;
    }

    /**
     * Recomputes the signature of the persisted matrix.
     *
     * @return empty when no readable matrix exists, otherwise whether the signature holds
     */
    public Optional<Boolean> verify() {
        Optional<Matrix> stored = matrixStore.load();
        if (stored.isEmpty()) {
            return Optional.empty();
        }
        boolean valid = auditSigner.verify(stored.get());
        metrics.recordSignatureCheck(valid);
        if (!valid) {
            log.warn("Signature mismatch for {}", matrixStore.location());
        }
        return Optional.of(valid);
    }
}
