package com.tracematrix.core.coverage;

import com.tracematrix.core.model.ComplianceFrameworkCoverage;
import com.tracematrix.core.model.CoverageScore;
import com.tracematrix.core.model.CoverageSummary;
import com.tracematrix.core.model.CoverageSummary.FeatureTotals;
import com.tracematrix.core.model.CoverageSummary.FrameworkTotals;
import com.tracematrix.core.model.CoverageSummary.RequirementTotals;
import com.tracematrix.core.model.FeatureLink;
import com.tracematrix.core.model.ScanResult;
import com.tracematrix.core.model.TraceabilityLink;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Turns the link graph into coverage figures.
 * <p>
 * Responsibilities:
 * <ul>
 *   <li>Requirement coverage: requirements with at least one test</li>
 *   <li>Feature coverage: features linked to a requirement, and to a tested requirement</li>
 *   <li>Compliance coverage: the mapping's per-framework numbers, passed through unchanged</li>
 *   <li>Per-requirement score used by validation, with its list of gaps</li>
 * </ul>
 */
@Service
public class CoverageCalculator {

    /** Minimum per-requirement score (inclusive) for validation to pass. */
    public static final int PASS_THRESHOLD = 80;

    static final String GAP_TESTS = "No test coverage";
    static final String GAP_BRANCHES = "No git branch tracking";
    static final String GAP_IMPLEMENTATION = "No implementation files identified";
    static final String GAP_COMPLIANCE = "No compliance framework mapping";

    private static final int CHECKS = 4;

    /**
     * {@code round(part / total * 100)}, half-up, or {@code 0} when {@code total} is zero.
     */
    public static int percentage(int part, int total) {
        if (total <= 0) {
            return 0;
        }
        return (int) Math.round(part * 100.0 / total);
    }

    public CoverageSummary summarize(ScanResult scan, SortedMap<String, TraceabilityLink> links) {
        int totalRequirements = scan.requirements().size();
        int tested = (int) links.values().stream().filter(TraceabilityLink::hasTests).count();

        var linkedFeatures = new HashSet<String>();
        var testedFeatures = new HashSet<String>();
        for (TraceabilityLink link : links.values()) {
            for (FeatureLink feature : link.features()) {
                linkedFeatures.add(feature.name());
                if (link.hasTests()) {
                    testedFeatures.add(feature.name());
                }
            }
        }
        int totalFeatures = scan.features().size();
        int withRequirements = (int) scan.features().keySet().stream().filter(linkedFeatures::contains).count();
        int withTests = (int) scan.features().keySet().stream().filter(testedFeatures::contains).count();

        var frameworks = new TreeMap<String, FrameworkTotals>();
        for (Map.Entry<String, ComplianceFrameworkCoverage> entry : scan.complianceFrameworks().entrySet()) {
            ComplianceFrameworkCoverage c = entry.getValue();
            frameworks.put(entry.getKey(), new FrameworkTotals(c.totalClauses(), c.coveredClauses(), c.percentage()));
        }

        return new CoverageSummary(
                new RequirementTotals(totalRequirements, tested, percentage(tested, totalRequirements)),
                new FeatureTotals(totalFeatures, withRequirements, withTests,
                        percentage(withRequirements, totalFeatures), percentage(withTests, totalFeatures)),
                frameworks
        );
    }

    /**
     * Scores one requirement's link: tests, branches, implementation files and compliance
     * mapping are each worth 25%.
     *
     * @param link the requirement's link, {@link TraceabilityLink#empty()} when it has none
     * @return the score, its gaps in check order, and whether it meets {@link #PASS_THRESHOLD}
     */
    public CoverageScore score(TraceabilityLink link) {
        List<String> gaps = new ArrayList<>();
        int met = 0;
        if (link.hasTests()) met++; else gaps.add(GAP_TESTS);
        if (link.hasBranches()) met++; else gaps.add(GAP_BRANCHES);
        if (link.hasImplementationFiles()) met++; else gaps.add(GAP_IMPLEMENTATION);
        if (link.hasComplianceMapping()) met++; else gaps.add(GAP_COMPLIANCE);

        int pct = percentage(met, CHECKS);
        return new CoverageScore(pct, gaps, pct >= PASS_THRESHOLD);
    }

    /** Tier used for report styling: high (&ge;80), medium (50-79), low (&lt;50). */
    public static String tier(int percentage) {
        if (percentage >= PASS_THRESHOLD) return "high";
        if (percentage >= 50) return "medium";
        return "low";
    }
}
