package com.tracematrix.dispatch.cli;

import com.tracematrix.core.model.ComplianceLink;
import com.tracematrix.core.model.CoverageSummary;
import com.tracematrix.core.model.CoverageSummary.FrameworkTotals;
import com.tracematrix.core.model.FeatureRecord;
import com.tracematrix.core.model.Matrix;
import com.tracematrix.core.model.RequirementValidation;
import com.tracematrix.core.model.TraceabilityLink;
import picocli.CommandLine;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * ANSI-colored terminal output utilities for the Tracematrix CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) TRACEMATRIX v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [TRACEMATRIX]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void warn(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(yellow) !|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void matrixSummary(Matrix matrix) {
        System.out.println();
        System.out.println(CommandLine.Help.Ansi.AUTO.string("@|bold Traceability Matrix Summary|@"));
        System.out.println("  Requirements: " + matrix.requirements().size());
        System.out.println("  Test files: " + matrix.tests().size());
        System.out.println("  Git branches: " + matrix.branchCount());
        System.out.println("  Compliance frameworks: " + matrix.complianceFrameworks().size());
        System.out.println("  Features: " + matrix.features().size());

        CoverageSummary coverage = matrix.coverage();
        System.out.println();
        System.out.println(CommandLine.Help.Ansi.AUTO.string("@|bold Coverage Metrics|@"));
        var requirements = coverage.requirements();
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  Requirements with tests: " + requirements.tested() + "/" + requirements.total()
                        + " (" + colorPercent(requirements.percentage()) + ")"));
        var features = coverage.features();
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  Features with requirements: " + features.withRequirements() + "/" + features.total()
                        + " (" + colorPercent(features.requirementsPercentage()) + ")"));
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  Features with tests: " + features.withTests() + "/" + features.total()
                        + " (" + colorPercent(features.testsPercentage()) + ")"));
        for (Map.Entry<String, FrameworkTotals> entry : coverage.complianceFrameworks().entrySet()) {
            FrameworkTotals totals = entry.getValue();
            System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "  " + entry.getKey() + ": " + totals.coveredClauses() + "/" + totals.totalClauses()
                            + " (" + colorPercent(totals.percentage()) + ")"));
        }

        featuresByDomain(matrix);
    }

    private static void featuresByDomain(Matrix matrix) {
        if (matrix.features().isEmpty()) {
            return;
        }
        Map<String, List<FeatureRecord>> byDomain = new TreeMap<>();
        for (FeatureRecord feature : matrix.features().values()) {
            byDomain.computeIfAbsent(feature.domain(), d -> new ArrayList<>()).add(feature);
        }
        System.out.println();
        System.out.println(CommandLine.Help.Ansi.AUTO.string("@|bold Features by Domain|@"));
        byDomain.forEach((domain, features) -> {
            System.out.println(CommandLine.Help.Ansi.AUTO.string("  @|fg(cyan) " + domain + ":|@"));
            for (FeatureRecord f : features) {
                int reqCount = f.requirements().size();
                String marker;
                if (f.testsPending()) {
                    marker = "@|fg(yellow) ~|@";
                } else if (reqCount > 0) {
                    marker = "@|fg(green) +|@";
                } else {
                    marker = "@|faint o|@";
                }
                System.out.println(CommandLine.Help.Ansi.AUTO.string(
                        "    " + marker + " " + f.name() + " (" + f.phase() + ") - " + reqCount + " req(s)"));
            }
        });
    }

    public static void complianceCoverage(Matrix matrix) {
        if (matrix.complianceFrameworks().isEmpty()) {
            warn("No compliance framework mapping found");
            return;
        }
        System.out.println();
        System.out.println(CommandLine.Help.Ansi.AUTO.string("@|bold Compliance Framework Coverage|@"));
        matrix.complianceFrameworks().forEach((name, framework) ->
                System.out.println(CommandLine.Help.Ansi.AUTO.string(
                        "  " + name + ": " + framework.coveredClauses() + "/" + framework.totalClauses()
                                + " clauses (" + colorPercent(framework.percentage()) + ")")));
    }

    public static void validation(RequirementValidation validation) {
        TraceabilityLink link = validation.link();
        System.out.println();
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(green) " + validation.requirement().id() + "|@: " + validation.requirement().title()));

        System.out.println();
        System.out.println(CommandLine.Help.Ansi.AUTO.string("@|bold Traceability Links|@"));
        listing("Tests", link.tests());
        listing("Git branches", link.branches());
        listing("Implementation files", link.implementationFiles());
        System.out.println("  Compliance frameworks: " + link.complianceFrameworks().size());
        for (ComplianceLink framework : link.complianceFrameworks()) {
            String clauses = framework.clauses().isEmpty() ? "N/A" : String.join(", ", framework.clauses());
            System.out.println("    - " + framework.framework() + ": " + clauses);
        }

        var score = validation.score();
        System.out.println();
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold Coverage:|@ " + colorPercent(score.percentage())));
        if (!score.gaps().isEmpty()) {
            System.out.println(CommandLine.Help.Ansi.AUTO.string("@|fg(yellow) Coverage gaps:|@"));
            for (String gap : score.gaps()) {
                System.out.println("  - " + gap);
            }
        }
        if (score.passed()) {
            success("Traceability validation passed");
        } else {
            error("Traceability validation failed (below 80%)");
        }
    }

    private static void listing(String label, List<String> items) {
        System.out.println("  " + label + ": " + items.size());
        for (String item : items) {
            System.out.println("    - " + item);
        }
    }

    private static String colorPercent(int percentage) {
        String color = percentage >= 80 ? "fg(green)" : percentage >= 50 ? "fg(yellow)" : "fg(red)";
        return "@|" + color + " " + percentage + "%|@";
    }
}
