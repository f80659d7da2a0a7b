package com.tracematrix.core.export;

import com.tracematrix.core.model.CoverageSummary;
import com.tracematrix.core.model.Matrix;
import com.tracematrix.core.model.Requirement;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Markdown summary for auditors: overall requirement coverage, per-framework clause
 * coverage, and the requirements that are not yet mapped to any framework.
 */
@Component
@Order(4)
public class ComplianceSummaryExporter implements MatrixExporter {

    @Override
    public String format() {
        return "markdown";
    }

    @Override
    public String fileName() {
        return "compliance-summary.md";
    }

    @Override
    public String render(Matrix matrix) {
        CoverageSummary coverage = matrix.coverage();
        var md = new StringBuilder("# Compliance Traceability Summary\n\n");
        md.append("Generated: ").append(matrix.metadata().generatedAt()).append("\n\n");
        if (matrix.auditTrail() != null) {
            md.append("Signature (SHA-256): `").append(matrix.auditTrail().signature()).append("`\n\n");
        }

        md.append("## Coverage Overview\n\n")
          .append("- Total Requirements: ").append(matrix.requirements().size()).append('\n')
          .append("- Requirements with Tests: ").append(coverage.requirements().tested())
          .append(" (").append(coverage.requirements().percentage()).append("%)\n\n");

        md.append("## Compliance Framework Coverage\n\n");
        if (coverage.complianceFrameworks().isEmpty()) {
            md.append("No compliance framework mapping available.\n\n");
        }
        coverage.complianceFrameworks().forEach((framework, totals) -> md
                .append("### ").append(framework).append('\n')
                .append("- Covered Clauses: ").append(totals.coveredClauses()).append('/').append(totals.totalClauses())
                .append(" (").append(totals.percentage()).append("%)\n\n"));

        List<String> unmapped = matrix.requirements().values().stream()
                .filter(req -> !matrix.linkFor(req.id()).hasComplianceMapping())
                .map(Requirement::id)
                .toList();
        if (!unmapped.isEmpty()) {
            md.append("## Requirements Without Compliance Mapping\n\n");
            unmapped.forEach(id -> md.append("- ").append(id).append('\n'));
            md.append('\n');
        }
        return md.toString();
    }
}
