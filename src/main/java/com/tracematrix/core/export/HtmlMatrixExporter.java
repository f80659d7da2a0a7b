package com.tracematrix.core.export;

import com.tracematrix.core.coverage.CoverageCalculator;
import com.tracematrix.core.model.CoverageSummary;
import com.tracematrix.core.model.Matrix;
import com.tracematrix.core.model.Requirement;
import com.tracematrix.core.model.TraceabilityLink;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Standalone HTML report: coverage summary plus a requirement table whose rows are styled
 * by coverage tier ({@code coverage-high}, {@code coverage-medium}, {@code coverage-low}).
 */
@Component
@Order(1)
public class HtmlMatrixExporter implements MatrixExporter {

    private static final String STYLE = """
                    body { font-family: Arial, sans-serif; margin: 20px; }
                    table { border-collapse: collapse; width: 100%; }
                    th, td { border: 1px solid #ddd; padding: 8px; text-align: left; }
                    th { background-color: #f2f2f2; }
                    .coverage-high { background-color: #d4edda; }
                    .coverage-medium { background-color: #fff3cd; }
                    .coverage-low { background-color: #f8d7da; }
                    .signature { font-family: monospace; color: #555; }
            """;

    private final CoverageCalculator coverageCalculator;

    public HtmlMatrixExporter(CoverageCalculator coverageCalculator) {
        this.coverageCalculator = coverageCalculator;
    }

    @Override
    public String format() {
        return "html";
    }

    @Override
    public String fileName() {
        return "traceability-matrix.html";
    }

    @Override
    public String render(Matrix matrix) {
        CoverageSummary.RequirementTotals totals = matrix.coverage().requirements();
        var html = new StringBuilder();
        html.append("<!DOCTYPE html>\n<html>\n<head>\n")
            .append("    <meta charset=\"utf-8\">\n")
            .append("    <title>Traceability Matrix Report</title>\n")
            .append("    <style>\n").append(STYLE).append("    </style>\n")
            .append("</head>\n<body>\n")
            .append("    <h1>Traceability Matrix Report</h1>\n")
            .append("    <p>Generated: ").append(escape(matrix.metadata().generatedAt())).append("</p>\n");
        if (matrix.auditTrail() != null) {
            html.append("    <p class=\"signature\">SHA-256: ")
                .append(escape(matrix.auditTrail().signature())).append("</p>\n");
        }
        html.append("\n    <h2>Coverage Summary</h2>\n")
            .append("    <p>Requirements with Tests: ").append(totals.tested()).append('/').append(totals.total())
            .append(" (").append(totals.percentage()).append("%)</p>\n")
            .append("\n    <h2>Requirements Traceability</h2>\n")
            .append("    <table>\n")
            .append("        <tr><th>Requirement ID</th><th>Title</th><th>Status</th><th>Tests</th>")
            .append("<th>Branches</th><th>Compliance</th><th>Coverage</th></tr>\n");

        for (Requirement req : matrix.requirements().values()) {
            TraceabilityLink link = matrix.linkFor(req.id());
            int pct = coverageCalculator.score(link).percentage();
            html.append("        <tr class=\"coverage-").append(CoverageCalculator.tier(pct)).append("\">")
                .append("<td>").append(escape(req.id())).append("</td>")
                .append("<td>").append(escape(req.title())).append("</td>")
                .append("<td>").append(escape(req.status())).append("</td>")
                .append("<td>").append(link.tests().size()).append("</td>")
                .append("<td>").append(link.branches().size()).append("</td>")
                .append("<td>").append(link.complianceFrameworks().size()).append("</td>")
                .append("<td>").append(pct).append("%</td></tr>\n");
        }
        html.append("    </table>\n</body>\n</html>\n");
        return html.toString();
    }

    static String escape(String text) {
        if (text == null) {
            return "";
        }
        var out = new StringBuilder(text.length());
        for (char c : text.toCharArray()) {
            switch (c) {
                case '<' -> out.append("&lt;");
                case '>' -> out.append("&gt;");
                case '&' -> out.append("&amp;");
                case '"' -> out.append("&quot;");
                case '\'' -> out.append("&#39;");
                default -> out.append(c);
            }
        }
        return out.toString();
    }
}
