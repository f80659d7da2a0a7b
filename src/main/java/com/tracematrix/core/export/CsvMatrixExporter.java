package com.tracematrix.core.export;

import com.tracematrix.core.coverage.CoverageCalculator;
import com.tracematrix.core.model.Matrix;
import com.tracematrix.core.model.Requirement;
import com.tracematrix.core.model.TraceabilityLink;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * One row per requirement: ID, title, status, test/branch/framework counts and coverage.
 */
@Component
@Order(2)
public class CsvMatrixExporter implements MatrixExporter {

    static final List<String> HEADERS = List.of(
            "Requirement ID", "Title", "Status", "Tests", "Branches", "Compliance Frameworks", "Coverage %");

    private final CoverageCalculator coverageCalculator;

    public CsvMatrixExporter(CoverageCalculator coverageCalculator) {
        this.coverageCalculator = coverageCalculator;
    }

    @Override
    public String format() {
        return "csv";
    }

    @Override
    public String fileName() {
        return "traceability-matrix.csv";
    }

    @Override
    public String render(Matrix matrix) {
        var csv = new StringBuilder(String.join(",", HEADERS)).append('\n');
        for (Requirement req : matrix.requirements().values()) {
            TraceabilityLink link = matrix.linkFor(req.id());
            csv.append(field(req.id())).append(',')
               .append(quoted(req.title())).append(',')
               .append(field(req.status())).append(',')
               .append(link.tests().size()).append(',')
               .append(link.branches().size()).append(',')
               .append(link.complianceFrameworks().size()).append(',')
               .append(coverageCalculator.score(link).percentage())
               .append('\n');
        }
        return csv.toString();
    }

    private static String field(String value) {
        if (value == null) {
            return "";
        }
        if (value.indexOf(',') >= 0 || value.indexOf('"') >= 0 || value.indexOf('\n') >= 0 || value.indexOf('\r') >= 0) {
            return quoted(value);
        }
        return value;
    }

    private static String quoted(String value) {
        return '"' + (value == null ? "" : value.replace("\"", "\"\"")) + '"';
    }
}
