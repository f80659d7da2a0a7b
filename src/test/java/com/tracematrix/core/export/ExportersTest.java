package com.tracematrix.core.export;

import com.tracematrix.core.audit.AuditSigner;
import com.tracematrix.core.coverage.CoverageCalculator;
import com.tracematrix.core.metrics.TraceabilityMetrics;
import com.tracematrix.core.model.Matrix;
import com.tracematrix.core.persistence.MatrixJson;
import com.tracematrix.testsupport.MatrixFixtures;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ExportersTest {

    private final CoverageCalculator calculator = new CoverageCalculator();
    private final Matrix matrix = new AuditSigner(Clock.fixed(Instant.parse("2026-01-15T10:00:01Z"), ZoneOffset.UTC))
            .sign(MatrixFixtures.unsignedMatrix());

    @Nested
    @DisplayName("CSV")
    class Csv {

        @Test
        @DisplayName("header plus one row per requirement with coverage")
        void rows() {
            List<String> lines = new CsvMatrixExporter(calculator).render(matrix).lines().toList();

            assertEquals("Requirement ID,Title,Status,Tests,Branches,Compliance Frameworks,Coverage %", lines.get(0));
            assertEquals("REQ-001,\"User login, with \"\"SSO\"\"\",approved,1,1,1,100", lines.get(1));
            assertEquals("REQ-002,\"Export <report>\",draft,1,0,0,25", lines.get(2));
            assertEquals(3, lines.size());
        }
    }

    @Nested
    @DisplayName("HTML")
    class Html {

        @Test
        @DisplayName("rows carry coverage tier classes and content is escaped")
        void rendersTable() {
            String html = new HtmlMatrixExporter(calculator).render(matrix);

            assertTrue(html.contains("<tr class=\"coverage-high\"><td>REQ-001</td>"));
            assertTrue(html.contains("<tr class=\"coverage-low\"><td>REQ-002</td>"));
            assertTrue(html.contains("Export &lt;report&gt;"));
            assertTrue(html.contains("User login, with &quot;SSO&quot;"));
            assertFalse(html.contains("<report>"));
            assertTrue(html.contains(matrix.auditTrail().signature()));
            assertTrue(html.contains("Requirements with Tests: 2/2 (100%)"));
        }
    }

    @Nested
    @DisplayName("JSON")
    class Json {

        @Test
        @DisplayName("parses back into an equal matrix")
        void roundTrip() throws IOException {
            String json = new JsonMatrixExporter().render(matrix);
            assertEquals(matrix, MatrixJson.read(json));
        }
    }

    @Nested
    @DisplayName("Compliance summary")
    class ComplianceSummary {

        @Test
        @DisplayName("lists framework coverage and unmapped requirements")
        void summary() {
            String md = new ComplianceSummaryExporter().render(matrix);

            assertTrue(md.startsWith("# Compliance Traceability Summary"));
            assertTrue(md.contains("- Total Requirements: 2"));
            assertTrue(md.contains("### ISO13485\n- Covered Clauses: 7/10 (70%)"));
            assertTrue(md.contains("## Requirements Without Compliance Mapping\n\n- REQ-002\n"));
            assertFalse(md.contains("- REQ-001\n"));
        }
    }

    @Nested
    @DisplayName("Writer")
    class Writer {

        @TempDir
        Path out;

        @Test
        @DisplayName("writes all four reports and counts each export")
        void writesAll() {
            var registry = new SimpleMeterRegistry();
            var writer = new AuditExportWriter(List.of(new HtmlMatrixExporter(calculator),
                    new CsvMatrixExporter(calculator), new JsonMatrixExporter(), new ComplianceSummaryExporter()),
                    new TraceabilityMetrics(registry));

            List<Path> written = writer.write(matrix, out.resolve("audit"));

            assertEquals(List.of("traceability-matrix.html", "traceability-matrix.csv", "traceability-matrix.json",
                    "compliance-summary.md"), written.stream().map(p -> p.getFileName().toString()).toList());
            written.forEach(p -> assertTrue(Files.isRegularFile(p)));
            assertEquals(1.0, registry.find("tracematrix.exports").tag("format", "csv").counter().count());
        }

        @Test
        @DisplayName("exporters do not modify the matrix")
        void noMutation() throws IOException {
            String before = MatrixJson.write(matrix);
            new AuditExportWriter(List.of(new CsvMatrixExporter(calculator), new ComplianceSummaryExporter()),
                    new TraceabilityMetrics(new SimpleMeterRegistry())).write(matrix, out);
            assertEquals(before, MatrixJson.write(matrix));
        }

        @Test
        @DisplayName("unwritable directory raises ExportException")
        void unwritable() throws IOException {
            Path blocker = Files.writeString(out.resolve("blocker"), "file");
            var writer = new AuditExportWriter(List.of(new JsonMatrixExporter()),
                    new TraceabilityMetrics(new SimpleMeterRegistry()));

            assertThrows(ExportException.class, () -> writer.write(matrix, blocker.resolve("sub")));
        }
    }
}
