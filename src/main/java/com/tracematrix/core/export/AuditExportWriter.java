package com.tracematrix.core.export;

import com.tracematrix.core.metrics.TraceabilityMetrics;
import com.tracematrix.core.model.Matrix;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Writes every registered {@link MatrixExporter} artifact into an output directory.
 */
@Service
public class AuditExportWriter {

    private static final Logger log = LoggerFactory.getLogger(AuditExportWriter.class);

    private final List<MatrixExporter> exporters;
    private final TraceabilityMetrics metrics;

    public AuditExportWriter(List<MatrixExporter> exporters, TraceabilityMetrics metrics) {
        this.exporters = List.copyOf(exporters);
        this.metrics = metrics;
    }

    /**
     * @return the files written, in exporter order
     * @throws ExportException if the directory or any artifact cannot be written
     */
    public List<Path> write(Matrix matrix, Path outputDir) {
        try {
            Files.createDirectories(outputDir);
        } catch (IOException e) {
            throw new ExportException("Could not create export directory " + outputDir, e);
        }

        var written = new ArrayList<Path>();
        for (MatrixExporter exporter : exporters) {
            Path target = outputDir.resolve(exporter.fileName());
            try {
                Files.writeString(target, exporter.render(matrix), StandardCharsets.UTF_8);
            } catch (IOException e) {
                throw new ExportException("Could not write " + target, e);
            }
            metrics.recordExport(exporter.format());
            log.info("Wrote {} report to {}", exporter.format(), target);
            written.add(target);
        }
        return written;
    }
}
