package com.tracematrix.dispatch.cli;

import com.tracematrix.core.engine.TraceabilityEngine;
import com.tracematrix.core.model.Matrix;
import com.tracematrix.core.persistence.MatrixStoreException;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.util.concurrent.Callable;

/**
 * CLI command: tracematrix coverage
 * <p>
 * Regenerates the matrix and reports coverage at every level.
 */
@Command(name = "coverage", mixinStandardHelpOptions = true,
        description = "Regenerate the matrix and show coverage analysis")
@Component
public class CoverageCommand implements Callable<Integer> {

    private final TraceabilityEngine engine;

    public CoverageCommand(TraceabilityEngine engine) {
        this.engine = engine;
    }

    @Override
    public Integer call() {
        ConsoleOutput.info("Analyzing traceability coverage...");
        try {
            Matrix matrix = engine.generate();
            ConsoleOutput.matrixSummary(matrix);
            ConsoleOutput.complianceCoverage(matrix);
            return 0;
        } catch (MatrixStoreException e) {
            ConsoleOutput.error("Coverage analysis failed: " + e.getMessage());
            return 1;
        }
    }
}
