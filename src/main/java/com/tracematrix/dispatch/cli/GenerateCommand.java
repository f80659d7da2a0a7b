package com.tracematrix.dispatch.cli;

import com.tracematrix.core.engine.TraceabilityEngine;
import com.tracematrix.core.model.Matrix;
import com.tracematrix.core.persistence.MatrixStoreException;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.util.concurrent.Callable;

/**
 * CLI command: tracematrix generate
 * <p>
 * Rescans the project, writes a freshly signed matrix and prints its summary.
 */
@Command(name = "generate", mixinStandardHelpOptions = true,
        description = "Scan the project and write a signed traceability matrix")
@Component
public class GenerateCommand implements Callable<Integer> {

    private final TraceabilityEngine engine;

    public GenerateCommand(TraceabilityEngine engine) {
        this.engine = engine;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Generating traceability matrix...");
        try {
            Matrix matrix = engine.generate();
            ConsoleOutput.success("Traceability matrix generated");
            ConsoleOutput.matrixSummary(matrix);
            return 0;
        } catch (MatrixStoreException e) {
            ConsoleOutput.error("Failed to generate traceability matrix: " + e.getMessage());
            return 1;
        }
    }
}
