package com.tracematrix.dispatch.cli;

import com.tracematrix.core.engine.TraceabilityEngine;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * CLI command: tracematrix verify
 * <p>
 * Recomputes the persisted matrix's signature. Exits 1 on mismatch or when no matrix exists.
 */
@Command(name = "verify", mixinStandardHelpOptions = true,
        description = "Check the persisted matrix against its audit signature")
@Component
public class VerifyCommand implements Callable<Integer> {

    private final TraceabilityEngine engine;

    public VerifyCommand(TraceabilityEngine engine) {
        this.engine = engine;
    }

    @Override
    public Integer call() {
        Optional<Boolean> valid = engine.verify();
        if (valid.isEmpty()) {
            ConsoleOutput.error("No readable traceability matrix found. Run 'tracematrix generate' first.");
            return 1;
        }
        if (valid.get()) {
            ConsoleOutput.success("Audit signature valid");
            return 0;
        }
        ConsoleOutput.error("Audit signature mismatch: matrix was modified after signing");
        return 1;
    }
}
