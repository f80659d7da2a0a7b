package com.tracematrix.dispatch.cli;

import com.tracematrix.core.engine.TraceabilityEngine;
import com.tracematrix.core.model.RequirementValidation;
import com.tracematrix.core.persistence.MatrixStoreException;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * CLI command: tracematrix validate &lt;requirement-id&gt;
 * <p>
 * Exit codes: 0 when the requirement scores at least 80%, 1 below that,
 * 2 when the requirement is not in the matrix.
 */
@Command(name = "validate", mixinStandardHelpOptions = true,
        description = "Validate traceability of one requirement")
@Component
public class ValidateCommand implements Callable<Integer> {

    static final int EXIT_BELOW_THRESHOLD = 1;
    static final int EXIT_NOT_FOUND = 2;

    @Parameters(index = "0", description = "Requirement ID, e.g. REQ-001")
    private String requirementId;

    private final TraceabilityEngine engine;

    public ValidateCommand(TraceabilityEngine engine) {
        this.engine = engine;
    }

    @Override
    public Integer call() {
        ConsoleOutput.info("Validating traceability for " + requirementId + "...");
        Optional<RequirementValidation> result;
        try {
            result = engine.validate(requirementId);
        } catch (MatrixStoreException e) {
            ConsoleOutput.error("Failed to load traceability matrix: " + e.getMessage());
            return 1;
        }
        if (result.isEmpty()) {
            ConsoleOutput.error("Requirement " + requirementId + " not found in traceability matrix");
            return EXIT_NOT_FOUND;
        }
        RequirementValidation validation = result.get();
        ConsoleOutput.validation(validation);
        return validation.passed() ? 0 : EXIT_BELOW_THRESHOLD;
    }
}
