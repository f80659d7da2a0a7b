package com.tracematrix.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level CLI command for Tracematrix.
 * Routes to subcommands: generate, validate, audit-export, coverage, verify.
 */
@Command(
        name = "tracematrix",
        mixinStandardHelpOptions = true,
        version = "Tracematrix 0.1.0",
        description = "Requirement traceability matrix for compliance audits",
        subcommands = {
                GenerateCommand.class,
                ValidateCommand.class,
                AuditExportCommand.class,
                CoverageCommand.class,
                VerifyCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class TracematrixCommand implements Runnable {

    @Spec
    CommandSpec spec;

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // When no subcommand is given, show usage help
        spec.commandLine().usage(System.out);
    }
}
