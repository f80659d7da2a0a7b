package com.tracematrix.dispatch.cli;

import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

import java.util.Arrays;

/**
 * Bridges picocli with Spring Boot lifecycle.
 * Parses CLI arguments and delegates to the appropriate command.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private final TracematrixCommand tracematrixCommand;
    private final IFactory factory;
    private int exitCode;

    public CliRunner(TracematrixCommand tracematrixCommand, IFactory factory) {
        this.tracematrixCommand = tracematrixCommand;
        this.factory = factory;
    }

    @Override
    public void run(String... args) throws Exception {
        // Spring property overrides (--tracematrix.project-root=...) are consumed by Boot, not picocli
        String[] commandArgs = Arrays.stream(args)
                .filter(arg -> !arg.startsWith("--tracematrix.") && !arg.startsWith("--spring.")
                        && !arg.startsWith("--logging."))
                .toArray(String[]::new);
        exitCode = new CommandLine(tracematrixCommand, factory).execute(commandArgs);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
