package com.ledgerwise.dispatch.cli;

import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

/**
 * Bridges picocli with the Spring Boot lifecycle.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private final LedgerwiseCommand ledgerwiseCommand;
    private final IFactory factory;
    private int exitCode;

    public CliRunner(LedgerwiseCommand ledgerwiseCommand, IFactory factory) {
        this.ledgerwiseCommand = ledgerwiseCommand;
        this.factory = factory;
    }

    @Override
    public void run(String... args) {
        exitCode = new CommandLine(ledgerwiseCommand, factory).execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
