package com.ledgerwise.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for Ledgerwise.
 */
@Command(
        name = "ledgerwise",
        mixinStandardHelpOptions = true,
        version = "Ledgerwise 0.1.0",
        description = "Finance and HR task assistant",
        subcommands = {
                AskCommand.class,
                ToolsCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class LedgerwiseCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        new CommandLine(this).usage(System.out);
    }
}
