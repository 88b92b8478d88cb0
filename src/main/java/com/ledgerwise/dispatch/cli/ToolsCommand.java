package com.ledgerwise.dispatch.cli;

import com.ledgerwise.core.model.ToolSpec;
import com.ledgerwise.core.tools.ToolRegistry;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: ledgerwise tools
 * <p>
 * Lists the registered tools in registration order.
 */
@Command(name = "tools", mixinStandardHelpOptions = true, description = "List the available tools")
@Component
public class ToolsCommand implements Runnable {

    private final ToolRegistry registry;

    public ToolsCommand(ToolRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        for (ToolSpec spec : registry.specs()) {
            ConsoleOutput.tool(spec);
        }
    }
}
