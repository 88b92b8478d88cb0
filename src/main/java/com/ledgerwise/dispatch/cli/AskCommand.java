package com.ledgerwise.dispatch.cli;

import com.ledgerwise.core.engine.AssistantEngine;
import com.ledgerwise.core.events.EventBus;
import com.ledgerwise.core.model.AggregatedAnswer;
import com.ledgerwise.core.model.RequestStatus;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * CLI command: ledgerwise ask "&lt;request&gt;"
 * <p>
 * Exit code 0 when the request completed, 1 when its plan was rejected and
 * 2 when processing failed.
 */
@Command(name = "ask", mixinStandardHelpOptions = true, description = "Ask the assistant to handle a request")
@Component
public class AskCommand implements Callable<Integer> {

    static final int EXIT_DONE = 0;
    static final int EXIT_REJECTED = 1;
    static final int EXIT_FAILED = 2;

    @Parameters(index = "0", description = "Natural language request")
    private String request;

    @Option(names = {"--verbose", "-v"}, description = "Show plan and step events while processing")
    private boolean verbose;

    private final AssistantEngine engine;
    private final EventBus eventBus;

    public AskCommand(AssistantEngine engine, EventBus eventBus) {
        this.engine = engine;
        this.eventBus = eventBus;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        String requestId = engine.generateRequestId();
        if (verbose) {
            ConsoleOutput.info("Request " + requestId);
        }
        EventBus.Subscription subscription = verbose
                ? eventBus.subscribe(requestId, ConsoleOutput::event)
                : null;
        AggregatedAnswer answer;
        try {
            answer = engine.run(requestId, request);
        } catch (RuntimeException e) {
            ConsoleOutput.error("Request failed: " + rootCauseMessage(e));
            return EXIT_FAILED;
        } finally {
            if (subscription != null) {
                subscription.unsubscribe();
            }
        }

        ConsoleOutput.answer(answer);
        if (verbose) {
            ConsoleOutput.steps(answer);
        }
        return answer.status() == RequestStatus.REJECTED ? EXIT_REJECTED : EXIT_DONE;
    }

    private static String rootCauseMessage(Throwable e) {
        Throwable root = e;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        return root.getMessage() != null ? root.getMessage() : root.getClass().getSimpleName();
    }
}
