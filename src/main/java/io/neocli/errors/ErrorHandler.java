package io.neocli.errors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;
import java.util.function.IntConsumer;

/**
 * Top-level failure coordinator. Anything that reaches {@link #handle(Object)} is either recovered
 * by a registered strategy or terminates the process with status 1. Exit listeners run before the
 * terminator, so owners of shared resources can tear down on every failure path.
 */
public final class ErrorHandler {
    public static final int FAILURE_EXIT_CODE = 1;

    private static final Logger log = LoggerFactory.getLogger(ErrorHandler.class);

    private final List<ErrorRecoveryStrategy> strategies = new ArrayList<>();
    private final List<IntConsumer> exitListeners = new ArrayList<>();
    private final PrintStream err;
    private final ProcessTerminator terminator;

    public ErrorHandler() {
        this(System.err, ProcessTerminator.SYSTEM);
    }

    public ErrorHandler(PrintStream err, ProcessTerminator terminator) {
        this.err = err;
        this.terminator = terminator;
    }

    public void registerStrategy(ErrorRecoveryStrategy strategy) {
        if (strategy != null) {
            strategies.add(strategy);
        }
    }

    public List<ErrorRecoveryStrategy> strategies() {
        return List.copyOf(strategies);
    }

    /**
     * Registers a listener called with the exit status right before the handler terminates the process.
     */
    public void beforeExit(IntConsumer listener) {
        if (listener != null) {
            exitListeners.add(listener);
        }
    }

    public void handle(Object thrown) {
        AppError error = normalize(thrown);
        err.println("✖ " + error.userMessage());

        for (ErrorRecoveryStrategy strategy : strategies) {
            if (!strategy.canRecover(error)) {
                continue;
            }
            try {
                strategy.recover(error);
                log.debug("Recovered {} with {}", error.code(), strategy.getClass().getSimpleName());
                return;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.debug("Recovery interrupted for {}", error.code());
                break;
            } catch (Exception e) {
                log.debug("Recovery strategy {} failed for {}: {}",
                        strategy.getClass().getSimpleName(), error.code(), e.getMessage());
            }
        }

        err.println(error.detailedReport());
        exit(FAILURE_EXIT_CODE);
    }

    public void handleCommandResult(Result<?> result, ConsoleUi ui) {
        if (result == null || result.isSuccess()) {
            return;
        }
        AppError error = result.error();
        ui.error(error.getMessage());
        if (!error.suggestions().isEmpty()) {
            ui.list(error.suggestions());
        }
        exit(FAILURE_EXIT_CODE);
    }

    public AppError normalize(Object thrown) {
        if (thrown instanceof AppError) {
            return (AppError) thrown;
        }
        if (thrown instanceof Throwable) {
            Throwable throwable = (Throwable) thrown;
            String message = throwable.getMessage() == null ? throwable.getClass().getName() : throwable.getMessage();
            return new UnclassifiedError(message, ErrorSeverity.HIGH, ErrorOptions.cause(throwable));
        }
        return new UnclassifiedError(String.valueOf(thrown), ErrorSeverity.CRITICAL, ErrorOptions.NONE);
    }

    private void exit(int status) {
        for (IntConsumer listener : exitListeners) {
            try {
                listener.accept(status);
            } catch (RuntimeException e) {
                log.warn("Exit listener failed: {}", e.getMessage(), e);
            }
        }
        terminator.exit(status);
    }
}
