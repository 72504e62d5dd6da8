package io.neocli.errors;

import java.io.PrintStream;
import java.util.List;

public final class PrintStreamConsoleUi implements ConsoleUi {
    private final PrintStream out;

    public PrintStreamConsoleUi(PrintStream out) {
        this.out = out;
    }

    public static PrintStreamConsoleUi stderr() {
        return new PrintStreamConsoleUi(System.err);
    }

    @Override
    public void error(String message) {
        out.println("✖ " + message);
    }

    @Override
    public void list(List<String> items) {
        if (items == null) {
            return;
        }
        for (String item : items) {
            out.println("  • " + item);
        }
    }
}
