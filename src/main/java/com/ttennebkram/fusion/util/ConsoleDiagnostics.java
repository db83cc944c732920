package com.ttennebkram.fusion.util;

import java.io.PrintStream;

/**
 * Prints "[Component] message" lines: info to stdout, errors to stderr.
 */
public class ConsoleDiagnostics implements FusionDiagnostics {

    private final String prefix;
    private final PrintStream out;
    private final PrintStream err;

    public ConsoleDiagnostics(String component) {
        this(component, System.out, System.err);
    }

    public ConsoleDiagnostics(String component, PrintStream out, PrintStream err) {
        this.prefix = "[" + component + "] ";
        this.out = out;
        this.err = err;
    }

    @Override
    public void info(String message) {
        out.println(prefix + message);
    }

    @Override
    public void error(String message, Throwable cause) {
        if (cause != null && cause.getMessage() != null && !message.contains(cause.getMessage())) {
            err.println(prefix + message + ": " + cause.getMessage());
        } else {
            err.println(prefix + message);
        }
    }
}
