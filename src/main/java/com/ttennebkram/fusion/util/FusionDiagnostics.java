package com.ttennebkram.fusion.util;

/**
 * Channel through which the pipeline reports progress and failures.
 * Each pipeline instance is given its own; nothing is written to global logger state.
 */
public interface FusionDiagnostics {

    void info(String message);

    /**
     * @param cause may be null
     */
    void error(String message, Throwable cause);

    /**
     * Diagnostics that print to the console.
     */
    static FusionDiagnostics console(String component) {
        return new ConsoleDiagnostics(component);
    }
}
