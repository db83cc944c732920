package com.ttennebkram.fusion.error;

/**
 * Base class for every failure raised inside the fusion pipeline.
 * The pipeline driver turns any of these into a failed result.
 */
public class FusionException extends Exception {

    public FusionException(String message) {
        super(message);
    }

    public FusionException(String message, Throwable cause) {
        super(message, cause);
    }
}
