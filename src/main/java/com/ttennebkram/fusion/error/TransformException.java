package com.ttennebkram.fusion.error;

/**
 * Forward and inverse transform shapes disagree, or a fusion step failed.
 */
public class TransformException extends FusionException {

    public TransformException(String message) {
        super(message);
    }

    public TransformException(String message, Throwable cause) {
        super(message, cause);
    }
}
