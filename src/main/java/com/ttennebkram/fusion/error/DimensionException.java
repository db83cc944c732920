package com.ttennebkram.fusion.error;

/**
 * A buffer has a shape the transform cannot work with.
 */
public class DimensionException extends FusionException {

    public DimensionException(String message) {
        super(message);
    }
}
