package com.ttennebkram.fusion.error;

/**
 * Fewer images were supplied than the operation needs.
 */
public class InsufficientInputException extends FusionException {

    private final int required;
    private final int supplied;

    public InsufficientInputException(int required, int supplied) {
        super("Need at least " + required + " images for fusion, got " + supplied);
        this.required = required;
        this.supplied = supplied;
    }

    public int getRequired() {
        return required;
    }

    public int getSupplied() {
        return supplied;
    }
}
