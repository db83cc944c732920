package com.ttennebkram.fusion.error;

/**
 * An input image could not be read or interpreted.
 */
public class DecodeException extends FusionException {

    private final String source;

    public DecodeException(String source, String message) {
        super("Failed to load image " + source + ": " + message);
        this.source = source;
    }

    public DecodeException(String source, String message, Throwable cause) {
        super("Failed to load image " + source + ": " + message, cause);
        this.source = source;
    }

    /**
     * Description of the input that failed (path, byte buffer name, ...).
     */
    public String getSource() {
        return source;
    }
}
