package com.ttennebkram.fusion.processors;

import com.google.gson.JsonObject;
import org.opencv.core.Mat;

/**
 * Abstract base class for fusion processors.
 * Provides common functionality and helper methods.
 */
public abstract class FusionProcessorBase implements FusionProcessor {

    /**
     * Standard null/empty check for input validation.
     * Call at the start of process() method.
     */
    protected boolean isInvalidInput(Mat input) {
        return input == null || input.empty();
    }

    /**
     * Display name from the @FusionProcessorInfo annotation, or the node type.
     */
    public String getDisplayName() {
        FusionProcessorInfo info = getClass().getAnnotation(FusionProcessorInfo.class);
        if (info != null && !info.displayName().isEmpty()) {
            return info.displayName();
        }
        return getNodeType();
    }

    /**
     * Helper to safely get a double from JSON.
     */
    protected double getJsonDouble(JsonObject json, String key, double defaultValue) {
        if (json.has(key) && !json.get(key).isJsonNull()) {
            return json.get(key).getAsDouble();
        }
        return defaultValue;
    }

    /**
     * Helper to safely get a String from JSON.
     */
    protected String getJsonString(JsonObject json, String key, String defaultValue) {
        if (json.has(key) && !json.get(key).isJsonNull()) {
            return json.get(key).getAsString();
        }
        return defaultValue;
    }
}
