package com.ttennebkram.fusion.processors;

import com.google.gson.JsonObject;
import com.ttennebkram.fusion.processing.ImageProcessor;
import org.opencv.core.Mat;

/**
 * Interface for self-contained pipeline stages.
 * Each processor encapsulates:
 * - Processing logic (OpenCV operations)
 * - Serialization/deserialization of its properties (JSON)
 */
public interface FusionProcessor {

    /**
     * Get the node type name (e.g., "ContrastEnhance", "WaveletFusion").
     * Used as the key of this processor's section in a pipeline configuration.
     */
    String getNodeType();

    /**
     * Get the category for grouping (e.g., "Enhancement", "Fusion").
     */
    String getCategory();

    /**
     * Get a description of this processor.
     * Should include the OpenCV function signature where there is one.
     */
    String getDescription();

    /**
     * Process an input image and return the result.
     *
     * @param input The input Mat (do not modify or release)
     * @return The processed output Mat (caller will release)
     */
    Mat process(Mat input);

    /**
     * Create an ImageProcessor lambda wrapping the process() method.
     */
    default ImageProcessor createImageProcessor() {
        return this::process;
    }

    /**
     * Check if this processor has configurable properties.
     */
    default boolean hasProperties() {
        return true;
    }

    /**
     * Serialize processor-specific properties to JSON.
     *
     * @param json The JSON object to add properties to
     */
    void serializeProperties(JsonObject json);

    /**
     * Deserialize processor-specific properties from JSON.
     * Missing keys keep their current values.
     *
     * @param json The JSON object to read properties from
     * @throws IllegalArgumentException if a present value is invalid
     */
    void deserializeProperties(JsonObject json);
}
