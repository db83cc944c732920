package com.ttennebkram.fusion.processors;

import com.google.gson.JsonObject;
import org.opencv.core.CvType;
import org.opencv.core.Mat;

/**
 * Contrast enhance processor.
 * Applies output = saturate(round(alpha * input + beta)) to every sample.
 */
@FusionProcessorInfo(
    nodeType = "ContrastEnhance",
    displayName = "Contrast Enhance",
    category = "Enhancement",
    description = "Affine intensity remap\nMat.convertTo(dst, CV_8U, alpha, beta)"
)
public class ContrastEnhanceProcessor extends FusionProcessorBase {

    public static final double DEFAULT_ALPHA = 1.2;
    public static final double DEFAULT_BETA = 10.0;

    // Properties with defaults
    private double alpha = DEFAULT_ALPHA;
    private double beta = DEFAULT_BETA;

    @Override
    public String getNodeType() {
        return "ContrastEnhance";
    }

    @Override
    public String getCategory() {
        return "Enhancement";
    }

    @Override
    public String getDescription() {
        return "Contrast Enhance\nMat.convertTo(dst, CV_8U, alpha, beta)";
    }

    @Override
    public Mat process(Mat input) {
        if (isInvalidInput(input)) {
            return input;
        }

        Mat output = new Mat();
        input.convertTo(output, CvType.CV_8U, alpha, beta);
        return output;
    }

    @Override
    public void serializeProperties(JsonObject json) {
        json.addProperty("alpha", alpha);
        json.addProperty("beta", beta);
    }

    @Override
    public void deserializeProperties(JsonObject json) {
        setAlpha(getJsonDouble(json, "alpha", alpha));
        setBeta(getJsonDouble(json, "beta", beta));
    }

    // Getters/setters
    public double getAlpha() {
        return alpha;
    }

    public void setAlpha(double alpha) {
        this.alpha = requireFinite("alpha", alpha);
    }

    public double getBeta() {
        return beta;
    }

    public void setBeta(double beta) {
        this.beta = requireFinite("beta", beta);
    }

    private static double requireFinite(String name, double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new IllegalArgumentException("Contrast " + name + " must be finite, got " + value);
        }
        return value;
    }
}
