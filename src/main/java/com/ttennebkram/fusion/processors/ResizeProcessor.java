package com.ttennebkram.fusion.processors;

import com.google.gson.JsonObject;
import org.opencv.core.Mat;
import org.opencv.core.Size;
import org.opencv.imgproc.Imgproc;

/**
 * Resize processor.
 * Resamples the image to the configured dimensions with one interpolation mode.
 */
@FusionProcessorInfo(
    nodeType = "Resize",
    displayName = "Resize",
    category = "Transform",
    description = "Resize image\nImgproc.resize(src, dst, dsize, 0, 0, interpolation)"
)
public class ResizeProcessor extends FusionProcessorBase {

    private static final String[] INTERPOLATION_NAMES = {"nearest", "linear", "cubic", "area"};
    private static final int[] INTERPOLATION_CODES = {
        Imgproc.INTER_NEAREST, Imgproc.INTER_LINEAR, Imgproc.INTER_CUBIC, Imgproc.INTER_AREA
    };

    // Properties with defaults
    private int width = 0;
    private int height = 0;
    private String interpolation = "linear";

    @Override
    public String getNodeType() {
        return "Resize";
    }

    @Override
    public String getCategory() {
        return "Transform";
    }

    @Override
    public String getDescription() {
        return "Resize (" + interpolation + ")\nImgproc.resize(src, dst, size, 0, 0, interpolation)";
    }

    @Override
    public Mat process(Mat input) {
        if (isInvalidInput(input)) {
            return input;
        }
        if (width <= 0 || height <= 0) {
            throw new IllegalStateException("Resize target not set: " + width + "x" + height);
        }

        Mat output = new Mat();
        if (input.width() == width && input.height() == height) {
            input.copyTo(output);
        } else {
            Imgproc.resize(input, output, new Size(width, height), 0, 0, interpolationCode(interpolation));
        }
        return output;
    }

    @Override
    public void serializeProperties(JsonObject json) {
        json.addProperty("interpolation", interpolation);
    }

    @Override
    public void deserializeProperties(JsonObject json) {
        setInterpolation(getJsonString(json, "interpolation", getInterpolation()));
    }

    public void setTargetSize(int width, int height) {
        this.width = width;
        this.height = height;
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public String getInterpolation() {
        return interpolation;
    }

    /**
     * @throws IllegalArgumentException for names other than nearest, linear, cubic, area
     */
    public void setInterpolation(String interpolation) {
        interpolationCode(interpolation);
        this.interpolation = interpolation.trim().toLowerCase();
    }

    private static int interpolationCode(String name) {
        if (name != null) {
            String key = name.trim().toLowerCase();
            for (int i = 0; i < INTERPOLATION_NAMES.length; i++) {
                if (INTERPOLATION_NAMES[i].equals(key)) {
                    return INTERPOLATION_CODES[i];
                }
            }
        }
        throw new IllegalArgumentException("Unsupported interpolation: " + name);
    }
}
