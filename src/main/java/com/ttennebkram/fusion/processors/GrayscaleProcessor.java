package com.ttennebkram.fusion.processors;

import com.google.gson.JsonObject;
import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.imgproc.Imgproc;

/**
 * Grayscale processor.
 * Converts a decoded image of any channel count to an 8-bit single-channel
 * intensity buffer using OpenCV's perceptual weights (0.299 R + 0.587 G + 0.114 B).
 * Single-channel input passes through unchanged.
 */
@FusionProcessorInfo(
    nodeType = "Grayscale",
    displayName = "Grayscale",
    category = "Basic",
    description = "Grayscale conversion\nImgproc.cvtColor(src, dst, COLOR_BGR2GRAY)"
)
public class GrayscaleProcessor extends FusionProcessorBase {

    @Override
    public String getNodeType() {
        return "Grayscale";
    }

    @Override
    public String getCategory() {
        return "Basic";
    }

    @Override
    public String getDescription() {
        return "Grayscale\nImgproc.cvtColor(src, dst, COLOR_BGR2GRAY)";
    }

    @Override
    public Mat process(Mat input) {
        if (isInvalidInput(input)) {
            return input;
        }

        Mat eightBit = toEightBit(input);
        Mat output = new Mat();
        switch (eightBit.channels()) {
            case 1:
                eightBit.copyTo(output);
                break;
            case 3:
                Imgproc.cvtColor(eightBit, output, Imgproc.COLOR_BGR2GRAY);
                break;
            case 4:
                Imgproc.cvtColor(eightBit, output, Imgproc.COLOR_BGRA2GRAY);
                break;
            default:
                // gray + alpha
                Core.extractChannel(eightBit, output, 0);
                break;
        }

        if (eightBit != input) {
            eightBit.release();
        }
        return output;
    }

    @Override
    public boolean hasProperties() {
        return false;
    }

    @Override
    public void serializeProperties(JsonObject json) {
        // No properties to serialize
    }

    @Override
    public void deserializeProperties(JsonObject json) {
        // No properties to deserialize
    }

    /**
     * Scale 16-bit and floating point buffers down to 8 bits.
     * Returns the input itself when it is already 8-bit unsigned.
     */
    static Mat toEightBit(Mat input) {
        int depth = input.depth();
        if (depth == CvType.CV_8U) {
            return input;
        }

        double scale;
        double shift = 0.0;
        if (depth == CvType.CV_16U) {
            scale = 1.0 / 256.0;
        } else if (depth == CvType.CV_16S) {
            scale = 1.0 / 256.0;
            shift = 128.0;
        } else if (depth == CvType.CV_8S) {
            scale = 1.0;
            shift = 128.0;
        } else if (depth == CvType.CV_32F || depth == CvType.CV_64F) {
            // floating point images are stored in [0, 1]
            scale = 255.0;
        } else {
            scale = 1.0;
        }

        Mat output = new Mat();
        input.convertTo(output, CvType.CV_8U, scale, shift);
        return output;
    }
}
