package com.ttennebkram.fusion.processors;

import com.google.gson.JsonObject;
import org.opencv.core.Core;
import org.opencv.core.Mat;
import org.opencv.imgproc.Imgproc;

/**
 * Color processor.
 * Produces an 8-bit 3-channel RGB buffer from a decoded image.
 * A single-channel input has its gray value duplicated into every channel.
 */
@FusionProcessorInfo(
    nodeType = "Color",
    displayName = "Color",
    category = "Basic",
    description = "RGB conversion\nImgproc.cvtColor(src, dst, COLOR_GRAY2RGB / COLOR_BGR2RGB)"
)
public class ColorProcessor extends FusionProcessorBase {

    @Override
    public String getNodeType() {
        return "Color";
    }

    @Override
    public String getCategory() {
        return "Basic";
    }

    @Override
    public String getDescription() {
        return "Color\nImgproc.cvtColor(src, dst, COLOR_GRAY2RGB)";
    }

    @Override
    public Mat process(Mat input) {
        if (isInvalidInput(input)) {
            return input;
        }

        Mat eightBit = GrayscaleProcessor.toEightBit(input);
        Mat output = new Mat();
        switch (eightBit.channels()) {
            case 1:
                Imgproc.cvtColor(eightBit, output, Imgproc.COLOR_GRAY2RGB);
                break;
            case 3:
                Imgproc.cvtColor(eightBit, output, Imgproc.COLOR_BGR2RGB);
                break;
            case 4:
                Imgproc.cvtColor(eightBit, output, Imgproc.COLOR_BGRA2RGB);
                break;
            default:
                Mat gray = new Mat();
                Core.extractChannel(eightBit, gray, 0);
                Imgproc.cvtColor(gray, output, Imgproc.COLOR_GRAY2RGB);
                gray.release();
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
}
