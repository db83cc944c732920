package com.ttennebkram.fusion.processors;

import com.ttennebkram.fusion.error.FusionException;
import com.ttennebkram.fusion.processing.DualImageProcessor;
import org.opencv.core.Mat;

/**
 * Base class for dual-input processors.
 * Extends FusionProcessorBase with dual-input specific functionality.
 */
public abstract class FusionDualInputProcessor extends FusionProcessorBase {

    /**
     * Process two input images.
     *
     * @param input1 First input image (not modified)
     * @param input2 Second input image (not modified)
     * @return Processed output image (caller will release)
     */
    public abstract Mat processDual(Mat input1, Mat input2) throws FusionException;

    /**
     * Single-input process() is not used for dual-input processors.
     * Throws UnsupportedOperationException.
     */
    @Override
    public Mat process(Mat input) {
        throw new UnsupportedOperationException(
                "Dual-input processors must use processDual(Mat, Mat)");
    }

    /**
     * Create a DualImageProcessor lambda for use with MultiImageReducer.
     */
    public DualImageProcessor createDualImageProcessor() {
        return this::processDual;
    }
}
