package com.ttennebkram.fusion.processing;

import com.ttennebkram.fusion.error.FusionException;
import org.opencv.core.Mat;

/**
 * Functional interface for combining two input images into one.
 * Used by the reducer to fold a batch pairwise.
 */
@FunctionalInterface
public interface DualImageProcessor {
    /**
     * Process two input images and return the result.
     *
     * @param input1 First input image (caller owns this Mat)
     * @param input2 Second input image (caller owns this Mat)
     * @return New output image (caller must release when done)
     * @throws FusionException if the pair cannot be combined
     */
    Mat process(Mat input1, Mat input2) throws FusionException;
}
