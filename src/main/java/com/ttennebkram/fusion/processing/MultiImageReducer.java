package com.ttennebkram.fusion.processing;

import com.ttennebkram.fusion.error.FusionException;
import com.ttennebkram.fusion.error.InsufficientInputException;
import com.ttennebkram.fusion.error.TransformException;
import org.opencv.core.Mat;

import java.util.List;

/**
 * Folds an ordered batch of equal-sized buffers into one with a pairwise
 * processor, strictly left to right:
 * <pre>
 *   result = images[0]
 *   result = pair(result, images[1])
 *   result = pair(result, images[2])
 *   ...
 * </pre>
 * The fold is not symmetric: reversing the batch generally gives a different result.
 */
public class MultiImageReducer {

    public static final int MINIMUM_IMAGES = 2;

    private final DualImageProcessor pairProcessor;

    public MultiImageReducer(DualImageProcessor pairProcessor) {
        if (pairProcessor == null) {
            throw new IllegalArgumentException("Pair processor is required");
        }
        this.pairProcessor = pairProcessor;
    }

    /**
     * Reduce the batch to one buffer.
     * The input Mats are neither modified nor released.
     *
     * @return a new buffer owned by the caller
     * @throws InsufficientInputException if fewer than two images are given
     * @throws TransformException if any pairwise step fails; no partial result is returned
     */
    public Mat reduce(List<Mat> images) throws FusionException {
        int count = images == null ? 0 : images.size();
        if (count < MINIMUM_IMAGES) {
            throw new InsufficientInputException(MINIMUM_IMAGES, count);
        }

        Mat accumulator = images.get(0).clone();
        for (int i = 1; i < count; i++) {
            Mat next;
            try {
                next = pairProcessor.process(accumulator, images.get(i));
            } catch (FusionException e) {
                accumulator.release();
                throw new TransformException("Fusion failed at image " + i + ": " + e.getMessage(), e);
            }
            accumulator.release();
            if (next == null || next.empty()) {
                throw new TransformException("Fusion failed at image " + i + ": no output");
            }
            accumulator = next;
        }
        return accumulator;
    }
}
