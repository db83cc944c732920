package com.ttennebkram.fusion;

import com.ttennebkram.fusion.error.FusionException;
import org.opencv.core.Mat;

/**
 * Outcome of one fusion run: either a 3-channel image or the reason it failed.
 * A failed result never carries a buffer.
 */
public class FusionResult {

    private final Mat image;
    private final FusionException error;

    private FusionResult(Mat image, FusionException error) {
        this.image = image;
        this.error = error;
    }

    static FusionResult success(Mat image) {
        return new FusionResult(image, null);
    }

    static FusionResult failure(FusionException error) {
        return new FusionResult(null, error);
    }

    public boolean isSuccess() {
        return image != null;
    }

    /**
     * The fused 8-bit 3-channel image, or null on failure. Owned by the caller.
     */
    public Mat getImage() {
        return image;
    }

    /**
     * Why the run failed, or null on success.
     */
    public FusionException getError() {
        return error;
    }

    /**
     * Release the fused image, if any.
     */
    public void release() {
        if (image != null) {
            image.release();
        }
    }
}
