package com.ttennebkram.fusion.processing;

import org.opencv.core.Mat;

import java.util.Collections;
import java.util.List;

/**
 * Output of {@link ImageNormalizer}: equal-sized 8-bit intensity buffers plus
 * the RGB companion of every input at its decoded size.
 * The batch owns all of its Mats; call {@link #release()} when done.
 */
public class NormalizedBatch {

    private final List<Mat> grayImages;
    private final List<Mat> colorImages;

    public NormalizedBatch(List<Mat> grayImages, List<Mat> colorImages) {
        this.grayImages = grayImages;
        this.colorImages = colorImages;
    }

    public List<Mat> getGrayImages() {
        return Collections.unmodifiableList(grayImages);
    }

    public List<Mat> getColorImages() {
        return Collections.unmodifiableList(colorImages);
    }

    public int size() {
        return grayImages.size();
    }

    public int rows() {
        return grayImages.isEmpty() ? 0 : grayImages.get(0).rows();
    }

    public int cols() {
        return grayImages.isEmpty() ? 0 : grayImages.get(0).cols();
    }

    public void release() {
        ImageNormalizer.releaseAll(grayImages);
        ImageNormalizer.releaseAll(colorImages);
    }
}
