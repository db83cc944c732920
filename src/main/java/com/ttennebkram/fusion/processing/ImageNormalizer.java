package com.ttennebkram.fusion.processing;

import com.google.gson.JsonObject;
import com.ttennebkram.fusion.error.DecodeException;
import com.ttennebkram.fusion.error.DimensionException;
import com.ttennebkram.fusion.error.FusionException;
import com.ttennebkram.fusion.error.InsufficientInputException;
import com.ttennebkram.fusion.error.TransformException;
import com.ttennebkram.fusion.processors.ColorProcessor;
import com.ttennebkram.fusion.processors.GrayscaleProcessor;
import com.ttennebkram.fusion.processors.ResizeProcessor;
import com.ttennebkram.fusion.source.ImageSource;
import org.opencv.core.CvException;
import org.opencv.core.Mat;
import org.opencv.core.Size;

import java.util.ArrayList;
import java.util.List;

/**
 * Decodes a batch of images and brings them to one common even-sized resolution.
 *
 * The target is the smallest height and the smallest width in the batch, each
 * rounded down to an even number. Every grayscale buffer is resampled to it with
 * one interpolation mode; buffers that already have the target size are copied.
 */
public class ImageNormalizer {

    public static final String NODE_TYPE = "Normalize";

    private final GrayscaleProcessor grayscale = new GrayscaleProcessor();
    private final ColorProcessor color = new ColorProcessor();
    private final ResizeProcessor resize = new ResizeProcessor();

    /**
     * Decode and normalize the whole batch. Fails fast: one undecodable image
     * aborts everything and nothing decoded so far is kept.
     *
     * @return a batch owned by the caller
     * @throws InsufficientInputException if the list is empty
     * @throws DecodeException if any image cannot be decoded
     * @throws DimensionException if the common size collapses to zero
     * @throws TransformException if OpenCV fails to resample a buffer
     */
    public NormalizedBatch normalize(List<? extends ImageSource> sources) throws FusionException {
        if (sources == null || sources.isEmpty()) {
            throw new InsufficientInputException(1, 0);
        }

        List<Mat> grays = new ArrayList<>();
        List<Mat> colors = new ArrayList<>();
        try {
            for (ImageSource source : sources) {
                Mat decoded = source.decode();
                try {
                    grays.add(grayscale.process(decoded));
                    colors.add(color.process(decoded));
                } catch (CvException e) {
                    throw new DecodeException(source.describe(), e.getMessage(), e);
                } finally {
                    decoded.release();
                }
            }

            List<Mat> resized;
            try {
                resized = resizeToCommon(grays);
            } catch (CvException e) {
                throw new TransformException("Failed to resize images to a common size: " + e.getMessage(), e);
            }
            releaseAll(grays);
            return new NormalizedBatch(resized, colors);
        } catch (FusionException e) {
            releaseAll(grays);
            releaseAll(colors);
            throw e;
        }
    }

    /**
     * Resample every buffer to {@link #commonSize(List)}.
     * The inputs are left untouched; the returned Mats are new and owned by the caller.
     */
    public List<Mat> resizeToCommon(List<Mat> images) throws DimensionException {
        Size target = commonSize(images);
        resize.setTargetSize((int) target.width, (int) target.height);

        List<Mat> resized = new ArrayList<>(images.size());
        for (Mat image : images) {
            resized.add(resize.process(image));
        }
        return resized;
    }

    /**
     * Smallest width and height over the batch, each rounded down to even.
     *
     * @throws DimensionException if the batch is empty or either side rounds to zero
     */
    public static Size commonSize(List<Mat> images) throws DimensionException {
        if (images == null || images.isEmpty()) {
            throw new DimensionException("No images to size");
        }
        int minRows = Integer.MAX_VALUE;
        int minCols = Integer.MAX_VALUE;
        for (Mat image : images) {
            minRows = Math.min(minRows, image.rows());
            minCols = Math.min(minCols, image.cols());
        }

        int rows = minRows - (minRows % 2);
        int cols = minCols - (minCols % 2);
        if (rows <= 0 || cols <= 0) {
            throw new DimensionException(String.format(
                    "Common size %dx%d is empty after rounding to even", minRows, minCols));
        }
        return new Size(cols, rows);
    }

    public String getInterpolation() {
        return resize.getInterpolation();
    }

    public void setInterpolation(String interpolation) {
        resize.setInterpolation(interpolation);
    }

    public void serializeProperties(JsonObject json) {
        resize.serializeProperties(json);
    }

    public void deserializeProperties(JsonObject json) {
        resize.deserializeProperties(json);
    }

    static void releaseAll(List<Mat> mats) {
        for (Mat mat : mats) {
            if (mat != null) {
                mat.release();
            }
        }
        mats.clear();
    }
}
