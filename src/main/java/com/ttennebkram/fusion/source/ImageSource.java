package com.ttennebkram.fusion.source;

import com.ttennebkram.fusion.error.DecodeException;
import org.opencv.core.Mat;

/**
 * Something that can be decoded into a pixel buffer.
 */
public interface ImageSource {

    /**
     * Decode the image, keeping its channel count and depth.
     *
     * @return a new Mat owned by the caller, never empty
     * @throws DecodeException if the data cannot be read or interpreted
     */
    Mat decode() throws DecodeException;

    /**
     * Short human readable description for diagnostics (e.g. the file path).
     */
    String describe();

    static ImageSource file(String path) {
        return new FileImageSource(path);
    }

    static ImageSource encoded(String name, byte[] data) {
        return new EncodedImageSource(name, data);
    }

    static ImageSource decoded(String name, Mat mat) {
        return new MatImageSource(name, mat);
    }
}
