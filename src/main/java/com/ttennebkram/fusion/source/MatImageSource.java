package com.ttennebkram.fusion.source;

import com.ttennebkram.fusion.error.DecodeException;
import org.opencv.core.Mat;

/**
 * Already-decoded pixel buffer. decode() hands out a copy; the wrapped Mat stays with its owner.
 */
public class MatImageSource implements ImageSource {

    private final String name;
    private final Mat mat;

    public MatImageSource(String name, Mat mat) {
        this.name = name == null ? "<mat>" : name;
        this.mat = mat;
    }

    @Override
    public Mat decode() throws DecodeException {
        if (mat == null || mat.empty()) {
            throw new DecodeException(name, "empty buffer");
        }
        return mat.clone();
    }

    @Override
    public String describe() {
        return name;
    }
}
