package com.ttennebkram.fusion.source;

import com.ttennebkram.fusion.error.DecodeException;
import org.opencv.core.Mat;
import org.opencv.imgcodecs.Imgcodecs;

import java.io.File;

/**
 * Image file on disk, read with Imgcodecs.imread().
 */
public class FileImageSource implements ImageSource {

    private final String path;

    public FileImageSource(String path) {
        if (path == null) {
            throw new IllegalArgumentException("Image path is required");
        }
        this.path = path;
    }

    @Override
    public Mat decode() throws DecodeException {
        if (!new File(path).isFile()) {
            throw new DecodeException(path, "file not found");
        }
        Mat mat = Imgcodecs.imread(path, Imgcodecs.IMREAD_UNCHANGED);
        if (mat.empty()) {
            mat.release();
            throw new DecodeException(path, "unsupported or corrupt image data");
        }
        return mat;
    }

    @Override
    public String describe() {
        return path;
    }

    public String getPath() {
        return path;
    }
}
