package com.ttennebkram.fusion.source;

import com.ttennebkram.fusion.error.DecodeException;
import org.opencv.core.Mat;
import org.opencv.core.MatOfByte;
import org.opencv.imgcodecs.Imgcodecs;

/**
 * Encoded image bytes (PNG, JPEG, TIFF, ...) held in memory, e.g. an upload body.
 */
public class EncodedImageSource implements ImageSource {

    private final String name;
    private final byte[] data;

    public EncodedImageSource(String name, byte[] data) {
        this.name = name == null ? "<bytes>" : name;
        this.data = data;
    }

    @Override
    public Mat decode() throws DecodeException {
        if (data == null || data.length == 0) {
            throw new DecodeException(name, "no data");
        }
        MatOfByte buffer = new MatOfByte(data);
        Mat mat = Imgcodecs.imdecode(buffer, Imgcodecs.IMREAD_UNCHANGED);
        buffer.release();
        if (mat.empty()) {
            mat.release();
            throw new DecodeException(name, "unsupported or corrupt image data");
        }
        return mat;
    }

    @Override
    public String describe() {
        return name;
    }
}
