package com.ttennebkram.fusion.processors;

import com.google.gson.JsonObject;
import com.ttennebkram.fusion.error.DimensionException;
import com.ttennebkram.fusion.error.FusionException;
import com.ttennebkram.fusion.wavelet.CoefficientFusionRule;
import com.ttennebkram.fusion.wavelet.DiscreteWaveletTransform2D;
import com.ttennebkram.fusion.wavelet.SignalExtension;
import com.ttennebkram.fusion.wavelet.SubbandSet;
import com.ttennebkram.fusion.wavelet.Wavelet;
import org.opencv.core.CvType;
import org.opencv.core.Mat;

/**
 * Wavelet fusion processor - fuses two equal-sized intensity buffers.
 * Both inputs are decomposed with one level of the 2D DWT, the sub-bands are
 * combined by {@link CoefficientFusionRule}, and the fused set is reconstructed,
 * clamped to [0, 255] and truncated to 8 bits.
 */
@FusionProcessorInfo(
    nodeType = "WaveletFusion",
    displayName = "Wavelet Fusion",
    category = "Fusion",
    description = "DWT fusion: mean approximation, max-abs details",
    dualInput = true
)
public class WaveletFusionProcessor extends FusionDualInputProcessor {

    // Properties with defaults
    private Wavelet wavelet = Wavelet.DB4;
    private SignalExtension extension = SignalExtension.SYMMETRIC;

    private DiscreteWaveletTransform2D transform = new DiscreteWaveletTransform2D(wavelet, extension);
    private final CoefficientFusionRule rule = new CoefficientFusionRule();

    @Override
    public String getNodeType() {
        return "WaveletFusion";
    }

    @Override
    public String getCategory() {
        return "Fusion";
    }

    @Override
    public String getDescription() {
        return "Wavelet Fusion (" + wavelet.getId() + ", " + extension.getId() + ")\n"
                + "approximation: average, details: maximum absolute value";
    }

    @Override
    public Mat processDual(Mat input1, Mat input2) throws FusionException {
        if (isInvalidInput(input1) || isInvalidInput(input2)) {
            throw new DimensionException("Cannot fuse an empty buffer");
        }
        if (input1.rows() != input2.rows() || input1.cols() != input2.cols()) {
            throw new DimensionException(String.format("Cannot fuse %dx%d with %dx%d",
                    input1.rows(), input1.cols(), input2.rows(), input2.cols()));
        }

        SubbandSet bands1 = transform.forward(input1);
        SubbandSet bands2 = null;
        SubbandSet fused = null;
        Mat reconstructed = null;
        try {
            bands2 = transform.forward(input2);
            fused = rule.fuse(bands1, bands2);
            reconstructed = transform.inverse(fused, input1.rows(), input1.cols());

            return clampAndTruncate(reconstructed);
        } finally {
            bands1.release();
            if (bands2 != null) {
                bands2.release();
            }
            if (fused != null) {
                fused.release();
            }
            if (reconstructed != null) {
                reconstructed.release();
            }
        }
    }

    /**
     * Clamp every sample to [0, 255] and drop its fractional part.
     * Unlike {@code convertTo(CV_8U)} this does not round.
     */
    static Mat clampAndTruncate(Mat reconstructed) {
        Mat samples64 = new Mat();
        reconstructed.convertTo(samples64, CvType.CV_64F);
        double[] samples = new double[(int) samples64.total()];
        samples64.get(0, 0, samples);
        samples64.release();

        byte[] data = new byte[samples.length];
        for (int i = 0; i < samples.length; i++) {
            double v = Math.min(255.0, Math.max(0.0, samples[i]));
            data[i] = (byte) (int) v;
        }

        Mat output = new Mat(reconstructed.rows(), reconstructed.cols(), CvType.CV_8UC1);
        output.put(0, 0, data);
        return output;
    }

    @Override
    public void serializeProperties(JsonObject json) {
        json.addProperty("wavelet", wavelet.getId());
        json.addProperty("extension", extension.getId());
    }

    @Override
    public void deserializeProperties(JsonObject json) {
        setWavelet(Wavelet.fromId(getJsonString(json, "wavelet", wavelet.getId())));
        setExtension(SignalExtension.fromId(getJsonString(json, "extension", extension.getId())));
    }

    // Getters/setters
    public Wavelet getWavelet() {
        return wavelet;
    }

    public void setWavelet(Wavelet wavelet) {
        if (wavelet == null) {
            throw new IllegalArgumentException("Wavelet is required");
        }
        this.wavelet = wavelet;
        this.transform = new DiscreteWaveletTransform2D(wavelet, extension);
    }

    public SignalExtension getExtension() {
        return extension;
    }

    public void setExtension(SignalExtension extension) {
        if (extension == null) {
            throw new IllegalArgumentException("Extension mode is required");
        }
        this.extension = extension;
        this.transform = new DiscreteWaveletTransform2D(wavelet, extension);
    }
}
