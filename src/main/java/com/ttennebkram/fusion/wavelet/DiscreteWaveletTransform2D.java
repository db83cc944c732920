package com.ttennebkram.fusion.wavelet;

import com.ttennebkram.fusion.error.DimensionException;
import com.ttennebkram.fusion.error.TransformException;
import org.opencv.core.CvType;
import org.opencv.core.Mat;

/**
 * Single-level separable 2D discrete wavelet transform.
 *
 * Forward: every row is split into low/high halves, then every column of
 * both halves, giving the approximation (low/low), horizontal detail
 * (column high of row low), vertical detail (column low of row high) and
 * diagonal detail (high/high) bands.
 *
 * Each 1D analysis pass convolves the extended signal with the decomposition
 * filters and keeps the odd positions, so a signal of length N gives
 * {@code floor((N + F - 1) / 2)} coefficients for filter length F. Synthesis
 * produces {@code 2C - F + 2} samples from C coefficients; for even N that is N
 * again, for odd N one extra sample that the 2D inverse crops.
 *
 * Holds no mutable state; instances can be shared.
 */
public class DiscreteWaveletTransform2D {

    private final Wavelet wavelet;
    private final SignalExtension extension;

    public DiscreteWaveletTransform2D() {
        this(Wavelet.DB4, SignalExtension.SYMMETRIC);
    }

    public DiscreteWaveletTransform2D(Wavelet wavelet, SignalExtension extension) {
        if (wavelet == null || extension == null) {
            throw new IllegalArgumentException("Wavelet and extension mode are required");
        }
        this.wavelet = wavelet;
        this.extension = extension;
    }

    public Wavelet getWavelet() {
        return wavelet;
    }

    public SignalExtension getExtension() {
        return extension;
    }

    /**
     * Number of coefficients one analysis pass produces from n samples.
     */
    public static int coefficientLength(int n, int filterLength) {
        return (n + filterLength - 1) / 2;
    }

    /**
     * Number of samples one synthesis pass produces from c coefficients.
     */
    public static int reconstructionLength(int c, int filterLength) {
        return 2 * c - filterLength + 2;
    }

    /**
     * Decompose a single-channel buffer into one sub-band set.
     *
     * @param image single-channel buffer of any depth (not modified)
     * @return a new sub-band set, owned by the caller
     * @throws DimensionException if the buffer is empty, multi-channel, or
     *         smaller than one decomposition level of the wavelet
     */
    public SubbandSet forward(Mat image) throws DimensionException {
        if (image == null || image.empty()) {
            throw new DimensionException("Cannot transform an empty buffer");
        }
        if (image.channels() != 1) {
            throw new DimensionException("Expected a single-channel buffer, got "
                    + image.channels() + " channels");
        }

        int rows = image.rows();
        int cols = image.cols();
        int min = wavelet.getMinimumSize();
        if (rows < min || cols < min) {
            throw new DimensionException(String.format(
                    "Buffer %dx%d is too small for %s (needs at least %dx%d)",
                    rows, cols, wavelet.getId(), min, min));
        }

        int f = wavelet.getFilterLength();
        int cr = coefficientLength(rows, f);
        int cc = coefficientLength(cols, f);
        double[] pixels = toArray(image);

        // Rows
        double[] lo = new double[rows * cc];
        double[] hi = new double[rows * cc];
        for (int y = 0; y < rows; y++) {
            analyze(pixels, y * cols, 1, cols, lo, hi, y * cc, 1, cc);
        }

        // Columns
        double[] aa = new double[cr * cc];
        double[] da = new double[cr * cc];
        double[] ad = new double[cr * cc];
        double[] dd = new double[cr * cc];
        for (int x = 0; x < cc; x++) {
            analyze(lo, x, cc, rows, aa, da, x, cc, cr);
            analyze(hi, x, cc, rows, ad, dd, x, cc, cr);
        }

        return new SubbandSet(toMat(aa, cr, cc), toMat(da, cr, cc),
                toMat(ad, cr, cc), toMat(dd, cr, cc));
    }

    /**
     * Reconstruct at the natural size of the sub-band set.
     */
    public Mat inverse(SubbandSet bands) throws TransformException {
        int f = wavelet.getFilterLength();
        return inverse(bands, reconstructionLength(bands.rows(), f),
                reconstructionLength(bands.cols(), f));
    }

    /**
     * Reconstruct a rows x cols CV_64FC1 buffer from a sub-band set.
     * The bands are not modified or released.
     *
     * @throws TransformException if the bands disagree in shape, or rows x cols
     *         is not the natural reconstruction size (or one less, for odd sizes)
     */
    public Mat inverse(SubbandSet bands, int rows, int cols) throws TransformException {
        int cr = bands.rows();
        int cc = bands.cols();
        if (!bands.getHorizontal().size().equals(bands.getApproximation().size())
                || !bands.getVertical().size().equals(bands.getApproximation().size())
                || !bands.getDiagonal().size().equals(bands.getApproximation().size())) {
            throw new TransformException("Sub-band sizes differ");
        }

        int f = wavelet.getFilterLength();
        int nr = reconstructionLength(cr, f);
        int nc = reconstructionLength(cc, f);
        if (nr <= 0 || nc <= 0) {
            throw new TransformException(String.format(
                    "Sub-bands %dx%d are too small for %s", cr, cc, wavelet.getId()));
        }
        if (rows <= 0 || cols <= 0 || rows > nr || nr - rows > 1 || cols > nc || nc - cols > 1) {
            throw new TransformException(String.format(
                    "Cannot reconstruct %dx%d from sub-bands %dx%d (natural size %dx%d)",
                    rows, cols, cr, cc, nr, nc));
        }

        double[] a = toArray(bands.getApproximation());
        double[] h = toArray(bands.getHorizontal());
        double[] v = toArray(bands.getVertical());
        double[] d = toArray(bands.getDiagonal());

        // Columns first, undoing the last forward pass
        double[] lo = new double[rows * cc];
        double[] hi = new double[rows * cc];
        for (int x = 0; x < cc; x++) {
            synthesize(a, h, x, cc, cr, lo, x, cc, rows);
            synthesize(v, d, x, cc, cr, hi, x, cc, rows);
        }

        double[] out = new double[rows * cols];
        for (int y = 0; y < rows; y++) {
            synthesize(lo, hi, y * cc, 1, cc, out, y * cols, 1, cols);
        }
        return toMat(out, rows, cols);
    }

    private void analyze(double[] in, int inOffset, int inStride, int n,
                         double[] lo, double[] hi, int outOffset, int outStride, int count) {
        double[] decLo = wavelet.decLo();
        double[] decHi = wavelet.decHi();
        int f = decLo.length;

        for (int o = 0; o < count; o++) {
            int base = 2 * o + 1;
            double sumLo = 0.0;
            double sumHi = 0.0;
            for (int j = 0; j < f; j++) {
                double s = extension.sample(in, inOffset, inStride, n, base - j);
                sumLo += decLo[j] * s;
                sumHi += decHi[j] * s;
            }
            lo[outOffset + o * outStride] = sumLo;
            hi[outOffset + o * outStride] = sumHi;
        }
    }

    private void synthesize(double[] lo, double[] hi, int inOffset, int inStride, int count,
                            double[] out, int outOffset, int outStride, int length) {
        double[] recLo = wavelet.recLo();
        double[] recHi = wavelet.recHi();
        int f = recLo.length;

        for (int t = 0; t < length; t++) {
            // coefficient o covers samples 2o+2-F .. 2o+1
            int first = t / 2;
            int last = Math.min(count - 1, (t + f - 2) / 2);
            double sum = 0.0;
            for (int o = first; o <= last; o++) {
                int k = t - 2 * o - 2 + f;
                int idx = inOffset + o * inStride;
                sum += lo[idx] * recLo[k] + hi[idx] * recHi[k];
            }
            out[outOffset + t * outStride] = sum;
        }
    }

    private static double[] toArray(Mat mat) {
        Mat m64 = new Mat();
        mat.convertTo(m64, CvType.CV_64F);
        double[] data = new double[(int) m64.total()];
        m64.get(0, 0, data);
        m64.release();
        return data;
    }

    private static Mat toMat(double[] data, int rows, int cols) {
        Mat mat = new Mat(rows, cols, CvType.CV_64FC1);
        mat.put(0, 0, data);
        return mat;
    }
}
