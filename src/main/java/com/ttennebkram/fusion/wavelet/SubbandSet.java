package com.ttennebkram.fusion.wavelet;

import org.opencv.core.Mat;

/**
 * One level of a 2D wavelet decomposition: the approximation band and the
 * horizontal, vertical and diagonal detail bands, all CV_64FC1 and of equal size.
 *
 * A set owns its four matrices; call {@link #release()} once it is consumed.
 */
public class SubbandSet {

    private final Mat approximation;
    private final Mat horizontal;
    private final Mat vertical;
    private final Mat diagonal;

    public SubbandSet(Mat approximation, Mat horizontal, Mat vertical, Mat diagonal) {
        this.approximation = approximation;
        this.horizontal = horizontal;
        this.vertical = vertical;
        this.diagonal = diagonal;
    }

    public Mat getApproximation() {
        return approximation;
    }

    public Mat getHorizontal() {
        return horizontal;
    }

    public Mat getVertical() {
        return vertical;
    }

    public Mat getDiagonal() {
        return diagonal;
    }

    public int rows() {
        return approximation.rows();
    }

    public int cols() {
        return approximation.cols();
    }

    /**
     * True when every band of both sets has the same shape.
     */
    public boolean sameShape(SubbandSet other) {
        return rows() == other.rows() && cols() == other.cols()
                && horizontal.size().equals(other.horizontal.size())
                && vertical.size().equals(other.vertical.size())
                && diagonal.size().equals(other.diagonal.size());
    }

    public void release() {
        approximation.release();
        horizontal.release();
        vertical.release();
        diagonal.release();
    }
}
