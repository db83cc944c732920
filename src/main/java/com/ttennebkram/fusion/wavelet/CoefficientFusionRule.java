package com.ttennebkram.fusion.wavelet;

import org.opencv.core.Core;
import org.opencv.core.Mat;
import org.opencv.core.Scalar;

/**
 * Combines the sub-bands of two images into one set.
 * <ul>
 *   <li>Approximation: element-wise mean.</li>
 *   <li>Horizontal, vertical and diagonal detail: per element, the coefficient
 *       with the larger magnitude (sign kept, ties go to the first set).</li>
 * </ul>
 * Neither input set is modified; the result is a new set owned by the caller.
 */
public class CoefficientFusionRule {

    public SubbandSet fuse(SubbandSet first, SubbandSet second) {
        if (!first.sameShape(second)) {
            throw new IllegalArgumentException(String.format(
                    "Sub-band sets differ in shape: %dx%d vs %dx%d",
                    first.rows(), first.cols(), second.rows(), second.cols()));
        }

        Mat approximation = new Mat();
        Core.addWeighted(first.getApproximation(), 0.5, second.getApproximation(), 0.5, 0.0, approximation);

        return new SubbandSet(
                approximation,
                maxAbsolute(first.getHorizontal(), second.getHorizontal()),
                maxAbsolute(first.getVertical(), second.getVertical()),
                maxAbsolute(first.getDiagonal(), second.getDiagonal()));
    }

    /**
     * Element-wise pick of whichever input has the larger absolute value.
     */
    static Mat maxAbsolute(Mat first, Mat second) {
        Mat absFirst = new Mat();
        Mat absSecond = new Mat();
        Core.absdiff(first, Scalar.all(0), absFirst);
        Core.absdiff(second, Scalar.all(0), absSecond);

        Mat mask = new Mat();
        Core.compare(absFirst, absSecond, mask, Core.CMP_GE);

        Mat output = second.clone();
        first.copyTo(output, mask);

        absFirst.release();
        absSecond.release();
        mask.release();
        return output;
    }
}
