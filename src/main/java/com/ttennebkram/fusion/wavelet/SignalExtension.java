package com.ttennebkram.fusion.wavelet;

/**
 * How a finite signal is extended past its ends during the forward transform.
 * Only the forward pass samples outside the signal; the inverse uses the
 * coefficients that cover the interior, so it works with any mode.
 */
public enum SignalExtension {

    /** Half-sample mirror: ... x1 x0 | x0 x1 ... x(n-1) | x(n-1) x(n-2) ... */
    SYMMETRIC("symmetric") {
        @Override
        double sample(double[] line, int offset, int stride, int n, int index) {
            int period = 2 * n;
            int m = Math.floorMod(index, period);
            if (m >= n) {
                m = period - 1 - m;
            }
            return line[offset + m * stride];
        }
    },

    /** Whole-sample mirror: ... x2 x1 | x0 x1 ... x(n-1) | x(n-2) ... */
    REFLECT("reflect") {
        @Override
        double sample(double[] line, int offset, int stride, int n, int index) {
            if (n == 1) {
                return line[offset];
            }
            int period = 2 * n - 2;
            int m = Math.floorMod(index, period);
            if (m >= n) {
                m = period - m;
            }
            return line[offset + m * stride];
        }
    },

    PERIODIC("periodic") {
        @Override
        double sample(double[] line, int offset, int stride, int n, int index) {
            return line[offset + Math.floorMod(index, n) * stride];
        }
    },

    ZERO("zero") {
        @Override
        double sample(double[] line, int offset, int stride, int n, int index) {
            if (index < 0 || index >= n) {
                return 0.0;
            }
            return line[offset + index * stride];
        }
    };

    private final String id;

    SignalExtension(String id) {
        this.id = id;
    }

    /**
     * Read sample {@code index} of the extended signal whose n real samples
     * sit at {@code line[offset + i * stride]}.
     */
    abstract double sample(double[] line, int offset, int stride, int n, int index);

    public String getId() {
        return id;
    }

    /**
     * @throws IllegalArgumentException if the name is not a supported mode
     */
    public static SignalExtension fromId(String name) {
        if (name != null) {
            String key = name.trim().toLowerCase();
            for (SignalExtension e : values()) {
                if (e.id.equals(key)) {
                    return e;
                }
            }
        }
        throw new IllegalArgumentException("Unsupported extension mode: " + name);
    }
}
