package com.ttennebkram.fusion.wavelet;

/**
 * Orthogonal Daubechies wavelets available to the transform.
 *
 * Each constant is defined by its reconstruction low-pass (scaling) filter.
 * The other three filters of the bank are derived from it:
 * <pre>
 *   dec_lo[k] = rec_lo[F-1-k]
 *   dec_hi[k] = (-1)^(k+1) * rec_lo[k]
 *   rec_hi[k] = dec_hi[F-1-k]
 * </pre>
 */
public enum Wavelet {

    DB1("db1", "Haar / Daubechies 1 (db1)", new double[] {
        0.7071067811865476, 0.7071067811865476
    }),

    DB2("db2", "Daubechies 2 (db2)", new double[] {
        0.48296291314469025, 0.836516303737469,
        0.22414386804185735, -0.12940952255092145
    }),

    DB3("db3", "Daubechies 3 (db3)", new double[] {
        0.3326705529509569, 0.8068915093133388, 0.4598775021193313,
        -0.13501102001039084, -0.08544127388224149, 0.035226291882100656
    }),

    DB4("db4", "Daubechies 4 (db4)", new double[] {
        0.23037781330885523, 0.7148465705525415, 0.6308807679295904,
        -0.02798376941698385, -0.18703481171888114, 0.030841381835986965,
        0.032883011666982945, -0.010597401784997278
    });

    private final String id;
    private final String displayName;
    private final double[] recLo;
    private final double[] recHi;
    private final double[] decLo;
    private final double[] decHi;

    Wavelet(String id, String displayName, double[] scaling) {
        this.id = id;
        this.displayName = displayName;
        int f = scaling.length;
        this.recLo = scaling.clone();
        this.decLo = new double[f];
        this.decHi = new double[f];
        this.recHi = new double[f];
        for (int k = 0; k < f; k++) {
            decLo[k] = scaling[f - 1 - k];
            decHi[k] = (k % 2 == 0 ? -1.0 : 1.0) * scaling[k];
        }
        for (int k = 0; k < f; k++) {
            recHi[k] = decHi[f - 1 - k];
        }
    }

    /**
     * Look up a wavelet by its short identifier ("db4", "haar", ...).
     *
     * @throws IllegalArgumentException if the name is not a supported wavelet
     */
    public static Wavelet fromId(String name) {
        if (name == null) {
            throw new IllegalArgumentException("Wavelet name must not be null");
        }
        String key = name.trim().toLowerCase();
        if ("haar".equals(key)) {
            return DB1;
        }
        for (Wavelet w : values()) {
            if (w.id.equals(key)) {
                return w;
            }
        }
        throw new IllegalArgumentException("Unsupported wavelet: " + name);
    }

    public String getId() {
        return id;
    }

    public String getDisplayName() {
        return displayName;
    }

    public int getFilterLength() {
        return recLo.length;
    }

    /**
     * Smallest signal length that supports one full decomposition level.
     */
    public int getMinimumSize() {
        return 2 * (recLo.length - 1);
    }

    // Callers must not modify the returned arrays
    double[] decLo() {
        return decLo;
    }

    double[] decHi() {
        return decHi;
    }

    double[] recLo() {
        return recLo;
    }

    double[] recHi() {
        return recHi;
    }
}
