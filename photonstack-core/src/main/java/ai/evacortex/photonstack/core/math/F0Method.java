/*
 * PhotonStack — Two-Photon Imaging Pipeline
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.photonstack.core.math;

import ai.evacortex.photonstack.core.exceptions.UnknownMethodException;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Statistic used to estimate the baseline fluorescence F0 over a window of samples.
 */
public enum F0Method {

    PERCENTILE("percentile", true) {
        @Override
        public double apply(double[] window, int from, int to, double percentile) {
            return Percentiles.percentile(window, from, to, percentile);
        }
    },
    MEAN("mean", false) {
        @Override
        public double apply(double[] window, int from, int to, double percentile) {
            double sum = 0;
            for (int i = from; i < to; i++) sum += window[i];
            return sum / (to - from);
        }
    },
    MEDIAN("median", false) {
        @Override
        public double apply(double[] window, int from, int to, double percentile) {
            return Percentiles.percentile(window, from, to, 50.0);
        }
    };

    private final String methodName;
    private final boolean percentileBased;

    F0Method(String methodName, boolean percentileBased) {
        this.methodName = methodName;
        this.percentileBased = percentileBased;
    }

    public String methodName()        { return methodName; }
    public boolean isPercentileBased() { return percentileBased; }

    /**
     * Computes the statistic over {@code values[from, to)}. {@code percentile} is ignored
     * by methods that are not percentile-based.
     */
    public abstract double apply(double[] values, int from, int to, double percentile);

    public static List<String> names() {
        return Arrays.stream(values()).map(F0Method::methodName).toList();
    }

    public static F0Method parse(String name) {
        if (name != null) {
            String key = name.trim().toLowerCase(Locale.ROOT);
            for (F0Method method : values()) {
                if (method.methodName.equals(key)) return method;
            }
        }
        throw new UnknownMethodException(String.valueOf(name), names());
    }
}
