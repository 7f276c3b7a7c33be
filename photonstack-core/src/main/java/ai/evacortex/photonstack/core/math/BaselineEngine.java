/*
 * PhotonStack — Two-Photon Imaging Pipeline
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.photonstack.core.math;

import ai.evacortex.photonstack.core.NdArray;
import ai.evacortex.photonstack.core.SampleType;
import ai.evacortex.photonstack.core.exceptions.ArrayDimensionNotSupportedException;
import ai.evacortex.photonstack.core.exceptions.InvalidPercentileException;
import ai.evacortex.photonstack.core.exceptions.OutOfRangePercentileException;
import ai.evacortex.photonstack.core.exceptions.RollingWindowTooLargeException;

import java.util.Objects;

/**
 * Estimates the baseline fluorescence F0 of extracted signals.
 *
 * <p>Input is a rank-2 array, axis 0 = time and axis 1 = channel (one column per ROI).
 * With {@code windowWidth == 0} the statistic is computed once per channel over the whole
 * time axis and the result has shape {@code (C)}. With {@code windowWidth > 0} the time axis
 * is padded by {@code windowWidth / 2} samples on each side and the statistic for output
 * index {@code t} is taken over {@code padded[t, t + windowWidth)}; the result has the input's
 * shape. For odd widths the window is centred on {@code t}; for even widths it covers
 * {@code [t - w/2, t + w/2)}.</p>
 *
 * <h3>Validation order</h3>
 * Rank, method, percentile (percentile-based methods only), window width, padding mode.
 */
public final class BaselineEngine {

    public static final String DEFAULT_METHOD = F0Method.PERCENTILE.methodName();
    public static final String DEFAULT_PADDING = PaddingMode.REFLECT.modeName();

    private BaselineEngine() {}

    /** Global baseline with the given method. */
    public static NdArray computeF0(NdArray signals, String method, Double percentile) {
        return computeF0(signals, method, percentile, 0, DEFAULT_PADDING, 0.0);
    }

    public static NdArray computeF0(NdArray signals,
                                    String method,
                                    Double percentile,
                                    int windowWidth,
                                    String paddingMode,
                                    double constantValue) {
        checkRank(signals);
        F0Method parsedMethod = F0Method.parse(method);
        checkPercentile(parsedMethod, percentile);
        checkWindow(signals, windowWidth);
        PaddingMode parsedPadding = PaddingMode.parse(paddingMode);
        return estimate(signals, parsedMethod, percentile, windowWidth, parsedPadding, constantValue);
    }

    public static NdArray computeF0(NdArray signals,
                                    F0Method method,
                                    Double percentile,
                                    int windowWidth,
                                    PaddingMode paddingMode,
                                    double constantValue) {
        checkRank(signals);
        Objects.requireNonNull(method, "method must not be null");
        checkPercentile(method, percentile);
        checkWindow(signals, windowWidth);
        Objects.requireNonNull(paddingMode, "paddingMode must not be null");
        return estimate(signals, method, percentile, windowWidth, paddingMode, constantValue);
    }

    private static NdArray estimate(NdArray signals,
                                    F0Method method,
                                    Double percentile,
                                    int windowWidth,
                                    PaddingMode paddingMode,
                                    double constantValue) {
        int length = signals.dim(0);
        int channels = signals.dim(1);
        double p = percentile == null ? Double.NaN : percentile;

        if (windowWidth == 0) {
            NdArray f0 = NdArray.allocate(SampleType.FLOAT64, channels);
            for (int c = 0; c < channels; c++) {
                double[] column = column(signals, c);
                f0.setDouble(c, method.apply(column, 0, column.length, p));
            }
            return f0;
        }

        int pad = windowWidth / 2;
        NdArray f0 = NdArray.allocate(SampleType.FLOAT64, length, channels);
        for (int c = 0; c < channels; c++) {
            double[] padded = paddingMode.pad(column(signals, c), pad, constantValue);
            for (int t = 0; t < length; t++) {
                f0.set(method.apply(padded, t, t + windowWidth, p), t, c);
            }
        }
        return f0;
    }

    private static double[] column(NdArray signals, int channel) {
        int length = signals.dim(0);
        double[] out = new double[length];
        for (int t = 0; t < length; t++) out[t] = signals.get(t, channel);
        return out;
    }

    private static void checkRank(NdArray signals) {
        Objects.requireNonNull(signals, "signals must not be null");
        if (signals.rank() != 2) throw new ArrayDimensionNotSupportedException(signals.rank());
    }

    private static void checkPercentile(F0Method method, Double percentile) {
        if (!method.isPercentileBased()) return;
        if (percentile == null || percentile.isNaN()) throw new InvalidPercentileException(percentile);
        if (percentile < 0 || percentile > 100) throw new OutOfRangePercentileException(percentile);
    }

    private static void checkWindow(NdArray signals, int windowWidth) {
        if (windowWidth < 0) {
            throw new IllegalArgumentException("Window width must not be negative. Found: " + windowWidth);
        }
        int length = signals.dim(0);
        if (windowWidth > 0 && windowWidth > 2 * length - 1) throw new RollingWindowTooLargeException(windowWidth, length);
    }
}
