/*
 * PhotonStack — Two-Photon Imaging Pipeline
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.photonstack.core.math;

import ai.evacortex.photonstack.core.exceptions.UnknownPaddingModeException;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * How the time axis is extended beyond its edges before a rolling window is applied.
 * Index mapping follows the usual array-padding conventions:
 * <pre>
 *   source:      a b c d
 *   constant:  k k | a b c d | k k
 *   edge:      a a | a b c d | d d
 *   reflect:   c b | a b c d | c b
 *   symmetric: b a | a b c d | d c
 *   wrap:      c d | a b c d | a b
 * </pre>
 */
public enum PaddingMode {

    CONSTANT("constant"),
    EDGE("edge"),
    REFLECT("reflect"),
    SYMMETRIC("symmetric"),
    WRAP("wrap");

    private final String modeName;

    PaddingMode(String modeName) {
        this.modeName = modeName;
    }

    public String modeName() {
        return modeName;
    }

    public static List<String> names() {
        return Arrays.stream(values()).map(PaddingMode::modeName).toList();
    }

    public static PaddingMode parse(String name) {
        if (name != null) {
            String key = name.trim().toLowerCase(Locale.ROOT);
            for (PaddingMode mode : values()) {
                if (mode.modeName.equals(key)) return mode;
            }
        }
        throw new UnknownPaddingModeException(String.valueOf(name), names());
    }

    /**
     * Returns {@code source} extended by {@code pad} samples on each side.
     */
    public double[] pad(double[] source, int pad, double constantValue) {
        int n = source.length;
        double[] out = new double[n + 2 * pad];
        System.arraycopy(source, 0, out, pad, n);
        for (int k = 1; k <= pad; k++) {
            out[pad - k] = valueAt(source, -k, constantValue);
            out[pad + n - 1 + k] = valueAt(source, n - 1 + k, constantValue);
        }
        return out;
    }

    private double valueAt(double[] source, int index, double constantValue) {
        int n = source.length;
        return switch (this) {
            case CONSTANT -> constantValue;
            case EDGE -> source[index < 0 ? 0 : n - 1];
            case REFLECT -> source[reflect(index, n)];
            case SYMMETRIC -> source[symmetric(index, n)];
            case WRAP -> source[Math.floorMod(index, n)];
        };
    }

    private static int reflect(int index, int n) {
        if (n == 1) return 0;
        int period = 2 * (n - 1);
        int m = Math.floorMod(index, period);
        return m < n ? m : period - m;
    }

    private static int symmetric(int index, int n) {
        int period = 2 * n;
        int m = Math.floorMod(index, period);
        return m < n ? m : period - 1 - m;
    }
}
