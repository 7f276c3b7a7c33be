/*
 * PhotonStack — Two-Photon Imaging Pipeline
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.photonstack.core.storage;

import java.util.Objects;

/**
 * Compression algorithm plus level. Byte shuffling is on exactly when compression is.
 */
public record CompressionSpec(Compression algorithm, int level) {

    public static final int DEFAULT_GZIP_LEVEL = 4;

    public CompressionSpec {
        Objects.requireNonNull(algorithm, "algorithm");
        if (algorithm == Compression.GZIP) {
            if (level < 0 || level > 9) {
                throw new IllegalArgumentException("gzip level must be within 0..9, was " + level);
            }
        } else {
            level = 0;
        }
    }

    public static CompressionSpec none() {
        return new CompressionSpec(Compression.NONE, 0);
    }

    public static CompressionSpec lz4() {
        return new CompressionSpec(Compression.LZ4, 0);
    }

    public static CompressionSpec gzip(int level) {
        return new CompressionSpec(Compression.GZIP, level);
    }

    /** Parses an algorithm name with its default level. */
    public static CompressionSpec parse(String name) {
        Compression algorithm = Compression.parse(name);
        return new CompressionSpec(algorithm, algorithm == Compression.GZIP ? DEFAULT_GZIP_LEVEL : 0);
    }

    public static CompressionSpec parse(String name, int level) {
        return new CompressionSpec(Compression.parse(name), level);
    }

    public boolean shuffle() {
        return algorithm != Compression.NONE;
    }
}
