/*
 * PhotonStack — Two-Photon Imaging Pipeline
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.photonstack.core.storage;

import net.jpountz.xxhash.XXHashFactory;

/**
 * xxHash digests used by the container: 32 bits per chunk, 64 bits for the catalog.
 */
public final class Checksums {

    private static final XXHashFactory XX_HASH = XXHashFactory.fastestInstance();
    private static final int SEED = 0x9747b28c;

    private Checksums() {}

    public static int chunk(byte[] bytes, int offset, int length) {
        return XX_HASH.hash32().hash(bytes, offset, length, SEED);
    }

    public static int chunk(byte[] bytes) {
        return chunk(bytes, 0, bytes.length);
    }

    public static long catalog(byte[] bytes) {
        return XX_HASH.hash64().hash(bytes, 0, bytes.length, SEED);
    }
}
