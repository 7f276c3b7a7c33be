/*
 * PhotonStack — Two-Photon Imaging Pipeline
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.photonstack.core.storage;

/**
 * Number of leading-axis frames stored per chunk.
 */
public record Chunking(int framesPerChunk) {

    public Chunking {
        if (framesPerChunk <= 0) {
            throw new IllegalArgumentException("framesPerChunk must be positive, was " + framesPerChunk);
        }
    }

    /** One frame per chunk, so single frames can be read without touching their neighbours. */
    public static Chunking perFrame() {
        return new Chunking(1);
    }

    /** The whole dataset in a single chunk. */
    public static Chunking contiguous() {
        return new Chunking(Integer.MAX_VALUE);
    }

    public int chunkCount(int frameCount) {
        if (frameCount == 0) return 1;
        return (int) ((frameCount + (long) framesPerChunk - 1) / framesPerChunk);
    }
}
