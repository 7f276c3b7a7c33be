/*
 * PhotonStack — Two-Photon Imaging Pipeline
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.photonstack.core.storage;

import ai.evacortex.photonstack.core.SampleType;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Catalog record of one dataset.
 *
 * @param generation catalog generation of the commit that wrote the data
 */
public record DatasetEntry(String sampleType,
                           int[] shape,
                           int[] chunkShape,
                           int framesPerChunk,
                           String compression,
                           int level,
                           boolean shuffle,
                           long generation,
                           List<ChunkLocation> chunks,
                           Map<String, Object> attributes) {

    public DatasetEntry {
        chunks = List.copyOf(chunks);
        attributes = attributes == null ? new LinkedHashMap<>() : new LinkedHashMap<>(attributes);
    }

    public SampleType type() {
        return SampleType.fromName(sampleType);
    }

    public CompressionSpec compressionSpec() {
        return CompressionSpec.parse(compression, level);
    }

    public long storedBytes() {
        long total = 0;
        for (ChunkLocation c : chunks) total += c.length();
        return total;
    }

    public DatasetEntry withAttributes(Map<String, Object> merged) {
        return new DatasetEntry(sampleType, shape, chunkShape, framesPerChunk, compression, level, shuffle,
                generation, chunks, merged);
    }

    public DatasetEntry withChunks(List<ChunkLocation> relocated) {
        return new DatasetEntry(sampleType, shape, chunkShape, framesPerChunk, compression, level, shuffle,
                generation, relocated, attributes);
    }
}
