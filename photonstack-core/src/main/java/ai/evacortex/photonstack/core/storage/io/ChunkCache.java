/*
 * PhotonStack — Two-Photon Imaging Pipeline
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.photonstack.core.storage.io;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;

import java.util.function.Function;

/**
 * Decoded chunks, bounded by total bytes.
 *
 * <p>Keys carry the dataset's generation so a dataset replaced under the same path never
 * serves stale chunks; superseded entries simply age out.</p>
 */
public final class ChunkCache {

    /* (datasetPath, generation) identifies one immutable write of a dataset */
    public record Key(String datasetPath, long generation, int chunkIndex) {}

    private final Cache<Key, byte[]> cache;

    public ChunkCache(long maxBytes) {
        this.cache = Caffeine.newBuilder()
                .maximumWeight(Math.max(0L, maxBytes))
                .weigher((Key k, byte[] v) -> v.length)
                .build();
    }

    public byte[] get(Key key, Function<Key, byte[]> loader) {
        return cache.get(key, loader);
    }

    public void invalidateDataset(String datasetPath) {
        cache.asMap().keySet().removeIf(k -> k.datasetPath().equals(datasetPath));
    }

    public void invalidateAll() {
        cache.invalidateAll();
        cache.cleanUp();
    }

    public long estimatedSize() {
        return cache.estimatedSize();
    }
}
