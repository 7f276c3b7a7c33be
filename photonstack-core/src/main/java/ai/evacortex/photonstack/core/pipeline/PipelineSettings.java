/*
 * PhotonStack — Two-Photon Imaging Pipeline
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.photonstack.core.pipeline;

import ai.evacortex.photonstack.core.ingest.IngestOptions;
import ai.evacortex.photonstack.core.storage.CompressionSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Process-wide defaults, taken from system properties:
 * <ul>
 *   <li>{@code photonstack.compression}: compression of new datasets, default {@code lz4}</li>
 *   <li>{@code photonstack.compression.level}: deflate level, default 4; a malformed or
 *       out-of-range value is ignored with a warning</li>
 *   <li>{@code photonstack.timestamps}: derive timestamps from notes files on ingestion, default false</li>
 * </ul>
 * The chunk cache bound ({@code photonstack.chunkCache.maxBytes}) is read by the container store.
 */
public record PipelineSettings(CompressionSpec compression, boolean timestamps) {

    private static final Logger log = LoggerFactory.getLogger(PipelineSettings.class);

    public static PipelineSettings fromSystemProperties() {
        String name = System.getProperty("photonstack.compression", "lz4");
        int level = compressionLevel(System.getProperty("photonstack.compression.level"));
        CompressionSpec compression = CompressionSpec.parse(name, level);
        boolean timestamps = Boolean.parseBoolean(System.getProperty("photonstack.timestamps", "false"));
        return new PipelineSettings(compression, timestamps);
    }

    static int compressionLevel(String raw) {
        if (raw == null) return CompressionSpec.DEFAULT_GZIP_LEVEL;
        try {
            int level = Integer.parseInt(raw.strip());
            if (level >= 0 && level <= 9) return level;
        } catch (NumberFormatException e) {
            log.debug("Unparsable photonstack.compression.level", e);
        }
        log.warn("Ignoring photonstack.compression.level={}, using {}", raw, CompressionSpec.DEFAULT_GZIP_LEVEL);
        return CompressionSpec.DEFAULT_GZIP_LEVEL;
    }

    public IngestOptions ingestOptions() {
        return IngestOptions.defaultOptions()
                .withCompression(compression)
                .withTimestamps(timestamps, null);
    }
}
