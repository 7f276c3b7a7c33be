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
import ai.evacortex.photonstack.core.ingest.RecordingIngestor;
import ai.evacortex.photonstack.core.io.PathCollector;

import java.nio.file.Path;
import java.util.List;

/**
 * Batch ingestion of every {@code .raw} recording under a source path.
 */
public final class RawConversion {

    public static final List<String> EXTENSIONS = List.of(".raw");

    private final RecordingIngestor ingestor;

    public RawConversion(RecordingIngestor ingestor) {
        this.ingestor = ingestor;
    }

    public BatchReport convert(Path source, boolean recursive, String include, String exclude, IngestOptions options) {
        List<Path> recordings = PathCollector.findPaths(source, EXTENSIONS, recursive, true, include, exclude);
        return BatchProcessor.run("convert", recordings, path -> !ingestor.ingest(path, options).skipped());
    }
}
