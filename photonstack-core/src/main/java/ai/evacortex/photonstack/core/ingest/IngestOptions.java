/*
 * PhotonStack — Two-Photon Imaging Pipeline
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.photonstack.core.ingest;

import ai.evacortex.photonstack.core.storage.CompressionSpec;

import java.nio.file.Path;

/**
 * Options of one ingestion. Null paths mean "derive from the recording".
 */
public record IngestOptions(
        Path outputDir,                 // directory of the container; its parent must exist
        Path iniOverride,               // instead of <stem>.ini
        Path descriptorOverride,        // instead of the sibling OME-XML file
        boolean timestamps,             // derive per-frame timestamps from the notes file
        Path notesOverride,             // instead of <stem>.notes.txt
        CompressionSpec compression,
        boolean force                   // replace an existing container
) {
    public static IngestOptions defaultOptions() {
        return new IngestOptions(null, null, null, false, null, CompressionSpec.lz4(), false);
    }

    public IngestOptions withOutputDir(Path dir) {
        return new IngestOptions(dir, iniOverride, descriptorOverride, timestamps, notesOverride, compression, force);
    }

    public IngestOptions withOverrides(Path ini, Path descriptor) {
        return new IngestOptions(outputDir, ini, descriptor, timestamps, notesOverride, compression, force);
    }

    public IngestOptions withTimestamps(boolean enabled, Path notes) {
        return new IngestOptions(outputDir, iniOverride, descriptorOverride, enabled, notes, compression, force);
    }

    public IngestOptions withCompression(CompressionSpec spec) {
        return new IngestOptions(outputDir, iniOverride, descriptorOverride, timestamps, notesOverride, spec, force);
    }

    public IngestOptions withForce(boolean enabled) {
        return new IngestOptions(outputDir, iniOverride, descriptorOverride, timestamps, notesOverride, compression, enabled);
    }
}
