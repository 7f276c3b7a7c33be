/*
 * PhotonStack — Two-Photon Imaging Pipeline
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.photonstack.core.ingest;

import ai.evacortex.photonstack.core.NdArray;
import ai.evacortex.photonstack.core.exceptions.ContainerIOException;
import ai.evacortex.photonstack.core.io.FrameDecoder;
import ai.evacortex.photonstack.core.metadata.MetadataBundle;
import ai.evacortex.photonstack.core.metadata.MetadataResolver;
import ai.evacortex.photonstack.core.metadata.NotesEntry;
import ai.evacortex.photonstack.core.metadata.TimestampGenerator;
import ai.evacortex.photonstack.core.storage.CanonicalSchema;
import ai.evacortex.photonstack.core.storage.Chunking;
import ai.evacortex.photonstack.core.storage.ContainerStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Map;

import static ai.evacortex.photonstack.core.storage.DatasetPaths.RAW_IMAGING;
import static ai.evacortex.photonstack.core.storage.DatasetPaths.TIMESTAMPS;

/**
 * Converts one vendor recording into its canonical container.
 *
 * <p>The container is built under {@code <name>.psc.tmp} and moved into place only once complete,
 * so a failed ingestion never leaves a container behind. The typed INI metadata becomes the
 * attributes of {@code raw-imaging}.</p>
 */
public final class RecordingIngestor {

    private static final Logger log = LoggerFactory.getLogger(RecordingIngestor.class);

    public static final String DURATION_MS = "DURATION_MS";

    private final MetadataResolver resolver;

    public RecordingIngestor() {
        this(new MetadataResolver());
    }

    public RecordingIngestor(MetadataResolver resolver) {
        this.resolver = resolver;
    }

    public IngestResult ingest(Path recordingPath, IngestOptions options) {
        Recording recording = new Recording(recordingPath);
        prepareOutputDir(options.outputDir());
        Path container = recording.containerPath(options.outputDir());

        if (Files.exists(container) && !options.force()) {
            log.info("{} already exists, skipping {} (force to overwrite)", container.getFileName(), recordingPath.getFileName());
            return new IngestResult(recordingPath, container, true, -1);
        }

        MetadataBundle bundle = resolver.resolve(recordingPath, options.iniOverride(), options.descriptorOverride());
        NdArray raw = FrameDecoder.decode(recordingPath, bundle);

        NotesEntry notesEntry = null;
        NdArray timestamps = null;
        if (options.timestamps()) {
            Path notes = options.notesOverride() != null ? options.notesOverride() : MetadataResolver.notesPathFor(recordingPath);
            notesEntry = resolver.notesEntry(recordingPath, notes);
            double[] ts = TimestampGenerator.generate(notesEntry, bundle.frameCount());
            timestamps = NdArray.ofDoubles(new int[]{ts.length}, ts);
        }

        Path tmp = container.resolveSibling(container.getFileName() + ".tmp");
        try {
            Files.deleteIfExists(tmp);
            writeContainer(tmp, raw, bundle.metadata(), timestamps, notesEntry, options);
            move(tmp, container);
        } catch (IOException e) {
            throw new ContainerIOException("Failed to write container " + container, e);
        } finally {
            deleteQuietly(tmp);
        }

        log.info("Ingested {} → {} ({} frames, {})", recordingPath.getFileName(), container.getFileName(),
                bundle.frameCount(), bundle.sampleType());
        return new IngestResult(recordingPath, container, false, bundle.frameCount());
    }

    private static void writeContainer(Path target, NdArray raw, Map<String, Object> metadata,
                                       NdArray timestamps, NotesEntry notesEntry, IngestOptions options) {
        try (ContainerStore store = ContainerStore.create(target)) {
            store.batch(batch -> {
                batch.create(RAW_IMAGING, raw, Chunking.perFrame(), options.compression());
                batch.setAttributes(RAW_IMAGING, metadata);
                if (timestamps != null) {
                    batch.create(TIMESTAMPS, timestamps, Chunking.contiguous(), options.compression());
                    batch.setAttributes(TIMESTAMPS, Map.of(DURATION_MS, notesEntry.durationMs()));
                }
            });
            CanonicalSchema.validate(store);
        }
    }

    private static void prepareOutputDir(Path outputDir) {
        if (outputDir == null || Files.isDirectory(outputDir)) return;
        try {
            // parent must already exist
            Files.createDirectory(outputDir);
        } catch (IOException e) {
            throw new ContainerIOException("Cannot create output directory " + outputDir, e);
        }
    }

    private static void move(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deleteQuietly(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            log.warn("Failed to remove temporary file {}", path, e);
        }
    }
}
