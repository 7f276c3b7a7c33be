/*
 * PhotonStack — Two-Photon Imaging Pipeline
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.photonstack.core.report;

import ai.evacortex.photonstack.core.NdArray;
import ai.evacortex.photonstack.core.RecordingFixtures;
import ai.evacortex.photonstack.core.SampleType;
import ai.evacortex.photonstack.core.ingest.RecordingIngestor;
import ai.evacortex.photonstack.core.motion.MotionCorrectionStage;
import ai.evacortex.photonstack.core.storage.Chunking;
import ai.evacortex.photonstack.core.storage.CompressionSpec;
import ai.evacortex.photonstack.core.storage.ContainerStore;
import ai.evacortex.photonstack.core.storage.DatasetPaths;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SessionSummaryTest {

    @TempDir
    Path tempDir;

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void testFreshContainerHasNoOptionalSections() throws Exception {
        Path path = RecordingFixtures.writeContainer(tempDir, "Rec_001_XYT", RecordingFixtures.ramp(5, 2, 2));
        try (ContainerStore store = ContainerStore.open(path)) {
            SessionSummary summary = SessionSummary.of(store);

            assertEquals("Rec_001_XYT", summary.sessionId());
            assertEquals(5, summary.frameCount());
            assertNull(summary.durationMs());
            assertNull(summary.motionCorrection());
            assertEquals(store.fileSize(), summary.fileSize());

            JsonNode json = mapper.readTree(summary.toJson(mapper));
            assertFalse(json.has("durationMs"));
            assertFalse(json.has("motionCorrection"));
        }
    }

    @Test
    void testProcessedContainer() throws Exception {
        Path path = RecordingFixtures.writeContainer(tempDir, "Rec_002_XYT", RecordingFixtures.ramp(2, 2, 2));
        try (ContainerStore store = ContainerStore.open(path)) {
            store.batch(b -> {
                b.create(DatasetPaths.TIMESTAMPS, NdArray.ofDoubles(new int[]{2}, 0, 500), Chunking.contiguous(), CompressionSpec.none());
                b.setAttributes(DatasetPaths.TIMESTAMPS, Map.of(RecordingIngestor.DURATION_MS, 1000.0));
                b.create(DatasetPaths.CORRECTED_IMAGING, RecordingFixtures.ramp(2, 2, 2), Chunking.perFrame(), CompressionSpec.none());
                b.create(DatasetPaths.DISPLACEMENTS, NdArray.allocate(SampleType.FLOAT64, 2, 2), Chunking.contiguous(), CompressionSpec.none());
                b.setAttributes(DatasetPaths.CORRECTED_IMAGING, Map.of(
                        MotionCorrectionStage.STRATEGY, "MARKOV",
                        MotionCorrectionStage.MAX_DISPLACEMENT, List.of(50, 50),
                        MotionCorrectionStage.PROCESSING_TIME, "0h 1m 2.00s"));
            });
        }

        Path report = tempDir.resolve("summary.json");
        try (ContainerStore store = ContainerStore.open(path)) {
            SessionSummary.of(store).writeTo(report, mapper);
        }

        JsonNode json = mapper.readTree(report.toFile());
        assertEquals(1000.0, json.get("durationMs").asDouble());
        assertEquals(2, json.get("frameCount").asInt());
        assertEquals("MARKOV", json.get("motionCorrection").get("strategy").asText());
        assertEquals(50, json.get("motionCorrection").get("maxDisplacement").get(1).asInt());
        assertEquals("0h 1m 2.00s", json.get("motionCorrection").get("processingTime").asText());
    }

    @Test
    void testUnfinishedMotionCorrectionIsNotReported() throws Exception {
        Path path = RecordingFixtures.writeContainer(tempDir, "Rec_003_XYT", RecordingFixtures.ramp(2, 2, 2));
        try (ContainerStore store = ContainerStore.open(path)) {
            store.batch(b -> {
                b.create(DatasetPaths.CORRECTED_IMAGING, RecordingFixtures.ramp(2, 2, 2), Chunking.perFrame(), CompressionSpec.none());
                b.create(DatasetPaths.DISPLACEMENTS, NdArray.allocate(SampleType.FLOAT64, 2, 2), Chunking.contiguous(), CompressionSpec.none());
            });
            assertNull(SessionSummary.of(store).motionCorrection());
        }
    }
}
