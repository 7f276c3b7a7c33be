/*
 * PhotonStack — Two-Photon Imaging Pipeline
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.photonstack.core.stage;

import ai.evacortex.photonstack.core.CanonicalStore;
import ai.evacortex.photonstack.core.NdArray;
import ai.evacortex.photonstack.core.RecordingFixtures;
import ai.evacortex.photonstack.core.SampleType;
import ai.evacortex.photonstack.core.exceptions.ContainerIOException;
import ai.evacortex.photonstack.core.storage.Chunking;
import ai.evacortex.photonstack.core.storage.CompressionSpec;
import ai.evacortex.photonstack.core.storage.ContainerBatch;
import ai.evacortex.photonstack.core.storage.ContainerStore;
import ai.evacortex.photonstack.core.storage.DatasetPaths;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

class StageRunnerTest {

    @TempDir
    Path tempDir;

    private Path container;
    private final AtomicLong clock = new AtomicLong();
    private StageRunner runner;

    @BeforeEach
    void setUp() {
        container = RecordingFixtures.writeContainer(tempDir, "session", RecordingFixtures.ramp(3, 2, 2));
        runner = new StageRunner(() -> clock.addAndGet(1_500_000_000L));
    }

    /** Writes the frame mean of raw imaging, using a scratch file along the way. */
    private static final class FrameMeanStage implements ProcessingStage<NdArray> {

        final AtomicInteger computeCalls = new AtomicInteger();
        boolean fail = false;
        boolean sawStaleScratch = false;

        @Override public String name() { return "frame-mean"; }
        @Override public String scratchSuffix() { return "mean"; }
        @Override public List<String> outputPaths() { return List.of("frame-mean"); }
        @Override public String markerPath() { return "frame-mean"; }
        @Override public String markerAttribute() { return "elapsed"; }

        @Override
        public NdArray compute(CanonicalStore store, Path scratchDir) throws IOException {
            computeCalls.incrementAndGet();
            sawStaleScratch = Files.exists(scratchDir);
            Files.createDirectories(scratchDir);
            Files.writeString(scratchDir.resolve("partial.txt"), "working");
            if (fail) throw new IOException("disk full");

            NdArray raw = store.read(DatasetPaths.RAW_IMAGING);
            NdArray mean = NdArray.allocate(SampleType.FLOAT64, raw.frameCount());
            for (int t = 0; t < raw.frameCount(); t++) {
                double[] values = raw.frame(t).toDoubleArray();
                double sum = 0;
                for (double v : values) sum += v;
                mean.setDouble(t, sum / values.length);
            }
            return mean;
        }

        @Override
        public void writeOutputs(ContainerBatch batch, NdArray result) {
            batch.create("frame-mean", result, Chunking.contiguous(), CompressionSpec.none());
        }

        @Override
        public Map<String, Object> completionAttributes(NdArray result, Duration elapsed) {
            return Map.of("elapsed", ElapsedTime.format(elapsed));
        }
    }

    @Test
    void testRunWritesOutputsAndMarker() {
        FrameMeanStage stage = new FrameMeanStage();
        StageOutcome outcome = runner.run(container, stage, false);

        assertEquals(StageOutcome.Status.COMPLETED, outcome.status());
        assertEquals(Duration.ofMillis(1500), outcome.elapsed());
        assertFalse(Files.exists(StageRunner.scratchDirFor(container, stage)));
        try (ContainerStore store = ContainerStore.open(container)) {
            assertTrue(StageRunner.isProcessed(store, stage));
            assertEquals(1.5, store.read("frame-mean").getDouble(0));
            assertEquals("0h 0m 1.50s", store.getAttributes("frame-mean").get("elapsed"));
        }
    }

    @Test
    void testProcessedContainerIsSkippedUntouched() throws Exception {
        FrameMeanStage stage = new FrameMeanStage();
        runner.run(container, stage, false);
        byte[] before = Files.readAllBytes(container);

        StageOutcome second = runner.run(container, stage, false);

        assertTrue(second.isSkipped());
        assertEquals(1, stage.computeCalls.get());
        assertArrayEquals(before, Files.readAllBytes(container));
    }

    @Test
    void testForceRedoesTheStage() {
        FrameMeanStage stage = new FrameMeanStage();
        runner.run(container, stage, false);
        StageOutcome forced = runner.run(container, stage, true);

        assertFalse(forced.isSkipped());
        assertEquals(2, stage.computeCalls.get());
        try (ContainerStore store = ContainerStore.open(container)) {
            assertEquals(1, store.describe("frame-mean").chunkCount());
        }
    }

    @Test
    void testFailedComputeLeavesContainerUnprocessed() {
        FrameMeanStage stage = new FrameMeanStage();
        stage.fail = true;

        ContainerIOException e = assertThrows(ContainerIOException.class, () -> runner.run(container, stage, false));
        assertInstanceOf(IOException.class, e.getCause());
        assertFalse(Files.exists(StageRunner.scratchDirFor(container, stage)));
        try (ContainerStore store = ContainerStore.open(container)) {
            assertFalse(StageRunner.isProcessed(store, stage));
            assertFalse(store.exists("frame-mean"));
        }
    }

    @Test
    void testStaleScratchIsClearedBeforeCompute() throws Exception {
        FrameMeanStage stage = new FrameMeanStage();
        Path scratch = StageRunner.scratchDirFor(container, stage);
        Files.createDirectories(scratch.resolve("nested"));
        Files.writeString(scratch.resolve("nested/leftover.bin"), "x");

        runner.run(container, stage, false);

        assertFalse(stage.sawStaleScratch);
        assertFalse(Files.exists(scratch));
    }

    @Test
    void testOutputsWithoutMarkerAreRedone() {
        FrameMeanStage stage = new FrameMeanStage();
        try (ContainerStore store = ContainerStore.open(container)) {
            store.create("frame-mean", NdArray.allocate(SampleType.FLOAT64, 3), Chunking.contiguous(), CompressionSpec.none());
            assertFalse(StageRunner.isProcessed(store, stage));
        }
        assertFalse(runner.run(container, stage, false).isSkipped());
    }

    @Test
    void testScratchDirNaming() {
        Path scratch = StageRunner.scratchDirFor(tempDir.resolve("a.psc"), new FrameMeanStage());
        assertEquals(tempDir.resolve(".a.psc.mean"), scratch);
    }

    @Test
    void testElapsedTimeFormat() {
        assertEquals("0h 0m 0.00s", ElapsedTime.format(Duration.ZERO));
        assertEquals("1h 2m 3.45s", ElapsedTime.format(Duration.ofMillis(3_723_450)));
        assertEquals("26h 0m 59.99s", ElapsedTime.format(Duration.ofHours(26).plusMillis(59_990)));
    }
}
