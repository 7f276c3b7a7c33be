/*
 * PhotonStack — Two-Photon Imaging Pipeline
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.photonstack.core.motion;

import ai.evacortex.photonstack.core.NdArray;
import ai.evacortex.photonstack.core.RecordingFixtures;
import ai.evacortex.photonstack.core.SampleType;
import ai.evacortex.photonstack.core.exceptions.MotionEstimateMismatchException;
import ai.evacortex.photonstack.core.stage.StageOutcome;
import ai.evacortex.photonstack.core.stage.StageRunner;
import ai.evacortex.photonstack.core.storage.CanonicalSchema;
import ai.evacortex.photonstack.core.storage.ContainerStore;
import ai.evacortex.photonstack.core.storage.DatasetInfo;
import ai.evacortex.photonstack.core.storage.DatasetPaths;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

class MotionCorrectionStageTest {

    private static final int T = 4, Y = 3, X = 5;

    @TempDir
    Path tempDir;

    private Path container;
    private NdArray raw;
    private final AtomicLong calls = new AtomicLong();
    private StageRunner runner;

    @BeforeEach
    void setUp() {
        raw = RecordingFixtures.ramp(T, Y, X);
        container = RecordingFixtures.writeContainer(tempDir, "session", raw);
        // n-th clock reading is n^2 seconds, so consecutive runs report different durations
        runner = new StageRunner(() -> {
            long n = calls.incrementAndGet();
            return n * n * 1_000_000_000L;
        });
    }

    /** Shifts every sample by +0.7 and reports a (t, -t) displacement, in the estimator's batched layout. */
    private final MotionEstimator fractional = (sequences, strategy, bounds, scratchDir) -> {
        NdArray in = sequences.get(0);
        NdArray corrected = NdArray.allocate(SampleType.FLOAT64, 1, T, Y, X, 1);
        for (int i = 0; i < in.size(); i++) corrected.setDouble(i, in.getDouble(i) + 0.7);
        corrected.setDouble(1, -5.0);
        corrected.setDouble(2, 70_000.0);
        NdArray displacements = NdArray.allocate(SampleType.FLOAT64, 1, T, 1, 2);
        for (int t = 0; t < T; t++) {
            displacements.setDouble(2L * t, t);
            displacements.setDouble(2L * t + 1, -t);
        }
        return new MotionEstimate(corrected, displacements);
    };

    private MotionCorrectionStage stage(MotionEstimator estimator) {
        return new MotionCorrectionStage(estimator, new MotionConfig(Strategy.FOURIER, new MaxDisplacement(10, 12)));
    }

    @Test
    void testCorrectionMatchesRawLayout() {
        StageOutcome outcome = runner.run(container, stage(fractional), false);
        assertEquals(StageOutcome.Status.COMPLETED, outcome.status());

        try (ContainerStore store = ContainerStore.open(container)) {
            CanonicalSchema.validate(store);

            DatasetInfo info = store.describe(DatasetPaths.CORRECTED_IMAGING);
            assertEquals(SampleType.UINT16, info.sampleType());
            assertArrayEquals(new int[]{T, Y, X}, info.shape());
            assertArrayEquals(new int[]{1, Y, X}, info.chunkShape());

            NdArray corrected = store.read(DatasetPaths.CORRECTED_IMAGING);
            assertEquals(0.0, corrected.getDouble(0));
            assertEquals(0.0, corrected.getDouble(1));
            assertEquals(65535.0, corrected.getDouble(2));
            assertEquals(17.0, corrected.getDouble(17));

            NdArray displacements = store.read(DatasetPaths.DISPLACEMENTS);
            assertArrayEquals(new int[]{T, 2}, displacements.shape());
            assertEquals(3.0, displacements.get(3, 0));
            assertEquals(-3.0, displacements.get(3, 1));

            Map<String, Object> attrs = store.getAttributes(DatasetPaths.CORRECTED_IMAGING);
            assertEquals("FOURIER", attrs.get(MotionCorrectionStage.STRATEGY));
            assertEquals(List.of(10L, 12L), attrs.get(MotionCorrectionStage.MAX_DISPLACEMENT));
            assertEquals("0h 0m 3.00s", attrs.get(MotionCorrectionStage.PROCESSING_TIME));
        }
    }

    @Test
    void testSecondRunIsByteIdentical() throws Exception {
        AtomicInteger estimates = new AtomicInteger();
        MotionEstimator counting = (s, st, b, d) -> {
            estimates.incrementAndGet();
            return fractional.correct(s, st, b, d);
        };
        runner.run(container, stage(counting), false);
        byte[] first = Files.readAllBytes(container);

        assertTrue(runner.run(container, stage(counting), false).isSkipped());

        assertEquals(1, estimates.get());
        assertArrayEquals(first, Files.readAllBytes(container));
    }

    @Test
    void testForceRecordsNewProcessingTime() {
        runner.run(container, stage(fractional), false);
        runner.run(container, stage(fractional), true);

        try (ContainerStore store = ContainerStore.open(container)) {
            assertEquals("0h 0m 7.00s", store.getAttributes(DatasetPaths.CORRECTED_IMAGING)
                    .get(MotionCorrectionStage.PROCESSING_TIME));
            assertTrue(raw.contentEquals(store.read(DatasetPaths.RAW_IMAGING)));
        }
    }

    @Test
    void testMismatchedEstimateWritesNothing() {
        MotionEstimator wrongSize = (sequences, strategy, bounds, scratchDir) -> {
            Files.createDirectories(scratchDir);
            return new MotionEstimate(NdArray.allocate(SampleType.FLOAT64, T, Y, X - 1),
                    NdArray.allocate(SampleType.FLOAT64, T, 2));
        };
        MotionCorrectionStage stage = stage(wrongSize);

        assertThrows(MotionEstimateMismatchException.class, () -> runner.run(container, stage, false));

        assertFalse(Files.exists(StageRunner.scratchDirFor(container, stage)));
        try (ContainerStore store = ContainerStore.open(container)) {
            assertEquals(java.util.Set.of(DatasetPaths.RAW_IMAGING), store.datasetPaths());
        }
    }

    @Test
    void testDisplacementsMustCoverEveryFrame() {
        NdArray tooFew = NdArray.allocate(SampleType.FLOAT64, 1, T - 1, 2);
        assertThrows(MotionEstimateMismatchException.class,
                () -> MotionCorrectionStage.flattenDisplacements(tooFew, T));
        NdArray wrongLeading = NdArray.allocate(SampleType.FLOAT64, 2, T);
        assertThrows(MotionEstimateMismatchException.class,
                () -> MotionCorrectionStage.flattenDisplacements(wrongLeading, T));
    }

    @Test
    void testSingleFrameRecording() {
        NdArray single = RecordingFixtures.ramp(1, 2, 2);
        NdArray corrected = NdArray.allocate(SampleType.FLOAT32, 1, 2, 2, 1);
        assertArrayEquals(new int[]{1, 2, 2}, MotionCorrectionStage.quantize(corrected, single).shape());
        NdArray pair = NdArray.ofDoubles(new int[]{1, 1, 2}, 0.5, -0.5);
        assertArrayEquals(new int[]{1, 2}, MotionCorrectionStage.flattenDisplacements(pair, 1).shape());
    }
}
