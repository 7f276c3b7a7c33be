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
import ai.evacortex.photonstack.core.exceptions.ContainerIOException;
import ai.evacortex.photonstack.core.storage.ContainerStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Comparator;
import java.util.Map;
import java.util.function.LongSupplier;
import java.util.stream.Stream;

/**
 * StageRunner drives a {@link ProcessingStage} through Unprocessed → Processed on one container.
 *
 * <h3>Sequence</h3>
 * <ol>
 *   <li>If the stage is already complete and {@code force} is not set, log and return SKIPPED.
 *       The container is not touched.</li>
 *   <li>Delete a stale scratch directory left by an interrupted run.</li>
 *   <li>Run {@link ProcessingStage#compute} and measure its elapsed time.</li>
 *   <li>In one commit, delete the previous outputs and write the new ones.</li>
 *   <li>Set the completion attributes on the marker dataset.</li>
 *   <li>Remove the scratch directory, whether the run succeeded or not.</li>
 * </ol>
 *
 * <p>An interrupted run therefore leaves either the old outputs or the new outputs without their
 * marker, and the next run redoes the stage. The runner does not serialise concurrent runs on the
 * same container; callers must.</p>
 */
public final class StageRunner {

    private static final Logger log = LoggerFactory.getLogger(StageRunner.class);

    private final LongSupplier nanoClock;

    public StageRunner() {
        this(System::nanoTime);
    }

    public StageRunner(LongSupplier nanoClock) {
        this.nanoClock = nanoClock;
    }

    public <R> StageOutcome run(Path containerPath, ProcessingStage<R> stage, boolean force) {
        try (ContainerStore store = ContainerStore.open(containerPath)) {
            return run(store, containerPath, stage, force);
        }
    }

    public <R> StageOutcome run(CanonicalStore store, Path containerPath, ProcessingStage<R> stage, boolean force) {
        if (isProcessed(store, stage)) {
            if (!force) {
                log.info("'{}' already done for {}, skipping (force to redo)", stage.name(), containerPath.getFileName());
                return StageOutcome.skipped(stage.name(), containerPath);
            }
            log.info("'{}' already done for {}, redoing", stage.name(), containerPath.getFileName());
        }

        Path scratch = scratchDirFor(containerPath, stage);
        try {
            if (Files.exists(scratch)) {
                log.debug("Removing stale scratch directory {}", scratch);
                deleteRecursively(scratch);
            }

            long started = nanoClock.getAsLong();
            R result;
            try {
                result = stage.compute(store, scratch);
            } catch (IOException e) {
                throw new ContainerIOException("'" + stage.name() + "' failed on " + containerPath, e);
            }
            Duration elapsed = Duration.ofNanos(nanoClock.getAsLong() - started);
            log.debug("'{}' computed for {} in {}", stage.name(), containerPath.getFileName(), ElapsedTime.format(elapsed));

            store.batch(batch -> {
                for (String output : stage.outputPaths()) batch.delete(output);
                stage.writeOutputs(batch, result);
            });

            Map<String, Object> attributes = stage.completionAttributes(result, elapsed);
            if (!attributes.containsKey(stage.markerAttribute())) {
                throw new IllegalStateException("'" + stage.name() + "' did not produce its marker attribute "
                        + stage.markerAttribute());
            }
            store.setAttributes(stage.markerPath(), attributes);

            log.info("'{}' done for {} in {}", stage.name(), containerPath.getFileName(), ElapsedTime.format(elapsed));
            return new StageOutcome(stage.name(), containerPath, StageOutcome.Status.COMPLETED, elapsed);
        } finally {
            removeScratch(scratch);
        }
    }

    /** All outputs present and the marker attribute set. */
    public static boolean isProcessed(CanonicalStore store, ProcessingStage<?> stage) {
        for (String output : stage.outputPaths()) {
            if (!store.exists(output)) return false;
        }
        return store.exists(stage.markerPath())
                && store.getAttributes(stage.markerPath()).containsKey(stage.markerAttribute());
    }

    public static Path scratchDirFor(Path containerPath, ProcessingStage<?> stage) {
        return containerPath.resolveSibling("." + containerPath.getFileName() + "." + stage.scratchSuffix());
    }

    private static void removeScratch(Path scratch) {
        if (!Files.exists(scratch)) return;
        try {
            deleteRecursively(scratch);
        } catch (ContainerIOException e) {
            log.warn("Failed to remove scratch directory {}", scratch, e);
        }
    }

    static void deleteRecursively(Path root) {
        try (Stream<Path> walk = Files.walk(root)) {
            walk.sorted(Comparator.reverseOrder()).forEach(p -> {
                try {
                    Files.delete(p);
                } catch (IOException e) {
                    throw new UncheckedIOException(e);
                }
            });
        } catch (IOException | UncheckedIOException e) {
            throw new ContainerIOException("Failed to delete " + root, e);
        }
    }
}
