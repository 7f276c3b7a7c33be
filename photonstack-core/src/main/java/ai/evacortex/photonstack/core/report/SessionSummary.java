/*
 * PhotonStack — Two-Photon Imaging Pipeline
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.photonstack.core.report;

import ai.evacortex.photonstack.core.CanonicalStore;
import ai.evacortex.photonstack.core.exceptions.ContainerIOException;
import ai.evacortex.photonstack.core.ingest.RecordingIngestor;
import ai.evacortex.photonstack.core.motion.MotionCorrectionStage;
import ai.evacortex.photonstack.core.storage.ContainerStore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static ai.evacortex.photonstack.core.storage.DatasetPaths.CORRECTED_IMAGING;
import static ai.evacortex.photonstack.core.storage.DatasetPaths.RAW_IMAGING;
import static ai.evacortex.photonstack.core.storage.DatasetPaths.TIMESTAMPS;

/**
 * Read-only facts about one session for report renderers.
 *
 * @param durationMs       acquisition duration from the notes file, {@code null} without timestamps
 * @param motionCorrection {@code null} until motion correction has completed
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SessionSummary(String sessionId,
                             Double durationMs,
                             int frameCount,
                             long fileSize,
                             MotionSummary motionCorrection) {

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record MotionSummary(String strategy, List<?> maxDisplacement, String processingTime) {}

    public static SessionSummary of(ContainerStore store) {
        String name = store.path().getFileName().toString();
        String sessionId = name.endsWith(ContainerStore.EXTENSION)
                ? name.substring(0, name.length() - ContainerStore.EXTENSION.length())
                : name;
        return of(sessionId, store, store.fileSize());
    }

    public static SessionSummary of(String sessionId, CanonicalStore store, long fileSize) {
        int frames = store.describe(RAW_IMAGING).frameCount();

        Double duration = null;
        if (store.exists(TIMESTAMPS)) {
            Object value = store.getAttributes(TIMESTAMPS).get(RecordingIngestor.DURATION_MS);
            if (value instanceof Number n) duration = n.doubleValue();
        }

        MotionSummary motion = null;
        if (store.exists(CORRECTED_IMAGING)) {
            Map<String, Object> attrs = store.getAttributes(CORRECTED_IMAGING);
            if (attrs.containsKey(MotionCorrectionStage.PROCESSING_TIME)) {
                Object bounds = attrs.get(MotionCorrectionStage.MAX_DISPLACEMENT);
                motion = new MotionSummary(
                        String.valueOf(attrs.get(MotionCorrectionStage.STRATEGY)),
                        bounds instanceof List<?> l ? l : null,
                        String.valueOf(attrs.get(MotionCorrectionStage.PROCESSING_TIME)));
            }
        }
        return new SessionSummary(sessionId, duration, frames, fileSize, motion);
    }

    public String toJson(ObjectMapper mapper) {
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(this);
        } catch (IOException e) {
            throw new ContainerIOException("Failed to serialise summary of " + sessionId, e);
        }
    }

    public void writeTo(Path target, ObjectMapper mapper) {
        try {
            mapper.writerWithDefaultPrettyPrinter().writeValue(target.toFile(), this);
        } catch (IOException e) {
            throw new ContainerIOException("Failed to write summary to " + target, e);
        }
    }
}
