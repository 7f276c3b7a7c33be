/*
 * PhotonStack — Two-Photon Imaging Pipeline
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.photonstack.core.metadata;

import ai.evacortex.photonstack.core.exceptions.NotesEntryMatchException;

import java.nio.file.Path;
import java.util.List;

/**
 * Per-frame timestamps in milliseconds, evenly spread over a notes entry's duration.
 */
public final class TimestampGenerator {

    private TimestampGenerator() {}

    /**
     * @return {@code t[i] = i * (durationMs / frameCount)} for {@code i} in {@code [0, frameCount)}
     */
    public static double[] generate(NotesEntry entry, int frameCount) {
        if (frameCount <= 0) throw new IllegalArgumentException("frameCount must be positive, was " + frameCount);
        double step = entry.durationMs() / frameCount;
        double[] timestamps = new double[frameCount];
        for (int i = 0; i < frameCount; i++) timestamps[i] = i * step;
        return timestamps;
    }

    /**
     * The single entry whose file path names {@code recording}.
     *
     * @throws NotesEntryMatchException on zero or several matches
     */
    public static NotesEntry findEntry(List<NotesEntry> entries, Path recording) {
        List<NotesEntry> matches = entries.stream().filter(e -> e.matches(recording)).toList();
        if (matches.size() != 1) throw new NotesEntryMatchException(recording, matches.size());
        return matches.get(0);
    }
}
