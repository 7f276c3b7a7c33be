/*
 * PhotonStack — Two-Photon Imaging Pipeline
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.photonstack.core.metadata;

import java.nio.file.Path;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Locale;

/**
 * One acquisition block of a session notes file.
 *
 * @param filePath Windows-style path of the recording as written by the acquisition PC
 */
public record NotesEntry(LocalDateTime startTime, LocalDateTime endTime, String filePath) {

    public double durationMs() {
        return Duration.between(startTime, endTime).toNanos() / 1_000_000.0;
    }

    /** Final component of {@link #filePath()}, splitting on both separator styles. */
    public String fileName() {
        int cut = Math.max(filePath.lastIndexOf('\\'), filePath.lastIndexOf('/'));
        return filePath.substring(cut + 1).strip();
    }

    public boolean matches(Path recording) {
        return fileName().toLowerCase(Locale.ROOT)
                .equals(recording.getFileName().toString().toLowerCase(Locale.ROOT));
    }
}
