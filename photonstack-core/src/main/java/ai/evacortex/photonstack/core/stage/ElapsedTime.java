/*
 * PhotonStack — Two-Photon Imaging Pipeline
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.photonstack.core.stage;

import java.time.Duration;
import java.util.Locale;

/**
 * Human-readable durations such as {@code 1h 2m 3.45s}.
 */
public final class ElapsedTime {

    private ElapsedTime() {}

    public static String format(Duration elapsed) {
        long nanos = elapsed.toNanos();
        long hours = nanos / 3_600_000_000_000L;
        long minutes = (nanos / 60_000_000_000L) % 60;
        double seconds = (nanos % 60_000_000_000L) / 1e9;
        return String.format(Locale.ROOT, "%dh %dm %.2fs", hours, minutes, seconds);
    }
}
