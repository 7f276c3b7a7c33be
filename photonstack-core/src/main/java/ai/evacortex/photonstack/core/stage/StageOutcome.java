/*
 * PhotonStack — Two-Photon Imaging Pipeline
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.photonstack.core.stage;

import java.nio.file.Path;
import java.time.Duration;

/**
 * What {@link StageRunner#run} did for one container.
 */
public record StageOutcome(String stage, Path container, Status status, Duration elapsed) {

    public enum Status { SKIPPED, COMPLETED }

    public static StageOutcome skipped(String stage, Path container) {
        return new StageOutcome(stage, container, Status.SKIPPED, Duration.ZERO);
    }

    public boolean isSkipped() {
        return status == Status.SKIPPED;
    }
}
