/*
 * PhotonStack — Two-Photon Imaging Pipeline
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.photonstack.core.storage;

import java.util.List;

/**
 * Dataset paths of the canonical container layout.
 */
public final class DatasetPaths {

    public static final String RAW_IMAGING = "raw-imaging";
    public static final String TIMESTAMPS = "timestamps";
    public static final String CORRECTED_IMAGING = "corrected-imaging";
    public static final String DISPLACEMENTS = "displacements";

    /** Datasets fixed at ingestion that the store refuses to delete or replace. */
    public static final List<String> IMMUTABLE = List.of(RAW_IMAGING);

    private DatasetPaths() {}
}
