/*
 * PhotonStack — Two-Photon Imaging Pipeline
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.photonstack.core.storage;

import ai.evacortex.photonstack.core.CanonicalStore;
import ai.evacortex.photonstack.core.exceptions.SchemaViolationException;

import java.util.Arrays;

import static ai.evacortex.photonstack.core.storage.DatasetPaths.CORRECTED_IMAGING;
import static ai.evacortex.photonstack.core.storage.DatasetPaths.DISPLACEMENTS;
import static ai.evacortex.photonstack.core.storage.DatasetPaths.RAW_IMAGING;
import static ai.evacortex.photonstack.core.storage.DatasetPaths.TIMESTAMPS;

/**
 * Structural rules every canonical container must satisfy.
 */
public final class CanonicalSchema {

    private CanonicalSchema() {}

    /**
     * @throws SchemaViolationException naming the first rule broken
     */
    public static void validate(CanonicalStore store) {
        if (!store.exists(RAW_IMAGING)) {
            throw new SchemaViolationException("'" + RAW_IMAGING + "' is missing");
        }
        DatasetInfo raw = store.describe(RAW_IMAGING);
        int[] rawShape = raw.shape();
        if (rawShape.length < 3 || rawShape.length > 4) {
            throw new SchemaViolationException("'" + RAW_IMAGING + "' must be (T, Y, X[, C]), is " + Arrays.toString(rawShape));
        }
        int frames = rawShape[0];

        if (store.exists(TIMESTAMPS)) {
            int[] ts = store.describe(TIMESTAMPS).shape();
            if (ts.length != 1 || ts[0] != frames) {
                throw new SchemaViolationException("'" + TIMESTAMPS + "' has shape " + Arrays.toString(ts)
                        + " but raw imaging has " + frames + " frames");
            }
        }

        boolean corrected = store.exists(CORRECTED_IMAGING);
        boolean displacements = store.exists(DISPLACEMENTS);
        if (corrected != displacements) {
            throw new SchemaViolationException("'" + CORRECTED_IMAGING + "' and '" + DISPLACEMENTS
                    + "' must be present together");
        }
        if (corrected) {
            DatasetInfo c = store.describe(CORRECTED_IMAGING);
            if (!Arrays.equals(c.shape(), rawShape)) {
                throw new SchemaViolationException("'" + CORRECTED_IMAGING + "' has shape " + Arrays.toString(c.shape())
                        + ", raw imaging " + Arrays.toString(rawShape));
            }
            if (c.sampleType() != raw.sampleType()) {
                throw new SchemaViolationException("'" + CORRECTED_IMAGING + "' is " + c.sampleType()
                        + ", raw imaging " + raw.sampleType());
            }
            int[] d = store.describe(DISPLACEMENTS).shape();
            if (d.length != 2 || d[0] != c.frameCount() || d[1] != 2) {
                throw new SchemaViolationException("'" + DISPLACEMENTS + "' must be (" + c.frameCount()
                        + ", 2), is " + Arrays.toString(d));
            }
        }
    }
}
