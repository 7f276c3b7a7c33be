/*
 * PhotonStack — Two-Photon Imaging Pipeline
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.photonstack.core.metadata;

/**
 * Outcome of one {@link DescriptorSource}: either a document or the reason there was none.
 */
public record DescriptorLookup(String source, String document, String failure) {

    public static DescriptorLookup found(String source, String document) {
        return new DescriptorLookup(source, document, null);
    }

    public static DescriptorLookup failed(String source, String reason) {
        return new DescriptorLookup(source, null, reason);
    }

    public boolean isFound() {
        return document != null;
    }
}
