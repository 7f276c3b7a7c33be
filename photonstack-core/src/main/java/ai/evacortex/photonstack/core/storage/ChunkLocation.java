/*
 * PhotonStack — Two-Photon Imaging Pipeline
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.photonstack.core.storage;

/**
 * Where one stored chunk lives in the container file.
 *
 * @param offset    absolute file offset of the stored bytes
 * @param length    stored (compressed) length
 * @param rawLength decoded length
 * @param checksum  xxHash32 of the stored bytes
 */
public record ChunkLocation(long offset, int length, int rawLength, int checksum) {}
