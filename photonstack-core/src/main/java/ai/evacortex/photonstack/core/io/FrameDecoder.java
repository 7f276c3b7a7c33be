/*
 * PhotonStack — Two-Photon Imaging Pipeline
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.photonstack.core.io;

import ai.evacortex.photonstack.core.NdArray;
import ai.evacortex.photonstack.core.SampleType;
import ai.evacortex.photonstack.core.exceptions.FrameDecodeException;
import ai.evacortex.photonstack.core.metadata.MetadataBundle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.channels.FileChannel;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Decodes a headerless, frame-major binary stream into an {@link NdArray}.
 */
public final class FrameDecoder {

    private static final Logger log = LoggerFactory.getLogger(FrameDecoder.class);

    private FrameDecoder() {}

    /**
     * Reads {@code path} in one pass. The file length must equal the product of the bundle's
     * shape times the sample size.
     *
     * @throws FrameDecodeException if the file is shorter or longer than expected or unreadable
     */
    public static NdArray decode(Path path, MetadataBundle bundle) {
        long expected = bundle.expectedByteCount();
        if (expected > Integer.MAX_VALUE) {
            throw new FrameDecodeException("Recording " + path + " needs " + expected
                    + " bytes, above the in-memory limit of " + Integer.MAX_VALUE);
        }
        try (FileChannel channel = FileChannel.open(path, StandardOpenOption.READ)) {
            long actual = channel.size();
            if (actual != expected) {
                throw new FrameDecodeException("Recording " + path + " holds " + actual
                        + " bytes but its metadata describes " + expected + " bytes");
            }
            ByteBuffer buffer = ByteBuffer.allocate((int) expected);
            while (buffer.hasRemaining()) {
                if (channel.read(buffer) < 0) {
                    throw new FrameDecodeException("Unexpected end of stream in " + path
                            + " at byte " + buffer.position());
                }
            }
            buffer.flip();
            if (bundle.byteOrder().equals(ByteOrder.BIG_ENDIAN)) {
                swapBytes(buffer, bundle.sampleType());
            }
            log.debug("Decoded {} frames ({} bytes) from {}", bundle.frameCount(), expected, path.getFileName());
            return NdArray.wrap(bundle.sampleType(), bundle.shape(), buffer);
        } catch (IOException e) {
            throw new FrameDecodeException("Failed to read recording " + path, e);
        }
    }

    static void swapBytes(ByteBuffer buffer, SampleType type) {
        int width = type.byteSize();
        if (width == 1) return;
        byte[] array = buffer.array();
        int base = buffer.arrayOffset();
        for (int i = base; i + width <= base + buffer.limit(); i += width) {
            for (int lo = i, hi = i + width - 1; lo < hi; lo++, hi--) {
                byte tmp = array[lo];
                array[lo] = array[hi];
                array[hi] = tmp;
            }
        }
    }
}
