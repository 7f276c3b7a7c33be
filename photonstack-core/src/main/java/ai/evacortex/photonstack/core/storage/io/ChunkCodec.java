/*
 * PhotonStack — Two-Photon Imaging Pipeline
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.photonstack.core.storage.io;

import ai.evacortex.photonstack.core.exceptions.ContainerCorruptedException;
import ai.evacortex.photonstack.core.storage.Compression;
import ai.evacortex.photonstack.core.storage.CompressionSpec;
import net.jpountz.lz4.LZ4Compressor;
import net.jpountz.lz4.LZ4Exception;
import net.jpountz.lz4.LZ4Factory;
import net.jpountz.lz4.LZ4FastDecompressor;

import java.io.ByteArrayOutputStream;
import java.util.zip.DataFormatException;
import java.util.zip.Deflater;
import java.util.zip.Inflater;

/**
 * ChunkCodec turns the raw little-endian bytes of a chunk into the bytes stored on disk and back.
 *
 * <p>When compression is enabled the bytes are shuffled first: byte {@code b} of every element
 * is grouped with byte {@code b} of every other element.</p>
 */
public final class ChunkCodec {

    private static final LZ4Factory LZ4 = LZ4Factory.fastestInstance();
    private static final LZ4Compressor LZ4_COMPRESSOR = LZ4.fastCompressor();
    private static final LZ4FastDecompressor LZ4_DECOMPRESSOR = LZ4.fastDecompressor();

    private ChunkCodec() {}

    public static byte[] encode(byte[] raw, int elementSize, CompressionSpec spec) {
        if (spec.algorithm() == Compression.NONE) return raw;
        byte[] shuffled = shuffle(raw, elementSize);
        return switch (spec.algorithm()) {
            case LZ4 -> LZ4_COMPRESSOR.compress(shuffled);
            case GZIP -> deflate(shuffled, spec.level());
            case NONE -> shuffled;
        };
    }

    /**
     * @param rawLength decoded length recorded in the catalog
     * @throws ContainerCorruptedException if the stored bytes do not decode to {@code rawLength} bytes
     */
    public static byte[] decode(byte[] stored, int rawLength, int elementSize, CompressionSpec spec) {
        if (spec.algorithm() == Compression.NONE) {
            if (stored.length != rawLength) {
                throw new ContainerCorruptedException("Stored chunk holds " + stored.length + " bytes, expected " + rawLength);
            }
            return stored;
        }
        byte[] shuffled = switch (spec.algorithm()) {
            case LZ4 -> lz4Decompress(stored, rawLength);
            case GZIP -> inflate(stored, rawLength);
            case NONE -> stored;
        };
        return unshuffle(shuffled, elementSize);
    }

    static byte[] shuffle(byte[] raw, int elementSize) {
        if (elementSize <= 1) return raw.clone();
        int count = raw.length / elementSize;
        byte[] out = new byte[raw.length];
        for (int i = 0; i < count; i++) {
            for (int b = 0; b < elementSize; b++) {
                out[b * count + i] = raw[i * elementSize + b];
            }
        }
        return out;
    }

    static byte[] unshuffle(byte[] shuffled, int elementSize) {
        if (elementSize <= 1) return shuffled;
        int count = shuffled.length / elementSize;
        byte[] out = new byte[shuffled.length];
        for (int i = 0; i < count; i++) {
            for (int b = 0; b < elementSize; b++) {
                out[i * elementSize + b] = shuffled[b * count + i];
            }
        }
        return out;
    }

    private static byte[] lz4Decompress(byte[] stored, int rawLength) {
        try {
            return LZ4_DECOMPRESSOR.decompress(stored, rawLength);
        } catch (LZ4Exception e) {
            throw new ContainerCorruptedException("LZ4 chunk could not be decoded", e);
        }
    }

    private static byte[] deflate(byte[] input, int level) {
        Deflater deflater = new Deflater(level);
        try {
            deflater.setInput(input);
            deflater.finish();
            ByteArrayOutputStream out = new ByteArrayOutputStream(Math.max(64, input.length / 2));
            byte[] buf = new byte[8192];
            while (!deflater.finished()) {
                int n = deflater.deflate(buf);
                out.write(buf, 0, n);
            }
            return out.toByteArray();
        } finally {
            deflater.end();
        }
    }

    private static byte[] inflate(byte[] stored, int rawLength) {
        Inflater inflater = new Inflater();
        try {
            inflater.setInput(stored);
            byte[] out = new byte[rawLength];
            int filled = 0;
            while (filled < rawLength && !inflater.finished()) {
                int n = inflater.inflate(out, filled, rawLength - filled);
                if (n == 0 && (inflater.needsInput() || inflater.needsDictionary())) break;
                filled += n;
            }
            if (filled != rawLength || !inflater.finished()) {
                throw new ContainerCorruptedException("Deflate chunk decoded to " + filled + " bytes, expected " + rawLength);
            }
            return out;
        } catch (DataFormatException e) {
            throw new ContainerCorruptedException("Deflate chunk could not be decoded", e);
        } finally {
            inflater.end();
        }
    }
}
