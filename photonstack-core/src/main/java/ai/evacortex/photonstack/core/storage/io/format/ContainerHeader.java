/*
 * PhotonStack — Two-Photon Imaging Pipeline
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.photonstack.core.storage.io.format;

import ai.evacortex.photonstack.core.exceptions.ContainerCorruptedException;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;

/**
 * ContainerHeader is the fixed-size record at offset 0 of every {@code .psc} container.
 * It points at the catalog of the last successful commit.
 *
 * <h3>Layout (little-endian)</h3>
 * <pre>
 * [MAGIC          4]  'PSCN'
 * [VERSION        2]
 * [TIMESTAMP      8]  millis of the commit
 * [CATALOG_OFFSET 8]
 * [CATALOG_LENGTH 4]
 * [CHECKSUM       8]  xxHash64 of the catalog bytes
 * [COMMIT_FLAG    1]  1 once the header describes a complete catalog
 * [padding]           to a multiple of 4
 * </pre>
 *
 * <p>The header is rewritten and forced to disk after the catalog it points at, so it always
 * describes either the previous or the new commit, never a partial one.</p>
 */
public final class ContainerHeader {

    public static final int MAGIC = 0x5053434E; // ASCII: 'PSCN'
    public static final int CURRENT_VERSION = 1;
    public static final byte COMMITTED = 1;
    public static final byte UNCOMMITTED = 0;

    private static final int MAGIC_LENGTH = 4;
    private static final int VERSION_LENGTH = 2;
    private static final int TIMESTAMP_LENGTH = 8;
    private static final int CATALOG_OFFSET_LENGTH = 8;
    private static final int CATALOG_LENGTH_LENGTH = 4;
    private static final int CHECKSUM_LENGTH = 8;
    private static final int COMMIT_FLAG_LENGTH = 1;

    public static final int SIZE = align(MAGIC_LENGTH + VERSION_LENGTH + TIMESTAMP_LENGTH
            + CATALOG_OFFSET_LENGTH + CATALOG_LENGTH_LENGTH + CHECKSUM_LENGTH + COMMIT_FLAG_LENGTH);

    private final int version;
    private final long timestamp;
    private final long catalogOffset;
    private final int catalogLength;
    private final long checksum;
    private final byte commitFlag;

    public ContainerHeader(int version, long timestamp, long catalogOffset, int catalogLength,
                           long checksum, byte commitFlag) {
        this.version = version;
        this.timestamp = timestamp;
        this.catalogOffset = catalogOffset;
        this.catalogLength = catalogLength;
        this.checksum = checksum;
        this.commitFlag = commitFlag;
    }

    /** Header of a freshly created file that has not seen its first commit. */
    public static ContainerHeader uncommitted(long timestamp) {
        return new ContainerHeader(CURRENT_VERSION, timestamp, SIZE, 0, 0L, UNCOMMITTED);
    }

    public byte[] toBytes() {
        ByteBuffer buf = ByteBuffer.allocate(SIZE).order(ByteOrder.LITTLE_ENDIAN);
        buf.putInt(MAGIC);
        buf.putShort((short) version);
        buf.putLong(timestamp);
        buf.putLong(catalogOffset);
        buf.putInt(catalogLength);
        buf.putLong(checksum);
        buf.put(commitFlag);
        return buf.array();
    }

    /**
     * @throws ContainerCorruptedException on a short buffer, a foreign magic or an unknown version
     */
    public static ContainerHeader from(ByteBuffer buf) {
        if (buf.remaining() < SIZE) {
            throw new ContainerCorruptedException("Container header truncated: " + buf.remaining() + " of " + SIZE + " bytes");
        }
        buf.order(ByteOrder.LITTLE_ENDIAN);

        int magic = buf.getInt();
        if (magic != MAGIC)
            throw new ContainerCorruptedException("Invalid magic: " + Integer.toHexString(magic));

        int version = buf.getShort() & 0xFFFF;
        if (version != CURRENT_VERSION)
            throw new ContainerCorruptedException("Unsupported container version: " + version);

        long timestamp = buf.getLong();
        long catalogOffset = buf.getLong();
        int catalogLength = buf.getInt();
        long checksum = buf.getLong();
        byte commitFlag = buf.get();
        buf.position(buf.position() + (SIZE - (MAGIC_LENGTH + VERSION_LENGTH + TIMESTAMP_LENGTH
                + CATALOG_OFFSET_LENGTH + CATALOG_LENGTH_LENGTH + CHECKSUM_LENGTH + COMMIT_FLAG_LENGTH)));

        return new ContainerHeader(version, timestamp, catalogOffset, catalogLength, checksum, commitFlag);
    }

    private static int align(int rawSize) {
        return (rawSize % 4 == 0) ? rawSize : rawSize + (4 - (rawSize % 4));
    }

    public int version()         { return version; }
    public long timestamp()      { return timestamp; }
    public long catalogOffset()  { return catalogOffset; }
    public int catalogLength()   { return catalogLength; }
    public long checksum()       { return checksum; }
    public byte commitFlag()     { return commitFlag; }
    public boolean isCommitted() { return commitFlag == COMMITTED; }
}
