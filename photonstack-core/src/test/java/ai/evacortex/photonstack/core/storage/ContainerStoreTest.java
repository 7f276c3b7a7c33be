/*
 * PhotonStack — Two-Photon Imaging Pipeline
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.photonstack.core.storage;

import ai.evacortex.photonstack.core.NdArray;
import ai.evacortex.photonstack.core.RecordingFixtures;
import ai.evacortex.photonstack.core.SampleType;
import ai.evacortex.photonstack.core.exceptions.ContainerCorruptedException;
import ai.evacortex.photonstack.core.exceptions.DatasetAlreadyExistsException;
import ai.evacortex.photonstack.core.exceptions.DatasetNotFoundException;
import ai.evacortex.photonstack.core.exceptions.ImmutableDatasetException;
import ai.evacortex.photonstack.core.exceptions.UnknownCompressionException;
import ai.evacortex.photonstack.core.metadata.TypedIniParser;
import ai.evacortex.photonstack.core.storage.io.format.ContainerHeader;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.nio.ByteBuffer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ContainerStoreTest {

    @TempDir
    Path tempDir;

    private Path container(String name) {
        return tempDir.resolve(name + ContainerStore.EXTENSION);
    }

    @ParameterizedTest
    @ValueSource(strings = {"none", "lz4", "gzip"})
    void testWriteReopenRead(String compression) {
        NdArray raw = RecordingFixtures.ramp(5, 3, 4);
        Path path = container("roundtrip-" + compression);
        try (ContainerStore store = ContainerStore.create(path)) {
            store.create(DatasetPaths.RAW_IMAGING, raw, Chunking.perFrame(), CompressionSpec.parse(compression));
        }

        try (ContainerStore store = ContainerStore.open(path)) {
            assertEquals(Set.of(DatasetPaths.RAW_IMAGING), store.datasetPaths());
            assertTrue(raw.contentEquals(store.read(DatasetPaths.RAW_IMAGING)));

            DatasetInfo info = store.describe(DatasetPaths.RAW_IMAGING);
            assertEquals(SampleType.UINT16, info.sampleType());
            assertArrayEquals(new int[]{5, 3, 4}, info.shape());
            assertArrayEquals(new int[]{1, 3, 4}, info.chunkShape());
            assertEquals(5, info.chunkCount());
            assertEquals(Compression.parse(compression), info.compression().algorithm());
            assertEquals(!"none".equals(compression), info.shuffle());
        }
    }

    @Test
    void testReadFrameAcrossChunkings() {
        NdArray raw = RecordingFixtures.ramp(7, 2, 3);
        try (ContainerStore store = ContainerStore.create(container("frames"))) {
            store.create("per-frame", raw, Chunking.perFrame(), CompressionSpec.lz4());
            store.create("by-three", raw, new Chunking(3), CompressionSpec.gzip(6));
            store.create("contiguous", raw, Chunking.contiguous(), CompressionSpec.none());

            assertEquals(3, store.describe("by-three").chunkCount());
            assertArrayEquals(new int[]{7, 2, 3}, store.describe("contiguous").chunkShape());
            for (String path : List.of("per-frame", "by-three", "contiguous")) {
                for (int t = 0; t < 7; t++) {
                    NdArray frame = store.readFrame(path, t);
                    assertArrayEquals(new int[]{2, 3}, frame.shape());
                    assertTrue(raw.frame(t).contentEquals(frame), path + " frame " + t);
                }
            }
            assertThrows(IndexOutOfBoundsException.class, () -> store.readFrame("per-frame", 7));
        }
    }

    @Test
    void testCreateExistingFails() {
        try (ContainerStore store = ContainerStore.create(container("dup"))) {
            NdArray ts = NdArray.ofDoubles(new int[]{2}, 0.0, 33.3);
            store.create(DatasetPaths.TIMESTAMPS, ts, Chunking.contiguous(), CompressionSpec.none());
            assertThrows(DatasetAlreadyExistsException.class,
                    () -> store.create(DatasetPaths.TIMESTAMPS, ts, Chunking.contiguous(), CompressionSpec.none()));
        }
    }

    @Test
    void testDeleteAbsentIsSilentAndRawIsImmutable() {
        Path path = RecordingFixtures.writeContainer(tempDir, "immutable", RecordingFixtures.ramp(2, 2, 2));
        try (ContainerStore store = ContainerStore.open(path)) {
            long before = store.fileSize();
            store.delete(DatasetPaths.CORRECTED_IMAGING);
            assertEquals(before, store.fileSize());

            assertThrows(ImmutableDatasetException.class, () -> store.delete(DatasetPaths.RAW_IMAGING));
            assertTrue(store.exists(DatasetPaths.RAW_IMAGING));
        }
    }

    @Test
    void testAttributesMergeAndRoundTrip() {
        Path path = RecordingFixtures.writeContainer(tempDir, "attrs", RecordingFixtures.ramp(2, 2, 2));
        try (ContainerStore store = ContainerStore.open(path)) {
            store.setAttributes(DatasetPaths.RAW_IMAGING, Map.of("frame.rate", 30.5, "objective", "Nikon 16x"));
            store.setAttributes(DatasetPaths.RAW_IMAGING, Map.of(
                    "frame.count", 2,
                    "frame.rate", 15.25,
                    "bidirectional", true,
                    "displacement", new int[]{50, 40}));
            assertThrows(DatasetNotFoundException.class,
                    () -> store.setAttributes(DatasetPaths.DISPLACEMENTS, Map.of("a", 1)));
            assertThrows(IllegalArgumentException.class,
                    () -> store.setAttributes(DatasetPaths.RAW_IMAGING, Map.of("bad", new Object())));
        }

        try (ContainerStore store = ContainerStore.open(path)) {
            Map<String, Object> attrs = store.getAttributes(DatasetPaths.RAW_IMAGING);
            assertEquals(5, attrs.size());
            assertEquals(15.25, attrs.get("frame.rate"));
            assertEquals("Nikon 16x", attrs.get("objective"));
            assertEquals(2L, attrs.get("frame.count"));
            assertEquals(Boolean.TRUE, attrs.get("bidirectional"));
            assertEquals(List.of(50L, 40L), attrs.get("displacement"));
        }
    }

    @Test
    void testTypedIniValuesKeepTheirTypes() {
        Map<String, Object> typed = new java.util.LinkedHashMap<>();
        typed.put("frame.count", TypedIniParser.coerce("1200"));
        typed.put("frame.rate", TypedIniParser.coerce("30.5"));
        typed.put("bidirectional", TypedIniParser.coerce("yes"));
        typed.put("channels", List.of(TypedIniParser.coerce("1"), TypedIniParser.coerce("2")));

        Path path = RecordingFixtures.writeContainer(tempDir, "typed", RecordingFixtures.ramp(1, 1, 1));
        try (ContainerStore store = ContainerStore.open(path)) {
            store.setAttributes(DatasetPaths.RAW_IMAGING, typed);
        }
        try (ContainerStore store = ContainerStore.open(path)) {
            Map<String, Object> attrs = store.getAttributes(DatasetPaths.RAW_IMAGING);
            assertEquals(typed, attrs);
            assertInstanceOf(Long.class, attrs.get("frame.count"));
        }
    }

    @Test
    void testFailedBatchLeavesNoTrace() throws Exception {
        Path path = RecordingFixtures.writeContainer(tempDir, "rollback", RecordingFixtures.ramp(3, 2, 2));
        long sizeBefore = Files.size(path);
        try (ContainerStore store = ContainerStore.open(path)) {
            NdArray corrected = RecordingFixtures.ramp(3, 2, 2);
            assertThrows(IllegalStateException.class, () -> store.batch(b -> {
                b.create(DatasetPaths.CORRECTED_IMAGING, corrected, Chunking.perFrame(), CompressionSpec.none());
                assertTrue(b.exists(DatasetPaths.CORRECTED_IMAGING));
                throw new IllegalStateException("estimator crashed");
            }));
            assertFalse(store.exists(DatasetPaths.CORRECTED_IMAGING));
            assertEquals(sizeBefore, store.fileSize());
        }
        try (ContainerStore store = ContainerStore.open(path)) {
            assertEquals(Set.of(DatasetPaths.RAW_IMAGING), store.datasetPaths());
        }
    }

    @Test
    void testUncommittedContainerIsRejected() throws Exception {
        Path path = container("uncommitted");
        Files.write(path, ContainerHeader.uncommitted(0L).toBytes());
        assertThrows(ContainerCorruptedException.class, () -> ContainerStore.open(path));
    }

    @Test
    void testForeignFileIsRejected() throws Exception {
        Path path = container("foreign");
        Files.write(path, new byte[ContainerHeader.SIZE * 2]);
        assertThrows(ContainerCorruptedException.class, () -> ContainerStore.open(path));
        Path tiny = container("tiny");
        Files.write(tiny, new byte[3]);
        assertThrows(ContainerCorruptedException.class, () -> ContainerStore.open(tiny));
    }

    @Test
    void testCatalogChecksumMismatch() throws Exception {
        Path path = RecordingFixtures.writeContainer(tempDir, "catalog", RecordingFixtures.ramp(2, 2, 2));
        byte[] bytes = Files.readAllBytes(path);
        ContainerHeader header = ContainerHeader.from(ByteBuffer.wrap(bytes));
        int target = (int) header.catalogOffset() + header.catalogLength() / 2;
        bytes[target] ^= 0x20;
        Files.write(path, bytes);

        ContainerCorruptedException e = assertThrows(ContainerCorruptedException.class, () -> ContainerStore.open(path));
        assertTrue(e.getMessage().contains("checksum"), e.getMessage());
    }

    @Test
    void testChunkChecksumMismatch() throws Exception {
        NdArray pattern = NdArray.allocate(SampleType.UINT8, 2, 4, 4);
        for (int i = 0; i < pattern.size(); i++) pattern.setDouble(i, 200 - i);
        Path path = container("chunk");
        try (ContainerStore store = ContainerStore.create(path)) {
            store.create(DatasetPaths.RAW_IMAGING, pattern, Chunking.perFrame(), CompressionSpec.none());
        }

        byte[] bytes = Files.readAllBytes(path);
        int at = indexOf(bytes, pattern.frame(1).toByteArray());
        assertTrue(at > 0);
        bytes[at + 5] ^= 0x01;
        Files.write(path, bytes);

        try (ContainerStore store = ContainerStore.open(path)) {
            assertTrue(pattern.frame(0).contentEquals(store.readFrame(DatasetPaths.RAW_IMAGING, 0)));
            assertThrows(ContainerCorruptedException.class, () -> store.readFrame(DatasetPaths.RAW_IMAGING, 1));
            assertThrows(ContainerCorruptedException.class, () -> store.read(DatasetPaths.RAW_IMAGING));
        }
    }

    @Test
    void testTrailingUncommittedBytesAreDiscarded() throws Exception {
        Path path = RecordingFixtures.writeContainer(tempDir, "tail", RecordingFixtures.ramp(2, 2, 2));
        long committed = Files.size(path);
        Files.write(path, new byte[]{1, 2, 3, 4, 5}, java.nio.file.StandardOpenOption.APPEND);

        try (ContainerStore store = ContainerStore.open(path)) {
            assertEquals(committed, store.fileSize());
            assertTrue(store.exists(DatasetPaths.RAW_IMAGING));
        }
    }

    @Test
    void testCompactReclaimsReplacedData() {
        NdArray raw = RecordingFixtures.ramp(4, 8, 8);
        Path path = RecordingFixtures.writeContainer(tempDir, "compact", raw);
        try (ContainerStore store = ContainerStore.open(path)) {
            for (int i = 0; i < 3; i++) {
                store.batch(b -> {
                    b.delete(DatasetPaths.CORRECTED_IMAGING);
                    b.create(DatasetPaths.CORRECTED_IMAGING, raw, Chunking.perFrame(), CompressionSpec.none());
                });
            }
            store.setAttributes(DatasetPaths.CORRECTED_IMAGING, Map.of("pass", 3));
            long before = store.fileSize();

            long reclaimed = store.compact();

            assertTrue(reclaimed > 0);
            assertEquals(before - reclaimed, store.fileSize());
            assertTrue(raw.contentEquals(store.read(DatasetPaths.CORRECTED_IMAGING)));
            assertEquals(3L, store.getAttributes(DatasetPaths.CORRECTED_IMAGING).get("pass"));
        }
        assertFalse(Files.exists(path.resolveSibling(path.getFileName() + ".compact.tmp")));
        try (ContainerStore store = ContainerStore.open(path)) {
            assertTrue(raw.contentEquals(store.read(DatasetPaths.RAW_IMAGING)));
        }
    }

    @Test
    void testCreateRefusesExistingFile() {
        Path path = RecordingFixtures.writeContainer(tempDir, "exists", RecordingFixtures.ramp(1, 1, 1));
        assertThrows(RuntimeException.class, () -> ContainerStore.create(path));
        try (ContainerStore store = ContainerStore.openOrCreate(path)) {
            assertTrue(store.exists(DatasetPaths.RAW_IMAGING));
        }
    }

    @Test
    void testClosedStoreRejectsCalls() {
        ContainerStore store = ContainerStore.create(container("closed"));
        store.close();
        store.close();
        assertThrows(IllegalStateException.class, store::datasetPaths);
    }

    @Test
    void testChunkCacheBoundFallsBackOnBadValues() {
        assertEquals(ContainerStore.DEFAULT_CHUNK_CACHE_BYTES, ContainerStore.chunkCacheBytes(null));
        assertEquals(1024L, ContainerStore.chunkCacheBytes(" 1024 "));
        assertEquals(0L, ContainerStore.chunkCacheBytes("0"));
        assertEquals(ContainerStore.DEFAULT_CHUNK_CACHE_BYTES, ContainerStore.chunkCacheBytes("64MB"));
        assertEquals(ContainerStore.DEFAULT_CHUNK_CACHE_BYTES, ContainerStore.chunkCacheBytes("-1"));
    }

    @Test
    void testUnknownCompression() {
        UnknownCompressionException e = assertThrows(UnknownCompressionException.class,
                () -> CompressionSpec.parse("zstd"));
        assertTrue(e.getMessage().contains("lz4"), e.getMessage());
        assertEquals(Compression.LZ4, CompressionSpec.parse("LZF").algorithm());
        assertEquals(CompressionSpec.DEFAULT_GZIP_LEVEL, CompressionSpec.parse("gzip").level());
        assertThrows(IllegalArgumentException.class, () -> CompressionSpec.gzip(10));
    }

    private static int indexOf(byte[] haystack, byte[] needle) {
        outer:
        for (int i = 0; i + needle.length <= haystack.length; i++) {
            for (int j = 0; j < needle.length; j++) {
                if (haystack[i + j] != needle[j]) continue outer;
            }
            return i;
        }
        return -1;
    }
}
