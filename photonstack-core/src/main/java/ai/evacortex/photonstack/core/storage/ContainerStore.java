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
import ai.evacortex.photonstack.core.NdArray;
import ai.evacortex.photonstack.core.SampleType;
import ai.evacortex.photonstack.core.exceptions.ContainerCorruptedException;
import ai.evacortex.photonstack.core.exceptions.ContainerIOException;
import ai.evacortex.photonstack.core.exceptions.DatasetAlreadyExistsException;
import ai.evacortex.photonstack.core.exceptions.DatasetNotFoundException;
import ai.evacortex.photonstack.core.exceptions.ImmutableDatasetException;
import ai.evacortex.photonstack.core.storage.io.ChunkCache;
import ai.evacortex.photonstack.core.storage.io.ChunkCodec;
import ai.evacortex.photonstack.core.storage.io.format.ContainerHeader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Consumer;

/**
 * ContainerStore is the single-file {@link CanonicalStore} behind every recording ({@code *.psc}).
 *
 * <h3>File layout</h3>
 * <pre>
 * [ContainerHeader]           // points at the catalog of the last commit
 * [chunk blobs ...]           // appended, never rewritten in place
 * [catalog JSON]              // written after the blobs of its commit
 * [chunk blobs ...]
 * [catalog JSON]              // current
 * </pre>
 *
 * <h3>Commit protocol</h3>
 * A commit appends the new chunk blobs after the committed end of the file, appends the new
 * catalog, forces both to disk, then rewrites and forces the {@link ContainerHeader}. A failure
 * at any earlier step leaves the header pointing at the previous catalog, and the partial tail
 * is truncated. Space held by superseded blobs and catalogs is reclaimed by {@link #compact()}.
 *
 * <h3>Integrity</h3>
 * The catalog is verified against the xxHash64 in the header when the container is opened; each
 * chunk is verified against its xxHash32 when read. Mismatches raise
 * {@link ContainerCorruptedException}.
 *
 * <h3>Concurrency</h3>
 * Readers share a read lock; commits and compaction take the write lock. The store does not
 * coordinate across processes.
 *
 * @see ContainerHeader
 * @see ContainerCatalog
 * @see ChunkCodec
 */
public final class ContainerStore implements CanonicalStore, Closeable {

    private static final Logger log = LoggerFactory.getLogger(ContainerStore.class);

    public static final String EXTENSION = ".psc";

    static final String CHUNK_CACHE_PROPERTY = "photonstack.chunkCache.maxBytes";
    static final long DEFAULT_CHUNK_CACHE_BYTES = 64L << 20;

    private static final long CHUNK_CACHE_MAX_BYTES = chunkCacheBytes(System.getProperty(CHUNK_CACHE_PROPERTY));

    private final Path path;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final ChunkCache cache;
    private FileChannel channel;
    private ContainerCatalog catalog;
    private long committedEnd;
    private volatile boolean closed = false;

    private ContainerStore(Path path, FileChannel channel, long cacheBytes) {
        this.path = path;
        this.channel = channel;
        this.cache = new ChunkCache(cacheBytes);
    }

    /**
     * Creates a new empty container. The file must not exist.
     */
    public static ContainerStore create(Path path) {
        try {
            if (path.getParent() != null) Files.createDirectories(path.getParent());
            FileChannel channel = FileChannel.open(path,
                    StandardOpenOption.CREATE_NEW, StandardOpenOption.READ, StandardOpenOption.WRITE);
            ContainerStore store = new ContainerStore(path, channel, CHUNK_CACHE_MAX_BYTES);
            try {
                writeFully(channel, ByteBuffer.wrap(ContainerHeader.uncommitted(System.currentTimeMillis()).toBytes()), 0);
                store.committedEnd = ContainerHeader.SIZE;
                store.commit(ContainerCatalog.empty(), ContainerHeader.SIZE);
            } catch (RuntimeException e) {
                store.close();
                throw e;
            }
            log.debug("Created container {}", path);
            return store;
        } catch (IOException e) {
            throw new ContainerIOException("Failed to create container " + path, e);
        }
    }

    /**
     * Opens an existing container, validating its header and catalog.
     *
     * @throws ContainerCorruptedException if the container was never committed or fails its checksum
     */
    public static ContainerStore open(Path path) {
        FileChannel channel;
        try {
            channel = FileChannel.open(path, StandardOpenOption.READ, StandardOpenOption.WRITE);
        } catch (IOException e) {
            throw new ContainerIOException("Failed to open container " + path, e);
        }
        ContainerStore store = new ContainerStore(path, channel, CHUNK_CACHE_MAX_BYTES);
        try {
            store.load();
            return store;
        } catch (RuntimeException e) {
            store.close();
            throw e;
        }
    }

    /** Parsed cache bound, or the default with a warning when {@code raw} is not a non-negative number. */
    static long chunkCacheBytes(String raw) {
        if (raw == null) return DEFAULT_CHUNK_CACHE_BYTES;
        try {
            long bytes = Long.parseLong(raw.strip());
            if (bytes >= 0) return bytes;
        } catch (NumberFormatException e) {
            log.debug("Unparsable {}", CHUNK_CACHE_PROPERTY, e);
        }
        log.warn("Ignoring {}={}, using {} bytes", CHUNK_CACHE_PROPERTY, raw, DEFAULT_CHUNK_CACHE_BYTES);
        return DEFAULT_CHUNK_CACHE_BYTES;
    }

    public static ContainerStore openOrCreate(Path path) {
        return Files.exists(path) ? open(path) : create(path);
    }

    public Path path() {
        return path;
    }

    /* ---------- reads ---------- */

    @Override
    public boolean exists(String datasetPath) {
        lock.readLock().lock();
        try {
            ensureOpen();
            return catalog.datasets().containsKey(datasetPath);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public NdArray read(String datasetPath) {
        lock.readLock().lock();
        try {
            DatasetEntry entry = entry(datasetPath);
            SampleType type = entry.type();
            long total = (long) NdArray.elementCount(entry.shape()) * type.byteSize();
            if (total > Integer.MAX_VALUE) {
                throw new IllegalStateException("Dataset '" + datasetPath + "' of " + total + " bytes exceeds the in-memory limit");
            }
            ByteBuffer out = ByteBuffer.allocate((int) total);
            for (int i = 0; i < entry.chunks().size(); i++) {
                out.put(chunk(datasetPath, entry, i));
            }
            out.flip();
            return NdArray.wrap(type, entry.shape(), out);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public NdArray readFrame(String datasetPath, int index) {
        lock.readLock().lock();
        try {
            DatasetEntry entry = entry(datasetPath);
            int[] shape = entry.shape();
            if (shape.length == 0) throw new IllegalArgumentException("Dataset '" + datasetPath + "' has no frames");
            if (index < 0 || index >= shape[0]) {
                throw new IndexOutOfBoundsException("Frame " + index + " outside [0, " + shape[0] + ") of '" + datasetPath + "'");
            }
            int[] frameShape = Arrays.copyOfRange(shape, 1, shape.length);
            int frameBytes = NdArray.elementCount(frameShape) * entry.type().byteSize();
            int chunkIndex = index / entry.framesPerChunk();
            int within = index % entry.framesPerChunk();

            byte[] chunk = chunk(datasetPath, entry, chunkIndex);
            ByteBuffer frame = ByteBuffer.allocate(frameBytes);
            frame.put(chunk, within * frameBytes, frameBytes).flip();
            return NdArray.wrap(entry.type(), frameShape, frame);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public DatasetInfo describe(String datasetPath) {
        lock.readLock().lock();
        try {
            DatasetEntry entry = entry(datasetPath);
            return new DatasetInfo(datasetPath, entry.type(), entry.shape(), entry.chunkShape(),
                    entry.compressionSpec(), entry.chunks().size(), entry.storedBytes());
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public Map<String, Object> getAttributes(String datasetPath) {
        lock.readLock().lock();
        try {
            return Collections.unmodifiableMap(new LinkedHashMap<>(entry(datasetPath).attributes()));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public Set<String> datasetPaths() {
        lock.readLock().lock();
        try {
            ensureOpen();
            return Collections.unmodifiableSet(new TreeSet<>(catalog.datasets().keySet()));
        } finally {
            lock.readLock().unlock();
        }
    }

    public long fileSize() {
        lock.readLock().lock();
        try {
            ensureOpen();
            return channel.size();
        } catch (IOException e) {
            throw new ContainerIOException("Failed to stat container " + path, e);
        } finally {
            lock.readLock().unlock();
        }
    }

    /* ---------- writes ---------- */

    @Override
    public void create(String datasetPath, NdArray array, Chunking chunking, CompressionSpec compression) {
        batch(b -> b.create(datasetPath, array, chunking, compression));
    }

    @Override
    public void delete(String datasetPath) {
        lock.readLock().lock();
        try {
            ensureOpen();
            if (!catalog.datasets().containsKey(datasetPath)) return;
        } finally {
            lock.readLock().unlock();
        }
        batch(b -> b.delete(datasetPath));
    }

    @Override
    public void setAttributes(String datasetPath, Map<String, Object> attributes) {
        batch(b -> b.setAttributes(datasetPath, attributes));
    }

    @Override
    public void batch(Consumer<ContainerBatch> mutations) {
        lock.writeLock().lock();
        try {
            ensureOpen();
            StagedBatch staged = new StagedBatch(catalog, committedEnd);
            try {
                mutations.accept(staged);
                if (!staged.dirty) return;
                commit(new ContainerCatalog(staged.generation, staged.datasets), staged.writeEnd);
                for (String replaced : staged.touchedData) cache.invalidateDataset(replaced);
            } catch (RuntimeException e) {
                rollback(e);
                throw e;
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Rewrites the container with only the live chunks and the current catalog, then atomically
     * replaces the file.
     *
     * @return number of bytes reclaimed
     */
    public long compact() {
        lock.writeLock().lock();
        try {
            ensureOpen();
            long before = channel.size();
            Path tmp = path.resolveSibling(path.getFileName() + ".compact.tmp");
            Files.deleteIfExists(tmp);

            try (FileChannel out = FileChannel.open(tmp,
                    StandardOpenOption.CREATE_NEW, StandardOpenOption.READ, StandardOpenOption.WRITE)) {
                writeFully(out, ByteBuffer.wrap(ContainerHeader.uncommitted(System.currentTimeMillis()).toBytes()), 0);
                long offset = ContainerHeader.SIZE;
                Map<String, DatasetEntry> relocated = new TreeMap<>();
                for (Map.Entry<String, DatasetEntry> e : catalog.datasets().entrySet()) {
                    List<ChunkLocation> moved = new ArrayList<>();
                    for (ChunkLocation loc : e.getValue().chunks()) {
                        byte[] stored = readStored(e.getKey(), loc);
                        writeFully(out, ByteBuffer.wrap(stored), offset);
                        moved.add(new ChunkLocation(offset, loc.length(), loc.rawLength(), loc.checksum()));
                        offset += stored.length;
                    }
                    relocated.put(e.getKey(), e.getValue().withChunks(moved));
                }
                writeCommit(out, new ContainerCatalog(catalog.generation(), relocated).toBytes(), offset);
            }

            channel.close();
            moveReplacing(tmp, path);
            channel = FileChannel.open(path, StandardOpenOption.READ, StandardOpenOption.WRITE);
            cache.invalidateAll();
            load();

            long reclaimed = before - channel.size();
            log.debug("Compacted {}: reclaimed {} bytes", path.getFileName(), reclaimed);
            return reclaimed;
        } catch (IOException e) {
            throw new ContainerIOException("Compaction of " + path + " failed", e);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public void close() {
        lock.writeLock().lock();
        try {
            if (closed) return;
            closed = true;
            cache.invalidateAll();
            if (channel.isOpen()) channel.close();
        } catch (IOException e) {
            throw new ContainerIOException("Failed to close container " + path, e);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /* ---------- internals ---------- */

    private void load() {
        try {
            long size = channel.size();
            if (size < ContainerHeader.SIZE) {
                throw new ContainerCorruptedException("Container " + path + " is shorter than its header");
            }
            ByteBuffer hdr = ByteBuffer.allocate(ContainerHeader.SIZE);
            readFully(channel, hdr, 0);
            hdr.flip();
            ContainerHeader header = ContainerHeader.from(hdr);
            if (!header.isCommitted()) {
                throw new ContainerCorruptedException("Container " + path + " was never committed");
            }
            long end = header.catalogOffset() + header.catalogLength();
            if (header.catalogOffset() < ContainerHeader.SIZE || end > size) {
                throw new ContainerCorruptedException("Catalog of " + path + " lies outside the file");
            }
            ByteBuffer cat = ByteBuffer.allocate(header.catalogLength());
            readFully(channel, cat, header.catalogOffset());
            byte[] bytes = cat.array();
            if (Checksums.catalog(bytes) != header.checksum()) {
                throw new ContainerCorruptedException("Catalog checksum mismatch in " + path);
            }
            this.catalog = ContainerCatalog.fromBytes(bytes);
            this.committedEnd = end;
            if (size > end) {
                log.warn("Discarding {} uncommitted bytes at the end of {}", size - end, path.getFileName());
                channel.truncate(end);
            }
        } catch (IOException e) {
            throw new ContainerIOException("Failed to read container " + path, e);
        }
    }

    private void commit(ContainerCatalog next, long catalogOffset) {
        try {
            byte[] bytes = next.toBytes();
            writeCommit(channel, bytes, catalogOffset);
            this.catalog = ContainerCatalog.fromBytes(bytes);
            this.committedEnd = catalogOffset + bytes.length;
        } catch (IOException e) {
            throw new ContainerIOException("Commit to " + path + " failed", e);
        }
    }

    private static void writeCommit(FileChannel target, byte[] catalogBytes, long catalogOffset) throws IOException {
        writeFully(target, ByteBuffer.wrap(catalogBytes), catalogOffset);
        target.force(false);
        ContainerHeader header = new ContainerHeader(ContainerHeader.CURRENT_VERSION, System.currentTimeMillis(),
                catalogOffset, catalogBytes.length, Checksums.catalog(catalogBytes), ContainerHeader.COMMITTED);
        writeFully(target, ByteBuffer.wrap(header.toBytes()), 0);
        target.force(true);
    }

    private void rollback(RuntimeException cause) {
        try {
            if (channel.isOpen() && channel.size() > committedEnd) channel.truncate(committedEnd);
        } catch (IOException e) {
            cause.addSuppressed(e);
        }
    }

    private byte[] chunk(String datasetPath, DatasetEntry entry, int index) {
        ChunkLocation loc = entry.chunks().get(index);
        return cache.get(new ChunkCache.Key(datasetPath, entry.generation(), index),
                k -> ChunkCodec.decode(readStored(datasetPath, loc), loc.rawLength(),
                        entry.type().byteSize(), entry.compressionSpec()));
    }

    private byte[] readStored(String datasetPath, ChunkLocation loc) {
        ByteBuffer buf = ByteBuffer.allocate(loc.length());
        try {
            readFully(channel, buf, loc.offset());
        } catch (IOException e) {
            throw new ContainerIOException("Failed to read chunk of '" + datasetPath + "' at " + loc.offset(), e);
        }
        byte[] stored = buf.array();
        if (Checksums.chunk(stored) != loc.checksum()) {
            throw new ContainerCorruptedException("Checksum mismatch in chunk of '" + datasetPath + "' at offset " + loc.offset());
        }
        return stored;
    }

    private DatasetEntry entry(String datasetPath) {
        ensureOpen();
        DatasetEntry entry = catalog.datasets().get(datasetPath);
        if (entry == null) throw new DatasetNotFoundException(datasetPath);
        return entry;
    }

    private void ensureOpen() {
        if (closed) throw new IllegalStateException("Container " + path + " is closed");
    }

    private static void writeFully(FileChannel ch, ByteBuffer buf, long position) throws IOException {
        long pos = position;
        while (buf.hasRemaining()) {
            pos += ch.write(buf, pos);
        }
    }

    private static void readFully(FileChannel ch, ByteBuffer buf, long position) throws IOException {
        long pos = position;
        while (buf.hasRemaining()) {
            int n = ch.read(buf, pos);
            if (n < 0) throw new ContainerCorruptedException("Unexpected end of container at offset " + pos);
            pos += n;
        }
    }

    private static void moveReplacing(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    /**
     * Working copy of the catalog. Chunk blobs are appended immediately past the committed end;
     * only the catalog and header writes are deferred to the commit.
     */
    private final class StagedBatch implements ContainerBatch {

        private final Map<String, DatasetEntry> datasets;
        private final long generation;
        private final Set<String> touchedData = new TreeSet<>();
        private long writeEnd;
        private boolean dirty = false;

        StagedBatch(ContainerCatalog base, long writeEnd) {
            this.datasets = new TreeMap<>(base.datasets());
            this.generation = base.generation() + 1;
            this.writeEnd = writeEnd;
        }

        @Override
        public void create(String datasetPath, NdArray array, Chunking chunking, CompressionSpec compression) {
            requireName(datasetPath);
            if (datasets.containsKey(datasetPath)) throw new DatasetAlreadyExistsException(datasetPath);

            int[] shape = array.shape();
            int frames = shape.length == 0 ? 1 : shape[0];
            int perChunk = shape.length == 0 ? 1 : Math.min(chunking.framesPerChunk(), Math.max(frames, 1));
            int chunkCount = shape.length == 0 ? 1 : chunking.chunkCount(frames);
            int[] chunkShape = shape.clone();
            if (chunkShape.length > 0) chunkShape[0] = frames == 0 ? 0 : perChunk;

            List<ChunkLocation> chunks = new ArrayList<>(chunkCount);
            int elementSize = array.type().byteSize();
            try {
                for (int c = 0; c < chunkCount; c++) {
                    NdArray slice;
                    if (shape.length == 0 || frames == 0) {
                        slice = array;
                    } else {
                        int from = c * perChunk;
                        slice = array.frames(from, Math.min(perChunk, frames - from));
                    }
                    byte[] raw = slice.toByteArray();
                    byte[] stored = ChunkCodec.encode(raw, elementSize, compression);
                    writeFully(channel, ByteBuffer.wrap(stored), writeEnd);
                    chunks.add(new ChunkLocation(writeEnd, stored.length, raw.length, Checksums.chunk(stored)));
                    writeEnd += stored.length;
                }
            } catch (IOException e) {
                throw new ContainerIOException("Failed to write dataset '" + datasetPath + "' to " + path, e);
            }

            datasets.put(datasetPath, new DatasetEntry(array.type().typeName(), shape, chunkShape, perChunk,
                    compression.algorithm().canonicalName(), compression.level(), compression.shuffle(),
                    generation, chunks, Map.of()));
            touchedData.add(datasetPath);
            dirty = true;
            log.debug("Staged '{}' {} {} in {} chunk(s) [{}]", datasetPath, array.type(), Arrays.toString(shape),
                    chunkCount, compression.algorithm().canonicalName());
        }

        @Override
        public void delete(String datasetPath) {
            if (!datasets.containsKey(datasetPath)) return;
            if (DatasetPaths.IMMUTABLE.contains(datasetPath)) throw new ImmutableDatasetException(datasetPath);
            datasets.remove(datasetPath);
            touchedData.add(datasetPath);
            dirty = true;
        }

        @Override
        public void setAttributes(String datasetPath, Map<String, Object> attributes) {
            DatasetEntry entry = datasets.get(datasetPath);
            if (entry == null) throw new DatasetNotFoundException(datasetPath);
            Map<String, Object> merged = new LinkedHashMap<>(entry.attributes());
            attributes.forEach((k, v) -> merged.put(requireName(k), normalize(k, v)));
            datasets.put(datasetPath, entry.withAttributes(merged));
            dirty = true;
        }

        @Override
        public boolean exists(String datasetPath) {
            return datasets.containsKey(datasetPath);
        }
    }

    private static String requireName(String name) {
        if (name == null || name.isBlank()) throw new IllegalArgumentException("Name must not be blank");
        return name;
    }

    /**
     * Attribute values are limited to what the JSON catalog round-trips: numbers, strings,
     * booleans and lists of those. Primitive arrays and enums are converted.
     */
    static Object normalize(String key, Object value) {
        if (value instanceof Number || value instanceof String || value instanceof Boolean) return value;
        if (value instanceof Enum<?> e) return e.name();
        if (value instanceof int[] a) return Arrays.stream(a).boxed().toList();
        if (value instanceof long[] a) return Arrays.stream(a).boxed().toList();
        if (value instanceof double[] a) return Arrays.stream(a).boxed().toList();
        if (value instanceof Collection<?> c) {
            List<Object> out = new ArrayList<>(c.size());
            for (Object item : c) out.add(normalize(key, item));
            return out;
        }
        throw new IllegalArgumentException("Unsupported value for attribute '" + key + "': "
                + (value == null ? "null" : value.getClass().getName()));
    }
}
