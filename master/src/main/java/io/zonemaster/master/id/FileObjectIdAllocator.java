package io.zonemaster.master.id;

import io.zonemaster.api.storage.IdentifierExhaustedException;
import io.zonemaster.api.storage.ObjectIdAllocator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;
import org.yaml.snakeyaml.nodes.Tag;

import javax.annotation.Nonnull;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Objects;

/**
 * Object id allocator backed by a small YAML file.
 *
 * <p>The file holds the high-water mark: no id above it has ever been handed
 * out. Ids are reserved in blocks; the end of a block is written to the file
 * before the first id of the block is returned, so a crash can waste ids but
 * never hand one out twice. {@link #save()} lowers the mark back to the last
 * id actually handed out.</p>
 */
public class FileObjectIdAllocator implements ObjectIdAllocator {

    private static final Logger LOGGER = LoggerFactory.getLogger(FileObjectIdAllocator.class);

    private final Path file;
    private final int blockSize;

    private long nextId;
    private long reservedUpTo;

    private FileObjectIdAllocator(Path file, int blockSize, long highWaterMark) {
        this.file = file;
        this.blockSize = blockSize;
        this.reservedUpTo = highWaterMark;
        this.nextId = highWaterMark + 1;
    }

    /**
     * Open the allocator, creating its file if it does not exist.
     *
     * @param file path of the high-water mark file
     * @param blockSize number of ids reserved per file write
     * @return the allocator
     * @throws IOException if the file cannot be read or created
     */
    @Nonnull
    public static FileObjectIdAllocator open(@Nonnull Path file, int blockSize) throws IOException {
        Objects.requireNonNull(file, "file");
        if (blockSize < 1) {
            throw new IllegalArgumentException("blockSize must be positive: " + blockSize);
        }

        long highWaterMark = 0;
        if (Files.exists(file)) {
            highWaterMark = read(file).getHighWaterMark();
            if (highWaterMark < 0 || highWaterMark > MAX_ID) {
                throw new IOException("Invalid high-water mark " + highWaterMark + " in " + file);
            }
        } else {
            write(file, 0);
        }

        LOGGER.info("Object ids resume after {} ({})", highWaterMark, file);
        return new FileObjectIdAllocator(file, blockSize, highWaterMark);
    }

    @Override
    public synchronized long generate() {
        if (nextId > MAX_ID) {
            throw new IdentifierExhaustedException("Object id space exhausted at " + MAX_ID);
        }

        if (nextId > reservedUpTo) {
            long blockEnd = Math.min(reservedUpTo + blockSize, MAX_ID);
            persist(blockEnd);
            reservedUpTo = blockEnd;
            LOGGER.debug("Reserved object ids up to {}", blockEnd);
        }
        return nextId++;
    }

    @Override
    public synchronized void save() {
        long lastIssued = nextId - 1;
        persist(lastIssued);
        reservedUpTo = lastIssued;
        LOGGER.info("Saved object id high-water mark {}", lastIssued);
    }

    /**
     * Get the persisted high-water mark.
     *
     * @return highest id that may have been handed out
     */
    public synchronized long getHighWaterMark() {
        return reservedUpTo;
    }

    private void persist(long highWaterMark) {
        try {
            write(file, highWaterMark);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to persist object id high-water mark to " + file, e);
        }
    }

    // ==================== File Format ====================

    private static State read(Path file) throws IOException {
        Yaml yaml = new Yaml(new Constructor(State.class, new LoaderOptions()));
        try (InputStream is = Files.newInputStream(file)) {
            State state = yaml.load(is);
            return state != null ? state : new State();
        } catch (YAMLException e) {
            throw new IOException("Unreadable object id file " + file, e);
        }
    }

    private static void write(Path file, long highWaterMark) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }

        State state = new State();
        state.setHighWaterMark(highWaterMark);

        Path temp = file.resolveSibling(file.getFileName() + ".tmp");
        Yaml yaml = new Yaml();
        try (Writer writer = Files.newBufferedWriter(temp)) {
            writer.write(yaml.dumpAs(state, Tag.MAP, DumperOptions.FlowStyle.BLOCK));
        }
        Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    }

    /**
     * Content of the high-water mark file.
     */
    public static class State {
        private long highWaterMark;

        public long getHighWaterMark() {
            return highWaterMark;
        }

        public void setHighWaterMark(long highWaterMark) {
            this.highWaterMark = highWaterMark;
        }
    }
}
