package io.zonemaster.master.id;

import io.zonemaster.api.storage.IdentifierExhaustedException;
import io.zonemaster.api.storage.ObjectIdAllocator;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

final class FileObjectIdAllocatorTest {

    @TempDir
    Path tempDir;

    @Test
    void freshFileStartsAtOne() throws Exception {
        Path file = tempDir.resolve("ids/object-ids.yml");

        FileObjectIdAllocator allocator = FileObjectIdAllocator.open(file, 10);

        Assertions.assertTrue(Files.exists(file));
        Assertions.assertEquals(1L, allocator.generate());
        Assertions.assertEquals(2L, allocator.generate());
    }

    @Test
    void blockEndIsPersistedBeforeIdsAreHandedOut() throws Exception {
        Path file = tempDir.resolve("object-ids.yml");
        FileObjectIdAllocator allocator = FileObjectIdAllocator.open(file, 10);

        allocator.generate();
        Assertions.assertEquals(10L, allocator.getHighWaterMark());
        Assertions.assertEquals(10L, FileObjectIdAllocator.open(file, 10).getHighWaterMark());

        for (int i = 0; i < 10; i++) {
            allocator.generate();
        }
        Assertions.assertEquals(20L, FileObjectIdAllocator.open(file, 10).getHighWaterMark());
    }

    @Test
    void restartAfterCrashNeverReusesIds() throws Exception {
        Path file = tempDir.resolve("object-ids.yml");
        FileObjectIdAllocator crashed = FileObjectIdAllocator.open(file, 10);
        long last = 0;
        for (int i = 0; i < 13; i++) {
            last = crashed.generate();
        }

        FileObjectIdAllocator restarted = FileObjectIdAllocator.open(file, 10);

        Assertions.assertTrue(restarted.generate() > last);
    }

    @Test
    void saveCompactsToLastIssuedId() throws Exception {
        Path file = tempDir.resolve("object-ids.yml");
        FileObjectIdAllocator allocator = FileObjectIdAllocator.open(file, 100);
        for (int i = 0; i < 5; i++) {
            allocator.generate();
        }

        allocator.save();

        FileObjectIdAllocator restarted = FileObjectIdAllocator.open(file, 100);
        Assertions.assertEquals(5L, restarted.getHighWaterMark());
        Assertions.assertEquals(6L, restarted.generate());
    }

    @Test
    void exhaustionThrows() throws Exception {
        Path file = tempDir.resolve("object-ids.yml");
        Files.writeString(file, "highWaterMark: " + (ObjectIdAllocator.MAX_ID - 2) + "\n");
        FileObjectIdAllocator allocator = FileObjectIdAllocator.open(file, 100);

        Assertions.assertEquals(ObjectIdAllocator.MAX_ID - 1, allocator.generate());
        Assertions.assertEquals(ObjectIdAllocator.MAX_ID, allocator.generate());
        Assertions.assertThrows(IdentifierExhaustedException.class, allocator::generate);
    }

    @Test
    void unreadableFileFailsToOpen() throws Exception {
        Path file = tempDir.resolve("object-ids.yml");
        Files.writeString(file, "highWaterMark: [not, a, number]\n");

        Assertions.assertThrows(IOException.class, () -> FileObjectIdAllocator.open(file, 10));
    }

    @Test
    void negativeMarkFailsToOpen() throws Exception {
        Path file = tempDir.resolve("object-ids.yml");
        Files.writeString(file, "highWaterMark: -5\n");

        Assertions.assertThrows(IOException.class, () -> FileObjectIdAllocator.open(file, 10));
    }
}
