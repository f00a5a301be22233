package io.github.huiyu.imgsort.mutation;

import io.github.huiyu.imgsort.retry.NTimesRetryStrategy;

import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.IOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.junit.Assert.*;

public class FileMoverTest {

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private Path dir;
    private FileMover mover;

    @Before
    public void setUp() throws Exception {
        dir = folder.newFolder("pictures").toPath();
        mover = new FileMover(() -> new NTimesRetryStrategy(2, 1L));
    }

    private Path touch(String name) throws IOException {
        return Files.write(dir.resolve(name), name.getBytes());
    }

    @Test
    public void testRelatedFiles() throws Exception {
        Path image = touch("holiday.jpg");
        touch("holiday.xmp");
        touch("holiday.txt");
        touch("holiday.png");
        touch("holiday2.txt");
        touch("other.xmp");

        List<Path> related = mover.relatedFiles(image);
        assertEquals(Arrays.asList(image, dir.resolve("holiday.txt"), dir.resolve("holiday.xmp")), related);
    }

    @Test
    public void testMoveAndMoveBack() throws Exception {
        Path image = touch("a.jpg");
        touch("a.xmp");
        Path target = dir.resolve("sorted");

        Map<Path, Path> moved = mover.move(image, target);
        assertEquals(2, moved.size());
        assertEquals(target.resolve("a.jpg"), moved.get(image));
        assertFalse(Files.exists(image));

        mover.moveBack(moved);
        assertTrue(Files.exists(image));
        assertTrue(Files.exists(dir.resolve("a.xmp")));
        assertFalse(Files.exists(target));
    }

    @Test
    public void testConflictLeavesEverythingInPlace() throws Exception {
        Path image = touch("a.jpg");
        touch("a.xmp");
        Path target = dir.resolve("sorted");
        Files.createDirectories(target);
        Files.write(target.resolve("a.xmp"), new byte[]{1});

        try {
            mover.move(image, target);
            fail();
        } catch (FileAlreadyExistsException e) {
            assertTrue(Files.exists(image));
            assertTrue(Files.exists(dir.resolve("a.xmp")));
            assertFalse(Files.exists(target.resolve("a.jpg")));
        }
    }

    @Test
    public void testCreatedFolderIsRemovedOnFailure() throws Exception {
        Path image = touch("a.jpg");
        Path target = dir.resolve("sorted");
        Files.delete(image);
        try {
            mover.move(image, target);
            fail();
        } catch (NoSuchFileException e) {
            assertFalse(Files.exists(target));
        }
    }

    @Test
    public void testRemoveIfEmpty() throws Exception {
        Path empty = Files.createDirectories(dir.resolve("empty"));
        assertTrue(mover.removeIfEmpty(empty));
        assertFalse(mover.removeIfEmpty(empty));
        touch("a.jpg");
        assertFalse(mover.removeIfEmpty(dir));
    }

    @Test
    public void testOnlyTransientFailuresAreRetried() {
        assertTrue(FileMover.isTransient(new IOException("busy")));
        assertTrue(FileMover.isTransient(new AccessDeniedException("locked")));
        assertFalse(FileMover.isTransient(new FileAlreadyExistsException("taken")));
        assertFalse(FileMover.isTransient(new NoSuchFileException("gone")));
        assertFalse(FileMover.isTransient(new IllegalStateException()));
    }

    @Test
    public void testBaseName() {
        assertEquals("a", FileMover.baseName("a.jpg"));
        assertEquals("a.b", FileMover.baseName("a.b.jpg"));
        assertEquals(".hidden", FileMover.baseName(".hidden"));
        assertEquals("plain", FileMover.baseName("plain"));
    }
}
