package io.github.huiyu.imgsort.config;

import org.junit.Test;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.Collections;

import static org.junit.Assert.*;

public class SortingLayoutTest {

    private final Path root = Paths.get("/photos").toAbsolutePath();

    @Test
    public void testFoldersBelowStartDir() {
        SortingLayout layout = SortingLayout.create(
                Collections.singletonList(root), null, Arrays.asList("keep", "later"));
        Path image = root.resolve("trip/a.png");
        assertEquals(root.resolve("keep"), layout.destinationFor(image, "keep"));
        assertEquals(root.resolve("later"), layout.destinationFor(image, "later"));
        assertEquals(root.resolve("deleted"), layout.deleteFolderFor(image));
        assertTrue(layout.isSortingFolder(root.resolve("keep")));
        assertTrue(layout.isSortingFolder(root.resolve("deleted")));
        assertFalse(layout.isSortingFolder(root.resolve("trip")));
    }

    @Test
    public void testSharedSortDir() {
        Path other = Paths.get("/more").toAbsolutePath();
        Path sorted = Paths.get("/sorted").toAbsolutePath();
        SortingLayout layout = SortingLayout.create(
                Arrays.asList(other, root), sorted, Collections.singletonList("keep"));
        assertEquals(sorted.resolve("keep"), layout.destinationFor(root.resolve("a.png"), "keep"));
        assertEquals(sorted.resolve("keep"), layout.destinationFor(other.resolve("b.png"), "keep"));
        assertEquals(sorted.resolve("deleted"), layout.deleteFolderFor(other.resolve("b.png")));
    }

    @Test
    public void testInnermostStartDirWins() {
        Path nested = root.resolve("nested");
        SortingLayout layout = SortingLayout.create(
                Arrays.asList(root, nested), null, Collections.singletonList("keep"));
        assertEquals(nested, layout.startDirOf(nested.resolve("a.png")));
        assertEquals(nested.resolve("keep"), layout.destinationFor(nested.resolve("a.png"), "keep"));
        assertEquals(root, layout.startDirOf(root.resolve("b.png")));
        assertNull(layout.startDirOf(Paths.get("/elsewhere/c.png").toAbsolutePath()));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnknownCategory() {
        SortingLayout layout = SortingLayout.create(
                Collections.singletonList(root), null, Collections.singletonList("keep"));
        layout.destinationFor(root.resolve("a.png"), "missing");
    }

    @Test(expected = IllegalArgumentException.class)
    public void testOutsideStartDirs() {
        SortingLayout layout = SortingLayout.create(
                Collections.singletonList(root), null, Collections.singletonList("keep"));
        layout.deleteFolderFor(Paths.get("/elsewhere/c.png").toAbsolutePath());
    }
}
