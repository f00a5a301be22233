package io.github.huiyu.imgsort.mutation;

import io.github.huiyu.imgsort.ImageType;
import io.github.huiyu.imgsort.ManualTicker;
import io.github.huiyu.imgsort.cache.LruImageCache;
import io.github.huiyu.imgsort.config.SortingLayout;
import io.github.huiyu.imgsort.exception.ErrorKind;
import io.github.huiyu.imgsort.image.DecodedImage;
import io.github.huiyu.imgsort.image.ImageDecoder;
import io.github.huiyu.imgsort.image.ImageIdentity;
import io.github.huiyu.imgsort.image.ImageMetadata;
import io.github.huiyu.imgsort.index.Direction;
import io.github.huiyu.imgsort.index.ImageIndex;
import io.github.huiyu.imgsort.metadata.NoMetadataStore;
import io.github.huiyu.imgsort.navigation.NavigationOrchestrator;
import io.github.huiyu.imgsort.retry.NTimesRetryStrategy;
import io.github.huiyu.imgsort.schedule.PriorityTaskScheduler;
import io.github.huiyu.imgsort.schedule.Result;

import org.junit.After;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;

import static org.junit.Assert.*;
import static org.mockito.Mockito.*;

public class FileMutationEngineTest {

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private Path startDir;
    private ImageIdentity a, b, c, d, e;
    private ImageIndex index;
    private PriorityTaskScheduler scheduler;
    private NavigationOrchestrator orchestrator;
    private UndoStack undoStack;
    private FileMutationEngine engine;
    private Level level;

    @Before
    public void setUp() throws Exception {
        Logger root = (Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);
        level = root.getLevel();
        root.setLevel(Level.OFF);

        startDir = folder.newFolder("pictures").toPath();
        a = create("a.jpg");
        b = create("b.jpg");
        c = create("c.jpg");
        d = create("d.jpg");
        e = create("e.jpg");

        ImageDecoder decoder = mock(ImageDecoder.class);
        when(decoder.decode(any())).thenReturn(new DecodedImage("pixels", 1L,
                new ImageMetadata(1, 1, 1L, ImageType.JPG, 0L)));
        index = new ImageIndex();
        scheduler = new PriorityTaskScheduler(2, 16);
        orchestrator = new NavigationOrchestrator(index, new LruImageCache(50, 1000L, new ManualTicker()),
                scheduler, decoder, new NoMetadataStore(), 1);
        orchestrator.open(Arrays.asList(a, b, c, d, e));

        SortingLayout layout = SortingLayout.create(Collections.singletonList(startDir), null,
                Arrays.asList("good", "bad"));
        undoStack = new UndoStack(3);
        engine = new FileMutationEngine(orchestrator, scheduler, layout,
                new FileMover(() -> new NTimesRetryStrategy(1, 1L)), undoStack);
    }

    @After
    public void tearDown() throws Exception {
        scheduler.shutdown();
        Logger root = (Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);
        root.setLevel(level);
    }

    private ImageIdentity create(String name) throws Exception {
        Path file = Files.write(startDir.resolve(name), name.getBytes());
        return ImageIdentity.of(file);
    }

    private static <T> Result<T> await(CompletableFuture<Result<T>> future) throws Exception {
        return future.get(5, TimeUnit.SECONDS);
    }

    @Test
    public void testDeleteAndUndoScenario() throws Exception {
        orchestrator.navigate(Direction.NEXT);
        orchestrator.navigate(Direction.NEXT);
        orchestrator.navigate(Direction.NEXT);
        assertEquals(d, orchestrator.current());

        Result<UndoRecord> deleted = await(engine.delete(d));
        assertTrue(deleted.isOk());
        assertTrue(deleted.getValue().isDelete());
        assertEquals(Arrays.asList(a, b, c, e), index.snapshot());
        assertEquals(e, orchestrator.current());
        assertFalse(Files.exists(d.getPath()));
        assertTrue(Files.exists(startDir.resolve("deleted").resolve("d.jpg")));
        assertEquals(1, undoStack.size());

        Result<UndoRecord> undone = await(engine.undo());
        assertTrue(undone.isOk());
        assertNull(undone.getKind());
        assertEquals(Arrays.asList(a, b, c, d, e), index.snapshot());
        assertEquals(d, orchestrator.current());
        assertTrue(Files.exists(d.getPath()));
        // the delete folder was created for this image only
        assertFalse(Files.exists(startDir.resolve("deleted")));
        assertEquals(0, undoStack.size());
    }

    @Test
    public void testMoveCurrentWithRelatedFiles() throws Exception {
        Files.write(startDir.resolve("a.xmp"), new byte[]{1});
        Files.write(startDir.resolve("a.txt"), new byte[]{2});

        Result<UndoRecord> moved = await(engine.moveCurrent("good"));
        assertTrue(moved.isOk());
        UndoRecord record = moved.getValue();
        assertEquals("good", record.getCategory());
        assertEquals(3, record.getMovedFiles().size());
        Path good = startDir.resolve("good");
        assertEquals(good.resolve("a.jpg"), record.getDestination());
        assertTrue(Files.exists(good.resolve("a.jpg")));
        assertTrue(Files.exists(good.resolve("a.xmp")));
        assertTrue(Files.exists(good.resolve("a.txt")));
        assertFalse(orchestrator.contains(a));
        assertEquals(b, orchestrator.current());

        assertTrue(await(engine.undo()).isOk());
        assertTrue(Files.exists(startDir.resolve("a.xmp")));
        assertTrue(Files.exists(startDir.resolve("a.txt")));
        assertFalse(Files.exists(good));
    }

    @Test
    public void testConflictRollsBack() throws Exception {
        Files.write(startDir.resolve("a.xmp"), new byte[]{1});
        Path bad = Files.createDirectories(startDir.resolve("bad"));
        Files.write(bad.resolve("a.xmp"), new byte[]{9});

        Result<UndoRecord> result = await(engine.move(a, "bad"));
        assertTrue(result.isFailed());
        assertEquals(ErrorKind.FILESYSTEM, result.getKind());
        // nothing changed
        assertTrue(Files.exists(a.getPath()));
        assertTrue(Files.exists(startDir.resolve("a.xmp")));
        assertFalse(Files.exists(bad.resolve("a.jpg")));
        assertTrue(orchestrator.contains(a));
        assertEquals(0, undoStack.size());
    }

    @Test
    public void testMissingFile() throws Exception {
        Files.delete(c.getPath());
        Result<UndoRecord> result = await(engine.delete(c));
        assertTrue(result.isFailed());
        assertEquals(ErrorKind.NOT_FOUND, result.getKind());
        assertEquals(0, undoStack.size());
        assertFalse(orchestrator.contains(c));
        assertEquals(4, index.size());
    }

    @Test
    public void testUndoOfVanishedImageDropsRecord() throws Exception {
        assertTrue(await(engine.delete(b)).isOk());
        Files.delete(startDir.resolve("deleted").resolve("b.jpg"));
        Result<UndoRecord> result = await(engine.undo());
        assertTrue(result.isFailed());
        assertEquals(ErrorKind.NOT_FOUND, result.getKind());
        assertEquals(0, undoStack.size());
        assertFalse(orchestrator.contains(b));
        assertFalse(Files.exists(b.getPath()));

        // the next undo has nothing left to do
        assertEquals(ErrorKind.EMPTY_UNDO, await(engine.undo()).getKind());
    }

    @Test
    public void testEmptyUndo() throws Exception {
        Result<UndoRecord> result = await(engine.undo());
        assertTrue(result.isOk());
        assertEquals(ErrorKind.EMPTY_UNDO, result.getKind());
        assertNull(result.getValue());
        assertEquals(5, index.size());
    }

    @Test
    public void testFailedUndoKeepsRecord() throws Exception {
        assertTrue(await(engine.delete(b)).isOk());
        // someone else put a file where b has to go back to
        Files.write(b.getPath(), new byte[]{7});
        Result<UndoRecord> result = await(engine.undo());
        assertTrue(result.isFailed());
        assertEquals(ErrorKind.FILESYSTEM, result.getKind());
        assertEquals(1, undoStack.size());
        assertFalse(orchestrator.contains(b));
    }

    @Test
    public void testMutationsOfOneImageAreChained() throws Exception {
        CompletableFuture<Result<UndoRecord>> first = engine.move(c, "good");
        CompletableFuture<Result<UndoRecord>> second = engine.move(c, "bad");
        assertTrue(await(first).isOk());
        Result<UndoRecord> result = await(second);
        // already gone from the index when its turn came
        assertTrue(result.isFailed());
        assertEquals(ErrorKind.NOT_FOUND, result.getKind());
        assertTrue(Files.exists(startDir.resolve("good").resolve("c.jpg")));
    }

    @Test
    public void testUndoWaitsForEarlierMutations() throws Exception {
        List<CompletableFuture<Result<UndoRecord>>> moves = new ArrayList<>();
        moves.add(engine.delete(a));
        moves.add(engine.move(b, "good"));
        CompletableFuture<Result<UndoRecord>> undo = engine.undo();
        for (CompletableFuture<Result<UndoRecord>> move : moves) {
            assertTrue(await(move).isOk());
        }
        UndoRecord undone = await(undo).getValue();
        assertNotNull(undone);
        assertEquals(1, undoStack.size());
        // exactly one of the two came back
        assertTrue(orchestrator.contains(a) ^ orchestrator.contains(b));
        assertEquals(undone.getIdentity(), orchestrator.current());
    }

    @Test
    public void testUndoCapacity() throws Exception {
        for (ImageIdentity identity : Arrays.asList(a, b, c, d)) {
            assertTrue(await(engine.delete(identity)).isOk());
        }
        assertEquals(3, undoStack.size());
        assertEquals(d, await(engine.undo()).getValue().getIdentity());
        assertEquals(c, await(engine.undo()).getValue().getIdentity());
        assertEquals(b, await(engine.undo()).getValue().getIdentity());
        // a fell off the bottom
        assertEquals(ErrorKind.EMPTY_UNDO, await(engine.undo()).getKind());
        assertFalse(orchestrator.contains(a));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnknownCategory() throws Exception {
        engine.move(a, "ugly");
    }
}
