package io.github.huiyu.imgsort.mutation;

import io.github.huiyu.imgsort.config.Configuration;
import io.github.huiyu.imgsort.config.SortingLayout;
import io.github.huiyu.imgsort.exception.ErrorKind;
import io.github.huiyu.imgsort.exception.ImgSortException;
import io.github.huiyu.imgsort.image.ImageIdentity;
import io.github.huiyu.imgsort.navigation.NavigationOrchestrator;
import io.github.huiyu.imgsort.retry.NTimesRetryStrategy;
import io.github.huiyu.imgsort.schedule.CancellationToken;
import io.github.huiyu.imgsort.schedule.Priority;
import io.github.huiyu.imgsort.schedule.Result;
import io.github.huiyu.imgsort.schedule.Task;
import io.github.huiyu.imgsort.schedule.TaskScheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Moves and deletes images as reversible transactions. A mutation runs as background
 * work; only after the files have moved is the image dropped from index and cache and an
 * {@link UndoRecord} pushed. Mutations of one image run one after another, and an undo
 * waits for every mutation submitted before it.
 */
@Component
public class FileMutationEngine {

    private static final Logger LOG = LoggerFactory.getLogger(FileMutationEngine.class);

    private final NavigationOrchestrator orchestrator;
    private final TaskScheduler scheduler;
    private final SortingLayout layout;
    private final FileMover fileMover;
    private final UndoStack undoStack;

    private final ReentrantLock chainLock = new ReentrantLock();
    // last submitted mutation per image, guarded by chainLock for writers
    private final ConcurrentMap<ImageIdentity, CompletableFuture<Result<UndoRecord>>> tails =
            new ConcurrentHashMap<>();
    private final Set<ImageIdentity> running = ConcurrentHashMap.newKeySet();
    private CompletableFuture<?> undoTail = CompletableFuture.completedFuture(null);

    @Autowired
    public FileMutationEngine(NavigationOrchestrator orchestrator,
                              TaskScheduler scheduler,
                              Configuration config) {
        this(orchestrator, scheduler, config.getSortingLayout(),
                new FileMover(() -> new NTimesRetryStrategy(
                        config.getMutationRetryTimes(), config.getMutationRetrySleep())),
                new UndoStack(config.getUndoCapacity()));
    }

    public FileMutationEngine(NavigationOrchestrator orchestrator,
                              TaskScheduler scheduler,
                              SortingLayout layout,
                              FileMover fileMover,
                              UndoStack undoStack) {
        this.orchestrator = checkNotNull(orchestrator);
        this.scheduler = checkNotNull(scheduler);
        this.layout = checkNotNull(layout);
        this.fileMover = checkNotNull(fileMover);
        this.undoStack = checkNotNull(undoStack);
    }

    public CompletableFuture<Result<UndoRecord>> move(ImageIdentity identity, String category) {
        checkArgument(layout.getCategories().contains(category), "Unknown category %s", category);
        return chain(identity, Task.Kind.MOVE, token -> moveToFolder(identity, category, token));
    }

    public CompletableFuture<Result<UndoRecord>> moveCurrent(String category) {
        ImageIdentity current = orchestrator.current();
        if (current == null) {
            return CompletableFuture.completedFuture(Result.failed(ErrorKind.NOT_FOUND, "No images"));
        }
        return move(current, category);
    }

    public CompletableFuture<Result<UndoRecord>> delete(ImageIdentity identity) {
        return chain(identity, Task.Kind.DELETE, token -> moveToFolder(identity, null, token));
    }

    public CompletableFuture<Result<UndoRecord>> deleteCurrent() {
        ImageIdentity current = orchestrator.current();
        if (current == null) {
            return CompletableFuture.completedFuture(Result.failed(ErrorKind.NOT_FOUND, "No images"));
        }
        return delete(current);
    }

    /**
     * Revert the most recent move or delete. With nothing to undo the result is OK and
     * carries {@link ErrorKind#EMPTY_UNDO}.
     */
    public CompletableFuture<Result<UndoRecord>> undo() {
        final ReentrantLock lock = this.chainLock;
        lock.lock();
        try {
            List<CompletableFuture<?>> predecessors = new ArrayList<>(tails.values());
            predecessors.add(undoTail);
            CompletableFuture<Result<UndoRecord>> result =
                    settled(CompletableFuture.allOf(predecessors.toArray(new CompletableFuture[0])))
                            .thenCompose(v -> runUndo());
            undoTail = result;
            return result;
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return true while a move, delete or undo of {@code identity} is queued or running
     */
    public boolean isMutating(ImageIdentity identity) {
        return tails.containsKey(identity) || running.contains(identity);
    }

    private CompletableFuture<Result<UndoRecord>> chain(ImageIdentity identity,
                                                        Task.Kind kind,
                                                        Task.Work<UndoRecord> work) {
        checkNotNull(identity);
        CompletableFuture<Result<UndoRecord>> result;
        final ReentrantLock lock = this.chainLock;
        lock.lock();
        try {
            CompletableFuture<?> previous = tails.get(identity);
            CompletableFuture<?> predecessors = previous == null ?
                    undoTail : CompletableFuture.allOf(previous, undoTail);
            result = settled(predecessors).thenCompose(v -> scheduler.submit(
                    Task.of(identity, kind, Priority.BACKGROUND, work)).result());
            tails.put(identity, result);
        } finally {
            lock.unlock();
        }
        final CompletableFuture<Result<UndoRecord>> tail = result;
        result.whenComplete((r, e) -> tails.remove(identity, tail));
        return result;
    }

    private static CompletableFuture<Void> settled(CompletableFuture<?> future) {
        return future.handle((v, e) -> null);
    }

    private UndoRecord moveToFolder(ImageIdentity identity, String category,
                                    CancellationToken token) throws Exception {
        if (token.isCancelled()) {
            return null;
        }
        if (!orchestrator.contains(identity)) {
            throw new ImgSortException(ErrorKind.NOT_FOUND, identity + " is not indexed");
        }
        Path source = identity.getPath();
        Path folder;
        try {
            folder = category == null ? layout.deleteFolderFor(source) : layout.destinationFor(source, category);
        } catch (IllegalArgumentException e) {
            throw new ImgSortException(ErrorKind.FILESYSTEM, e.getMessage(), e);
        }

        running.add(identity);
        try {
            Map<Path, Path> moved;
            try {
                moved = fileMover.move(source, folder);
            } catch (NoSuchFileException e) {
                if (Files.exists(source)) {
                    // a related file vanished, the image itself is fine
                    throw new ImgSortException(ErrorKind.FILESYSTEM, e.toString(), e);
                }
                // removed behind our back, it must not stay indexed
                orchestrator.forget(identity);
                throw new ImgSortException(ErrorKind.NOT_FOUND, source + " is gone", e);
            }
            orchestrator.forget(identity);
            UndoRecord record = new UndoRecord(identity, moved.get(source), category, moved,
                    System.currentTimeMillis());
            undoStack.push(record);
            LOG.info("{} {} to {}", category == null ? "Deleted" : "Moved", source, folder);
            return record;
        } finally {
            running.remove(identity);
        }
    }

    private CompletableFuture<Result<UndoRecord>> runUndo() {
        UndoRecord record = undoStack.pop();
        if (record == null) {
            LOG.info("Nothing to undo");
            return CompletableFuture.completedFuture(
                    Result.ok(null, ErrorKind.EMPTY_UNDO, "Nothing to undo"));
        }
        Task<UndoRecord> task = Task.of(record.getIdentity(), Task.Kind.UNDO, Priority.BACKGROUND,
                token -> restore(record));
        return scheduler.submit(task).result().thenApply(r -> {
            if (r.isFailed() && r.getKind() == ErrorKind.NOT_FOUND) {
                LOG.warn("Undo of {} impossible, dropping it: {}", record, r.getMessage());
            } else if (!r.isOk()) {
                LOG.warn("Undo of {} failed, keep it: {}", record, r);
                undoStack.push(record);
            }
            return r;
        });
    }

    private UndoRecord restore(UndoRecord record) throws Exception {
        ImageIdentity identity = record.getIdentity();
        running.add(identity);
        try {
            try {
                fileMover.moveBack(record.getMovedFiles());
            } catch (NoSuchFileException e) {
                if (Files.exists(record.getDestination())) {
                    throw new ImgSortException(ErrorKind.FILESYSTEM, e.toString(), e);
                }
                throw new ImgSortException(ErrorKind.NOT_FOUND,
                        record.getDestination() + " is gone, can not restore " + record.getSource(), e);
            }
            orchestrator.restore(identity);
            LOG.info("Restored {}", record.getSource());
            return record;
        } finally {
            running.remove(identity);
        }
    }
}
