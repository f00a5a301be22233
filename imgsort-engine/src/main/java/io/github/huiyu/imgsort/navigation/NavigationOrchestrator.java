package io.github.huiyu.imgsort.navigation;

import io.github.huiyu.imgsort.cache.Cache;
import io.github.huiyu.imgsort.cache.CacheEntry;
import io.github.huiyu.imgsort.config.Configuration;
import io.github.huiyu.imgsort.exception.ErrorKind;
import io.github.huiyu.imgsort.image.DecodedImage;
import io.github.huiyu.imgsort.image.ImageDecoder;
import io.github.huiyu.imgsort.image.ImageIdentity;
import io.github.huiyu.imgsort.image.ImageMetadata;
import io.github.huiyu.imgsort.index.Direction;
import io.github.huiyu.imgsort.index.Focus;
import io.github.huiyu.imgsort.index.ImageIndex;
import io.github.huiyu.imgsort.metadata.MetadataStore;
import io.github.huiyu.imgsort.schedule.CancellationToken;
import io.github.huiyu.imgsort.schedule.Priority;
import io.github.huiyu.imgsort.schedule.Result;
import io.github.huiyu.imgsort.schedule.Task;
import io.github.huiyu.imgsort.schedule.TaskHandle;
import io.github.huiyu.imgsort.schedule.TaskScheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Turns navigation commands into cache lookups and loads. Callers get a future right away
 * and never wait for a decode. At most one load per image is in flight; the neighborhood
 * of the cursor is prefetched at background priority.
 */
@Component
public class NavigationOrchestrator {

    private static final Logger LOG = LoggerFactory.getLogger(NavigationOrchestrator.class);

    private final ImageIndex index;
    private final Cache cache;
    private final TaskScheduler scheduler;
    private final ImageDecoder decoder;
    private final MetadataStore metadataStore;
    private final int prefetchRadius;

    final ConcurrentMap<ImageIdentity, PendingLoad> inFlight = new ConcurrentHashMap<>();

    @Autowired
    public NavigationOrchestrator(ImageIndex index,
                                  Cache cache,
                                  TaskScheduler scheduler,
                                  ImageDecoder decoder,
                                  MetadataStore metadataStore,
                                  Configuration config) {
        this(index, cache, scheduler, decoder, metadataStore, config.getPrefetchRadius());
    }

    public NavigationOrchestrator(ImageIndex index,
                                  Cache cache,
                                  TaskScheduler scheduler,
                                  ImageDecoder decoder,
                                  MetadataStore metadataStore,
                                  int prefetchRadius) {
        checkArgument(prefetchRadius >= 0, "prefetchRadius must not be negative");
        this.index = index;
        this.cache = cache;
        this.scheduler = scheduler;
        this.decoder = decoder;
        this.metadataStore = metadataStore;
        this.prefetchRadius = prefetchRadius;
    }

    /**
     * Replace everything known with a freshly scanned set of images.
     */
    public void open(Collection<ImageIdentity> identities) {
        for (PendingLoad load : new ArrayList<>(inFlight.values())) {
            load.cancel(scheduler, false);
        }
        index.reset(identities);
        cache.invalidateAll();
        publishFocus();
    }

    public CompletableFuture<Result<CacheEntry>> navigate(Direction direction) {
        ImageIdentity target = index.advance(direction);
        if (target == null) {
            return CompletableFuture.completedFuture(Result.failed(ErrorKind.NOT_FOUND, "No images"));
        }
        if (LOG.isTraceEnabled()) {
            LOG.trace("{} -> {}", direction, target);
        }
        return request(target);
    }

    /**
     * Request the current image again, e.g. after a mutation moved the cursor.
     */
    public CompletableFuture<Result<CacheEntry>> show() {
        ImageIdentity current = index.current();
        if (current == null) {
            return CompletableFuture.completedFuture(Result.failed(ErrorKind.NOT_FOUND, "No images"));
        }
        return request(current);
    }

    public ImageIdentity current() {
        return index.current();
    }

    public CompletableFuture<Result<ImageMetadata>> metadata(ImageIdentity identity) {
        ImageMetadata metadata = cache.getMetadata(identity);
        if (metadata != null) {
            return CompletableFuture.completedFuture(Result.ok(metadata));
        }
        Task<ImageMetadata> task = Task.of(identity, Task.Kind.METADATA, Priority.BACKGROUND,
                token -> readMetadata(identity, token));
        return scheduler.submit(task).result();
    }

    /**
     * @return READY or ERROR for a cached image, PENDING while a load runs, null otherwise
     */
    public CacheEntry.Status status(ImageIdentity identity) {
        CacheEntry entry = cache.peek(identity);
        if (entry != null) {
            return entry.getStatus();
        }
        PendingLoad load = inFlight.get(identity);
        return load != null && !load.result.isDone() ? CacheEntry.Status.PENDING : null;
    }

    /**
     * Drop an image that left the index: index first, then loads, then cache.
     *
     * @return the position it had in the index, -1 if it was not indexed
     */
    public int forget(ImageIdentity identity) {
        int position = index.remove(identity);
        publishFocus();
        cancelLoad(identity);
        cache.invalidate(identity);
        metadataStore.delete(identity);
        if (position >= 0) {
            LOG.debug("Forgot {} at {}", identity, position);
        }
        return position;
    }

    /**
     * Bring an image back in sort order and point the cursor at it.
     */
    public void restore(ImageIdentity identity) {
        index.insertSorted(identity);
        index.moveTo(identity);
        publishFocus();
    }

    /**
     * Add an image that appeared on disk without moving the cursor.
     */
    public boolean add(ImageIdentity identity) {
        boolean added = index.insertSorted(identity) >= 0;
        if (added) {
            publishFocus();
        }
        return added;
    }

    /**
     * The file changed on disk, the next request decodes it again.
     */
    public void refresh(ImageIdentity identity) {
        cancelLoad(identity);
        cache.invalidate(identity);
    }

    public boolean contains(ImageIdentity identity) {
        return index.contains(identity);
    }

    public int size() {
        return index.size();
    }

    private CompletableFuture<Result<CacheEntry>> request(ImageIdentity target) {
        Focus focus = publishFocus();
        CompletableFuture<Result<CacheEntry>> result;
        CacheEntry entry = cache.get(target);
        if (entry == null) {
            result = load(target, Priority.INTERACTIVE);
        } else if (entry.getStatus() == CacheEntry.Status.ERROR) {
            result = CompletableFuture.completedFuture(
                    Result.failed(entry.getError(), "Can not load " + target));
        } else {
            result = CompletableFuture.completedFuture(Result.ok(entry));
        }
        prefetch(focus);
        return result;
    }

    private Focus publishFocus() {
        Focus focus = index.focus();
        cache.focus(focus);
        return focus;
    }

    private void prefetch(Focus focus) {
        List<ImageIdentity> window = new ArrayList<>(focus.neighborhood(prefetchRadius));
        Set<ImageIdentity> inWindow = new HashSet<>(window);

        // stale prefetches first, so they do not crowd the queue
        for (Map.Entry<ImageIdentity, PendingLoad> e : inFlight.entrySet()) {
            PendingLoad load = e.getValue();
            if (!inWindow.contains(e.getKey())) {
                load.cancel(scheduler, true);
            }
        }

        // nearest first
        window.sort(Comparator.comparingInt(focus::distance));
        for (ImageIdentity identity : window) {
            if (!cache.contains(identity)) {
                load(identity, Priority.BACKGROUND);
            }
        }
    }

    /**
     * Attach to the pending load of {@code identity} or start one. A load that was
     * cancelled while its decode runs keeps its slot until the decode returns, a new
     * request then waits for it and goes again.
     */
    CompletableFuture<Result<CacheEntry>> load(ImageIdentity identity, Priority priority) {
        boolean interactive = priority == Priority.INTERACTIVE;
        while (true) {
            PendingLoad existing = inFlight.get(identity);
            if (existing != null && !existing.result.isDone()) {
                if (existing.attach(interactive, scheduler)) {
                    return existing.result;
                }
                return existing.result.thenCompose(r -> load(identity, priority));
            }
            PendingLoad load = new PendingLoad(interactive);
            boolean reserved = existing == null
                    ? inFlight.putIfAbsent(identity, load) == null
                    : inFlight.replace(identity, existing, load);
            if (reserved) {
                start(identity, priority, load);
                return load.result;
            }
        }
    }

    // runs outside of any map operation, submit may complete other loads on this thread
    private void start(ImageIdentity identity, Priority priority, PendingLoad load) {
        Task<CacheEntry> task = Task.of(identity, Task.Kind.LOAD, priority,
                token -> decode(identity, token));
        TaskHandle<CacheEntry> handle = scheduler.submit(task);
        handle.result()
                .thenApply(r -> onLoaded(identity, r))
                .whenComplete((r, ex) -> {
                    inFlight.remove(identity, load);
                    if (ex != null) {
                        LOG.error("Load of " + identity + " failed", ex);
                        load.result.complete(Result.failed(ErrorKind.DECODE, ex.toString()));
                    } else {
                        load.result.complete(r);
                    }
                });
        load.started(handle, scheduler);
    }

    private CacheEntry decode(ImageIdentity identity, CancellationToken token) throws Exception {
        if (token.isCancelled()) {
            return null;
        }
        DecodedImage image = decoder.decode(identity);
        if (token.isCancelled()) {
            return null;
        }
        Cache.Admission admission = cache.put(identity, image);
        if (image.getMetadata() != null) {
            metadataStore.save(identity, image.getMetadata());
        }
        if (admission == Cache.Admission.ADMITTED) {
            CacheEntry entry = cache.peek(identity);
            if (entry != null) {
                return entry;
            }
        }
        return CacheEntry.transientEntry(identity, image);
    }

    private Result<CacheEntry> onLoaded(ImageIdentity identity, Result<CacheEntry> result) {
        if (result.isOk()) {
            CacheEntry entry = result.getValue();
            if (!entry.isCached()) {
                return Result.ok(entry, ErrorKind.CAPACITY, "Served without caching");
            }
            return result;
        }
        if (result.isFailed()) {
            if (result.getKind() == ErrorKind.NOT_FOUND) {
                LOG.info("{} is gone, removing it", identity);
                forget(identity);
            } else if (result.getKind() == ErrorKind.DECODE) {
                cache.putError(identity, ErrorKind.DECODE);
            }
        }
        return result;
    }

    private ImageMetadata readMetadata(ImageIdentity identity, CancellationToken token) throws Exception {
        ImageMetadata metadata = metadataStore.get(identity);
        if (metadata == null) {
            if (token.isCancelled()) {
                return null;
            }
            metadata = decoder.readMetadata(identity);
            metadataStore.save(identity, metadata);
        }
        cache.putMetadata(identity, metadata);
        return metadata;
    }

    private void cancelLoad(ImageIdentity identity) {
        PendingLoad load = inFlight.get(identity);
        if (load != null) {
            load.cancel(scheduler, false);
        }
    }

    static final class PendingLoad {

        final CompletableFuture<Result<CacheEntry>> result = new CompletableFuture<>();

        // guarded by this, scheduler calls happen outside
        private TaskHandle<CacheEntry> handle;
        // someone is waiting to see it
        private boolean interactive;
        private boolean cancelled;

        PendingLoad(boolean interactive) {
            this.interactive = interactive;
        }

        /**
         * @return false if the load was cancelled and can not be reused
         */
        boolean attach(boolean interactiveRequest, TaskScheduler scheduler) {
            TaskHandle<CacheEntry> toPromote = null;
            synchronized (this) {
                if (cancelled) {
                    return false;
                }
                if (interactiveRequest && !interactive) {
                    interactive = true;
                    toPromote = handle;
                }
            }
            // a running prefetch can not be promoted, but it is no longer cancellable
            if (toPromote != null) {
                scheduler.promote(toPromote);
            }
            return true;
        }

        void started(TaskHandle<CacheEntry> handle, TaskScheduler scheduler) {
            boolean cancel;
            boolean promote;
            synchronized (this) {
                this.handle = handle;
                cancel = cancelled;
                promote = interactive && handle.getPriority() == Priority.BACKGROUND;
            }
            if (cancel) {
                scheduler.cancel(handle);
            } else if (promote) {
                scheduler.promote(handle);
            }
        }

        /**
         * @param onlyBackground leave loads alone that an interactive request waits for
         */
        void cancel(TaskScheduler scheduler, boolean onlyBackground) {
            TaskHandle<CacheEntry> toCancel;
            synchronized (this) {
                if (cancelled || (onlyBackground && interactive)) {
                    return;
                }
                cancelled = true;
                toCancel = handle;
            }
            if (toCancel != null) {
                scheduler.cancel(toCancel);
            }
        }
    }
}
