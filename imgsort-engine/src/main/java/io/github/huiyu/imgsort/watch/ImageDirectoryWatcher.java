package io.github.huiyu.imgsort.watch;

import com.google.common.util.concurrent.ThreadFactoryBuilder;

import io.github.huiyu.imgsort.ImageType;
import io.github.huiyu.imgsort.config.Configuration;
import io.github.huiyu.imgsort.config.SortingLayout;
import io.github.huiyu.imgsort.image.ImageIdentity;
import io.github.huiyu.imgsort.mutation.FileMutationEngine;
import io.github.huiyu.imgsort.navigation.NavigationOrchestrator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.ClosedWatchServiceException;
import java.nio.file.FileSystems;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.StandardWatchEventKinds;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Keeps the index in line with changes made to the start directories by other programs.
 * New images are inserted in order, vanished ones forgotten unless one of our own
 * mutations is moving them, modified ones decoded again on the next request.
 */
@Component
@ConditionalOnProperty(prefix = "imgsort", name = "watch.enabled", havingValue = "true")
public class ImageDirectoryWatcher implements DisposableBean {

    private static final Logger LOG = LoggerFactory.getLogger(ImageDirectoryWatcher.class);

    private final NavigationOrchestrator orchestrator;
    private final FileMutationEngine mutationEngine;
    private final SortingLayout layout;

    private final Map<WatchKey, Path> directories = new ConcurrentHashMap<>();
    private volatile WatchService watchService;
    private volatile Thread thread;

    @Autowired
    public ImageDirectoryWatcher(NavigationOrchestrator orchestrator,
                                 FileMutationEngine mutationEngine,
                                 Configuration config) {
        this(orchestrator, mutationEngine, config.getSortingLayout());
    }

    public ImageDirectoryWatcher(NavigationOrchestrator orchestrator,
                                 FileMutationEngine mutationEngine,
                                 SortingLayout layout) {
        this.orchestrator = orchestrator;
        this.mutationEngine = mutationEngine;
        this.layout = layout;
    }

    public synchronized void start() {
        if (thread != null) {
            return;
        }
        try {
            watchService = FileSystems.getDefault().newWatchService();
            for (Path startDir : layout.getStartDirs()) {
                if (Files.isDirectory(startDir)) {
                    registerAll(startDir);
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Can not watch start directories", e);
        }
        thread = new ThreadFactoryBuilder()
                .setNameFormat("imgsort-watcher")
                .setDaemon(true)
                .build()
                .newThread(this::watch);
        thread.start();
        LOG.info("Watching {} directories", directories.size());
    }

    private void registerAll(Path root) throws IOException {
        Files.walkFileTree(root, new SimpleFileVisitor<Path>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) throws IOException {
                if (layout.isSortingFolder(dir)) {
                    return FileVisitResult.SKIP_SUBTREE;
                }
                WatchKey key = dir.register(watchService,
                        StandardWatchEventKinds.ENTRY_CREATE,
                        StandardWatchEventKinds.ENTRY_DELETE,
                        StandardWatchEventKinds.ENTRY_MODIFY);
                directories.put(key, dir);
                return FileVisitResult.CONTINUE;
            }
        });
    }

    private void watch() {
        while (!Thread.currentThread().isInterrupted()) {
            WatchKey key;
            try {
                key = watchService.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            } catch (ClosedWatchServiceException e) {
                return;
            }
            Path dir = directories.get(key);
            if (dir != null) {
                for (WatchEvent<?> event : key.pollEvents()) {
                    try {
                        handle(dir, event);
                    } catch (RuntimeException ex) {
                        LOG.error("Handling " + event.kind().name() + " in " + dir + " failed", ex);
                    }
                }
            }
            if (!key.reset()) {
                directories.remove(key);
            }
        }
    }

    void handle(Path dir, WatchEvent<?> event) {
        WatchEvent.Kind<?> kind = event.kind();
        if (kind == StandardWatchEventKinds.OVERFLOW) {
            LOG.warn("Missed file events in {}", dir);
            return;
        }
        Path path = dir.resolve((Path) event.context());
        if (kind == StandardWatchEventKinds.ENTRY_CREATE && Files.isDirectory(path)) {
            if (!layout.isSortingFolder(path)) {
                try {
                    registerAll(path);
                } catch (IOException e) {
                    LOG.warn("Can not watch {}: {}", path, e.toString());
                }
            }
            return;
        }
        if (!ImageType.isImageFile(path.getFileName().toString())) {
            return;
        }
        ImageIdentity identity = ImageIdentity.of(path);
        if (kind == StandardWatchEventKinds.ENTRY_CREATE) {
            if (orchestrator.add(identity)) {
                LOG.info("New image {}", identity);
            }
        } else if (kind == StandardWatchEventKinds.ENTRY_DELETE) {
            if (!mutationEngine.isMutating(identity) && orchestrator.forget(identity) >= 0) {
                LOG.info("Image {} disappeared", identity);
            }
        } else if (kind == StandardWatchEventKinds.ENTRY_MODIFY) {
            if (LOG.isDebugEnabled()) {
                LOG.debug("Image {} changed", identity);
            }
            orchestrator.refresh(identity);
        }
    }

    @Override
    public synchronized void destroy() throws Exception {
        if (thread != null) {
            thread.interrupt();
        }
        if (watchService != null) {
            watchService.close();
        }
    }
}
