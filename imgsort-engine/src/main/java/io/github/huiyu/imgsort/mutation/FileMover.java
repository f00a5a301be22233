package io.github.huiyu.imgsort.mutation;

import io.github.huiyu.imgsort.ImageType;
import io.github.huiyu.imgsort.retry.RetryCallable;
import io.github.huiyu.imgsort.retry.RetryStrategy;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryNotEmptyException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Moves an image together with its related files. Either every file arrives or none has
 * moved: a failure half way moves the already moved files back.
 */
public class FileMover {

    private static final Logger LOG = LoggerFactory.getLogger(FileMover.class);

    private final Supplier<RetryStrategy> retryStrategies;

    public FileMover(Supplier<RetryStrategy> retryStrategies) {
        this.retryStrategies = retryStrategies;
    }

    /**
     * Files next to {@code image} sharing its base name, e.g. {@code a.xmp} for {@code a.jpg}.
     * Other images are never related, they are indexed on their own. The image comes first.
     */
    public List<Path> relatedFiles(Path image) throws IOException {
        String base = baseName(image.getFileName().toString());
        List<Path> related = new ArrayList<>();
        related.add(image);
        try (Stream<Path> siblings = Files.list(image.getParent())) {
            related.addAll(siblings
                    .filter(p -> !p.equals(image))
                    .filter(Files::isRegularFile)
                    .filter(p -> baseName(p.getFileName().toString()).equals(base))
                    .filter(p -> !ImageType.isImageFile(p.getFileName().toString()))
                    .sorted()
                    .collect(Collectors.toList()));
        }
        return related;
    }

    /**
     * Move {@code image} and its related files into {@code folder}, creating it on demand.
     *
     * @return original location to new location, in move order
     */
    public Map<Path, Path> move(Path image, Path folder) throws IOException {
        if (!Files.exists(image)) {
            throw new NoSuchFileException(image.toString());
        }
        List<Path> files = relatedFiles(image);
        boolean created = !Files.isDirectory(folder);
        Files.createDirectories(folder);

        Map<Path, Path> moved = new LinkedHashMap<>();
        try {
            for (Path source : files) {
                Path target = folder.resolve(source.getFileName());
                moveOne(source, target);
                moved.put(source, target);
            }
        } catch (IOException e) {
            rollback(moved, e);
            if (created) {
                removeIfEmpty(folder);
            }
            throw e;
        }
        return moved;
    }

    /**
     * Undo a {@link #move}: every destination goes back to its original location. On
     * failure the files already moved back are moved forward again.
     */
    public void moveBack(Map<Path, Path> moved) throws IOException {
        Map<Path, Path> back = new LinkedHashMap<>();
        try {
            for (Map.Entry<Path, Path> e : moved.entrySet()) {
                Files.createDirectories(e.getKey().getParent());
                moveOne(e.getValue(), e.getKey());
                back.put(e.getValue(), e.getKey());
            }
        } catch (IOException e) {
            rollback(back, e);
            throw e;
        }
        Set<Path> folders = new LinkedHashSet<>();
        for (Path destination : moved.values()) {
            folders.add(destination.getParent());
        }
        removeEmpty(folders);
    }

    private void removeEmpty(Collection<Path> folders) {
        for (Path folder : folders) {
            try {
                removeIfEmpty(folder);
            } catch (IOException e) {
                LOG.warn("Can not remove empty folder {}: {}", folder, e.toString());
            }
        }
    }

    boolean removeIfEmpty(Path folder) throws IOException {
        if (!Files.isDirectory(folder)) {
            return false;
        }
        try (Stream<Path> children = Files.list(folder)) {
            if (children.findAny().isPresent()) {
                return false;
            }
        }
        try {
            Files.delete(folder);
        } catch (DirectoryNotEmptyException e) {
            LOG.debug("{} filled up again, keep it", folder);
            return false;
        }
        LOG.debug("Removed empty folder {}", folder);
        return true;
    }

    private void rollback(Map<Path, Path> moved, IOException cause) {
        List<Map.Entry<Path, Path>> entries = new ArrayList<>(moved.entrySet());
        for (int i = entries.size() - 1; i >= 0; i--) {
            Map.Entry<Path, Path> e = entries.get(i);
            try {
                Files.move(e.getValue(), e.getKey());
            } catch (IOException ex) {
                LOG.error("Rollback of " + e.getValue() + " to " + e.getKey() + " failed", ex);
                cause.addSuppressed(ex);
            }
        }
    }

    private void moveOne(Path source, Path target) throws IOException {
        RetryCallable<Path> callable = new RetryCallable<>(
                () -> Files.move(source, target),
                retryStrategies.get(),
                FileMover::isTransient);
        try {
            callable.call();
        } catch (IOException | RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new IOException("Move " + source + " to " + target + " failed", e);
        }
        if (LOG.isTraceEnabled()) {
            LOG.trace("Moved {} to {}", source, target);
        }
    }

    /**
     * A conflict or a vanished source does not go away by trying again.
     */
    static boolean isTransient(Exception e) {
        return e instanceof IOException
                && !(e instanceof FileAlreadyExistsException)
                && !(e instanceof NoSuchFileException);
    }

    static String baseName(String fileName) {
        int dot = fileName.lastIndexOf('.');
        return dot <= 0 ? fileName : fileName.substring(0, dot);
    }
}
