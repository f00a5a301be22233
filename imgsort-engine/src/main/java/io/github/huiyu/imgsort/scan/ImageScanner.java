package io.github.huiyu.imgsort.scan;

import com.google.common.base.Stopwatch;

import io.github.huiyu.imgsort.ImageType;
import io.github.huiyu.imgsort.config.Configuration;
import io.github.huiyu.imgsort.config.SortingLayout;
import io.github.huiyu.imgsort.image.ImageIdentity;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;

/**
 * Collects every image below the start directories, leaving out the folders images are
 * sorted into.
 */
@Component
public class ImageScanner {

    private static final Logger LOG = LoggerFactory.getLogger(ImageScanner.class);

    private final SortingLayout layout;

    @Autowired
    public ImageScanner(Configuration config) {
        this(config.getSortingLayout());
    }

    public ImageScanner(SortingLayout layout) {
        this.layout = layout;
    }

    /**
     * @return all images in natural order, without duplicates
     */
    public List<ImageIdentity> scan() {
        Stopwatch stopwatch = Stopwatch.createStarted();
        TreeSet<ImageIdentity> found = new TreeSet<>();
        for (Path startDir : layout.getStartDirs()) {
            if (!Files.isDirectory(startDir)) {
                LOG.warn("Start directory {} does not exist, skip it", startDir);
                continue;
            }
            try {
                Files.walkFileTree(startDir, new Collector(found));
            } catch (IOException e) {
                throw new UncheckedIOException("Scan of " + startDir + " failed", e);
            }
        }
        LOG.info("Found {} images in {}", found.size(), stopwatch);
        return new ArrayList<>(found);
    }

    private class Collector extends SimpleFileVisitor<Path> {

        private final TreeSet<ImageIdentity> found;

        Collector(TreeSet<ImageIdentity> found) {
            this.found = found;
        }

        @Override
        public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
            if (layout.isSortingFolder(dir)) {
                return FileVisitResult.SKIP_SUBTREE;
            }
            return FileVisitResult.CONTINUE;
        }

        @Override
        public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
            if (attrs.isRegularFile() && ImageType.isImageFile(file.getFileName().toString())) {
                found.add(ImageIdentity.of(file));
            }
            return FileVisitResult.CONTINUE;
        }

        @Override
        public FileVisitResult visitFileFailed(Path file, IOException e) {
            LOG.warn("Can not read {}: {}", file, e.toString());
            return FileVisitResult.CONTINUE;
        }
    }
}
