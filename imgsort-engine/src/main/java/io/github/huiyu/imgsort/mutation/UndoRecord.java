package io.github.huiyu.imgsort.mutation;

import com.google.common.collect.ImmutableMap;

import io.github.huiyu.imgsort.image.ImageIdentity;

import java.nio.file.Path;
import java.util.Map;

/**
 * What one move or delete did, enough to put every file back.
 */
public final class UndoRecord {

    private final ImageIdentity identity;
    private final Path source;
    private final Path destination;
    private final String category;
    private final ImmutableMap<Path, Path> movedFiles;
    private final long timestamp;

    public UndoRecord(ImageIdentity identity,
                      Path destination,
                      String category,
                      Map<Path, Path> movedFiles,
                      long timestamp) {
        this.identity = identity;
        this.source = identity.getPath();
        this.destination = destination;
        this.category = category;
        this.movedFiles = ImmutableMap.copyOf(movedFiles);
        this.timestamp = timestamp;
    }

    public ImageIdentity getIdentity() {
        return identity;
    }

    public Path getSource() {
        return source;
    }

    public Path getDestination() {
        return destination;
    }

    /**
     * @return the category, null for a delete
     */
    public String getCategory() {
        return category;
    }

    public boolean isDelete() {
        return category == null;
    }

    /**
     * Original location to destination, the image itself included.
     */
    public Map<Path, Path> getMovedFiles() {
        return movedFiles;
    }

    public long getTimestamp() {
        return timestamp;
    }

    @Override
    public String toString() {
        return "UndoRecord{" +
                (isDelete() ? "delete " : "move to " + category + " ") + source +
                ", files=" + movedFiles.size() +
                '}';
    }
}
