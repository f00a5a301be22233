package io.github.huiyu.imgsort.image;

import io.github.huiyu.imgsort.util.NaturalOrderComparator;

import java.nio.file.Path;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Stable handle of one image for the whole session. Wraps the absolute, normalized path;
 * instances order by natural order of that path.
 */
public final class ImageIdentity implements Comparable<ImageIdentity> {

    private final Path path;
    private final String key;

    private ImageIdentity(Path path) {
        this.path = path;
        this.key = path.toString();
    }

    public static ImageIdentity of(Path path) {
        checkNotNull(path);
        return new ImageIdentity(path.toAbsolutePath().normalize());
    }

    public Path getPath() {
        return path;
    }

    public String getFileName() {
        return path.getFileName().toString();
    }

    @Override
    public int compareTo(ImageIdentity o) {
        return NaturalOrderComparator.INSTANCE.compare(key, o.key);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ImageIdentity)) return false;
        return key.equals(((ImageIdentity) o).key);
    }

    @Override
    public int hashCode() {
        return key.hashCode();
    }

    @Override
    public String toString() {
        return key;
    }
}
