package io.github.huiyu.imgsort.index;

import com.google.common.collect.ImmutableList;

import io.github.huiyu.imgsort.image.ImageIdentity;

import java.util.Collections;
import java.util.List;

/**
 * Immutable snapshot of the index: the sequence and the cursor at one point in time.
 * Safe to read from any thread without touching the index lock.
 */
public final class Focus {

    private final ImmutableList<ImageIdentity> entries;
    private final int cursor;
    private final boolean sorted;
    private final long version;

    Focus(ImmutableList<ImageIdentity> entries, int cursor, boolean sorted, long version) {
        this.entries = entries;
        this.cursor = cursor;
        this.sorted = sorted;
        this.version = version;
    }

    /**
     * Grows with every change of the index it was taken from.
     */
    public long getVersion() {
        return version;
    }

    public ImageIdentity current() {
        return cursor < 0 ? null : entries.get(cursor);
    }

    public int getCursor() {
        return cursor;
    }

    public int size() {
        return entries.size();
    }

    public List<ImageIdentity> getEntries() {
        return entries;
    }

    public int positionOf(ImageIdentity identity) {
        return positionOf(entries, sorted, identity);
    }

    public boolean contains(ImageIdentity identity) {
        return positionOf(identity) >= 0;
    }

    /**
     * @return distance in positions from the cursor, {@link Integer#MAX_VALUE} when the
     * identity is not in the snapshot
     */
    public int distance(ImageIdentity identity) {
        int position = positionOf(identity);
        if (position < 0 || cursor < 0) {
            return Integer.MAX_VALUE;
        }
        return Math.abs(position - cursor);
    }

    /**
     * The current image and its immediate neighbors are never evicted.
     */
    public boolean isPinned(ImageIdentity identity) {
        return distance(identity) <= 1;
    }

    public List<ImageIdentity> neighborhood(int radius) {
        return neighborhood(entries, cursor, radius);
    }

    static List<ImageIdentity> neighborhood(ImmutableList<ImageIdentity> entries, int cursor, int radius) {
        if (cursor < 0) {
            return ImmutableList.of();
        }
        int from = Math.max(0, cursor - radius);
        int to = Math.min(entries.size(), cursor + radius + 1);
        return entries.subList(from, to);
    }

    static int positionOf(ImmutableList<ImageIdentity> entries, boolean sorted, ImageIdentity identity) {
        if (sorted) {
            int position = Collections.binarySearch(entries, identity);
            return position >= 0 ? position : -1;
        }
        return entries.indexOf(identity);
    }

    @Override
    public String toString() {
        return "Focus{current=" + current() + ", cursor=" + cursor + ", size=" + entries.size() + '}';
    }
}
