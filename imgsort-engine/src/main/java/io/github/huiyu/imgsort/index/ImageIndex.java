package io.github.huiyu.imgsort.index;

import com.google.common.collect.ImmutableList;

import io.github.huiyu.imgsort.image.ImageIdentity;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.TreeSet;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Ordered sequence of images with a cursor. The sequence is copy-on-write, so a
 * {@link Focus} snapshot costs nothing. The cursor is -1 exactly when the sequence is
 * empty.
 */
@Component
public class ImageIndex {

    private static final Logger LOG = LoggerFactory.getLogger(ImageIndex.class);

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final Random random;

    private ImmutableList<ImageIdentity> entries = ImmutableList.of();
    private int cursor = -1;
    private boolean sorted = true;
    // bumped on every change, orders Focus snapshots
    private long version = 0L;

    // identities still to visit in random order, dropped on every mutation
    private final ArrayDeque<ImageIdentity> shuffled = new ArrayDeque<>();

    public ImageIndex() {
        this(new Random());
    }

    public ImageIndex(Random random) {
        this.random = random;
    }

    /**
     * Replace the whole sequence, sorted and without duplicates, cursor on the first entry.
     */
    public void reset(Collection<ImageIdentity> identities) {
        ImmutableList<ImageIdentity> sortedEntries = ImmutableList.copyOf(new TreeSet<>(identities));
        lock.writeLock().lock();
        try {
            entries = sortedEntries;
            cursor = entries.isEmpty() ? -1 : 0;
            sorted = true;
            shuffled.clear();
            version++;
        } finally {
            lock.writeLock().unlock();
        }
        LOG.info("Index holds {} images", sortedEntries.size());
    }

    public ImageIdentity current() {
        lock.readLock().lock();
        try {
            return cursor < 0 ? null : entries.get(cursor);
        } finally {
            lock.readLock().unlock();
        }
    }

    public int getCursor() {
        lock.readLock().lock();
        try {
            return cursor;
        } finally {
            lock.readLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return entries.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean contains(ImageIdentity identity) {
        lock.readLock().lock();
        try {
            return Focus.positionOf(entries, sorted, identity) >= 0;
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<ImageIdentity> snapshot() {
        lock.readLock().lock();
        try {
            return entries;
        } finally {
            lock.readLock().unlock();
        }
    }

    public Focus focus() {
        lock.readLock().lock();
        try {
            return new Focus(entries, cursor, sorted, version);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Move the cursor. NEXT and PREVIOUS wrap around, RANDOM never stays on the current
     * image when there is more than one.
     *
     * @return the new current image, null if the index is empty
     */
    public ImageIdentity advance(Direction direction) {
        lock.writeLock().lock();
        try {
            int size = entries.size();
            if (size == 0) {
                return null;
            }
            switch (direction) {
                case NEXT:
                    cursor = (cursor + 1) % size;
                    break;
                case PREVIOUS:
                    cursor = (cursor - 1 + size) % size;
                    break;
                case FIRST:
                    cursor = 0;
                    break;
                case LAST:
                    cursor = size - 1;
                    break;
                case RANDOM:
                    cursor = nextRandomPosition();
                    break;
                default:
                    throw new IllegalArgumentException("Unknown direction " + direction);
            }
            version++;
            return entries.get(cursor);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Point the cursor at {@code identity}.
     *
     * @return false if it is not in the index
     */
    public boolean moveTo(ImageIdentity identity) {
        lock.writeLock().lock();
        try {
            int position = Focus.positionOf(entries, sorted, identity);
            if (position < 0) {
                return false;
            }
            cursor = position;
            version++;
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Remove an image. Removing the current one moves the cursor to the next remaining
     * entry, or the previous one when the last entry was removed.
     *
     * @return the position it was removed from, -1 if absent
     */
    public int remove(ImageIdentity identity) {
        lock.writeLock().lock();
        try {
            int position = Focus.positionOf(entries, sorted, identity);
            if (position < 0) {
                return -1;
            }
            List<ImageIdentity> copy = new ArrayList<>(entries);
            copy.remove(position);
            entries = ImmutableList.copyOf(copy);
            if (entries.isEmpty()) {
                cursor = -1;
            } else if (position < cursor) {
                cursor--;
            } else if (position == cursor && cursor >= entries.size()) {
                cursor = entries.size() - 1;
            }
            shuffled.clear();
            version++;
            return position;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Insert at an explicit position, clipped to the bounds. An insertion at or before the
     * cursor shifts the cursor so it keeps pointing at the same image.
     *
     * @return false if the identity is already present
     */
    public boolean insert(ImageIdentity identity, int position) {
        lock.writeLock().lock();
        try {
            if (Focus.positionOf(entries, sorted, identity) >= 0) {
                return false;
            }
            doInsert(identity, Math.max(0, Math.min(position, entries.size())));
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Insert at the position consistent with the global sort order.
     *
     * @return the position, or -1 if the identity is already present
     */
    public int insertSorted(ImageIdentity identity) {
        lock.writeLock().lock();
        try {
            if (Focus.positionOf(entries, sorted, identity) >= 0) {
                return -1;
            }
            int position;
            if (sorted) {
                position = -Collections.binarySearch(entries, identity) - 1;
            } else {
                position = 0;
                while (position < entries.size() && entries.get(position).compareTo(identity) < 0) {
                    position++;
                }
            }
            doInsert(identity, position);
            return position;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public List<ImageIdentity> neighborhood(int radius) {
        lock.readLock().lock();
        try {
            return Focus.neighborhood(entries, cursor, radius);
        } finally {
            lock.readLock().unlock();
        }
    }

    private void doInsert(ImageIdentity identity, int position) {
        List<ImageIdentity> copy = new ArrayList<>(entries.size() + 1);
        copy.addAll(entries);
        copy.add(position, identity);
        if (sorted) {
            boolean afterPrevious = position == 0 || copy.get(position - 1).compareTo(identity) < 0;
            boolean beforeNext = position == copy.size() - 1 || identity.compareTo(copy.get(position + 1)) < 0;
            sorted = afterPrevious && beforeNext;
        }
        entries = ImmutableList.copyOf(copy);
        if (cursor < 0) {
            cursor = 0;
        } else if (position <= cursor) {
            cursor++;
        }
        shuffled.clear();
        version++;
    }

    private int nextRandomPosition() {
        int size = entries.size();
        if (size == 1) {
            return 0;
        }
        ImageIdentity current = entries.get(cursor);
        for (int attempt = 0; attempt < 3; attempt++) {
            if (shuffled.isEmpty()) {
                List<ImageIdentity> permutation = new ArrayList<>(entries);
                Collections.shuffle(permutation, random);
                shuffled.addAll(permutation);
            }
            while (!shuffled.isEmpty()) {
                ImageIdentity candidate = shuffled.pollFirst();
                if (!candidate.equals(current)) {
                    return Focus.positionOf(entries, sorted, candidate);
                }
            }
        }
        // unreachable with more than one entry
        return (cursor + 1) % size;
    }
}
