package io.github.huiyu.imgsort.mutation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.concurrent.locks.ReentrantLock;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Bounded LIFO of {@link UndoRecord}s. Pushing onto a full stack silently forgets the
 * oldest record.
 */
public class UndoStack {

    private static final Logger LOG = LoggerFactory.getLogger(UndoStack.class);

    private final ReentrantLock lock = new ReentrantLock();
    private final ArrayDeque<UndoRecord> records = new ArrayDeque<>();
    private final int capacity;

    public UndoStack(int capacity) {
        checkArgument(capacity > 0, "capacity must be positive");
        this.capacity = capacity;
    }

    public void push(UndoRecord record) {
        checkNotNull(record);
        final ReentrantLock lock = this.lock;
        lock.lock();
        try {
            if (records.size() >= capacity) {
                UndoRecord dropped = records.pollLast();
                LOG.debug("Undo stack full, forget {}", dropped);
            }
            records.addFirst(record);
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return the most recent record, null when empty
     */
    public UndoRecord pop() {
        final ReentrantLock lock = this.lock;
        lock.lock();
        try {
            return records.pollFirst();
        } finally {
            lock.unlock();
        }
    }

    public UndoRecord peek() {
        final ReentrantLock lock = this.lock;
        lock.lock();
        try {
            return records.peekFirst();
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        final ReentrantLock lock = this.lock;
        lock.lock();
        try {
            return records.size();
        } finally {
            lock.unlock();
        }
    }
}
