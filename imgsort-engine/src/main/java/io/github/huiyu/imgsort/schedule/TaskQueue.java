package io.github.huiyu.imgsort.schedule;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Two lane blocking queue. The interactive lane is always drained before the background
 * lane. Only the background lane is bounded; offering into a full background lane pushes
 * out its oldest sheddable element instead of blocking the caller. File mutations are
 * never shed, they may overfill the lane.
 */
class TaskQueue {

    final ReentrantLock lock = new ReentrantLock();
    final Condition notEmpty = lock.newCondition();

    private final ArrayDeque<TaskHandle<?>> interactive = new ArrayDeque<>();
    private final ArrayDeque<TaskHandle<?>> background = new ArrayDeque<>();
    private final int backgroundCapacity;

    TaskQueue(int backgroundCapacity) {
        this.backgroundCapacity = backgroundCapacity;
    }

    /**
     * @return the background element pushed out to make room, or null
     */
    TaskHandle<?> offer(TaskHandle<?> handle) {
        final ReentrantLock lock = this.lock;
        lock.lock();
        try {
            TaskHandle<?> overflow = null;
            if (handle.getPriority() == Priority.INTERACTIVE) {
                interactive.addLast(handle);
            } else {
                if (background.size() >= backgroundCapacity) {
                    overflow = pollOldestSheddable();
                }
                background.addLast(handle);
            }
            notEmpty.signal();
            return overflow;
        } finally {
            lock.unlock();
        }
    }

    private TaskHandle<?> pollOldestSheddable() {
        Iterator<TaskHandle<?>> it = background.iterator();
        while (it.hasNext()) {
            TaskHandle<?> candidate = it.next();
            if (candidate.getTask().getKind().isSheddable()) {
                it.remove();
                return candidate;
            }
        }
        return null;
    }

    TaskHandle<?> take() throws InterruptedException {
        final ReentrantLock lock = this.lock;
        lock.lockInterruptibly();
        try {
            while (interactive.isEmpty() && background.isEmpty())
                notEmpty.await();
            return interactive.isEmpty() ? background.pollFirst() : interactive.pollFirst();
        } finally {
            lock.unlock();
        }
    }

    boolean remove(TaskHandle<?> handle) {
        final ReentrantLock lock = this.lock;
        lock.lock();
        try {
            return interactive.remove(handle) || background.remove(handle);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Move a queued background element to the tail of the interactive lane.
     */
    boolean promote(TaskHandle<?> handle) {
        final ReentrantLock lock = this.lock;
        lock.lock();
        try {
            if (!background.remove(handle)) {
                return false;
            }
            handle.priority = Priority.INTERACTIVE;
            interactive.addLast(handle);
            return true;
        } finally {
            lock.unlock();
        }
    }

    int size() {
        final ReentrantLock lock = this.lock;
        lock.lock();
        try {
            return interactive.size() + background.size();
        } finally {
            lock.unlock();
        }
    }

    int backgroundSize() {
        final ReentrantLock lock = this.lock;
        lock.lock();
        try {
            return background.size();
        } finally {
            lock.unlock();
        }
    }

    List<TaskHandle<?>> drain() {
        final ReentrantLock lock = this.lock;
        lock.lock();
        try {
            List<TaskHandle<?>> drained = new ArrayList<>(interactive);
            drained.addAll(background);
            interactive.clear();
            background.clear();
            return drained;
        } finally {
            lock.unlock();
        }
    }
}
