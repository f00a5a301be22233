package io.github.huiyu.imgsort.schedule;

import io.github.huiyu.imgsort.image.ImageIdentity;

public interface TaskScheduler {

    <T> TaskHandle<T> submit(Task<T> task);

    /**
     * Cooperative cancel. A queued task is dropped, a running task finishes but resolves
     * as cancelled.
     */
    void cancel(TaskHandle<?> handle);

    void cancelAllFor(ImageIdentity identity);

    /**
     * Raise a queued background task to interactive priority.
     *
     * @return false if the task is no longer queued
     */
    boolean promote(TaskHandle<?> handle);

    int getQueueSize();

    void shutdown();
}
