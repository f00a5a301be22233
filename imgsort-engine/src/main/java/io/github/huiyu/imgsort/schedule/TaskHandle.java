package io.github.huiyu.imgsort.schedule;

import io.github.huiyu.imgsort.exception.ErrorKind;
import io.github.huiyu.imgsort.exception.ImgSortException;

import java.io.FileNotFoundException;
import java.nio.file.NoSuchFileException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Handle of a submitted {@link Task}. The result future always completes normally with a
 * {@link Result}, never exceptionally.
 */
public class TaskHandle<T> implements CancellationToken {

    enum State {
        QUEUED, RUNNING, DONE
    }

    private final long sequence;
    private final Task<T> task;
    private final CompletableFuture<Result<T>> future = new CompletableFuture<>();
    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    volatile State state = State.QUEUED;
    volatile Priority priority;

    TaskHandle(long sequence, Task<T> task) {
        this.sequence = sequence;
        this.task = task;
        this.priority = task.getPriority();
    }

    public Task<T> getTask() {
        return task;
    }

    public Priority getPriority() {
        return priority;
    }

    public CompletableFuture<Result<T>> result() {
        return future;
    }

    @Override
    public boolean isCancelled() {
        return cancelled.get();
    }

    public boolean isDone() {
        return future.isDone();
    }

    long getSequence() {
        return sequence;
    }

    boolean markCancelled() {
        return cancelled.compareAndSet(false, true);
    }

    void complete(Result<T> result) {
        state = State.DONE;
        future.complete(result);
    }

    void run() {
        if (cancelled.get()) {
            complete(Result.cancelled());
            return;
        }
        state = State.RUNNING;
        Result<T> result;
        try {
            result = Result.ok(task.getWork().run(this));
        } catch (ImgSortException e) {
            result = Result.failed(e.getKind(), e.getMessage());
        } catch (NoSuchFileException | FileNotFoundException e) {
            result = Result.failed(ErrorKind.NOT_FOUND, e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            result = Result.cancelled();
        } catch (Exception e) {
            result = Result.failed(task.getKind().getDefaultError(), e.toString());
        }
        // a token set while running discards the result
        complete(cancelled.get() ? Result.cancelled() : result);
    }

    @Override
    public String toString() {
        return "TaskHandle{" + task + ", seq=" + sequence + ", state=" + state + '}';
    }
}
