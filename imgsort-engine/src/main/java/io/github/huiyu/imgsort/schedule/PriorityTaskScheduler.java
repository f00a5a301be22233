package io.github.huiyu.imgsort.schedule;

import com.google.common.util.concurrent.ThreadFactoryBuilder;

import io.github.huiyu.imgsort.config.Configuration;
import io.github.huiyu.imgsort.exception.ErrorKind;
import io.github.huiyu.imgsort.image.ImageIdentity;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Fixed set of worker loops fed by a {@link TaskQueue}. Submission never blocks.
 */
@Component
public class PriorityTaskScheduler implements TaskScheduler, DisposableBean {

    private static final Logger LOG = LoggerFactory.getLogger(PriorityTaskScheduler.class);

    final TaskQueue queue;
    private final List<Thread> workers;
    private final AtomicLong sequence = new AtomicLong();
    private final ConcurrentMap<ImageIdentity, Set<TaskHandle<?>>> handlesByIdentity =
            new ConcurrentHashMap<>();

    private volatile boolean shutdown = false;

    @Autowired
    public PriorityTaskScheduler(Configuration config) {
        this(config.getWorkers(), config.getQueueCapacity());
    }

    public PriorityTaskScheduler(int workerCount, int queueCapacity) {
        checkArgument(workerCount > 0, "workerCount must be positive");
        checkArgument(queueCapacity > 0, "queueCapacity must be positive");
        this.queue = new TaskQueue(queueCapacity);
        ThreadFactory threadFactory = new ThreadFactoryBuilder()
                .setNameFormat("imgsort-worker-%d")
                .setDaemon(true)
                .setUncaughtExceptionHandler((t, e) -> LOG.error("Worker " + t.getName() + " died", e))
                .build();
        this.workers = new ArrayList<>(workerCount);
        for (int i = 0; i < workerCount; i++) {
            Thread worker = threadFactory.newThread(this::work);
            workers.add(worker);
            worker.start();
        }
        LOG.info("Started {} workers, background queue capacity {}", workerCount, queueCapacity);
    }

    @Override
    public <T> TaskHandle<T> submit(Task<T> task) {
        TaskHandle<T> handle = new TaskHandle<>(sequence.incrementAndGet(), task);
        if (shutdown) {
            handle.markCancelled();
            handle.complete(Result.cancelled());
            return handle;
        }

        register(handle);
        handle.result().whenComplete((r, ex) -> unregister(handle));

        TaskHandle<?> overflow = queue.offer(handle);
        if (overflow != null) {
            LOG.debug("Queue full, dropped {}", overflow);
            cancelQueued(overflow);
        }
        // shutdown may have drained the queue between the check above and the offer
        if (shutdown && queue.remove(handle)) {
            cancelQueued(handle);
        }
        if (LOG.isTraceEnabled()) {
            LOG.trace("Submitted {}", handle);
        }
        return handle;
    }

    @Override
    public void cancel(TaskHandle<?> handle) {
        if (handle.isDone() || !handle.markCancelled()) {
            return;
        }
        if (queue.remove(handle)) {
            handle.complete(Result.cancelled());
        }
        // a running task resolves as cancelled when it returns
        if (LOG.isTraceEnabled()) {
            LOG.trace("Cancelled {}", handle);
        }
    }

    @Override
    public void cancelAllFor(ImageIdentity identity) {
        Set<TaskHandle<?>> handles = handlesByIdentity.get(identity);
        if (handles == null) {
            return;
        }
        for (TaskHandle<?> handle : new ArrayList<>(handles)) {
            cancel(handle);
        }
    }

    @Override
    public boolean promote(TaskHandle<?> handle) {
        boolean promoted = queue.promote(handle);
        if (promoted && LOG.isTraceEnabled()) {
            LOG.trace("Promoted {}", handle);
        }
        return promoted;
    }

    @Override
    public int getQueueSize() {
        return queue.size();
    }

    @Override
    public void shutdown() {
        if (shutdown) {
            return;
        }
        shutdown = true;
        for (TaskHandle<?> handle : queue.drain()) {
            cancelQueued(handle);
        }
        workers.forEach(Thread::interrupt);
        for (Thread worker : workers) {
            try {
                worker.join(TimeUnit.SECONDS.toMillis(1));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        LOG.info("Task scheduler stopped");
    }

    @Override
    public void destroy() throws Exception {
        shutdown();
    }

    private void cancelQueued(TaskHandle<?> handle) {
        handle.markCancelled();
        handle.complete(Result.cancelled());
    }

    private void register(TaskHandle<?> handle) {
        handlesByIdentity.compute(handle.getTask().getIdentity(), (k, handles) -> {
            if (handles == null) {
                handles = ConcurrentHashMap.newKeySet();
            }
            handles.add(handle);
            return handles;
        });
    }

    private void unregister(TaskHandle<?> handle) {
        handlesByIdentity.computeIfPresent(handle.getTask().getIdentity(), (k, handles) -> {
            handles.remove(handle);
            return handles.isEmpty() ? null : handles;
        });
    }

    private void work() {
        while (!shutdown) {
            TaskHandle<?> handle;
            try {
                handle = queue.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            runIsolated(handle);
        }
    }

    private <T> void runIsolated(TaskHandle<T> handle) {
        try {
            handle.run();
        } catch (Throwable t) {
            // keep the worker alive whatever the task did
            LOG.error("Task " + handle + " crashed", t);
            ErrorKind kind = handle.getTask().getKind().getDefaultError();
            handle.complete(Result.failed(kind, t.toString()));
        }
        Result<T> result = handle.result().getNow(null);
        if (result != null && result.isFailed()) {
            LOG.warn("{} failed: {} {}", handle.getTask(), result.getKind(), result.getMessage());
        }
    }
}
