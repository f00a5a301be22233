package io.github.huiyu.imgsort.retry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Callable;
import java.util.function.Predicate;

public class RetryCallable<T> implements Callable<T> {

    private static final Logger LOG = LoggerFactory.getLogger(RetryCallable.class);

    private final Callable<T> task;
    private final RetryStrategy strategy;
    private final Predicate<Exception> retryable;

    public RetryCallable(Callable<T> task, RetryStrategy strategy) {
        this(task, strategy, e -> true);
    }

    public RetryCallable(Callable<T> task, RetryStrategy strategy, Predicate<Exception> retryable) {
        this.task = task;
        this.strategy = strategy;
        this.retryable = retryable;
    }

    @Override
    public T call() throws Exception {
        try {
            return task.call();
        } catch (Exception e) {
            Exception last = e;
            while (retryable.test(last) && strategy.allowRetry()) try {
                return task.call();
            } catch (Exception ex) {
                LOG.warn("Retry {} failed: {}", task, ex.toString());
                last = ex;
            }
            throw last;
        }
    }
}
