package io.github.huiyu.imgsort.retry;

public interface RetryStrategy {

    /**
     * Block until the next attempt may run.
     *
     * @return false when no more attempts are allowed
     */
    boolean allowRetry();
}
