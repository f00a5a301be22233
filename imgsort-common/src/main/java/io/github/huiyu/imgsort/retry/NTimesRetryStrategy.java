package io.github.huiyu.imgsort.retry;

public class NTimesRetryStrategy implements RetryStrategy {

    private volatile int times;
    private final long millisecondBetweenSleeps;

    public NTimesRetryStrategy(int times, long millisecondBetweenSleeps) {
        this.times = times;
        this.millisecondBetweenSleeps = millisecondBetweenSleeps;
    }

    @Override
    public boolean allowRetry() {
        if (Thread.currentThread().isInterrupted() || times <= 0) {
            return false;
        }
        await();
        times--;
        return !Thread.currentThread().isInterrupted();
    }

    private synchronized void await() {
        if (millisecondBetweenSleeps <= 0) {
            return;
        }
        try {
            wait(millisecondBetweenSleeps);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
