package io.github.huiyu.imgsort;

import com.google.common.base.Ticker;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Ticker that only moves when told to.
 */
public class ManualTicker extends Ticker {

    private final AtomicLong nanos = new AtomicLong();

    @Override
    public long read() {
        return nanos.get();
    }

    public ManualTicker advance(long time, TimeUnit unit) {
        nanos.addAndGet(unit.toNanos(time));
        return this;
    }

    public ManualTicker setMillis(long millis) {
        nanos.set(TimeUnit.MILLISECONDS.toNanos(millis));
        return this;
    }
}
