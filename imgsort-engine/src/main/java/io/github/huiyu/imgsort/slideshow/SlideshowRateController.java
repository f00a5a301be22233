package io.github.huiyu.imgsort.slideshow;

import com.google.common.base.Ticker;

import io.github.huiyu.imgsort.config.Configuration;
import io.github.huiyu.imgsort.index.Direction;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Slideshow interval negotiation. While running, two presses of the same cycle direction
 * within the timeout set the interval to the time between them. A lone press that times
 * out leaves the interval alone. Time comes from a {@link Ticker}, nothing here sleeps.
 */
@Component
public class SlideshowRateController {

    private static final Logger LOG = LoggerFactory.getLogger(SlideshowRateController.class);

    static final long MIN_INTERVAL_MILLIS = 50L;

    public enum State {
        IDLE, RUNNING, AWAITING_SECOND_PRESS
    }

    private final Ticker ticker;
    private final long defaultIntervalMillis;
    private final long timeoutNanos;

    private State state = State.IDLE;
    private long intervalMillis;
    private Direction lastCycleDirection = Direction.NEXT;

    // first press of the pending pair
    private Direction pressed;
    private long firstPressNanos;

    @Autowired
    public SlideshowRateController(Configuration config) {
        this(Ticker.systemTicker(), config.getSlideshowInterval(), config.getSlideshowTimeout());
    }

    public SlideshowRateController(Ticker ticker, long defaultIntervalMillis, long timeoutMillis) {
        checkArgument(defaultIntervalMillis > 0, "defaultIntervalMillis must be positive");
        checkArgument(timeoutMillis > 0, "timeoutMillis must be positive");
        this.ticker = checkNotNull(ticker);
        this.defaultIntervalMillis = defaultIntervalMillis;
        this.timeoutNanos = TimeUnit.MILLISECONDS.toNanos(timeoutMillis);
        this.intervalMillis = defaultIntervalMillis;
    }

    /**
     * Start at the default interval, or stop.
     */
    public synchronized State toggle() {
        if (state == State.IDLE) {
            state = State.RUNNING;
            intervalMillis = defaultIntervalMillis;
            LOG.info("Slideshow started, {} ms", intervalMillis);
        } else {
            state = State.IDLE;
            pressed = null;
            LOG.info("Slideshow stopped");
        }
        return state;
    }

    /**
     * A cycle key was pressed. Remembered as the slideshow direction in any state.
     */
    public synchronized State press(Direction direction) {
        checkArgument(direction.isCycle(), "%s does not cycle", direction);
        long now = ticker.read();
        expire(now);
        lastCycleDirection = direction;
        switch (state) {
            case IDLE:
                break;
            case RUNNING:
                awaitSecond(direction, now);
                break;
            case AWAITING_SECOND_PRESS:
                if (direction == pressed) {
                    long elapsed = TimeUnit.NANOSECONDS.toMillis(now - firstPressNanos);
                    intervalMillis = Math.max(MIN_INTERVAL_MILLIS, elapsed);
                    state = State.RUNNING;
                    pressed = null;
                    LOG.info("Slideshow interval set to {} ms", intervalMillis);
                } else {
                    awaitSecond(direction, now);
                }
                break;
            default:
                throw new IllegalStateException("Unknown state " + state);
        }
        return state;
    }

    public synchronized State getState() {
        expire(ticker.read());
        return state;
    }

    public synchronized boolean isRunning() {
        return getState() != State.IDLE;
    }

    public synchronized long getIntervalMillis() {
        expire(ticker.read());
        return intervalMillis;
    }

    public synchronized Direction getLastCycleDirection() {
        return lastCycleDirection;
    }

    private void awaitSecond(Direction direction, long now) {
        state = State.AWAITING_SECOND_PRESS;
        pressed = direction;
        firstPressNanos = now;
    }

    private void expire(long now) {
        if (state == State.AWAITING_SECOND_PRESS && now - firstPressNanos >= timeoutNanos) {
            state = State.RUNNING;
            pressed = null;
            if (LOG.isDebugEnabled()) {
                LOG.debug("Second press timed out, keep {} ms", intervalMillis);
            }
        }
    }
}
