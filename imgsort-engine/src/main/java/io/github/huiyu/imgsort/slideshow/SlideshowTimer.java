package io.github.huiyu.imgsort.slideshow;

import com.google.common.util.concurrent.ThreadFactoryBuilder;

import io.github.huiyu.imgsort.cache.CacheEntry;
import io.github.huiyu.imgsort.index.Direction;
import io.github.huiyu.imgsort.navigation.NavigationOrchestrator;
import io.github.huiyu.imgsort.schedule.Result;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Advances the index while the slideshow runs. Every tick schedules the next one with the
 * interval current at that moment, so a negotiated rate applies from the next tick on.
 */
@Component
public class SlideshowTimer implements DisposableBean {

    private static final Logger LOG = LoggerFactory.getLogger(SlideshowTimer.class);

    private final SlideshowRateController controller;
    private final NavigationOrchestrator orchestrator;
    private final ScheduledExecutorService executor;
    // ticks of an earlier run are ignored
    private final AtomicLong generation = new AtomicLong();

    private volatile Consumer<Result<CacheEntry>> listener = r -> { };

    @Autowired
    public SlideshowTimer(SlideshowRateController controller, NavigationOrchestrator orchestrator) {
        this.controller = controller;
        this.orchestrator = orchestrator;
        this.executor = Executors.newSingleThreadScheduledExecutor(new ThreadFactoryBuilder()
                .setNameFormat("imgsort-slideshow")
                .setDaemon(true)
                .build());
    }

    public SlideshowRateController.State toggle() {
        SlideshowRateController.State state = controller.toggle();
        long current = generation.incrementAndGet();
        if (state != SlideshowRateController.State.IDLE) {
            schedule(current);
        }
        return state;
    }

    /**
     * Feed a cycle key press into the rate negotiation.
     */
    public SlideshowRateController.State press(Direction direction) {
        return controller.press(direction);
    }

    /**
     * Receives the image shown by every tick.
     */
    public void setListener(Consumer<Result<CacheEntry>> listener) {
        this.listener = checkNotNull(listener);
    }

    public boolean isRunning() {
        return controller.isRunning();
    }

    private void schedule(long expected) {
        executor.schedule(() -> tick(expected), controller.getIntervalMillis(), TimeUnit.MILLISECONDS);
    }

    private void tick(long expected) {
        if (generation.get() != expected || !controller.isRunning()) {
            return;
        }
        Direction direction = controller.getLastCycleDirection();
        try {
            orchestrator.navigate(direction).thenAccept(listener);
        } catch (RuntimeException e) {
            LOG.error("Slideshow step " + direction + " failed", e);
        }
        schedule(expected);
    }

    @Override
    public void destroy() throws Exception {
        generation.incrementAndGet();
        executor.shutdownNow();
    }
}
