package io.github.huiyu.imgsort.slideshow;

import com.google.common.base.Ticker;

import io.github.huiyu.imgsort.cache.CacheEntry;
import io.github.huiyu.imgsort.index.Direction;
import io.github.huiyu.imgsort.navigation.NavigationOrchestrator;
import io.github.huiyu.imgsort.schedule.Result;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.util.concurrent.CompletableFuture;

import static org.junit.Assert.*;
import static org.mockito.Mockito.*;

public class SlideshowTimerTest {

    private NavigationOrchestrator orchestrator;
    private SlideshowTimer timer;

    @Before
    public void setUp() {
        orchestrator = mock(NavigationOrchestrator.class);
        when(orchestrator.navigate(any())).thenReturn(
                CompletableFuture.completedFuture(Result.<CacheEntry>cancelled()));
        SlideshowRateController controller = new SlideshowRateController(Ticker.systemTicker(), 50L, 60000L);
        timer = new SlideshowTimer(controller, orchestrator);
    }

    @After
    public void tearDown() throws Exception {
        timer.destroy();
    }

    @Test
    public void testTicksInLastCycleDirection() throws Exception {
        timer.press(Direction.PREVIOUS);
        timer.toggle();
        verify(orchestrator, timeout(2000).atLeast(2)).navigate(Direction.PREVIOUS);
        verify(orchestrator, never()).navigate(Direction.NEXT);
    }

    @Test
    public void testStopsWhenToggledOff() throws Exception {
        timer.toggle();
        verify(orchestrator, timeout(2000).atLeastOnce()).navigate(Direction.NEXT);
        timer.toggle();
        assertFalse(timer.isRunning());
        Thread.sleep(100L);
        clearInvocations(orchestrator);
        Thread.sleep(200L);
        verify(orchestrator, never()).navigate(any());
    }
}
