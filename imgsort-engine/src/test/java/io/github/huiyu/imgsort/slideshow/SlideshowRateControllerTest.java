package io.github.huiyu.imgsort.slideshow;

import io.github.huiyu.imgsort.ManualTicker;
import io.github.huiyu.imgsort.index.Direction;

import org.junit.Before;
import org.junit.Test;

import static io.github.huiyu.imgsort.slideshow.SlideshowRateController.State.*;
import static org.junit.Assert.*;

public class SlideshowRateControllerTest {

    private ManualTicker ticker;
    private SlideshowRateController controller;

    @Before
    public void setUp() {
        ticker = new ManualTicker();
        controller = new SlideshowRateController(ticker, 3000L, 60000L);
    }

    @Test
    public void testNegotiateRate() {
        assertEquals(IDLE, controller.getState());
        assertEquals(RUNNING, controller.toggle());
        assertEquals(3000L, controller.getIntervalMillis());

        ticker.setMillis(0L);
        assertEquals(AWAITING_SECOND_PRESS, controller.press(Direction.NEXT));
        ticker.setMillis(1200L);
        assertEquals(RUNNING, controller.press(Direction.NEXT));
        assertEquals(1200L, controller.getIntervalMillis());

        // a lone press times out without changing the rate
        ticker.setMillis(10000L);
        assertEquals(AWAITING_SECOND_PRESS, controller.press(Direction.NEXT));
        ticker.setMillis(69999L);
        assertEquals(AWAITING_SECOND_PRESS, controller.getState());
        ticker.setMillis(70000L);
        assertEquals(RUNNING, controller.getState());
        assertEquals(1200L, controller.getIntervalMillis());
    }

    @Test
    public void testPressAfterTimeoutStartsNewPair() {
        controller.toggle();
        controller.press(Direction.NEXT);
        ticker.setMillis(61000L);
        assertEquals(AWAITING_SECOND_PRESS, controller.press(Direction.NEXT));
        ticker.setMillis(62500L);
        assertEquals(RUNNING, controller.press(Direction.NEXT));
        assertEquals(1500L, controller.getIntervalMillis());
    }

    @Test
    public void testDirectionChangeRestartsPair() {
        controller.toggle();
        controller.press(Direction.NEXT);
        ticker.setMillis(500L);
        assertEquals(AWAITING_SECOND_PRESS, controller.press(Direction.PREVIOUS));
        ticker.setMillis(2500L);
        assertEquals(RUNNING, controller.press(Direction.PREVIOUS));
        assertEquals(2000L, controller.getIntervalMillis());
        assertEquals(Direction.PREVIOUS, controller.getLastCycleDirection());
    }

    @Test
    public void testPressWhileIdleOnlyRemembersDirection() {
        assertEquals(IDLE, controller.press(Direction.RANDOM));
        assertEquals(IDLE, controller.getState());
        assertEquals(Direction.RANDOM, controller.getLastCycleDirection());
    }

    @Test
    public void testRestartResetsRate() {
        controller.toggle();
        controller.press(Direction.NEXT);
        ticker.setMillis(800L);
        controller.press(Direction.NEXT);
        assertEquals(800L, controller.getIntervalMillis());

        assertEquals(IDLE, controller.toggle());
        assertEquals(RUNNING, controller.toggle());
        assertEquals(3000L, controller.getIntervalMillis());
    }

    @Test
    public void testToggleWhileAwaitingStops() {
        controller.toggle();
        controller.press(Direction.NEXT);
        assertEquals(IDLE, controller.toggle());
        assertFalse(controller.isRunning());
    }

    @Test
    public void testIntervalHasAFloor() {
        controller.toggle();
        controller.press(Direction.NEXT);
        controller.press(Direction.NEXT);
        assertEquals(SlideshowRateController.MIN_INTERVAL_MILLIS, controller.getIntervalMillis());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testOnlyCycleDirections() {
        controller.press(Direction.FIRST);
    }
}
