package de.caluga.test.topology.sdam;

import de.caluga.topology.sdam.PeriodicExecutor;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicInteger;

import static de.caluga.test.topology.TestUtils.waitForConditionToBecomeTrue;
import static de.caluga.test.topology.TestUtils.waitForIntegerValueMin;
import static org.junit.jupiter.api.Assertions.*;

public class PeriodicExecutorTest {
    private static final Logger log = LoggerFactory.getLogger(PeriodicExecutorTest.class);

    @Test
    public void runsRightAwayAndOnWake() throws Exception {
        AtomicInteger runs = new AtomicInteger();
        PeriodicExecutor ex = new PeriodicExecutor("test", 60000, 100, () -> {
            runs.incrementAndGet();
            return true;
        });
        ex.open();
        waitForIntegerValueMin(1000, "first run missing", runs, 1);

        long start = System.currentTimeMillis();
        ex.wake();
        waitForIntegerValueMin(2000, "wake ignored", runs, 2);
        log.info("woken run after {}ms", System.currentTimeMillis() - start);
        assertEquals(2, runs.get());

        ex.close();
        assertTrue(ex.join(1000));
        assertTrue(ex.isStopped());
    }

    @Test
    public void wakeRespectsMinInterval() throws Exception {
        AtomicInteger runs = new AtomicInteger();
        PeriodicExecutor ex = new PeriodicExecutor("test", 60000, 500, () -> {
            runs.incrementAndGet();
            return true;
        });
        ex.open();
        waitForIntegerValueMin(1000, "first run missing", runs, 1);
        ex.wake();
        Thread.sleep(200);
        assertEquals(1, runs.get());
        waitForIntegerValueMin(2000, "wake ignored", runs, 2);
        ex.close();
    }

    @Test
    public void failuresDoNotStopTheLoop() throws Exception {
        AtomicInteger runs = new AtomicInteger();
        PeriodicExecutor ex = new PeriodicExecutor("test", 50, 10, () -> {
            if (runs.incrementAndGet() == 1) {
                throw new IllegalStateException("first run fails");
            }

            return true;
        });
        ex.open();
        waitForIntegerValueMin(2000, "loop died after failure", runs, 3);
        ex.close();
        assertTrue(ex.join(1000));
    }

    @Test
    public void targetCanStopIt() throws Exception {
        AtomicInteger runs = new AtomicInteger();
        PeriodicExecutor ex = new PeriodicExecutor("test", 10, 10, () -> runs.incrementAndGet() < 3);
        ex.open();
        waitForConditionToBecomeTrue(2000, "not stopped", ex::isStopped);
        assertTrue(ex.join(1000));
        assertEquals(3, runs.get());
    }
}
