package de.caluga.test.topology.sdam;

import de.caluga.topology.sdam.MovingAverage;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class MovingAverageTest {

    @Test
    public void average() {
        MovingAverage avg = new MovingAverage();
        assertNull(avg.get());
        avg.addSample(10);
        assertEquals(10.0, avg.get(), 0.0001);
        avg.addSample(20);
        assertEquals(12.0, avg.get(), 0.0001);
        avg.addSample(-5);
        assertEquals(12.0, avg.get(), 0.0001, "negative samples are dropped");
        avg.reset();
        assertNull(avg.get());
        avg.addSample(3);
        assertEquals(3.0, avg.get(), 0.0001);
    }
}
