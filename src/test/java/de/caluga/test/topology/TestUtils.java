package de.caluga.test.topology;

import java.util.concurrent.atomic.AtomicInteger;

public class TestUtils {
    public interface Condition {
        boolean test() throws Exception;
    }

    public static long waitForConditionToBecomeTrue(long maxDuration, String failMessage, Condition tst) {
        return waitForConditionToBecomeTrue(maxDuration, failMessage, tst, null);
    }

    /**
     * wait until cond.get() >= valueToReach
     */
    public static long waitForIntegerValueMin(long maxDuration, String failMessage, AtomicInteger cond, int valueToReach) {
        return waitForConditionToBecomeTrue(maxDuration, failMessage, () -> cond.get() >= valueToReach, null);
    }

    public static long waitForConditionToBecomeTrue(long maxDuration, String failMessage, Condition tst, Runnable statusMessage) {
        long start = System.currentTimeMillis();
        int last = 0;

        try {
            while (!tst.test()) {
                if (System.currentTimeMillis() - start > maxDuration) {
                    throw new AssertionError(failMessage);
                }

                if (statusMessage != null && ((System.currentTimeMillis() - start) / 1000) > last) {
                    last = (int) (System.currentTimeMillis() - start) / 1000;
                    statusMessage.run();
                }

                Thread.sleep(10);
            }

            if (statusMessage != null) {
                statusMessage.run();
            }

            return System.currentTimeMillis() - start;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RuntimeException("Interrupted while waiting for condition", e);
        } catch (Exception e) {
            throw new RuntimeException(e);
        }
    }
}
