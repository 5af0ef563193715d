package de.caluga.test.topology.sdam;

import de.caluga.topology.sdam.CancellationToken;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

public class CancellationTokenTest {

    @Test
    public void callbacksRunOnce() {
        CancellationToken token = new CancellationToken();
        AtomicInteger calls = new AtomicInteger();
        token.onCancel(calls::incrementAndGet);
        token.onCancel(() -> {
            throw new IllegalStateException("failing callback");
        });
        token.onCancel(calls::incrementAndGet);
        assertFalse(token.isCancelled());

        token.cancel();
        token.cancel();
        assertTrue(token.isCancelled());
        assertEquals(2, calls.get());

        token.onCancel(calls::incrementAndGet);
        assertEquals(3, calls.get(), "late callback runs right away");
    }

    @Test
    public void removedCallbackDoesNotRun() {
        CancellationToken token = new CancellationToken();
        AtomicInteger calls = new AtomicInteger();
        Runnable r = calls::incrementAndGet;
        token.onCancel(r);
        token.onCancel(calls::incrementAndGet);
        assertEquals(2, token.getCallbackCount());

        assertTrue(token.removeOnCancel(r));
        assertFalse(token.removeOnCancel(r));
        assertEquals(1, token.getCallbackCount());

        token.cancel();
        assertEquals(1, calls.get());
        assertEquals(0, token.getCallbackCount());
    }
}
