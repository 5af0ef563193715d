package de.caluga.topology.session;

import de.caluga.topology.driver.Doc;
import de.caluga.topology.driver.bson.MongoBinary;
import de.caluga.topology.driver.bson.UUIDRepresentation;
import de.caluga.topology.driver.bson.UuidHelper;

import java.util.Map;
import java.util.UUID;

/**
 * the server side half of a session: its id and transaction number
 */
public class ServerSession {
    private final Map<String, Object> sessionId;
    private volatile long lastUse;
    private long transactionId = 0;
    private volatile boolean dirty = false;

    public ServerSession() {
        // always subtype 4, independent of the configured uuid representation
        sessionId = Doc.of("id", new MongoBinary(UuidHelper.encode(UUID.randomUUID(), UUIDRepresentation.STANDARD), MongoBinary.SUBTYPE_UUID));
        lastUse = now();
    }

    static long now() {
        return System.nanoTime() / 1000000L;
    }

    public Map<String, Object> getSessionId() {
        return sessionId;
    }

    /**
     * monotonic ms of the last use
     */
    public long getLastUse() {
        return lastUse;
    }

    public void touch() {
        lastUse = now();
    }

    /**
     * sessions that got a network error are not returned to the pool
     */
    public void markDirty() {
        dirty = true;
    }

    public boolean isDirty() {
        return dirty;
    }

    public synchronized long getTransactionId() {
        return transactionId;
    }

    public synchronized long incTransactionId() {
        return ++transactionId;
    }

    /**
     * true if the server may expire this session within the next minute
     */
    public boolean timedOut(int sessionTimeoutMinutes) {
        long idle = now() - lastUse;
        return idle > (sessionTimeoutMinutes - 1) * 60000L;
    }

    @Override
    public String toString() {
        return "ServerSession{" + sessionId.get("id") + ", txn=" + transactionId + (dirty ? ", dirty" : "") + "}";
    }
}
