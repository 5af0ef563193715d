package de.caluga.topology.operation;

import de.caluga.topology.driver.DriverException;
import de.caluga.topology.driver.commands.GetMoreCommand;
import de.caluga.topology.driver.commands.KillCursorsCommand;
import de.caluga.topology.sdam.ServerAddress;
import de.caluga.topology.session.ClientSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

/**
 * Iterates the result of a command returning <code>{cursor: {id, ns, firstBatch}}</code>. Further
 * batches are fetched with getMore from the server that created the cursor.
 * <p>
 * Errors while fetching are thrown as RuntimeException wrapping the {@link DriverException}, use
 * {@link #nextBatch()} to get them checked.
 */
public class CommandCursor implements Iterator<Map<String, Object>>, Closeable {
    private static final Logger log = LoggerFactory.getLogger(CommandCursor.class);

    private final OperationExecutor executor;
    private final ServerAddress address;
    private final String db;
    private final String collection;
    private final Deque<Map<String, Object>> data = new ArrayDeque<>();
    private final boolean ownsSession;
    private ClientSession session;
    private int batchSize;
    private Integer maxAwaitTimeMS;
    private long cursorId;
    private boolean killed;

    /**
     * @param reply       checked reply of the command that opened the cursor
     * @param session     session the cursor runs in, may be null
     * @param ownsSession true if the session was created for this cursor only and is ended with it
     */
    @SuppressWarnings("unchecked")
    public CommandCursor(OperationExecutor executor, Map<String, Object> reply, ServerAddress address, int batchSize, ClientSession session, boolean ownsSession)
    throws DriverException {
        this.executor = executor;
        this.address = address;
        this.session = session;
        this.ownsSession = ownsSession;

        if (!(reply.get("cursor") instanceof Map)) {
            throw new DriverException("No cursor returned: " + reply.get("code") + "  Message: " + reply.get("errmsg"));
        }

        Map<String, Object> cursor = (Map<String, Object>) reply.get("cursor");
        cursorId = cursor.get("id") instanceof Number ? ((Number) cursor.get("id")).longValue() : 0;
        String ns = (String) cursor.get("ns");

        if (ns == null || !ns.contains(".")) {
            throw new DriverException("cursor reply without valid namespace: " + ns);
        }

        db = ns.substring(0, ns.indexOf('.'));
        collection = ns.substring(ns.indexOf('.') + 1);

        if (cursor.get("firstBatch") instanceof List) {
            data.addAll((List<Map<String, Object>>) cursor.get("firstBatch"));
        }

        setBatchSize(batchSize);
        killed = cursorId == 0;

        if (killed) {
            endSession();
        }
    }

    /**
     * 0 lets the server decide. 1 is sent as 2, a batch of one would close the cursor.
     */
    public CommandCursor setBatchSize(int batchSize) {
        if (batchSize < 0) {
            throw new IllegalArgumentException("batchSize must be >= 0");
        }

        this.batchSize = batchSize == 1 ? 2 : batchSize;
        return this;
    }

    public int getBatchSize() {
        return batchSize;
    }

    public CommandCursor setMaxAwaitTimeMS(Integer maxAwaitTimeMS) {
        this.maxAwaitTimeMS = maxAwaitTimeMS;
        return this;
    }

    public long getCursorId() {
        return cursorId;
    }

    public ServerAddress getAddress() {
        return address;
    }

    public String getDb() {
        return db;
    }

    public String getCollection() {
        return collection;
    }

    public ClientSession getSession() {
        return ownsSession ? null : session;
    }

    /**
     * number of documents that can be returned without talking to the server
     */
    public int available() {
        return data.size();
    }

    /**
     * true while there is data left or the server may still send some
     */
    public boolean isAlive() {
        return !data.isEmpty() || !killed;
    }

    @Override
    public synchronized boolean hasNext() {
        try {
            while (data.isEmpty() && !killed) {
                refresh();
            }
        } catch (DriverException e) {
            throw new RuntimeException(e);
        }

        return !data.isEmpty();
    }

    @Override
    public synchronized Map<String, Object> next() {
        if (!hasNext()) {
            throw new NoSuchElementException("cursor " + cursorId + " exhausted");
        }

        return data.pollFirst();
    }

    /**
     * the documents of the current batch, fetching the next batch first if the current one is used up.
     * Empty when the cursor is exhausted.
     */
    public synchronized List<Map<String, Object>> nextBatch() throws DriverException {
        if (data.isEmpty() && !killed) {
            refresh();
        }

        List<Map<String, Object>> ret = List.copyOf(data);
        data.clear();
        return ret;
    }

    @SuppressWarnings("unchecked")
    private void refresh() throws DriverException {
        if (cursorId == 0) {
            kill();
            return;
        }

        GetMoreCommand cmd = new GetMoreCommand().setCursorId(cursorId).setColl(collection).setDb(db).setMaxTimeMS(maxAwaitTimeMS);

        if (batchSize > 0) {
            cmd.setBatchSize(batchSize);
        }

        Map<String, Object> reply;

        try {
            reply = executor.executeAt(address, db, cmd.asMap(), session).getReply();
        } catch (DriverException | RuntimeException e) {
            // the cursor is gone or unreachable, no killCursors
            log.debug("getMore on cursor {} at {} failed: {}", cursorId, address, e.getMessage());
            kill();
            throw e;
        }

        Map<String, Object> cursor = (Map<String, Object>) reply.get("cursor");

        if (cursor == null) {
            kill();
            throw new DriverException("getMore returned no cursor: " + reply);
        }

        cursorId = cursor.get("id") instanceof Number ? ((Number) cursor.get("id")).longValue() : 0;

        if (cursor.get("nextBatch") instanceof List) {
            data.addAll((List<Map<String, Object>>) cursor.get("nextBatch"));
        }

        if (cursorId == 0) {
            kill();
        }
    }

    private void kill() {
        killed = true;
        endSession();
    }

    private void endSession() {
        if (session != null && ownsSession) {
            session.endSession();
            session = null;
        }
    }

    /**
     * kills the cursor on the server if it is still open there. Errors are logged only.
     */
    @Override
    public synchronized void close() {
        boolean alreadyKilled = killed;
        killed = true;
        data.clear();

        if (cursorId != 0 && !alreadyKilled) {
            KillCursorsCommand cmd = new KillCursorsCommand().addCursor(cursorId).setColl(collection).setDb(db);

            try {
                executor.executeAt(address, db, cmd.asMap(), session);
            } catch (DriverException e) {
                log.warn("could not kill cursor {} on {}: {}", cursorId, address, e.getMessage());
            }
        }

        cursorId = 0;
        endSession();
    }

    @Override
    public String toString() {
        return "CommandCursor{id=" + cursorId + ", ns=" + db + "." + collection + ", address=" + address + "}";
    }
}
