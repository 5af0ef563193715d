package de.caluga.topology.session;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;

/**
 * Pooled server sessions, most recently used first.
 */
public class ServerSessionPool {
    private final Deque<ServerSession> sessions = new ArrayDeque<>();

    public ServerSession getServerSession(int sessionTimeoutMinutes) {
        synchronized (sessions) {
            clearStale(sessionTimeoutMinutes);

            while (!sessions.isEmpty()) {
                ServerSession s = sessions.pollFirst();

                if (!s.timedOut(sessionTimeoutMinutes)) {
                    return s;
                }
            }
        }

        return new ServerSession();
    }

    public void returnServerSession(ServerSession session, int sessionTimeoutMinutes) {
        synchronized (sessions) {
            clearStale(sessionTimeoutMinutes);

            if (!session.timedOut(sessionTimeoutMinutes) && !session.isDirty()) {
                sessions.addFirst(session);
            }
        }
    }

    /**
     * empties the pool
     *
     * @return the ids of all pooled sessions, to be sent with <code>endSessions</code>
     */
    public List<Map<String, Object>> popAll() {
        List<Map<String, Object>> ids = new ArrayList<>();

        synchronized (sessions) {
            while (!sessions.isEmpty()) {
                ids.add(sessions.pollLast().getSessionId());
            }
        }

        return ids;
    }

    public void clear() {
        synchronized (sessions) {
            sessions.clear();
        }
    }

    public int size() {
        synchronized (sessions) {
            return sessions.size();
        }
    }

    // least recently used are at the end
    private void clearStale(int sessionTimeoutMinutes) {
        while (!sessions.isEmpty() && sessions.peekLast().timedOut(sessionTimeoutMinutes)) {
            sessions.pollLast();
        }
    }
}
