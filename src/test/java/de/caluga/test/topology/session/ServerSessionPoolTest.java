package de.caluga.test.topology.session;

import de.caluga.topology.driver.bson.MongoBinary;
import de.caluga.topology.session.ServerSession;
import de.caluga.topology.session.ServerSessionPool;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class ServerSessionPoolTest {

    @Test
    public void sessionId() {
        ServerSession s = new ServerSession();
        MongoBinary id = (MongoBinary) s.getSessionId().get("id");
        assertEquals(MongoBinary.SUBTYPE_UUID, id.getSubtype());
        assertEquals(16, id.getData().length);
        assertNotEquals(s.getSessionId(), new ServerSession().getSessionId());
        assertEquals(0, s.getTransactionId());
        assertEquals(1, s.incTransactionId());
        assertEquals(1, s.getTransactionId());
    }

    @Test
    public void mostRecentlyUsedFirst() {
        ServerSessionPool pool = new ServerSessionPool();
        ServerSession s1 = pool.getServerSession(30);
        ServerSession s2 = pool.getServerSession(30);
        assertNotSame(s1, s2);

        pool.returnServerSession(s1, 30);
        pool.returnServerSession(s2, 30);
        assertEquals(2, pool.size());
        assertSame(s2, pool.getServerSession(30));
        assertSame(s1, pool.getServerSession(30));
        assertEquals(0, pool.size());
    }

    @Test
    public void dirtySessionsAreDropped() {
        ServerSessionPool pool = new ServerSessionPool();
        ServerSession s = pool.getServerSession(30);
        s.markDirty();
        pool.returnServerSession(s, 30);
        assertEquals(0, pool.size());
        assertNotSame(s, pool.getServerSession(30));
    }

    @Test
    public void timedOutSessionsAreDropped() throws Exception {
        ServerSessionPool pool = new ServerSessionPool();
        ServerSession s = pool.getServerSession(30);
        pool.returnServerSession(s, 30);
        assertEquals(1, pool.size());

        // with a timeout of one minute every session counts as expiring
        Thread.sleep(5);
        assertTrue(s.timedOut(1));
        assertFalse(s.timedOut(30));
        assertNotSame(s, pool.getServerSession(1));
        assertEquals(0, pool.size());

        pool.returnServerSession(s, 1);
        assertEquals(0, pool.size());
    }

    @Test
    public void popAll() {
        ServerSessionPool pool = new ServerSessionPool();
        ServerSession s1 = new ServerSession();
        ServerSession s2 = new ServerSession();
        pool.returnServerSession(s1, 30);
        pool.returnServerSession(s2, 30);

        List<Map<String, Object>> ids = pool.popAll();
        assertEquals(List.of(s1.getSessionId(), s2.getSessionId()), ids);
        assertEquals(0, pool.size());

        pool.returnServerSession(s1, 30);
        pool.clear();
        assertEquals(0, pool.size());
    }
}
