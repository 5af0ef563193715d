package de.caluga.test.topology.driver.wire;

import de.caluga.topology.driver.Doc;
import de.caluga.topology.driver.DriverException;
import de.caluga.topology.driver.ErrorLabel;
import de.caluga.topology.driver.NotPrimaryException;
import de.caluga.topology.driver.OperationFailureException;
import de.caluga.topology.driver.WriteConcernException;
import de.caluga.topology.driver.wire.ReplyHelper;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ReplyHelperTest {

    @Test
    public void okReplies() throws Exception {
        ReplyHelper.checkReply(Doc.of("ok", 1.0));
        ReplyHelper.checkReply(Doc.of("ok", 1));
        ReplyHelper.checkReply(Doc.of("ok", true));
        assertThrows(DriverException.class, () -> ReplyHelper.checkReply(null));
    }

    @Test
    public void commandFailure() {
        Doc reply = Doc.of("ok", 0.0, "code", 11000, "codeName", "DuplicateKey", "errmsg", "E11000 duplicate key").add("errorLabels", List.of("Custom"));
        OperationFailureException ex = assertThrows(OperationFailureException.class, () -> ReplyHelper.checkReply(reply));
        assertFalse(ex instanceof NotPrimaryException);
        assertEquals(11000, ex.getMongoCode());
        assertEquals("DuplicateKey", ex.getCodeName());
        assertEquals("E11000 duplicate key", ex.getMessage());
        assertSame(reply, ex.getReply());
        assertTrue(ex.hasErrorLabel("Custom"));
    }

    @Test
    public void notPrimary() {
        NotPrimaryException ex = assertThrows(NotPrimaryException.class, () -> ReplyHelper.checkReply(Doc.of("ok", 0.0, "code", 10107, "errmsg", "not primary")));
        assertFalse(ex.isShuttingDown());
        ex = assertThrows(NotPrimaryException.class, () -> ReplyHelper.checkReply(Doc.of("ok", 0.0, "code", 91, "errmsg", "shutting down")));
        assertTrue(ex.isShuttingDown());

        // old servers without a code
        assertThrows(NotPrimaryException.class, () -> ReplyHelper.checkReply(Doc.of("ok", 0.0, "errmsg", "not master")));
        assertThrows(NotPrimaryException.class, () -> ReplyHelper.checkReply(Doc.of("ok", 0.0, "errmsg", "node is recovering")));
        OperationFailureException other = assertThrows(OperationFailureException.class, () -> ReplyHelper.checkReply(Doc.of("ok", 0.0, "code", 2, "errmsg", "not master")));
        assertFalse(other instanceof NotPrimaryException);
    }

    @Test
    public void writeConcernError() {
        Doc wce = Doc.of("code", 64, "codeName", "WriteConcernFailed", "errmsg", "waiting for replication timed out", "errInfo", Doc.of("wtimeout", true));
        Doc reply = Doc.of("ok", 1.0, "n", 1, "writeConcernError", wce).add("errorLabels", List.of("RetryableWriteError"));
        WriteConcernException ex = assertThrows(WriteConcernException.class, () -> ReplyHelper.checkReply(reply));
        assertTrue(ex.isWTimeout());
        assertEquals(64, ex.getMongoCode());
        assertEquals("WriteConcernFailed", ex.getCodeName());
        assertTrue(ex.hasErrorLabel(ErrorLabel.RETRYABLE_WRITE_ERROR));

        ex = assertThrows(WriteConcernException.class, () -> ReplyHelper.checkReply(Doc.of("ok", 1.0, "writeConcernError", Doc.of("code", 100, "errmsg", "unsatisfiable"))));
        assertFalse(ex.isWTimeout());
    }
}
