package de.caluga.topology.session;

import de.caluga.topology.driver.DriverException;
import de.caluga.topology.driver.ReadConcern;
import de.caluga.topology.driver.ReadPreference;
import de.caluga.topology.driver.WriteConcern;
import de.caluga.topology.driver.commands.MongoCommand;

import java.util.Map;

/**
 * what a {@link ClientSession} needs from the client that created it
 */
public interface SessionClient {
    ReadConcern getReadConcern();

    WriteConcern getWriteConcern();

    ReadPreference getReadPreference();

    /**
     * runs commitTransaction / abortTransaction on the primary (or the pinned mongos) within the session
     *
     * @return the checked reply
     */
    Map<String, Object> runTransactionCommand(ClientSession session, MongoCommand<?> cmd) throws DriverException;

    void returnServerSession(ServerSession session);
}
