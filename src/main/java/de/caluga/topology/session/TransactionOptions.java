package de.caluga.topology.session;

import de.caluga.topology.driver.ConfigurationException;
import de.caluga.topology.driver.ReadConcern;
import de.caluga.topology.driver.ReadPreference;
import de.caluga.topology.driver.WriteConcern;

import java.util.Objects;

/**
 * Options of one transaction. Unset values (null) are inherited from the session defaults and then
 * from the client.
 */
public final class TransactionOptions {
    public static final TransactionOptions DEFAULT = new TransactionOptions(null, null, null, null);

    private final ReadConcern readConcern;
    private final WriteConcern writeConcern;
    private final ReadPreference readPreference;
    private final Integer maxCommitTimeMS;

    public TransactionOptions(ReadConcern readConcern, WriteConcern writeConcern, ReadPreference readPreference, Integer maxCommitTimeMS) {
        if (writeConcern != null && !writeConcern.isAcknowledged()) {
            throw new ConfigurationException("transactions do not support unacknowledged write concern: " + writeConcern);
        }

        if (maxCommitTimeMS != null && maxCommitTimeMS < 0) {
            throw new ConfigurationException("maxCommitTimeMS must be >= 0, not " + maxCommitTimeMS);
        }

        this.readConcern = readConcern;
        this.writeConcern = writeConcern;
        this.readPreference = readPreference;
        this.maxCommitTimeMS = maxCommitTimeMS;
    }

    public ReadConcern getReadConcern() {
        return readConcern;
    }

    public WriteConcern getWriteConcern() {
        return writeConcern;
    }

    public ReadPreference getReadPreference() {
        return readPreference;
    }

    public Integer getMaxCommitTimeMS() {
        return maxCommitTimeMS;
    }

    public TransactionOptions withReadConcern(ReadConcern rc) {
        return new TransactionOptions(rc, writeConcern, readPreference, maxCommitTimeMS);
    }

    public TransactionOptions withWriteConcern(WriteConcern wc) {
        return new TransactionOptions(readConcern, wc, readPreference, maxCommitTimeMS);
    }

    public TransactionOptions withReadPreference(ReadPreference rp) {
        return new TransactionOptions(readConcern, writeConcern, rp, maxCommitTimeMS);
    }

    public TransactionOptions withMaxCommitTimeMS(Integer ms) {
        return new TransactionOptions(readConcern, writeConcern, readPreference, ms);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TransactionOptions)) return false;
        TransactionOptions that = (TransactionOptions) o;
        return Objects.equals(readConcern, that.readConcern) && Objects.equals(writeConcern, that.writeConcern) && Objects.equals(readPreference, that.readPreference)
               && Objects.equals(maxCommitTimeMS, that.maxCommitTimeMS);
    }

    @Override
    public int hashCode() {
        return Objects.hash(readConcern, writeConcern, readPreference, maxCommitTimeMS);
    }

    @Override
    public String toString() {
        return "TransactionOptions{readConcern=" + readConcern + ", writeConcern=" + writeConcern + ", readPreference=" + readPreference + ", maxCommitTimeMS="
               + maxCommitTimeMS + "}";
    }
}
