package de.caluga.topology.sdam;

import de.caluga.topology.driver.bson.MongoId;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable state of one server as seen by its last heartbeat.
 * <p>
 * roundTripTime is in ms, lastUpdateTime is a monotonic ms value, lastWriteDate is epoch ms.
 */
public final class ServerDescription {
    private final ServerAddress address;
    private final ServerType type;
    private final Double roundTripTime;
    private final long lastUpdateTime;
    private final int minWireVersion;
    private final int maxWireVersion;
    private final Integer maxBsonObjectSize;
    private final String replicaSetName;
    private final Integer setVersion;
    private final MongoId electionId;
    private final ServerAddress primary;
    private final ServerAddress me;
    private final Set<ServerAddress> allHosts;
    private final Map<String, String> tags;
    private final Map<String, Object> clusterTime;
    private final Integer logicalSessionTimeoutMinutes;
    private final Long lastWriteDate;
    private final Throwable error;
    private final HelloResult helloResult;

    private ServerDescription(ServerAddress address, HelloResult hello, Double roundTripTime, Throwable error, long lastUpdateTime) {
        this.address = Objects.requireNonNull(address, "address");
        this.helloResult = hello;
        this.roundTripTime = roundTripTime;
        this.error = error;
        this.lastUpdateTime = lastUpdateTime;

        if (hello == null) {
            type = ServerType.Unknown;
            minWireVersion = 0;
            maxWireVersion = 0;
            maxBsonObjectSize = null;
            replicaSetName = null;
            setVersion = null;
            electionId = null;
            primary = null;
            me = null;
            allHosts = Collections.emptySet();
            tags = Collections.emptyMap();
            clusterTime = null;
            logicalSessionTimeoutMinutes = null;
            lastWriteDate = null;
            return;
        }

        type = hello.getServerType();
        minWireVersion = hello.getMinWireVersion() == null ? 0 : hello.getMinWireVersion();
        maxWireVersion = hello.getMaxWireVersion() == null ? 0 : hello.getMaxWireVersion();
        maxBsonObjectSize = hello.getMaxBsonObjectSize();
        replicaSetName = hello.getSetName();
        setVersion = hello.getSetVersion();
        electionId = hello.getElectionId();
        primary = hello.getPrimary() == null ? null : ServerAddress.parse(hello.getPrimary());
        me = hello.getMe() == null ? null : ServerAddress.parse(hello.getMe());
        Set<ServerAddress> hosts = new LinkedHashSet<>();

        for (String h : hello.getAllHosts()) {
            hosts.add(ServerAddress.parse(h));
        }

        allHosts = Collections.unmodifiableSet(hosts);
        tags = Collections.unmodifiableMap(new LinkedHashMap<>(hello.getTagsAsStrings()));
        clusterTime = hello.getClusterTime();
        logicalSessionTimeoutMinutes = hello.getLogicalSessionTimeoutMinutes();
        lastWriteDate = hello.getLastWriteDate();
    }

    static long now() {
        return System.nanoTime() / 1000000L;
    }

    public static ServerDescription unknown(ServerAddress address) {
        return new ServerDescription(address, null, null, null, now());
    }

    public static ServerDescription unknown(ServerAddress address, Throwable error) {
        return new ServerDescription(address, null, null, error, now());
    }

    /**
     * @param roundTripTime in ms, may be null
     */
    public static ServerDescription fromHello(ServerAddress address, HelloResult hello, Double roundTripTime) {
        return new ServerDescription(address, hello, roundTripTime, null, now());
    }

    /**
     * for tests and replay of recorded heartbeats
     */
    public static ServerDescription fromHello(ServerAddress address, HelloResult hello, Double roundTripTime, long lastUpdateTime) {
        return new ServerDescription(address, hello, roundTripTime, null, lastUpdateTime);
    }

    public ServerDescription withRoundTripTime(Double rtt) {
        return new ServerDescription(address, helloResult, rtt, error, lastUpdateTime);
    }

    public ServerDescription toUnknown(Throwable err) {
        return unknown(address, err);
    }

    public ServerAddress getAddress() {
        return address;
    }

    public ServerType getType() {
        return type;
    }

    public Double getRoundTripTime() {
        return roundTripTime;
    }

    public long getLastUpdateTime() {
        return lastUpdateTime;
    }

    public int getMinWireVersion() {
        return minWireVersion;
    }

    public int getMaxWireVersion() {
        return maxWireVersion;
    }

    public Integer getMaxBsonObjectSize() {
        return maxBsonObjectSize;
    }

    public String getReplicaSetName() {
        return replicaSetName;
    }

    public Integer getSetVersion() {
        return setVersion;
    }

    public MongoId getElectionId() {
        return electionId;
    }

    public ServerAddress getPrimary() {
        return primary;
    }

    public ServerAddress getMe() {
        return me;
    }

    public Set<ServerAddress> getAllHosts() {
        return allHosts;
    }

    public Map<String, String> getTags() {
        return tags;
    }

    public Map<String, Object> getClusterTime() {
        return clusterTime;
    }

    public Integer getLogicalSessionTimeoutMinutes() {
        return logicalSessionTimeoutMinutes;
    }

    public Long getLastWriteDate() {
        return lastWriteDate;
    }

    public Throwable getError() {
        return error;
    }

    public HelloResult getHelloResult() {
        return helloResult;
    }

    public boolean isWritable() {
        return type == ServerType.RSPrimary || type == ServerType.Standalone || type == ServerType.Mongos;
    }

    public boolean isReadable() {
        return type == ServerType.RSSecondary || isWritable();
    }

    public boolean isServerTypeKnown() {
        return type != ServerType.Unknown;
    }

    public boolean isDataBearing() {
        return isReadable();
    }

    public boolean isRetryableWritesSupported() {
        return logicalSessionTimeoutMinutes != null && (type == ServerType.Mongos || type == ServerType.RSPrimary);
    }

    public ElectionTuple getElectionTuple() {
        return new ElectionTuple(setVersion, electionId);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }

        if (!(o instanceof ServerDescription)) {
            return false;
        }

        ServerDescription that = (ServerDescription) o;
        return address.equals(that.address) && type == that.type && minWireVersion == that.minWireVersion && maxWireVersion == that.maxWireVersion
               && Objects.equals(me, that.me) && allHosts.equals(that.allHosts) && tags.equals(that.tags) && Objects.equals(replicaSetName, that.replicaSetName)
               && Objects.equals(setVersion, that.setVersion) && Objects.equals(electionId, that.electionId) && Objects.equals(primary, that.primary)
               && Objects.equals(logicalSessionTimeoutMinutes, that.logicalSessionTimeoutMinutes) && sameError(error, that.error);
    }

    private static boolean sameError(Throwable a, Throwable b) {
        if (a == null || b == null) {
            return a == b;
        }

        return a.getClass().equals(b.getClass()) && Objects.equals(a.getMessage(), b.getMessage());
    }

    @Override
    public int hashCode() {
        return Objects.hash(address, type, minWireVersion, maxWireVersion, me, allHosts, replicaSetName, setVersion, electionId, primary);
    }

    @Override
    public String toString() {
        StringBuilder b = new StringBuilder("<ServerDescription ").append(address).append(" server_type: ").append(type);

        if (roundTripTime != null) {
            b.append(", rtt: ").append(String.format("%.2f", roundTripTime));
        }

        if (error != null) {
            b.append(", error=").append(error.getMessage());
        }

        return b.append(">").toString();
    }

    /**
     * (setVersion, electionId) of a primary, compared in that order
     */
    public record ElectionTuple(Integer setVersion, MongoId electionId) implements Comparable<ElectionTuple> {
        public boolean isComplete() {
            return setVersion != null && electionId != null;
        }

        @Override
        public int compareTo(ElectionTuple o) {
            int c = Integer.compare(setVersion, o.setVersion);

            if (c != 0) {
                return c;
            }

            return electionId.compareTo(o.electionId);
        }
    }
}
