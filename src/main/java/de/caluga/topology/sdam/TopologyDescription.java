package de.caluga.topology.sdam;

import de.caluga.topology.driver.ConfigurationException;
import de.caluga.topology.driver.bson.MongoId;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable snapshot of the whole deployment. New snapshots are derived with
 * {@link #updated(TopologyDescription, ServerDescription)}, nothing is ever changed in place.
 */
public final class TopologyDescription {
    public static final int MIN_SUPPORTED_WIRE_VERSION = 2;
    public static final int MAX_SUPPORTED_WIRE_VERSION = 8;
    public static final String MIN_SUPPORTED_SERVER_VERSION = "2.6";

    private final TopologyType type;
    private final Map<ServerAddress, ServerDescription> serverDescriptions;
    private final String replicaSetName;
    private final Integer maxSetVersion;
    private final MongoId maxElectionId;
    private final TopologySettings settings;
    private final String incompatibleError;
    private final Integer logicalSessionTimeoutMinutes;

    public TopologyDescription(TopologyType type, Map<ServerAddress, ServerDescription> serverDescriptions, String replicaSetName, Integer maxSetVersion,
                               MongoId maxElectionId, TopologySettings settings) {
        this.type = type;
        this.serverDescriptions = Collections.unmodifiableMap(new LinkedHashMap<>(serverDescriptions));
        this.replicaSetName = replicaSetName;
        this.maxSetVersion = maxSetVersion;
        this.maxElectionId = maxElectionId;
        this.settings = settings;
        incompatibleError = findIncompatibility();
        logicalSessionTimeoutMinutes = computeSessionTimeout();
    }

    /**
     * the description a topology starts with: every seed Unknown
     */
    public static TopologyDescription initial(TopologySettings settings) {
        Map<ServerAddress, ServerDescription> sds = new LinkedHashMap<>();

        for (ServerAddress a : settings.getSeeds()) {
            sds.put(a, ServerDescription.unknown(a));
        }

        return new TopologyDescription(settings.getInitialTopologyType(), sds, settings.getReplicaSetName(), null, null, settings);
    }

    private String findIncompatibility() {
        for (ServerDescription s : serverDescriptions.values()) {
            if (!s.isServerTypeKnown()) {
                continue;
            }

            if (s.getMinWireVersion() > MAX_SUPPORTED_WIRE_VERSION) {
                return "Server at " + s.getAddress() + " requires wire version " + s.getMinWireVersion() + ", but this version of the driver only supports up to "
                       + MAX_SUPPORTED_WIRE_VERSION + ".";
            }

            if (s.getMaxWireVersion() < MIN_SUPPORTED_WIRE_VERSION) {
                return "Server at " + s.getAddress() + " reports wire version " + s.getMaxWireVersion() + ", but this version of the driver requires at least "
                       + MIN_SUPPORTED_WIRE_VERSION + " (MongoDB " + MIN_SUPPORTED_SERVER_VERSION + ").";
            }
        }

        return null;
    }

    private Integer computeSessionTimeout() {
        List<ServerDescription> readable = getReadableServers();

        if (readable.isEmpty()) {
            return null;
        }

        Integer ret = null;

        for (ServerDescription sd : readable) {
            Integer t = sd.getLogicalSessionTimeoutMinutes();

            if (t == null) {
                return null;
            }

            if (ret == null || t < ret) {
                ret = t;
            }
        }

        return ret;
    }

    /**
     * @throws ConfigurationException if a known server's wire version range does not overlap the
     *                                supported one
     */
    public void checkCompatible() {
        if (incompatibleError != null) {
            throw new ConfigurationException(incompatibleError);
        }
    }

    public boolean hasServer(ServerAddress address) {
        return serverDescriptions.containsKey(address);
    }

    /**
     * a copy with one server marked Unknown
     */
    public TopologyDescription resetServer(ServerAddress address) {
        return updated(this, ServerDescription.unknown(address));
    }

    /**
     * a copy with all servers marked Unknown
     */
    public TopologyDescription reset() {
        TopologyType t = type == TopologyType.ReplicaSetWithPrimary ? TopologyType.ReplicaSetNoPrimary : type;
        Map<ServerAddress, ServerDescription> sds = new LinkedHashMap<>();

        for (ServerAddress a : serverDescriptions.keySet()) {
            sds.put(a, ServerDescription.unknown(a));
        }

        return new TopologyDescription(t, sds, replicaSetName, maxSetVersion, maxElectionId, settings);
    }

    public Map<ServerAddress, ServerDescription> getServerDescriptions() {
        return serverDescriptions;
    }

    public ServerDescription getServerDescription(ServerAddress address) {
        return serverDescriptions.get(address);
    }

    public TopologyType getType() {
        return type;
    }

    public String getReplicaSetName() {
        return replicaSetName;
    }

    public Integer getMaxSetVersion() {
        return maxSetVersion;
    }

    public MongoId getMaxElectionId() {
        return maxElectionId;
    }

    public TopologySettings getSettings() {
        return settings;
    }

    public String getIncompatibleError() {
        return incompatibleError;
    }

    public Integer getLogicalSessionTimeoutMinutes() {
        return logicalSessionTimeoutMinutes;
    }

    public long getHeartbeatFrequency() {
        return settings.getHeartbeatFrequency();
    }

    public List<ServerDescription> getKnownServers() {
        List<ServerDescription> ret = new ArrayList<>();

        for (ServerDescription sd : serverDescriptions.values()) {
            if (sd.isServerTypeKnown()) {
                ret.add(sd);
            }
        }

        return ret;
    }

    public boolean hasKnownServers() {
        return !getKnownServers().isEmpty();
    }

    public List<ServerDescription> getReadableServers() {
        List<ServerDescription> ret = new ArrayList<>();

        for (ServerDescription sd : serverDescriptions.values()) {
            if (sd.isReadable()) {
                ret.add(sd);
            }
        }

        return ret;
    }

    /**
     * minimum of the known servers' max wire versions, null if no server is known
     */
    public Integer getCommonWireVersion() {
        Integer ret = null;

        for (ServerDescription sd : getKnownServers()) {
            if (ret == null || sd.getMaxWireVersion() < ret) {
                ret = sd.getMaxWireVersion();
            }
        }

        return ret;
    }

    public List<ServerDescription> applySelector(ServerSelector selector, ServerAddress address) {
        return applySelector(selector, address, settings.getCustomSelector());
    }

    /**
     * the servers suitable for the selector. An explicit address bypasses the selector, so does a
     * Single topology. For sharded clusters the read preference is ignored.
     */
    public List<ServerDescription> applySelector(ServerSelector selector, ServerAddress address, ServerSelector customSelector) {
        int minWire = selector.getMinWireVersion();

        if (minWire != 0) {
            Integer common = getCommonWireVersion();

            if (common != null && common != 0 && common < minWire) {
                throw new ConfigurationException(selector + " requires min wire version " + minWire + ", but topology's min wire version is " + common);
            }
        }

        if (type == TopologyType.Single) {
            return getKnownServers();
        }

        if (address != null) {
            ServerDescription sd = serverDescriptions.get(address);
            return sd == null ? List.of() : List.of(sd);
        }

        Selection selection;

        if (type == TopologyType.Sharded) {
            selection = Selection.fromTopologyDescription(this);
        } else {
            selection = selector.select(Selection.fromTopologyDescription(this));
        }

        if (customSelector != null && !selection.isEmpty()) {
            selection = customSelector.select(selection);
        }

        return applyLocalThreshold(selection);
    }

    private List<ServerDescription> applyLocalThreshold(Selection selection) {
        if (selection.isEmpty()) {
            return List.of();
        }

        double fastest = Double.MAX_VALUE;

        for (ServerDescription sd : selection.getServerDescriptions()) {
            fastest = Math.min(fastest, rtt(sd));
        }

        List<ServerDescription> ret = new ArrayList<>();

        for (ServerDescription sd : selection.getServerDescriptions()) {
            if (rtt(sd) - fastest <= settings.getLocalThreshold()) {
                ret.add(sd);
            }
        }

        return ret;
    }

    private static double rtt(ServerDescription sd) {
        return sd.getRoundTripTime() == null ? 0 : sd.getRoundTripTime();
    }

    public boolean hasReadableServer(ServerSelector readPreference) {
        return !applySelector(readPreference, null).isEmpty();
    }

    public boolean hasWritableServer() {
        return hasReadableServer(ServerSelectors.WRITABLE);
    }

    /**
     * the description that results from receiving <code>sd</code>. Does not modify <code>td</code>.
     */
    public static TopologyDescription updated(TopologyDescription td, ServerDescription sd) {
        ServerAddress address = sd.getAddress();
        TopologyType topologyType = td.type;
        RsState rs = new RsState(td.replicaSetName, td.maxSetVersion, td.maxElectionId);
        ServerType serverType = sd.getType();
        Map<ServerAddress, ServerDescription> sds = new LinkedHashMap<>(td.serverDescriptions);
        sds.put(address, sd);

        if (topologyType == TopologyType.Single) {
            return new TopologyDescription(TopologyType.Single, sds, rs.setName, rs.maxSetVersion, rs.maxElectionId, td.settings);
        }

        if (topologyType == TopologyType.Unknown) {
            if (serverType == ServerType.Standalone) {
                sds.remove(address);
            } else if (serverType != ServerType.Unknown && serverType != ServerType.RSGhost) {
                topologyType = topologyTypeFor(serverType);
            }
        }

        switch (topologyType) {
            case Sharded:
                if (serverType != ServerType.Mongos && serverType != ServerType.Unknown) {
                    sds.remove(address);
                }

                break;

            case ReplicaSetNoPrimary:
                if (serverType == ServerType.Standalone || serverType == ServerType.Mongos) {
                    sds.remove(address);
                } else if (serverType == ServerType.RSPrimary) {
                    topologyType = updateRsFromPrimary(sds, rs, sd);
                } else if (isMember(serverType)) {
                    topologyType = updateRsNoPrimaryFromMember(sds, rs, sd);
                }

                break;

            case ReplicaSetWithPrimary:
                if (serverType == ServerType.Standalone || serverType == ServerType.Mongos) {
                    sds.remove(address);
                    topologyType = checkHasPrimary(sds);
                } else if (serverType == ServerType.RSPrimary) {
                    topologyType = updateRsFromPrimary(sds, rs, sd);
                } else if (isMember(serverType)) {
                    topologyType = updateRsWithPrimaryFromMember(sds, rs, sd);
                } else {
                    // Unknown or RSGhost, maybe the primary is gone
                    topologyType = checkHasPrimary(sds);
                }

                break;

            default:
                break;
        }

        return new TopologyDescription(topologyType, sds, rs.setName, rs.maxSetVersion, rs.maxElectionId, td.settings);
    }

    private static boolean isMember(ServerType t) {
        return t == ServerType.RSSecondary || t == ServerType.RSArbiter || t == ServerType.RSOther;
    }

    private static TopologyType topologyTypeFor(ServerType t) {
        switch (t) {
            case Mongos:
                return TopologyType.Sharded;

            case RSPrimary:
                return TopologyType.ReplicaSetWithPrimary;

            default:
                return TopologyType.ReplicaSetNoPrimary;
        }
    }

    private static TopologyType updateRsFromPrimary(Map<ServerAddress, ServerDescription> sds, RsState rs, ServerDescription sd) {
        if (rs.setName == null) {
            rs.setName = sd.getReplicaSetName();
        } else if (!rs.setName.equals(sd.getReplicaSetName())) {
            sds.remove(sd.getAddress());
            return checkHasPrimary(sds);
        }

        ServerDescription.ElectionTuple serverTuple = sd.getElectionTuple();

        if (serverTuple.isComplete()) {
            ServerDescription.ElectionTuple maxTuple = new ServerDescription.ElectionTuple(rs.maxSetVersion, rs.maxElectionId);

            if (maxTuple.isComplete() && maxTuple.compareTo(serverTuple) > 0) {
                // stale primary
                sds.put(sd.getAddress(), ServerDescription.unknown(sd.getAddress()));
                return checkHasPrimary(sds);
            }

            rs.maxElectionId = sd.getElectionId();
        }

        if (sd.getSetVersion() != null && (rs.maxSetVersion == null || sd.getSetVersion() > rs.maxSetVersion)) {
            rs.maxSetVersion = sd.getSetVersion();
        }

        ServerAddress oldPrimary = null;

        for (ServerDescription s : sds.values()) {
            if (s.getType() == ServerType.RSPrimary && !s.getAddress().equals(sd.getAddress())) {
                oldPrimary = s.getAddress();
                break;
            }
        }

        if (oldPrimary != null) {
            sds.put(oldPrimary, ServerDescription.unknown(oldPrimary));
        }

        for (ServerAddress a : sd.getAllHosts()) {
            sds.putIfAbsent(a, ServerDescription.unknown(a));
        }

        sds.keySet().retainAll(sd.getAllHosts());
        return checkHasPrimary(sds);
    }

    private static TopologyType updateRsWithPrimaryFromMember(Map<ServerAddress, ServerDescription> sds, RsState rs, ServerDescription sd) {
        if (rs.setName == null || !rs.setName.equals(sd.getReplicaSetName())) {
            sds.remove(sd.getAddress());
        } else if (sd.getMe() != null && !sd.getAddress().equals(sd.getMe())) {
            sds.remove(sd.getAddress());
        }

        return checkHasPrimary(sds);
    }

    private static TopologyType updateRsNoPrimaryFromMember(Map<ServerAddress, ServerDescription> sds, RsState rs, ServerDescription sd) {
        if (rs.setName == null) {
            rs.setName = sd.getReplicaSetName();
        } else if (!rs.setName.equals(sd.getReplicaSetName())) {
            sds.remove(sd.getAddress());
            return TopologyType.ReplicaSetNoPrimary;
        }

        // members never remove hosts, they only add
        for (ServerAddress a : sd.getAllHosts()) {
            sds.putIfAbsent(a, ServerDescription.unknown(a));
        }

        if (sd.getMe() != null && !sd.getAddress().equals(sd.getMe())) {
            sds.remove(sd.getAddress());
        }

        return TopologyType.ReplicaSetNoPrimary;
    }

    private static TopologyType checkHasPrimary(Map<ServerAddress, ServerDescription> sds) {
        for (ServerDescription s : sds.values()) {
            if (s.getType() == ServerType.RSPrimary) {
                return TopologyType.ReplicaSetWithPrimary;
            }
        }

        return TopologyType.ReplicaSetNoPrimary;
    }

    @Override
    public String toString() {
        StringBuilder b = new StringBuilder("<TopologyDescription id: ");
        b.append(Integer.toHexString(System.identityHashCode(this))).append(", topology_type: ").append(type);

        if (replicaSetName != null) {
            b.append(", replica_set_name: ").append(replicaSetName);
        }

        b.append(", servers: ").append(serverDescriptions.values()).append(">");
        return b.toString();
    }

    private static class RsState {
        private String setName;
        private Integer maxSetVersion;
        private MongoId maxElectionId;

        RsState(String setName, Integer maxSetVersion, MongoId maxElectionId) {
            this.setName = setName;
            this.maxSetVersion = maxSetVersion;
            this.maxElectionId = maxElectionId;
        }
    }
}
