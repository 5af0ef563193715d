package de.caluga.topology.sdam;

import java.util.Collections;
import java.util.List;

/**
 * Input and output of a {@link ServerSelector}: the candidate servers plus what a selector needs to know
 * about the topology.
 */
public final class Selection {
    private final TopologyType topologyType;
    private final List<ServerDescription> serverDescriptions;
    private final Integer commonWireVersion;
    private final ServerDescription primary;
    private final long heartbeatFrequency;

    public Selection(TopologyType topologyType, List<ServerDescription> serverDescriptions, Integer commonWireVersion, ServerDescription primary, long heartbeatFrequency) {
        this.topologyType = topologyType;
        this.serverDescriptions = Collections.unmodifiableList(serverDescriptions);
        this.commonWireVersion = commonWireVersion;
        this.primary = primary;
        this.heartbeatFrequency = heartbeatFrequency;
    }

    public static Selection fromTopologyDescription(TopologyDescription td) {
        List<ServerDescription> known = td.getKnownServers();
        ServerDescription primary = null;

        for (ServerDescription sd : known) {
            if (sd.getType() == ServerType.RSPrimary) {
                primary = sd;
                break;
            }
        }

        return new Selection(td.getType(), known, td.getCommonWireVersion(), primary, td.getHeartbeatFrequency());
    }

    public Selection withServerDescriptions(List<ServerDescription> sds) {
        return new Selection(topologyType, sds, commonWireVersion, primary, heartbeatFrequency);
    }

    public Selection primarySelection() {
        return withServerDescriptions(primary == null ? List.of() : List.of(primary));
    }

    /**
     * the secondary with the most recent lastWriteDate, or null if there are no secondaries
     */
    public ServerDescription secondaryWithMaxLastWriteDate() {
        ServerDescription ret = null;

        for (ServerDescription sd : ServerSelectors.SECONDARY.select(this).getServerDescriptions()) {
            if (ret == null || lastWrite(sd) > lastWrite(ret)) {
                ret = sd;
            }
        }

        return ret;
    }

    static long lastWrite(ServerDescription sd) {
        return sd.getLastWriteDate() == null ? 0 : sd.getLastWriteDate();
    }

    public boolean isEmpty() {
        return serverDescriptions.isEmpty();
    }

    public TopologyType getTopologyType() {
        return topologyType;
    }

    public List<ServerDescription> getServerDescriptions() {
        return serverDescriptions;
    }

    public Integer getCommonWireVersion() {
        return commonWireVersion;
    }

    public ServerDescription getPrimary() {
        return primary;
    }

    public long getHeartbeatFrequency() {
        return heartbeatFrequency;
    }

    @Override
    public String toString() {
        return "Selection{" + topologyType + ", " + serverDescriptions + "}";
    }
}
