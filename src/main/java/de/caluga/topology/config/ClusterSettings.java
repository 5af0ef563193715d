package de.caluga.topology.config;

import java.util.ArrayList;
import java.util.List;

public class ClusterSettings extends Settings {
    public static final int MIN_HEARTBEAT_FREQUENCY = 500;

    private List<String> hostSeed = new ArrayList<>(List.of("localhost:27017"));
    private String replicaSetName;
    private Boolean directConnection;
    private int heartbeatFrequency = 10000;
    private int serverSelectionTimeout = 30000;
    private int localThreshold = 15;
    private String readPreference = "primary";
    /**
     * tag sets, separated by <code>;</code>, tags as <code>name:value</code> separated by <code>,</code>.
     * An empty set matches every server, e.g. <code>dc:ny,rack:1;dc:la;</code>
     */
    private String readPreferenceTags;
    private int maxStalenessSeconds = -1;

    public List<String> getHostSeed() {
        if (hostSeed == null) {
            hostSeed = new ArrayList<>();
        }

        return hostSeed;
    }

    public ClusterSettings setHostSeed(List<String> hostSeed) {
        this.hostSeed = hostSeed;
        return this;
    }

    public ClusterSettings setHostSeed(String... hostPorts) {
        hostSeed = new ArrayList<>();

        for (String h : hostPorts) {
            addHostToSeed(h);
        }

        return this;
    }

    public ClusterSettings addHostToSeed(String host) {
        host = host.replaceAll(" ", "");

        if (!host.isEmpty()) {
            getHostSeed().add(host);
        }

        return this;
    }

    public ClusterSettings addHostToSeed(String host, int port) {
        return addHostToSeed(host + ":" + port);
    }

    public String getReplicaSetName() {
        return replicaSetName;
    }

    public ClusterSettings setReplicaSetName(String replicaSetName) {
        this.replicaSetName = replicaSetName;
        return this;
    }

    public Boolean getDirectConnection() {
        return directConnection;
    }

    /**
     * null: direct if exactly one seed and no replica set name
     */
    public ClusterSettings setDirectConnection(Boolean directConnection) {
        this.directConnection = directConnection;
        return this;
    }

    public int getHeartbeatFrequency() {
        return heartbeatFrequency;
    }

    public ClusterSettings setHeartbeatFrequency(int heartbeatFrequency) {
        this.heartbeatFrequency = heartbeatFrequency;
        return this;
    }

    public int getServerSelectionTimeout() {
        return serverSelectionTimeout;
    }

    public ClusterSettings setServerSelectionTimeout(int serverSelectionTimeout) {
        this.serverSelectionTimeout = serverSelectionTimeout;
        return this;
    }

    public int getLocalThreshold() {
        return localThreshold;
    }

    public ClusterSettings setLocalThreshold(int localThreshold) {
        this.localThreshold = localThreshold;
        return this;
    }

    public String getReadPreference() {
        return readPreference;
    }

    public ClusterSettings setReadPreference(String readPreference) {
        this.readPreference = readPreference;
        return this;
    }

    public String getReadPreferenceTags() {
        return readPreferenceTags;
    }

    public ClusterSettings setReadPreferenceTags(String readPreferenceTags) {
        this.readPreferenceTags = readPreferenceTags;
        return this;
    }

    public int getMaxStalenessSeconds() {
        return maxStalenessSeconds;
    }

    public ClusterSettings setMaxStalenessSeconds(int maxStalenessSeconds) {
        this.maxStalenessSeconds = maxStalenessSeconds;
        return this;
    }
}
