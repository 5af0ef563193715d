package de.caluga.topology.sdam;

import de.caluga.topology.config.ClusterSettings;
import de.caluga.topology.config.DriverConfig;
import de.caluga.topology.driver.ConfigurationException;
import de.caluga.topology.driver.wire.ConnectionFactory;
import de.caluga.topology.driver.wire.SocketConnectionFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Immutable settings of a {@link Topology}, all times in ms.
 */
public final class TopologySettings {
    private final List<ServerAddress> seeds;
    private final String replicaSetName;
    private final boolean direct;
    private final long heartbeatFrequency;
    private final long serverSelectionTimeout;
    private final long localThreshold;
    private final int minPoolSize;
    private final int maxPoolSize;
    private final long maxWaitTime;
    private final ConnectionFactory connectionFactory;
    private final ServerSelector customSelector;

    private TopologySettings(Builder b) {
        if (b.seeds.isEmpty()) {
            throw new ConfigurationException("need at least one seed");
        }

        if (b.heartbeatFrequency < ClusterSettings.MIN_HEARTBEAT_FREQUENCY) {
            throw new ConfigurationException("heartbeatFrequency must be at least " + ClusterSettings.MIN_HEARTBEAT_FREQUENCY + "ms, not " + b.heartbeatFrequency);
        }

        if (b.direct && b.seeds.size() > 1) {
            throw new ConfigurationException("Cannot specify multiple hosts with directConnection=true");
        }

        if (b.connectionFactory == null) {
            throw new ConfigurationException("connectionFactory must be set");
        }

        seeds = Collections.unmodifiableList(new ArrayList<>(b.seeds));
        replicaSetName = b.replicaSetName;
        direct = b.direct;
        heartbeatFrequency = b.heartbeatFrequency;
        serverSelectionTimeout = b.serverSelectionTimeout;
        localThreshold = b.localThreshold;
        minPoolSize = b.minPoolSize;
        maxPoolSize = b.maxPoolSize;
        maxWaitTime = b.maxWaitTime;
        connectionFactory = b.connectionFactory;
        customSelector = b.customSelector;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * settings from a validated config, connections created by the given factory (a
     * {@link SocketConnectionFactory} if null)
     */
    public static TopologySettings fromConfig(DriverConfig cfg, ConnectionFactory factory) {
        cfg.validate();
        ClusterSettings cs = cfg.getClusterSettings();
        return builder().setSeeds(cfg.getSeeds())
                        .setReplicaSetName(cs.getReplicaSetName())
                        .setDirect(cfg.isDirectConnection())
                        .setHeartbeatFrequency(cs.getHeartbeatFrequency())
                        .setServerSelectionTimeout(cs.getServerSelectionTimeout())
                        .setLocalThreshold(cs.getLocalThreshold())
                        .setMinPoolSize(cfg.getConnectionSettings().getMinPoolSize())
                        .setMaxPoolSize(cfg.getConnectionSettings().getMaxPoolSize())
                        .setMaxWaitTime(cfg.getConnectionSettings().getMaxWaitTime())
                        .setConnectionFactory(factory == null ? new SocketConnectionFactory(cfg.getConnectionSettings()) : factory)
                        .build();
    }

    public TopologyType getInitialTopologyType() {
        if (direct) {
            return TopologyType.Single;
        }

        if (replicaSetName != null) {
            return TopologyType.ReplicaSetNoPrimary;
        }

        return TopologyType.Unknown;
    }

    public List<ServerAddress> getSeeds() {
        return seeds;
    }

    public String getReplicaSetName() {
        return replicaSetName;
    }

    public boolean isDirect() {
        return direct;
    }

    public long getHeartbeatFrequency() {
        return heartbeatFrequency;
    }

    public long getServerSelectionTimeout() {
        return serverSelectionTimeout;
    }

    public long getLocalThreshold() {
        return localThreshold;
    }

    public int getMinPoolSize() {
        return minPoolSize;
    }

    public int getMaxPoolSize() {
        return maxPoolSize;
    }

    public long getMaxWaitTime() {
        return maxWaitTime;
    }

    public ConnectionFactory getConnectionFactory() {
        return connectionFactory;
    }

    public ServerSelector getCustomSelector() {
        return customSelector;
    }

    @Override
    public String toString() {
        return "TopologySettings{seeds=" + seeds + ", replicaSetName=" + replicaSetName + ", direct=" + direct + ", heartbeatFrequency=" + heartbeatFrequency
               + ", serverSelectionTimeout=" + serverSelectionTimeout + ", localThreshold=" + localThreshold + "}";
    }

    public static class Builder {
        private List<ServerAddress> seeds = List.of(new ServerAddress("localhost", ServerAddress.DEFAULT_PORT));
        private String replicaSetName;
        private boolean direct = false;
        private long heartbeatFrequency = 10000;
        private long serverSelectionTimeout = 30000;
        private long localThreshold = 15;
        private int minPoolSize = 0;
        private int maxPoolSize = 100;
        private long maxWaitTime = 2000;
        private ConnectionFactory connectionFactory;
        private ServerSelector customSelector;

        public Builder setSeeds(List<ServerAddress> seeds) {
            this.seeds = seeds;
            return this;
        }

        public Builder setSeeds(ServerAddress... seeds) {
            this.seeds = List.of(seeds);
            return this;
        }

        public Builder setReplicaSetName(String replicaSetName) {
            this.replicaSetName = replicaSetName;
            return this;
        }

        public Builder setDirect(boolean direct) {
            this.direct = direct;
            return this;
        }

        public Builder setHeartbeatFrequency(long heartbeatFrequency) {
            this.heartbeatFrequency = heartbeatFrequency;
            return this;
        }

        public Builder setServerSelectionTimeout(long serverSelectionTimeout) {
            this.serverSelectionTimeout = serverSelectionTimeout;
            return this;
        }

        public Builder setLocalThreshold(long localThreshold) {
            this.localThreshold = localThreshold;
            return this;
        }

        public Builder setMinPoolSize(int minPoolSize) {
            this.minPoolSize = minPoolSize;
            return this;
        }

        public Builder setMaxPoolSize(int maxPoolSize) {
            this.maxPoolSize = maxPoolSize;
            return this;
        }

        public Builder setMaxWaitTime(long maxWaitTime) {
            this.maxWaitTime = maxWaitTime;
            return this;
        }

        public Builder setConnectionFactory(ConnectionFactory connectionFactory) {
            this.connectionFactory = connectionFactory;
            return this;
        }

        /**
         * applied after the read preference, before the local threshold
         */
        public Builder setCustomSelector(ServerSelector customSelector) {
            this.customSelector = customSelector;
            return this;
        }

        public TopologySettings build() {
            return new TopologySettings(this);
        }
    }
}
