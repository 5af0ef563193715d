package de.caluga.topology.config;

import de.caluga.topology.driver.ConfigurationException;
import de.caluga.topology.driver.ReadPreference;
import de.caluga.topology.driver.ReadPreferenceType;
import de.caluga.topology.driver.wireprotocol.OpCompressed;
import de.caluga.topology.sdam.ServerAddress;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;

/**
 * all settings of a client, grouped into {@link ClusterSettings} and {@link ConnectionSettings}. Can be read from
 * properties, with an optional prefix, e.g. <code>topology.heartbeatFrequency=5000</code>.
 */
public class DriverConfig {
    private ClusterSettings clusterSettings = new ClusterSettings();
    private ConnectionSettings connectionSettings = new ConnectionSettings();

    public DriverConfig() {
    }

    public DriverConfig(final Properties prop) {
        this(null, prop);
    }

    public DriverConfig(String prefix, final Properties prop) {
        this(prefix, prop::get);
    }

    public DriverConfig(String prefix, ConfigResolver resolver) {
        clusterSettings.loadFrom(prefix, resolver);
        connectionSettings.loadFrom(prefix, resolver);
        String pfx = prefix == null || prefix.isEmpty() ? "" : prefix + ".";

        if (resolver.resolveSetting(pfx + "hostSeed") == null) {
            Object lst = resolver.resolveSetting(pfx + "hosts");

            if (lst != null) {
                clusterSettings.setHostSeed(new ArrayList<>());

                for (String s : Settings.parseList(lst.toString())) {
                    clusterSettings.addHostToSeed(s);
                }
            }
        }
    }

    public ClusterSettings getClusterSettings() {
        return clusterSettings;
    }

    public DriverConfig setClusterSettings(ClusterSettings clusterSettings) {
        this.clusterSettings = clusterSettings;
        return this;
    }

    public ConnectionSettings getConnectionSettings() {
        return connectionSettings;
    }

    public DriverConfig setConnectionSettings(ConnectionSettings connectionSettings) {
        this.connectionSettings = connectionSettings;
        return this;
    }

    public DriverConfig copy() {
        return new DriverConfig().setClusterSettings(clusterSettings.copy()).setConnectionSettings(connectionSettings.copy());
    }

    public Properties asProperties() {
        return asProperties(null);
    }

    public Properties asProperties(String prefix) {
        Properties p = clusterSettings.asProperties(prefix);
        p.putAll(connectionSettings.asProperties(prefix));
        return p;
    }

    /**
     * the seed list parsed into addresses
     */
    public List<ServerAddress> getSeeds() {
        List<ServerAddress> ret = new ArrayList<>();

        for (String h : clusterSettings.getHostSeed()) {
            ServerAddress a = ServerAddress.parse(h);

            if (!ret.contains(a)) {
                ret.add(a);
            }
        }

        return ret;
    }

    /**
     * explicit setting, otherwise direct if there is exactly one seed and no replica set name
     */
    public boolean isDirectConnection() {
        if (clusterSettings.getDirectConnection() != null) {
            return clusterSettings.getDirectConnection();
        }

        return clusterSettings.getHostSeed().size() == 1 && clusterSettings.getReplicaSetName() == null;
    }

    public ReadPreference getDefaultReadPreference() {
        ReadPreferenceType type = ReadPreferenceType.fromName(clusterSettings.getReadPreference());
        List<Map<String, String>> tags = parseTagSets(clusterSettings.getReadPreferenceTags());
        return ReadPreference.of(type, tags, clusterSettings.getMaxStalenessSeconds());
    }

    /**
     * parses <code>dc:ny,rack:1;dc:la;</code> into <code>[{dc:ny, rack:1}, {dc:la}, {}]</code>
     *
     * @return null if no tags are given
     */
    public static List<Map<String, String>> parseTagSets(String tags) {
        if (tags == null || tags.isBlank()) {
            return null;
        }

        List<Map<String, String>> ret = new ArrayList<>();
        String[] sets = tags.split(";", -1);

        for (int i = 0; i < sets.length; i++) {
            String set = sets[i].trim();

            if (set.isEmpty() && i == sets.length - 1 && i > 0 && sets[i - 1].trim().isEmpty()) {
                //"a:b;;" only adds one empty set
                continue;
            }

            Map<String, String> tagSet = new LinkedHashMap<>();

            for (String tag : set.split(",")) {
                if (tag.trim().isEmpty()) {
                    continue;
                }

                int idx = tag.indexOf(':');

                if (idx <= 0) {
                    throw new ConfigurationException("invalid read preference tag '" + tag + "', expected name:value");
                }

                tagSet.put(tag.substring(0, idx).trim(), tag.substring(idx + 1).trim());
            }

            ret.add(tagSet);
        }

        return ret;
    }

    public void validate() {
        ClusterSettings c = clusterSettings;
        ConnectionSettings cs = connectionSettings;

        if (c.getHeartbeatFrequency() < ClusterSettings.MIN_HEARTBEAT_FREQUENCY) {
            throw new ConfigurationException("heartbeatFrequency must be at least " + ClusterSettings.MIN_HEARTBEAT_FREQUENCY + "ms, is " + c.getHeartbeatFrequency());
        }

        if (c.getServerSelectionTimeout() < 0) {
            throw new ConfigurationException("serverSelectionTimeout must not be negative");
        }

        if (c.getLocalThreshold() < 0) {
            throw new ConfigurationException("localThreshold must not be negative");
        }

        if (cs.getConnectionTimeout() <= 0) {
            throw new ConfigurationException("connectionTimeout must be positive");
        }

        if (cs.getReadTimeout() < 0) {
            throw new ConfigurationException("readTimeout must not be negative");
        }

        if (cs.getMaxWaitTime() < 0) {
            throw new ConfigurationException("maxWaitTime must not be negative");
        }

        if (cs.getMaxPoolSize() <= 0) {
            throw new ConfigurationException("maxPoolSize must be positive");
        }

        if (cs.getMinPoolSize() < 0 || cs.getMinPoolSize() > cs.getMaxPoolSize()) {
            throw new ConfigurationException("minPoolSize must be between 0 and maxPoolSize (" + cs.getMaxPoolSize() + "), is " + cs.getMinPoolSize());
        }

        for (String comp : cs.getCompressors()) {
            if (OpCompressed.compressorIdFor(comp) < 0) {
                throw new ConfigurationException("unsupported compressor " + comp);
            }
        }

        List<ServerAddress> seeds = getSeeds();

        if (seeds.isEmpty()) {
            throw new ConfigurationException("need at least one host in hostSeed");
        }

        if (Boolean.TRUE.equals(c.getDirectConnection()) && seeds.size() > 1) {
            throw new ConfigurationException("Cannot specify multiple hosts with directConnection=true");
        }

        ReadPreference rp = getDefaultReadPreference();

        if (rp.getMaxStalenessSeconds() != -1) {
            //same check the selector does, but fail early
            long maxStalenessMs = rp.getMaxStalenessSeconds() * 1000L;

            if (maxStalenessMs < c.getHeartbeatFrequency() + 10000L || rp.getMaxStalenessSeconds() < 90) {
                throw new ConfigurationException("maxStalenessSeconds must be at least 90 and at least heartbeatFrequency + 10 seconds, is " + rp.getMaxStalenessSeconds());
            }
        }
    }

    @Override
    public String toString() {
        return "DriverConfig" + asProperties();
    }
}
