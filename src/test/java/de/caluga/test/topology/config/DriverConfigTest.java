package de.caluga.test.topology.config;

import de.caluga.topology.config.ConnectionSettings;
import de.caluga.topology.config.DriverConfig;
import de.caluga.topology.driver.ConfigurationException;
import de.caluga.topology.driver.ReadPreference;
import de.caluga.topology.driver.ReadPreferenceType;
import de.caluga.topology.sdam.ServerAddress;
import de.caluga.topology.sdam.TopologySettings;
import de.caluga.topology.sdam.TopologyType;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.function.Consumer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

public class DriverConfigTest {

    private static Properties props() {
        Properties p = new Properties();
        p.put("topology.hosts", "a:27017, B:27018");
        p.put("topology.replicaSetName", "rs");
        p.put("topology.heartbeatFrequency", "5000");
        p.put("topology.retryWrites", "false");
        p.put("topology.readPreference", "secondaryPreferred");
        p.put("topology.readPreferenceTags", "dc:ny,rack:1;dc:la;");
        p.put("topology.maxStalenessSeconds", "120");
        p.put("topology.compressors", "snappy,zlib");
        p.put("other.heartbeatFrequency", "1");
        return p;
    }

    @Test
    public void defaults() {
        DriverConfig cfg = new DriverConfig();
        cfg.validate();
        assertEquals(List.of(new ServerAddress("localhost", 27017)), cfg.getSeeds());
        assertTrue(cfg.isDirectConnection());
        assertEquals(10000, cfg.getClusterSettings().getHeartbeatFrequency());
        assertEquals(30000, cfg.getClusterSettings().getServerSelectionTimeout());
        assertEquals(15, cfg.getClusterSettings().getLocalThreshold());
        assertTrue(cfg.getConnectionSettings().isRetryReads());
        assertTrue(cfg.getConnectionSettings().isRetryWrites());
        assertSame(ReadPreference.primary(), cfg.getDefaultReadPreference());
        assertTrue(cfg.asProperties().isEmpty());
    }

    @Test
    public void loadFromProperties() {
        DriverConfig cfg = new DriverConfig("topology", props());
        cfg.validate();
        assertEquals(List.of(ServerAddress.parse("a:27017"), ServerAddress.parse("b:27018")), cfg.getSeeds());
        assertEquals("rs", cfg.getClusterSettings().getReplicaSetName());
        assertFalse(cfg.isDirectConnection());
        assertEquals(5000, cfg.getClusterSettings().getHeartbeatFrequency());
        assertFalse(cfg.getConnectionSettings().isRetryWrites());
        assertEquals(List.of("snappy", "zlib"), cfg.getConnectionSettings().getCompressors());

        ReadPreference rp = cfg.getDefaultReadPreference();
        assertEquals(ReadPreferenceType.SECONDARY_PREFERRED, rp.getType());
        assertEquals(List.of(Map.of("dc", "ny", "rack", "1"), Map.of("dc", "la"), Map.of()), rp.getTagSets());
        assertEquals(120, rp.getMaxStalenessSeconds());

        TopologySettings ts = TopologySettings.fromConfig(cfg, null);
        assertEquals(TopologyType.ReplicaSetNoPrimary, ts.getInitialTopologyType());
        assertEquals(5000, ts.getHeartbeatFrequency());
    }

    @Test
    public void propertiesRoundTrip() {
        DriverConfig cfg = new DriverConfig("topology", props());
        Properties exported = cfg.asProperties("x");
        assertEquals("5000", exported.get("x.heartbeatFrequency"));
        assertNull(exported.get("x.localThreshold"));

        DriverConfig copy = new DriverConfig("x", exported);
        assertEquals(cfg.getClusterSettings(), copy.getClusterSettings());
        assertEquals(cfg.getConnectionSettings(), copy.getConnectionSettings());
        assertEquals(cfg.getClusterSettings(), cfg.copy().getClusterSettings());
        assertNotSame(cfg.getClusterSettings().getHostSeed(), cfg.copy().getClusterSettings().getHostSeed());
    }

    @Test
    public void copyWith() {
        ConnectionSettings cs = new ConnectionSettings();
        ConnectionSettings changed = cs.copyWith((ConnectionSettings c) -> c.setMaxPoolSize(5));
        assertEquals(5, changed.getMaxPoolSize());
        assertEquals(100, cs.getMaxPoolSize());
        assertNotEquals(cs, changed);
    }

    @Test
    public void invalidNumber() {
        Properties p = new Properties();
        p.put("heartbeatFrequency", "often");
        ConfigurationException ex = assertThrows(ConfigurationException.class, () -> new DriverConfig(p));
        assertEquals("invalid value for heartbeatFrequency: often", ex.getMessage());
    }

    @Test
    public void directConnection() {
        DriverConfig cfg = new DriverConfig();
        cfg.getClusterSettings().setHostSeed("a", "b");
        assertFalse(cfg.isDirectConnection());
        cfg.getClusterSettings().setHostSeed("a").setReplicaSetName("rs");
        assertFalse(cfg.isDirectConnection());
        cfg.getClusterSettings().setDirectConnection(true);
        assertTrue(cfg.isDirectConnection());

        cfg.getClusterSettings().setHostSeed("a", "b");
        ConfigurationException ex = assertThrows(ConfigurationException.class, cfg::validate);
        assertEquals("Cannot specify multiple hosts with directConnection=true", ex.getMessage());
    }

    @Test
    public void validation() {
        assertInvalid(c -> c.getClusterSettings().setHeartbeatFrequency(100), "heartbeatFrequency must be at least 500ms");
        assertInvalid(c -> c.getClusterSettings().setServerSelectionTimeout(-1), "serverSelectionTimeout");
        assertInvalid(c -> c.getClusterSettings().setHostSeed(List.of()), "need at least one host");
        assertInvalid(c -> c.getConnectionSettings().setMinPoolSize(20).setMaxPoolSize(10), "minPoolSize must be between");
        assertInvalid(c -> c.getConnectionSettings().setCompressors(List.of("lz4")), "unsupported compressor lz4");
        assertInvalid(c -> c.getClusterSettings().setReadPreference("secondary").setMaxStalenessSeconds(30), "maxStalenessSeconds must be at least 90");
        assertInvalid(c -> c.getClusterSettings().setReadPreferenceTags("dc:ny"), "cannot be combined with tags");
        assertInvalid(c -> c.getClusterSettings().setReadPreference("fastest"), "fastest");
        assertInvalid(c -> c.getClusterSettings().setHostSeed("a:99999"), "Port must be an integer");
    }

    private static void assertInvalid(Consumer<DriverConfig> change, String msg) {
        DriverConfig cfg = new DriverConfig();
        ConfigurationException ex = assertThrows(ConfigurationException.class, () -> {
            change.accept(cfg);
            cfg.validate();
        });
        assertThat(ex.getMessage()).contains(msg);
    }

    @Test
    public void tagSets() {
        assertNull(DriverConfig.parseTagSets(null));
        assertNull(DriverConfig.parseTagSets(" "));
        assertEquals(List.of(Map.of("a", "b"), Map.of()), DriverConfig.parseTagSets("a:b;;"));
        assertEquals(List.of(Map.of("a", "b")), DriverConfig.parseTagSets("a:b"));
        assertEquals(List.of(Map.of(), Map.of("x", "y:z")), DriverConfig.parseTagSets(";x:y:z"));
        assertThrows(ConfigurationException.class, () -> DriverConfig.parseTagSets("dc"));
    }
}
