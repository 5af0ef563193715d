package de.caluga.topology.sdam;

import de.caluga.topology.driver.ConfigurationException;

import java.util.ArrayList;
import java.util.List;

/**
 * Filters secondaries whose estimated replication lag exceeds maxStalenessSeconds. Primaries and other
 * server types are never filtered.
 */
public final class MaxStalenessSelector {
    /** ms, a primary writes a no-op at least this often */
    public static final long IDLE_WRITE_PERIOD = 10000;
    public static final int SMALLEST_MAX_STALENESS = 90;

    private MaxStalenessSelector() {
    }

    public static Selection select(int maxStalenessSeconds, Selection selection) {
        if (maxStalenessSeconds == -1) {
            return selection;
        }

        validate(maxStalenessSeconds, selection.getHeartbeatFrequency());

        if (selection.getPrimary() != null) {
            return withPrimary(maxStalenessSeconds * 1000L, selection);
        }

        return noPrimary(maxStalenessSeconds * 1000L, selection);
    }

    static void validate(int maxStalenessSeconds, long heartbeatFrequency) {
        if (maxStalenessSeconds * 1000L < heartbeatFrequency + IDLE_WRITE_PERIOD) {
            throw new ConfigurationException(String.format("maxStalenessSeconds must be at least heartbeatFrequencyMS + %d seconds. maxStalenessSeconds is set to %d, heartbeatFrequencyMS is set to %d.",
                                             IDLE_WRITE_PERIOD / 1000, maxStalenessSeconds, heartbeatFrequency));
        }

        if (maxStalenessSeconds < SMALLEST_MAX_STALENESS) {
            throw new ConfigurationException(String.format("maxStalenessSeconds must be at least %d. maxStalenessSeconds is set to %d.", SMALLEST_MAX_STALENESS, maxStalenessSeconds));
        }
    }

    private static Selection withPrimary(long maxStaleness, Selection selection) {
        ServerDescription p = selection.getPrimary();
        List<ServerDescription> ret = new ArrayList<>();

        for (ServerDescription s : selection.getServerDescriptions()) {
            if (s.getType() == ServerType.RSSecondary) {
                long staleness = (s.getLastUpdateTime() - Selection.lastWrite(s)) - (p.getLastUpdateTime() - Selection.lastWrite(p)) + selection.getHeartbeatFrequency();

                if (staleness <= maxStaleness) {
                    ret.add(s);
                }
            } else {
                ret.add(s);
            }
        }

        return selection.withServerDescriptions(ret);
    }

    private static Selection noPrimary(long maxStaleness, Selection selection) {
        ServerDescription smax = selection.secondaryWithMaxLastWriteDate();

        if (smax == null) {
            return selection.withServerDescriptions(List.of());
        }

        List<ServerDescription> ret = new ArrayList<>();

        for (ServerDescription s : selection.getServerDescriptions()) {
            if (s.getType() == ServerType.RSSecondary) {
                long staleness = Selection.lastWrite(smax) - Selection.lastWrite(s) + selection.getHeartbeatFrequency();

                if (staleness <= maxStaleness) {
                    ret.add(s);
                }
            } else {
                ret.add(s);
            }
        }

        return selection.withServerDescriptions(ret);
    }
}
