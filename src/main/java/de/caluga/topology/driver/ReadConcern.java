package de.caluga.topology.driver;

import java.util.Map;
import java.util.Objects;

public class ReadConcern {
    public static final ReadConcern LOCAL = new ReadConcern("local");
    public static final ReadConcern MAJORITY = new ReadConcern("majority");
    public static final ReadConcern SNAPSHOT = new ReadConcern("snapshot");
    public static final ReadConcern LINEARIZABLE = new ReadConcern("linearizable");
    public static final ReadConcern AVAILABLE = new ReadConcern("available");
    /**
     * server default, nothing is sent
     */
    public static final ReadConcern DEFAULT = new ReadConcern(null);

    private final String level;

    private ReadConcern(String level) {
        this.level = level;
    }

    public static ReadConcern of(String level) {
        return level == null ? DEFAULT : new ReadConcern(level);
    }

    public String getLevel() {
        return level;
    }

    public boolean isServerDefault() {
        return level == null;
    }

    public Map<String, Object> asMap() {
        Doc d = Doc.of();
        d.addIfNotNull("level", level);
        return d;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return Objects.equals(level, ((ReadConcern) o).level);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(level);
    }

    @Override
    public String toString() {
        return "ReadConcern" + asMap();
    }
}
