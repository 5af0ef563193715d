package de.caluga.topology.driver;

import java.util.Map;
import java.util.Objects;

/**
 * define how secure the write should be. most important the w value which states the number of nodes written to:
 * 0: unacknowledged
 * 1: primary only
 * >1: number of nodes
 * <0: majority
 **/
public class WriteConcern {
    public static final int MAJORITY = -1;

    private final int w;
    private final boolean j;

    /**
     * write timeout in ms, 0 means not set
     */
    private final int wtimeout;

    private WriteConcern(int w, boolean j, int wtimeout) {
        this.w = w;
        this.j = j;
        this.wtimeout = wtimeout;
    }

    public static WriteConcern getWc(int w, boolean j, int wtimeout) {
        return new WriteConcern(w, j, wtimeout);
    }

    public static WriteConcern majority(int wtimeout) {
        return new WriteConcern(MAJORITY, false, wtimeout);
    }

    /**
     * same journaling setting, but w upgraded to majority. A wtimeout that was not set gets the given default.
     */
    public WriteConcern withMajority(int defaultWtimeout) {
        return new WriteConcern(MAJORITY, j, wtimeout > 0 ? wtimeout : defaultWtimeout);
    }

    public int getW() {
        return w;
    }

    public boolean isJ() {
        return j;
    }

    public int getWtimeout() {
        return wtimeout;
    }

    public boolean isMajority() {
        return w < 0;
    }

    public boolean isAcknowledged() {
        return w != 0 || j;
    }

    public Map<String, Object> asMap() {
        Doc wc = Doc.of();

        if (w < 0) {
            wc.put("w", "majority");
        } else {
            wc.put("w", w);
        }

        if (j) {
            wc.put("j", true);
        }

        if (wtimeout > 0) {
            wc.put("wtimeout", wtimeout);
        }

        return wc;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        WriteConcern that = (WriteConcern) o;
        return (w == that.w || (w < 0 && that.w < 0)) && j == that.j && wtimeout == that.wtimeout;
    }

    @Override
    public int hashCode() {
        return Objects.hash(w < 0 ? MAJORITY : w, j, wtimeout);
    }

    @Override
    public String toString() {
        return "WriteConcern" + asMap();
    }
}
