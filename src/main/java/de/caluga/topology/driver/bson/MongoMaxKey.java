package de.caluga.topology.driver.bson;

/**
 * compares higher than every other BSON value
 */
public final class MongoMaxKey {
    public static final MongoMaxKey INSTANCE = new MongoMaxKey();

    @Override
    public boolean equals(Object o) {
        return o instanceof MongoMaxKey;
    }

    @Override
    public int hashCode() {
        return 1;
    }

    @Override
    public String toString() {
        return "MaxKey";
    }
}
