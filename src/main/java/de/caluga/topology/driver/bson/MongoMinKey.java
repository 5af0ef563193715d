package de.caluga.topology.driver.bson;

/**
 * compares lower than every other BSON value
 */
public final class MongoMinKey {
    public static final MongoMinKey INSTANCE = new MongoMinKey();

    @Override
    public boolean equals(Object o) {
        return o instanceof MongoMinKey;
    }

    @Override
    public int hashCode() {
        return 0;
    }

    @Override
    public String toString() {
        return "MinKey";
    }
}
