package de.caluga.topology.driver.bson;

/**
 * internal BSON timestamp: seconds in the upper, increment in the lower 32 bit. Used for cluster and
 * operation times. Ordering is unsigned.
 */
public class MongoTimestamp implements Comparable<MongoTimestamp> {
    private final long value;

    public MongoTimestamp(long value) {
        this.value = value;
    }

    public MongoTimestamp(int seconds, int increment) {
        this.value = (long) seconds << 32 | (long) increment & 0xFFFFFFFFL;
    }

    public long getValue() {
        return this.value;
    }

    /**
     * @return seconds, as unsigned int in a long
     */
    public long getTime() {
        return this.value >>> 32;
    }

    public long getInc() {
        return this.value & 0xFFFFFFFFL;
    }

    @Override
    public String toString() {
        return "Timestamp{seconds=" + getTime() + ", inc=" + getInc() + '}';
    }

    @Override
    public int compareTo(MongoTimestamp ts) {
        return Long.compareUnsigned(this.value, ts.value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        } else if (o != null && this.getClass() == o.getClass()) {
            return this.value == ((MongoTimestamp) o).value;
        } else {
            return false;
        }
    }

    @Override
    public int hashCode() {
        return (int) (this.value ^ this.value >>> 32);
    }
}
