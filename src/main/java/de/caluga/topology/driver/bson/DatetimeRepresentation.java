package de.caluga.topology.driver.bson;

public enum DatetimeRepresentation {
    /**
     * <code>{"$date": millis}</code>
     */
    LEGACY,
    /**
     * <code>{"$date": {"$numberLong": "millis"}}</code>
     */
    NUMBERLONG,
    /**
     * <code>{"$date": "1970-01-01T00:00:00.000Z"}</code> for dates between epoch and year 9999, NUMBERLONG otherwise
     */
    ISO8601
}
