package de.caluga.topology.driver.wire;

/**
 * creates unconnected {@link MongoConnection}s. Monitoring connections may be configured differently,
 * e.g. with the connect timeout as read timeout.
 */
public interface ConnectionFactory {
    MongoConnection createConnection();

    default MongoConnection createMonitorConnection() {
        return createConnection();
    }
}
