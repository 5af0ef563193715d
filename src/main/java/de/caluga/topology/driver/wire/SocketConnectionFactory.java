package de.caluga.topology.driver.wire;

import de.caluga.topology.config.ConnectionSettings;

public class SocketConnectionFactory implements ConnectionFactory {
    private final ConnectionSettings settings;

    public SocketConnectionFactory(ConnectionSettings settings) {
        this.settings = settings;
    }

    @Override
    public MongoConnection createConnection() {
        return new SingleMongoConnection(settings, false);
    }

    @Override
    public MongoConnection createMonitorConnection() {
        return new SingleMongoConnection(settings, true);
    }
}
