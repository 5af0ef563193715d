package de.caluga.topology.sdam;

/**
 * one server of the topology: its application pool, its monitor and the last known description
 */
public class Server {
    private final ConnectionPool pool;
    private final Monitor monitor;
    private volatile ServerDescription description;

    public Server(ServerDescription description, ConnectionPool pool, Monitor monitor) {
        this.description = description;
        this.pool = pool;
        this.monitor = monitor;
    }

    public void open() {
        monitor.open();
    }

    public void close() {
        monitor.close();
        pool.reset();
    }

    /**
     * clears the application pool
     */
    public void reset() {
        pool.reset();
    }

    public void requestCheck() {
        monitor.requestCheck();
    }

    public ServerAddress getAddress() {
        return description.getAddress();
    }

    public ServerDescription getDescription() {
        return description;
    }

    void setDescription(ServerDescription description) {
        this.description = description;
    }

    public ConnectionPool getPool() {
        return pool;
    }

    public Monitor getMonitor() {
        return monitor;
    }

    @Override
    public String toString() {
        return "Server{" + description + "}";
    }
}
