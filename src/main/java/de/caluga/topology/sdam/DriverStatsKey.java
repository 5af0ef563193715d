package de.caluga.topology.sdam;

public enum DriverStatsKey {
    HEARTBEATS, HEARTBEAT_FAILURES,
    SERVER_SELECTIONS, SERVER_SELECTION_TIMEOUTS,
    TOPOLOGY_CHANGES,
    CONNECTIONS_OPENED, CONNECTIONS_CLOSED, CONNECTIONS_BORROWED, CONNECTIONS_RELEASED,
    ERRORS, RETRIES,
}
