package de.caluga.topology.sdam;

/**
 * SDAM events. All methods have empty defaults, exceptions thrown by listeners are logged and ignored.
 */
public interface TopologyListener {
    default void topologyOpened(TopologyDescription description) {
    }

    default void topologyDescriptionChanged(TopologyDescription previous, TopologyDescription current) {
    }

    default void serverDescriptionChanged(ServerDescription previous, ServerDescription current) {
    }

    default void serverHeartbeatStarted(ServerAddress address) {
    }

    /**
     * @param duration round trip of this heartbeat in ms
     */
    default void serverHeartbeatSucceeded(ServerAddress address, double duration, HelloResult reply) {
    }

    default void serverHeartbeatFailed(ServerAddress address, double duration, Throwable error) {
    }

    default void topologyClosed() {
    }
}
