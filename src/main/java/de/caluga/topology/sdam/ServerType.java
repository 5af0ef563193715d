package de.caluga.topology.sdam;

public enum ServerType {
    Unknown, Standalone, Mongos, RSPrimary, RSSecondary, RSArbiter, RSOther, RSGhost;

    public boolean isReplicaSetMember() {
        return this == RSPrimary || this == RSSecondary || this == RSArbiter || this == RSOther || this == RSGhost;
    }
}
