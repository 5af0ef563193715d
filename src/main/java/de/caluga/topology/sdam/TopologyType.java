package de.caluga.topology.sdam;

public enum TopologyType {
    Single, ReplicaSetNoPrimary, ReplicaSetWithPrimary, Sharded, Unknown;

    public boolean isReplicaSet() {
        return this == ReplicaSetNoPrimary || this == ReplicaSetWithPrimary;
    }
}
