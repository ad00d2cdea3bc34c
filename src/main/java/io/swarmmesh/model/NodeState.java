package io.swarmmesh.model;

/**
 * Lifecycle of a node inside the topology manager. Unregistered nodes have no state.
 */
public enum NodeState {
    REGISTERED,
    CONNECTED,
    RECONNECTING
}
