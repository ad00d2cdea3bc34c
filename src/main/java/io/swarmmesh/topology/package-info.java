/**
 * Swarm topology.
 *
 * <p>{@link io.swarmmesh.topology.TopologyManager} registers agents, mirrors their links into a
 * directed edge map and derives clusters, bridges, paths and health from it through the pure
 * functions in {@link io.swarmmesh.topology.TopologyGraph}.
 */
package io.swarmmesh.topology;
