/**
 * SwarmMesh source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.swarmmesh.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.swarmmesh.topology.TopologyManager} owns the agent registry and graph view.</li>
 *   <li>{@code io.swarmmesh.agent.PeerAgent} turns agent intents into transport messages.</li>
 *   <li>{@code io.swarmmesh.transport.AbstractTransport} holds the shared connection and dispatch logic.</li>
 * </ul>
 */
package io.swarmmesh;
