/**
 * Best-effort, at-most-once messaging between nodes, over sockets or an in-process fabric.
 */
package io.swarmmesh.transport;
