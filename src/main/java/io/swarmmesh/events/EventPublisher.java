package io.swarmmesh.events;

/**
 * Sink for domain events raised by agents and the topology manager. Implementations must not
 * throw back into the caller for delivery problems.
 */
@FunctionalInterface
public interface EventPublisher {
    EventPublisher NOOP = event -> {
    };

    void publish(NetworkEvent event);
}
