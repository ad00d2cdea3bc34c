package io.swarmmesh.transport;

import io.swarmmesh.model.NetworkMessage;

@FunctionalInterface
public interface MessageHandler {
    void handle(NetworkMessage message) throws Exception;
}
