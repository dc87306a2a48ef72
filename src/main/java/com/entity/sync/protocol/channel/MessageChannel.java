package com.entity.sync.protocol.channel;

import java.util.function.Consumer;

/**
 * Bidirectional text channel to the server, typically a WebSocket.
 * Delivery, framing and reconnects are the channel's concern.
 */
public interface MessageChannel {

    /**
     * Sends one frame.
     *
     * @throws com.entity.sync.protocol.TransportException if the frame cannot be sent
     */
    void send(String frame);

    boolean isOpen();

    /**
     * Sets the receiver of inbound frames. Called on the channel's thread.
     */
    void setFrameHandler(Consumer<String> handler);
}
