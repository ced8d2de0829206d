package com.koni.homeenergy.infrastructure.fanout;

import java.io.IOException;

/**
 * One live connection on the real-time telemetry channel.
 */
public interface Subscriber {

    String getId();

    boolean isOpen();

    /**
     * Sends one already-serialised message.
     *
     * @throws IOException if the connection cannot take the message
     */
    void send(String message) throws IOException;

    void close();
}
