package com.example.chathub.room;

import java.io.IOException;

/**
 * A live client endpoint registered in a room.
 */
public interface Connection {

    String getId();

    void send(String payload) throws IOException;

    /**
     * Tear the connection down after a failed send. Must be idempotent.
     */
    void disconnect();
}
