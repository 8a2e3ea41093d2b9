package com.liveclass.server.broadcast;

/**
 * Outbound side of the connection gateway. Sends are fire-and-forget: failures are
 * logged by the implementation and never thrown back to the caller.
 */
public interface Broadcaster {

    /**
     * Unicast to one connection.
     *
     * @return false when the handle has no live connection (message dropped)
     */
    boolean sendTo(String socketId, String event, Object payload);

    /**
     * Fan-out to every member of the room, optionally skipping one connection.
     *
     * @param excludingSocketId may be null
     */
    void broadcastToRoom(String roomId, String event, Object payload, String excludingSocketId);
}
