package com.roomsignal.ws;

import com.roomsignal.dto.SignalEvent;

/**
 * Outbound side of the session transport. Delivery is fire-and-forget.
 */
public interface SessionGateway {

    void send(String participantId, SignalEvent event);

    /**
     * Closes the transport session. The resulting disconnect comes back through
     * the normal disconnect path.
     */
    void disconnect(String sessionHandle);
}
