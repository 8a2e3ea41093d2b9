package com.liveclass.server.relay;

import com.liveclass.server.model.Events;

/**
 * WebRTC negotiation messages the relay forwards. Each kind carries its payload under
 * its own field name, both inbound and outbound.
 */
public enum SignalKind {
    OFFER(Events.OFFER, "offer"),
    ANSWER(Events.ANSWER, "answer"),
    ICE_CANDIDATE(Events.ICE_CANDIDATE, "candidate");

    private final String event;
    private final String payloadField;

    SignalKind(String event, String payloadField) {
        this.event = event;
        this.payloadField = payloadField;
    }

    public String event() {
        return event;
    }

    public String payloadField() {
        return payloadField;
    }

    /** @return null when the event is not a signaling message */
    public static SignalKind fromEvent(String event) {
        for (SignalKind k : values()) {
            if (k.event.equals(event)) return k;
        }
        return null;
    }
}
