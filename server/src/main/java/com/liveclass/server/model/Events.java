package com.liveclass.server.model;

/**
 * Event names on the wire. Clients match these literally.
 */
public final class Events {
    private Events() {}

    // inbound
    public static final String JOIN_ROOM = "join-room";
    public static final String NAME_CHANGED = "name-changed";
    public static final String VOICE_ACTIVITY = "voice-activity";

    // outbound
    public static final String USER_LIST = "user-list";
    public static final String USER_JOINED = "user-joined";
    public static final String USER_NAME_CHANGED = "user-name-changed";
    public static final String USER_VOICE_ACTIVITY = "user-voice-activity";
    public static final String USER_DISCONNECTED = "user-disconnected";
    public static final String MODERATOR_LEFT = "moderator-left";
    public static final String MODERATOR_RETURNED = "moderator-returned";
    public static final String ROOM_CLOSED = "room-closed";
    public static final String CLASS_ENDED = "class-ended";
    public static final String ERROR = "error";

    // both directions
    public static final String OFFER = "offer";
    public static final String ANSWER = "answer";
    public static final String ICE_CANDIDATE = "ice-candidate";
}
