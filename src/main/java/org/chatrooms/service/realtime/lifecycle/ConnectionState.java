package org.chatrooms.service.realtime.lifecycle;

public enum ConnectionState {
    CONNECTING,     // handshake accepted, no identity yet
    AUTHENTICATING, // token handed to the verifier
    ADMITTED,       // identity known, admission to the room in progress
    ACTIVE,         // inbound callbacks and outbound pump running
    CLOSING,        // close requested, resources being released
    CLOSED
}
