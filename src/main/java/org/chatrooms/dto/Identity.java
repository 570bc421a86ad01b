package org.chatrooms.dto;

/**
 * Who is behind a connection, as vouched for by the token verifier. Never changes for the
 * lifetime of a connection.
 */
public record Identity(String userId, String username, String role) {

    public static final String DEFAULT_ROLE = "USER";

    public Identity(String userId, String username) {
        this(userId, username, DEFAULT_ROLE);
    }
}
