package org.chatrooms.service;

import org.chatrooms.dto.Identity;
import org.chatrooms.exception.UnauthorizedException;

/**
 * Validates a bearer credential. The core forwards the token verbatim and never looks inside it.
 */
public interface TokenVerifier {

    /**
     * @throws UnauthorizedException when the token is missing, malformed or expired
     */
    Identity verify(String token);
}
