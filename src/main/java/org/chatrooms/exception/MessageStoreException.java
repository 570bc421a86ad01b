package org.chatrooms.exception;

/**
 * Raised by a {@link org.chatrooms.service.MessageStore} when a write is rejected or the
 * store is unavailable. Opaque to the core, which reports it as a persistence failure.
 */
public class MessageStoreException extends RuntimeException {
    public MessageStoreException(String message, Throwable cause) {
        super(message, cause);
    }

    public MessageStoreException(String message) {
        super(message);
    }
}
