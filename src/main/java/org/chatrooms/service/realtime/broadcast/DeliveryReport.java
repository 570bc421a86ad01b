package org.chatrooms.service.realtime.broadcast;

/**
 * Outcome of one fan-out. Informational only.
 *
 * @param delivered members whose queue accepted the frame
 * @param skipped   members that were closing or whose queue was full
 * @param evicted   members closed as slow consumers during this fan-out (counted in skipped too)
 */
public record DeliveryReport(String chatroomId, Long messageId, int delivered, int skipped, int evicted) {
}
