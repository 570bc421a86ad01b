package org.chatrooms.config;

import lombok.Getter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Tuning knobs of the WebSocket core, read from application.properties.
 * Example:
 *   chat.ws.outbound-capacity=256
 *   chat.ws.slow-consumer-threshold=32
 *   chat.ws.max-content-length=2000
 *   chat.ws.pump-poll-ms=500
 */
@Getter
@Component
public class RealtimeSettings {

    // frames buffered per connection before the broadcaster starts dropping
    private final int outboundCapacity;

    // consecutive drops after which a connection is evicted
    private final int slowConsumerThreshold;

    private final int maxContentLength;

    private final long pumpPollMillis;

    public RealtimeSettings(@Value("${chat.ws.outbound-capacity:256}") int outboundCapacity,
                            @Value("${chat.ws.slow-consumer-threshold:32}") int slowConsumerThreshold,
                            @Value("${chat.ws.max-content-length:2000}") int maxContentLength,
                            @Value("${chat.ws.pump-poll-ms:500}") long pumpPollMillis) {
        if (outboundCapacity < 1 || slowConsumerThreshold < 1 || maxContentLength < 1 || pumpPollMillis < 1) {
            throw new IllegalStateException("chat.ws.* settings must all be positive");
        }
        this.outboundCapacity = outboundCapacity;
        this.slowConsumerThreshold = slowConsumerThreshold;
        this.maxContentLength = maxContentLength;
        this.pumpPollMillis = pumpPollMillis;
    }
}
