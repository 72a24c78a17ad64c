package com.questrail.schemagrid.observability;

import java.time.Instant;

/**
 * Record representing a failure caught inside a protocol operation.
 *
 * <p>The failure has already been converted into the operation's documented
 * error channel; this event exists only so it is not lost to diagnostics.</p>
 */
public record ConversionErrorEvent(
    Instant timestamp,
    String protocol,
    String message,
    Throwable cause
) {
    public static ConversionErrorEvent of(String protocol, String message, Throwable cause) {
        return new ConversionErrorEvent(Instant.now(), protocol, message, cause);
    }
}
