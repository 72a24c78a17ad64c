package com.questrail.schemagrid.observability;

import java.time.Instant;
import java.util.List;

/**
 * Record describing one completed protocol operation.
 *
 * <p>{@code degraded} is set when the operation returned a fallback instead of
 * its normal product: an embedded-error string from generation, a JSON-RPC
 * error envelope, or a parse result carrying an error.</p>
 */
public record ConversionEvent(
    Instant timestamp,
    String protocol,
    ConversionOperation operation,
    boolean degraded,
    List<String> detail
) {
    public ConversionEvent {
        detail = (detail == null) ? List.of() : List.copyOf(detail);
    }

    public static ConversionEvent succeeded(String protocol, ConversionOperation operation) {
        return new ConversionEvent(Instant.now(), protocol, operation, false, List.of());
    }

    public static ConversionEvent degraded(String protocol, ConversionOperation operation, List<String> detail) {
        return new ConversionEvent(Instant.now(), protocol, operation, true, detail);
    }
}
