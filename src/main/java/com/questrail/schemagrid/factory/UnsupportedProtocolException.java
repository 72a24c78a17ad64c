package com.questrail.schemagrid.factory;

import com.questrail.schemagrid.protocol.ProtocolKind;

import java.util.Locale;
import java.util.Optional;

/**
 * Thrown by {@link ProtocolFactory#createProtocol} when a format name cannot
 * be turned into a protocol instance.
 *
 * <p>Two cases are distinguished:</p>
 * <ul>
 *   <li>a registered format with no implementation yet
 *       ({@code "SOAP protocol not yet implemented"})</li>
 *   <li>a name that is not registered at all
 *       ({@code "Unsupported protocol type: <name>"}, with the caller's
 *       original casing and whitespace)</li>
 * </ul>
 *
 * <p>The message texts are stable; callers match on them.</p>
 */
public final class UnsupportedProtocolException extends IllegalArgumentException
{
    private final transient ProtocolKind knownKind;

    private UnsupportedProtocolException(String message, ProtocolKind knownKind) {
        super(message);
        this.knownKind = knownKind;
    }

    static UnsupportedProtocolException notImplemented(ProtocolKind kind) {
        return new UnsupportedProtocolException(
                kind.key().toUpperCase(Locale.ROOT) + " protocol not yet implemented", kind);
    }

    static UnsupportedProtocolException unknown(String protocolType) {
        return new UnsupportedProtocolException("Unsupported protocol type: " + protocolType, null);
    }

    /**
     * Returns the registered format when the failure is "not implemented yet",
     * or empty when the name was not recognised.
     */
    public Optional<ProtocolKind> knownKind() {
        return Optional.ofNullable(knownKind);
    }
}
