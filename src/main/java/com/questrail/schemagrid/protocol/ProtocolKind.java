package com.questrail.schemagrid.protocol;

import java.util.Locale;
import java.util.Optional;

/**
 * The closed set of wire formats the engine knows about.
 *
 * <p>A format can be known without being implemented: its key is registered
 * (and reported as supported) so callers can distinguish "coming later" from
 * "never heard of it", but no {@link GridProtocol} exists for it yet.</p>
 */
public enum ProtocolKind
{
    WSDL("wsdl", true),
    SOAP("soap", false),
    JSONRPC("jsonrpc", true),
    XSD("xsd", true),
    SAP("sap", true);

    private final String key;
    private final boolean implemented;

    ProtocolKind(String key, boolean implemented) {
        this.key = key;
        this.implemented = implemented;
    }

    /**
     * Lower-case registry key, e.g. {@code "jsonrpc"}.
     */
    public String key() {
        return key;
    }

    public boolean isImplemented() {
        return implemented;
    }

    /**
     * Resolves a format name case-insensitively. Surrounding whitespace is
     * significant: {@code " wsdl"} is not a known key.
     *
     * @param name format name as supplied by a caller, may be null
     * @return the matching kind, or empty for null, empty or unknown names
     */
    public static Optional<ProtocolKind> fromKey(String name) {
        if (name == null || name.isEmpty()) {
            return Optional.empty();
        }
        final String normalised = name.toLowerCase(Locale.ROOT);
        for (ProtocolKind kind : values()) {
            if (kind.key.equals(normalised)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
